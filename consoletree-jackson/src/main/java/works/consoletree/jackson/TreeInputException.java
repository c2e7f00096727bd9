package works.consoletree.jackson;

import java.io.IOException;

/**
 * Input text was read successfully but could not be decoded into a tree.
 */
public class TreeInputException extends IOException {
	public TreeInputException(String message, Throwable cause) {
		super(message, cause);
	}
}
