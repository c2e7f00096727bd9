package works.consoletree.exceptions;

public final class MissingRootException extends TreeContentException {
	public MissingRootException(String message) {
		super(message);
	}
}
