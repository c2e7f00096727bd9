package works.consoletree;

import static java.util.Objects.requireNonNull;

/**
 * A leaf. Numbers and booleans are carried as their JSON literal text.
 */
public record Scalar(String text) implements TreeValue {
	public Scalar {
		requireNonNull(text);
	}
}
