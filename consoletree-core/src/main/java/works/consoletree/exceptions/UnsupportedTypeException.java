package works.consoletree.exceptions;

import org.jetbrains.annotations.Nullable;

/**
 * A value in the tree is not a scalar, sequence, or mapping.
 * Null values land here too; they are never coerced to text.
 */
public final class UnsupportedTypeException extends TreeContentException {
	private final String path;

	public UnsupportedTypeException(String path, @Nullable Class<?> type) {
		super("Type " + (type == null ? "null" : type.getName()) + " is unsupported in the tree: " + path);
		this.path = path;
	}

	public String path() {
		return path;
	}
}
