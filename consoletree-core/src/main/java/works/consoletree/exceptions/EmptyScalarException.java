package works.consoletree.exceptions;

/**
 * A scalar or key has no visible text.
 */
public final class EmptyScalarException extends TreeContentException {
	private final String path;

	public EmptyScalarException(String path) {
		this("Tree items cannot be empty strings: " + path, path);
	}

	private EmptyScalarException(String message, String path) {
		super(message);
		this.path = path;
	}

	/**
	 * @param mappingPath the mapping holding the entry
	 * @param index position of the entry whose key is blank
	 */
	public static EmptyScalarException forKey(String mappingPath, int index) {
		return new EmptyScalarException("Tree keys cannot be empty strings: entry " + index + " of " + mappingPath, mappingPath);
	}

	/**
	 * @return slash-separated keys and indexes leading to the offending item, or to the mapping holding the offending key
	 */
	public String path() {
		return path;
	}
}
