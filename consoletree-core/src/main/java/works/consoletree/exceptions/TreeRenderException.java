package works.consoletree.exceptions;

/**
 * A tree could not be rendered. There is never partial output:
 * any of these aborts the whole render.
 */
public sealed abstract class TreeRenderException extends RuntimeException permits TreeContentException, TreeLayoutException {
	protected TreeRenderException(String message) {
		super(message);
	}
}
