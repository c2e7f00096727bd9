package works.consoletree.exceptions;

/**
 * The input value has a shape or content that cannot be drawn.
 * Rendering the same value again will fail the same way.
 */
public sealed abstract class TreeContentException extends TreeRenderException permits
	EmptyScalarException,
	MissingRootException,
	UnsupportedTypeException
{
	protected TreeContentException(String message) {
		super(message);
	}
}
