package works.consoletree.exceptions;

/**
 * The layout algorithm broke one of its own invariants.
 * <p>
 * Input that passes the {@link TreeContentException content checks} should never cause this;
 * if it does, that's a bug in the layout code, not a problem with the input.
 */
public sealed abstract class TreeLayoutException extends TreeRenderException permits
	DrawContractException,
	InvalidConnectionException
{
	protected TreeLayoutException(String message) {
		super(message);
	}
}
