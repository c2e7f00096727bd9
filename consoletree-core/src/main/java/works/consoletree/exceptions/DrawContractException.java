package works.consoletree.exceptions;

/**
 * A connector glyph was drawn onto a cell that can't take it.
 */
public final class DrawContractException extends TreeLayoutException {
	public DrawContractException(String message) {
		super(message);
	}
}
