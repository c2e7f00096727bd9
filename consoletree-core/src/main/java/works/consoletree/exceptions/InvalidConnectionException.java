package works.consoletree.exceptions;

public final class InvalidConnectionException extends TreeLayoutException {
	public InvalidConnectionException(int parentRow, int parentColumn, int childRow) {
		super("Cannot draw from parent at cell (" + parentRow + ", " + parentColumn
			+ ") to a child in row " + childRow + ", which is not below its parent's row");
	}
}
