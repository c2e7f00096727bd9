package works.consoletree.layout;

import java.util.ArrayList;
import java.util.List;
import works.consoletree.exceptions.InvalidConnectionException;

import static works.consoletree.layout.Glyph.HORIZONTAL;
import static works.consoletree.layout.Glyph.VERTICAL;

/**
 * Finds which rows to join and draws the connectors between them.
 * <p>
 * Columns are visited left to right, parents top to bottom, children top to bottom.
 * That order matters: a later child's vertical stroke turns an earlier child's
 * corner into a junction.
 */
public final class ConnectorPlanner {
	private final GridCanvas canvas;
	private final Grid grid;

	public ConnectorPlanner(GridCanvas canvas) {
		this.canvas = canvas;
		this.grid = canvas.grid();
	}

	public void connectAll() {
		for (int j = 0; j < grid.columnCount() - 1; j++) {
			for (int parentRow : findParents(j)) {
				for (int childRow : findChildren(parentRow, j)) {
					connect(parentRow, j, childRow);
				}
			}
		}
	}

	/**
	 * @return the rows holding a tree item in the given column, in ascending order
	 */
	public List<Integer> findParents(int column) {
		List<Integer> result = new ArrayList<>();
		for (int i = 0; i < grid.rowCount(); i++) {
			if (grid.isOccupied(i, column)) {
				result.add(i);
			}
		}
		return result;
	}

	/**
	 * Scans down from the parent until the next item in the parent's column.
	 *
	 * @return the rows in that range holding an item in the column to the right
	 */
	public List<Integer> findChildren(int parentRow, int column) {
		List<Integer> result = new ArrayList<>();
		for (int i = parentRow + 1; i < grid.rowCount(); i++) {
			if (grid.isOccupied(i, column)) {
				break;
			}
			if (grid.isOccupied(i, column + 1)) {
				result.add(i);
			}
		}
		return result;
	}

	/**
	 * Draws verticals down the parent's column to the child's row,
	 * then the turn into the child.
	 */
	public void connect(int parentRow, int parentColumn, int childRow) {
		if (childRow <= parentRow) {
			throw new InvalidConnectionException(parentRow, parentColumn, childRow);
		}
		for (int i = parentRow + 1; i < childRow; i++) {
			canvas.draw(VERTICAL, i, parentColumn);
		}
		canvas.draw(HORIZONTAL, childRow, parentColumn);
	}
}
