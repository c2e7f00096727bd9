package works.consoletree.layout;

import works.consoletree.exceptions.DrawContractException;

import static works.consoletree.layout.Glyph.CORNER;
import static works.consoletree.layout.Glyph.JUNCTION;
import static works.consoletree.layout.Glyph.VERTICAL;

/**
 * Draws connector pieces onto the blank cells of a {@link Grid}.
 * <p>
 * Drawing is top-down within a column: a parent pulls {@link Glyph#VERTICAL VERTICAL}
 * strokes down its column and ends each child's connector with a
 * {@link Glyph#HORIZONTAL HORIZONTAL} stroke, which lands as a {@link Glyph#CORNER CORNER}.
 * When a later sibling's vertical passes over that corner, it becomes a {@link Glyph#JUNCTION JUNCTION}.
 */
public final class GridCanvas {
	private final Grid grid;

	public GridCanvas(Grid grid) {
		this.grid = grid;
	}

	public Grid grid() {
		return grid;
	}

	/**
	 * @param stroke {@link Glyph#VERTICAL VERTICAL} or {@link Glyph#HORIZONTAL HORIZONTAL}
	 * @throws DrawContractException if the cell holds tree text, or already holds
	 * something the stroke can't be drawn over
	 */
	public void draw(Glyph stroke, int row, int column) {
		if (!(grid.cell(row, column) instanceof Cell.Drawable cell)) {
			throw new DrawContractException("Cannot draw " + stroke + " over the tree item at (" + row + ", " + column + ")");
		}
		switch (stroke) {
			case VERTICAL -> drawVertical(cell, row, column);
			case HORIZONTAL -> drawHorizontal(cell, row, column);
			default -> throw new DrawContractException("Only VERTICAL and HORIZONTAL can be drawn; got " + stroke);
		}
	}

	private static void drawVertical(Cell.Drawable cell, int row, int column) {
		Glyph lead = cell.lead();
		if (lead == null || lead == VERTICAL) {
			cell.lead(VERTICAL);
		} else if (lead == CORNER) {
			// Another child shares this column further down
			cell.lead(JUNCTION);
		} else if (lead != JUNCTION) {
			throw new DrawContractException("It should not be possible for VERTICAL to be drawn over " + lead + " at (" + row + ", " + column + ")");
		}
	}

	private static void drawHorizontal(Cell.Drawable cell, int row, int column) {
		if (!cell.isBlank()) {
			throw new DrawContractException("It should not be possible to draw HORIZONTAL over " + cell.lead() + " at (" + row + ", " + column + ")");
		}
		cell.lead(CORNER);
	}
}
