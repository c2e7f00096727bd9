package works.consoletree.layout;

/**
 * Fixes each column's width to the widest content in that column,
 * so every cell in a column renders to the same length, left-justified.
 * <p>
 * Connectors are drawn after this, and rely on the widths being final.
 */
public final class ColumnFormatter {
	private ColumnFormatter() {}

	public static Grid padColumns(Grid grid) {
		int[] widths = new int[grid.columnCount()];
		for (int i = 0; i < grid.rowCount(); i++) {
			for (int j = 0; j < widths.length; j++) {
				widths[j] = Math.max(widths[j], grid.cell(i, j).contentWidth());
			}
		}
		grid.fixColumnWidths(widths);
		return grid;
	}
}
