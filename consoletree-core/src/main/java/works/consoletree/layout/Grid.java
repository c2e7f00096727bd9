package works.consoletree.layout;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

import static java.util.Collections.unmodifiableList;

/**
 * A rectangle of {@link Cell cells}, where a tree item's column is its depth.
 * <p>
 * Rows arrive jagged from the {@link Tabularizer} and are right-padded with
 * {@link Cell.Drawable blank cells} on construction, so every row has the same length.
 * Column widths are unknown until {@link ColumnFormatter} fixes them;
 * after that the grid can be {@link #render rendered} as text.
 */
public final class Grid {
	private final List<List<Cell>> rows;
	private final int columnCount;
	private int[] columnWidths;

	private Grid(List<List<Cell>> rows, int columnCount) {
		this.rows = rows;
		this.columnCount = columnCount;
	}

	/**
	 * @throws IllegalArgumentException if there is nothing to draw
	 */
	public static Grid padded(List<? extends List<? extends Cell>> jaggedRows) {
		int columnCount = jaggedRows.stream().mapToInt(List::size).max().orElse(0);
		if (columnCount == 0) {
			throw new IllegalArgumentException("Grid must have at least one row and one column");
		}
		List<List<Cell>> rows = new ArrayList<>(jaggedRows.size());
		for (List<? extends Cell> jagged : jaggedRows) {
			List<Cell> row = new ArrayList<>(columnCount);
			row.addAll(jagged);
			while (row.size() < columnCount) {
				row.add(new Cell.Drawable());
			}
			rows.add(unmodifiableList(row));
		}
		return new Grid(unmodifiableList(rows), columnCount);
	}

	public int rowCount() {
		return rows.size();
	}

	public int columnCount() {
		return columnCount;
	}

	public List<Cell> row(int row) {
		return rows.get(row);
	}

	public Cell cell(int row, int column) {
		return rows.get(row).get(column);
	}

	/**
	 * @return true if the cell holds tree text rather than connector space
	 */
	public boolean isOccupied(int row, int column) {
		return cell(row, column) instanceof Cell.Label;
	}

	public boolean isFormatted() {
		return columnWidths != null;
	}

	public int columnWidth(int column) {
		checkFormatted();
		return columnWidths[column];
	}

	void fixColumnWidths(int[] widths) {
		if (widths.length != columnCount) {
			throw new IllegalArgumentException("Expected " + columnCount + " column widths; got " + widths.length);
		}
		this.columnWidths = widths.clone();
	}

	public String renderCell(int row, int column) {
		return cell(row, column).render(columnWidth(column));
	}

	/**
	 * @return one line per row, with cells concatenated and no separator between them
	 */
	public String render() {
		checkFormatted();
		StringJoiner lines = new StringJoiner("\n");
		for (List<Cell> row : rows) {
			StringBuilder line = new StringBuilder();
			for (int j = 0; j < columnCount; j++) {
				line.append(row.get(j).render(columnWidths[j]));
			}
			lines.add(line);
		}
		return lines.toString();
	}

	private void checkFormatted() {
		if (columnWidths == null) {
			throw new IllegalStateException("Column widths have not been fixed");
		}
	}

	@Override
	public String toString() {
		if (isFormatted()) {
			return render();
		}
		StringJoiner lines = new StringJoiner("\n");
		for (List<Cell> row : rows) {
			StringJoiner line = new StringJoiner("|");
			row.forEach(cell -> line.add(cell instanceof Cell.Label label ? label.text() : ""));
			lines.add(line.toString());
		}
		return lines.toString();
	}
}
