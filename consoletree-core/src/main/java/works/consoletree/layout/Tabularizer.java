package works.consoletree.layout;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.consoletree.Mapping;
import works.consoletree.Scalar;
import works.consoletree.Sequence;
import works.consoletree.TreeValue;
import works.consoletree.exceptions.EmptyScalarException;
import works.consoletree.exceptions.UnsupportedTypeException;

/**
 * Flattens a {@link TreeValue} into a {@link Grid}.
 * <p>
 * All items at the same depth land in the same column.
 * A parent sits one column to the left of its children,
 * on the row immediately above its first child.
 * <p>
 * In simple mode, sequence items are placed directly where the sequence is,
 * with no index rows and no extra column.
 * Otherwise each item sits under a row holding its index,
 * just as mapping values sit under their keys.
 */
public final class Tabularizer {
	private final boolean simpleMode;

	public Tabularizer(boolean simpleMode) {
		this.simpleMode = simpleMode;
	}

	/**
	 * @throws EmptyScalarException if any scalar or key is blank
	 * @throws UnsupportedTypeException if any value is null
	 * @throws IllegalArgumentException if <code>value</code> contains nothing to draw
	 */
	public Grid tabularize(@Nullable TreeValue value) {
		return Grid.padded(rowsFor(value, ""));
	}

	private List<List<Cell>> rowsFor(@Nullable TreeValue value, String path) {
		List<List<Cell>> rows = new ArrayList<>();
		if (value instanceof Scalar scalar) {
			rows.add(singletonRow(label(scalar.text(), path)));
		} else if (value instanceof Sequence sequence) {
			List<TreeValue> items = sequence.items();
			for (int i = 0; i < items.size(); i++) {
				String itemPath = path + "/" + i;
				if (simpleMode) {
					rows.addAll(rowsFor(items.get(i), itemPath));
				} else {
					rows.add(singletonRow(new Cell.Label(Integer.toString(i))));
					addIndented(rows, rowsFor(items.get(i), itemPath));
				}
			}
		} else if (value instanceof Mapping mapping) {
			List<Mapping.Entry> entries = mapping.entries();
			for (int i = 0; i < entries.size(); i++) {
				Mapping.Entry entry = entries.get(i);
				if (isBlank(entry.key())) {
					throw EmptyScalarException.forKey(displayPath(path), i);
				}
				String entryPath = path + "/" + entry.key();
				rows.add(singletonRow(new Cell.Label(entry.key())));
				addIndented(rows, rowsFor(entry.value(), entryPath));
			}
		} else {
			throw new UnsupportedTypeException(displayPath(path), value == null ? null : value.getClass());
		}
		return rows;
	}

	/**
	 * Offsets the children one column to the right of their parent.
	 */
	private static void addIndented(List<List<Cell>> rows, List<List<Cell>> childRows) {
		for (List<Cell> childRow : childRows) {
			List<Cell> row = new ArrayList<>(childRow.size() + 1);
			row.add(new Cell.Drawable());
			row.addAll(childRow);
			rows.add(row);
		}
	}

	private static List<Cell> singletonRow(Cell cell) {
		List<Cell> row = new ArrayList<>(1);
		row.add(cell);
		return row;
	}

	private static Cell.Label label(String text, String path) {
		if (isBlank(text)) {
			throw new EmptyScalarException(displayPath(path));
		}
		return new Cell.Label(text);
	}

	/**
	 * Unlike {@link String#isBlank()}, also counts no-break spaces
	 * such as U+00A0, U+2007 and U+202F as blank.
	 */
	private static boolean isBlank(String text) {
		return text.codePoints().allMatch(cp -> Character.isWhitespace(cp) || Character.isSpaceChar(cp));
	}

	private static String displayPath(String path) {
		return path.isEmpty() ? "/" : path;
	}
}
