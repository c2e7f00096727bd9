package works.consoletree.layout;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.consoletree.Mapping;
import works.consoletree.Sequence;
import works.consoletree.TreeValue;
import works.consoletree.exceptions.MissingRootException;
import works.consoletree.exceptions.TreeRenderException;

/**
 * Runs the layout passes in order:
 * {@link Tabularizer}, {@link ColumnFormatter}, then {@link ConnectorPlanner},
 * and joins the resulting grid into text.
 */
public final class TreeRenderer {
	private TreeRenderer() {}

	/**
	 * @param root must be a {@link Mapping} with exactly one entry
	 * @return the drawing, one line per tree item, with no trailing newline
	 * @throws TreeRenderException if the tree can't be drawn; nothing is drawn in that case
	 */
	public static String render(@Nullable TreeValue root, boolean simpleMode) {
		if (!(root instanceof Mapping mapping) || mapping.entries().size() != 1) {
			throw new MissingRootException("Tree must have a root, but the top-level value is " + describe(root));
		}

		Grid grid = new Tabularizer(simpleMode).tabularize(root);
		LOGGER.debug("Tabularized tree \"{}\" into {} rows and {} columns (simpleMode={})",
			mapping.entries().get(0).key(), grid.rowCount(), grid.columnCount(), simpleMode);

		if (grid.rowCount() == 1 && grid.columnCount() == 1
			&& grid.cell(0, 0) instanceof Cell.Label only) {
			LOGGER.debug("Tree has no children; skipping connectors");
			return only.text();
		}

		ColumnFormatter.padColumns(grid);
		new ConnectorPlanner(new GridCanvas(grid)).connectAll();

		String result = grid.render();
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Rendered tree:\n{}", result);
		}
		return result;
	}

	private static String describe(@Nullable TreeValue value) {
		if (value == null) {
			return "null";
		} else if (value instanceof Mapping m) {
			return "a mapping with " + m.entries().size() + " entries";
		} else if (value instanceof Sequence) {
			return "a sequence";
		} else {
			return "a scalar";
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TreeRenderer.class);
}
