/**
 * The two-phase layout that turns a tree value into text.
 * <p>
 * First the {@link works.consoletree.layout.Tabularizer} lays the tree out
 * in a {@link works.consoletree.layout.Grid} where depth is column;
 * then the {@link works.consoletree.layout.ConnectorPlanner} draws
 * {@link works.consoletree.layout.Glyph connectors} into the blank cells
 * joining each parent to its children.
 * {@link works.consoletree.layout.TreeRenderer} runs the whole thing.
 */
package works.consoletree.layout;
