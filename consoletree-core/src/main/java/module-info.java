/**
 * Core console tree library: the {@link works.consoletree.TreeValue tree value model}
 * and the grid layout that draws it as text.
 * <p>
 * Start with {@link works.consoletree.ConsoleTree} for the primary entry point.
 * The {@link works.consoletree.layout} package holds the individual layout passes,
 * and {@link works.consoletree.exceptions} the failures they can raise.
 */
module works.consoletree.core {
	requires transitive org.jetbrains.annotations;
	requires org.slf4j;

	requires static lombok;

	exports works.consoletree;
	exports works.consoletree.exceptions;
	exports works.consoletree.layout;
}
