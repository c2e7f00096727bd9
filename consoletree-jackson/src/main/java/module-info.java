/**
 * Decodes JSON text into {@link works.consoletree.TreeValue tree values} using Jackson.
 * <p>
 * See {@link works.consoletree.jackson.JacksonTreeReader} for the main entry point.
 */
module works.consoletree.jackson {
	requires transitive tools.jackson.core;
	requires transitive tools.jackson.databind;
	requires org.slf4j;
	requires transitive works.consoletree.core;

	exports works.consoletree.jackson;
}
