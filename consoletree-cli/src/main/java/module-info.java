/**
 * The {@code consoletree} command: draws the tree of a JSON file on standard output.
 */
module works.consoletree.cli {
	requires works.consoletree.jackson;
	requires info.picocli;
	requires org.slf4j;
	requires ch.qos.logback.classic;

	opens works.consoletree.cli to info.picocli;
}
