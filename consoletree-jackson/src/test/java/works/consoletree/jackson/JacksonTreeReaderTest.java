package works.consoletree.jackson;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import works.consoletree.ConsoleTree;
import works.consoletree.Mapping;
import works.consoletree.RenderSettings;
import works.consoletree.exceptions.UnsupportedTypeException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.consoletree.TreeValue.entry;
import static works.consoletree.TreeValue.mapping;
import static works.consoletree.TreeValue.scalar;
import static works.consoletree.TreeValue.sequence;

class JacksonTreeReaderTest {
	final JacksonTreeReader reader = new JacksonTreeReader();

	@Test
	void parse_objectMemberOrderKept() throws IOException {
		assertEquals(mapping(entry("root", mapping(
			entry("z", scalar(1)),
			entry("a", sequence(scalar(true), scalar("s"), scalar(2.5)))
		))), reader.parse("""
			{"root": {"z": 1, "a": [true, "s", 2.5]}}
			"""));
	}

	@Test
	void parse_null() throws IOException {
		assertNull(reader.parse("null"));
		assertEquals(Mapping.root("a", null), reader.parse("{\"a\": null}"));
	}

	@Test
	void parse_malformed_throws() {
		var e = assertThrows(TreeInputException.class, () -> reader.parse("{\"a\": "));
		assertThat(e.getMessage(), containsString("(line 1, column "));
		assertThrows(TreeInputException.class, () -> reader.parse("{'a': 1}"));
	}

	@Test
	void parse_malformed_messageIsOneLine() {
		var e = assertThrows(TreeInputException.class, () -> reader.parse("{\"a\": [1,\n 2"));
		assertThat(e.getMessage(), not(containsString("\n")));
		assertThat(e.getMessage(), not(startsWith("Malformed JSON")));
		assertThat(e.getMessage(), containsString("(line 2, column "));
	}

	@Test
	void parse_floats_keepWrittenDigits() throws IOException {
		assertEquals(Mapping.root("r", sequence(
			scalar("0.0001"),
			scalar("1E+5"),
			scalar("1E+20"),
			scalar("1.50"),
			scalar("-2.5"),
			scalar("12345678901234567890")
		)), reader.parse("{\"r\": [0.0001, 1e5, 1e20, 1.50, -2.5, 12345678901234567890]}"));
	}

	@Test
	void decodedFloats_renderAsWritten() throws IOException {
		String drawing = ConsoleTree.render(reader.parse("{\"r\": [0.0001, 1e20]}"),
			RenderSettings.builder().simpleMode(true).build());
		assertEquals("r      \n├0.0001\n└1E+20 ", drawing);
	}

	@Test
	void parse_trailingContent_throws() {
		assertThrows(TreeInputException.class, () -> reader.parse("{\"a\": 1} {\"b\": 2}"));
	}

	@Test
	void read_utf8File(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("tree.json");
		Files.writeString(file, "{\"🌳\": [\"ünïcödé\"]}", UTF_8);
		assertEquals(mapping(entry("🌳", sequence(scalar("ünïcödé")))), reader.read(file));
	}

	@Test
	void read_missingFile_throws(@TempDir Path dir) {
		assertThrows(NoSuchFileException.class, () -> reader.read(dir.resolve("absent.json")));
	}

	@Test
	void decodedNull_rejectedWhenRendered() throws IOException {
		var value = reader.parse("[1, null]");
		RenderSettings settings = RenderSettings.builder().rootName("r").build();
		var e = assertThrows(UnsupportedTypeException.class, () -> ConsoleTree.render(value, settings));
		assertEquals("/r/1", e.path());
	}

	@Test
	void decodedDocument_renders() throws IOException {
		var value = reader.parse("{\"config\": {\"debug\": false, \"ports\": [80, 443]}}");
		assertEquals(String.join("\n",
			"config          ",
			"├─────debug     ",
			"│     └────false",
			"└─────ports     ",
			"      ├────80   ",
			"      └────443  "
		), ConsoleTree.render(value, RenderSettings.builder().simpleMode(true).build()));
	}
}
