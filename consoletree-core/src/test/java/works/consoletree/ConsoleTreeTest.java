package works.consoletree;

import org.junit.jupiter.api.Test;
import works.consoletree.exceptions.MissingRootException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.consoletree.TreeValue.entry;
import static works.consoletree.TreeValue.mapping;
import static works.consoletree.TreeValue.scalar;
import static works.consoletree.TreeValue.sequence;

class ConsoleTreeTest {

	@Test
	void defaultSettings() {
		assertFalse(RenderSettings.DEFAULT.isSimpleMode());
		assertNull(RenderSettings.DEFAULT.getRootName());
	}

	@Test
	void defaults_indexedWithNoRootWrap() {
		assertEquals("a  \n└0 \n └x", ConsoleTree.render(mapping(entry("a", sequence(scalar("x"))))));
	}

	@Test
	void rootName_wrapsValue() {
		RenderSettings settings = RenderSettings.builder()
			.rootName("top")
			.simpleMode(true)
			.build();
		assertEquals(String.join("\n",
			"top ",
			"├──1",
			"└──2"
		), ConsoleTree.render(sequence(scalar(1), scalar(2)), settings));
	}

	@Test
	void rootName_wrapsEvenASingleRootMapping() {
		RenderSettings settings = RenderSettings.DEFAULT.toBuilder().rootName("outer").build();
		assertEquals(String.join("\n",
			"outer     ",
			"└────a    ",
			"     └leaf"
		), ConsoleTree.render(mapping(entry("a", "leaf")), settings));
	}

	@Test
	void noRootName_rootlessValue_throws() {
		assertThrows(MissingRootException.class, () -> ConsoleTree.render(sequence(scalar(1))));
	}

	@Test
	void sequenceItems_preserveOrder() {
		String drawn = ConsoleTree.render(sequence(scalar("c"), scalar("a"), scalar("b")),
			RenderSettings.builder().rootName("r").simpleMode(true).build());
		assertEquals("r \n├c\n├a\n└b", drawn);
	}
}
