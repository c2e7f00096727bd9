package works.consoletree.jackson;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import works.consoletree.Mapping;
import works.consoletree.Scalar;
import works.consoletree.Sequence;
import works.consoletree.TreeValue;
import works.consoletree.exceptions.UnsupportedTypeException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.consoletree.TreeValue.entry;
import static works.consoletree.TreeValue.mapping;
import static works.consoletree.TreeValue.scalar;
import static works.consoletree.TreeValue.sequence;

class TreeValuesTest {

	@Test
	void scalars_literalText() {
		assertEquals(new Scalar("hello"), TreeValues.from("hello"));
		assertEquals(new Scalar("12"), TreeValues.from(12));
		assertEquals(new Scalar("3.5"), TreeValues.from(3.5));
		assertEquals(new Scalar("false"), TreeValues.from(false));
		assertEquals(new Scalar("123456789012345678901234567890"), TreeValues.from(new BigInteger("123456789012345678901234567890")));
		assertEquals(new Scalar("1.50"), TreeValues.from(new BigDecimal("1.50")));
		assertEquals(new Scalar("1E+20"), TreeValues.from(new BigDecimal("1e20")));
	}

	@Test
	void mapsAndLists_keepOrder() {
		Map<String, Object> decoded = new LinkedHashMap<>();
		decoded.put("zebra", List.of("b", "a"));
		decoded.put("apple", Map.of("k", 1));
		assertEquals(mapping(
			entry("zebra", sequence(scalar("b"), scalar("a"))),
			entry("apple", mapping(entry("k", scalar(1))))
		), TreeValues.from(decoded));
	}

	@Test
	void nonStringKeys_usedAsText() {
		Map<Object, Object> decoded = new LinkedHashMap<>();
		decoded.put(7, "seven");
		assertEquals(mapping(entry("7", "seven")), TreeValues.from(decoded));
	}

	@Test
	void nulls_passThrough() {
		assertNull(TreeValues.from(null));
		TreeValue converted = TreeValues.from(Arrays.asList("x", null));
		assertEquals(2, ((Sequence) converted).items().size());
		assertNull(((Sequence) converted).items().get(1));

		Map<String, Object> decoded = new LinkedHashMap<>();
		decoded.put("a", null);
		assertNull(((Mapping) TreeValues.from(decoded)).entries().get(0).value());
	}

	@Test
	void treeValues_unchanged() {
		TreeValue value = mapping(entry("a", "b"));
		assertSame(value, TreeValues.from(value));
	}

	@Test
	void otherObjects_throw() {
		var e = assertThrows(UnsupportedTypeException.class, () ->
			TreeValues.from(Map.of("id", List.of(UUID.randomUUID()))));
		assertEquals("/id/0", e.path());
	}
}
