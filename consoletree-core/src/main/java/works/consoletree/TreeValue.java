package works.consoletree;

import static java.util.Arrays.asList;

/**
 * A JSON-like value that can be drawn as a tree:
 * a {@link Scalar}, an ordered {@link Sequence}, or a key-ordered {@link Mapping}.
 * <p>
 * Values are immutable and form a strict tree. Nothing here checks that scalar text
 * is drawable; that happens when the tree is rendered.
 */
public sealed interface TreeValue permits Scalar, Sequence, Mapping {

	static Scalar scalar(String text) {
		return new Scalar(text);
	}

	static Scalar scalar(Number number) {
		return new Scalar(String.valueOf(number));
	}

	static Scalar scalar(boolean value) {
		return new Scalar(String.valueOf(value));
	}

	static Sequence sequence(TreeValue... items) {
		return new Sequence(asList(items));
	}

	static Mapping mapping(Mapping.Entry... entries) {
		return new Mapping(asList(entries));
	}

	static Mapping.Entry entry(String key, TreeValue value) {
		return new Mapping.Entry(key, value);
	}

	static Mapping.Entry entry(String key, String scalarText) {
		return new Mapping.Entry(key, scalar(scalarText));
	}
}
