package works.consoletree.jackson;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.consoletree.Mapping;
import works.consoletree.Scalar;
import works.consoletree.Sequence;
import works.consoletree.TreeValue;
import works.consoletree.exceptions.UnsupportedTypeException;

/**
 * Converts the plain Java values produced by untyped JSON decoding
 * ({@link Map}, {@link List}, {@link String}, {@link Number}, {@link Boolean})
 * into {@link TreeValue}s.
 */
public final class TreeValues {
	private TreeValues() {}

	/**
	 * @return null if <code>decoded</code> is null; nulls nested inside
	 * lists and maps are likewise kept as nulls.
	 * @throws UnsupportedTypeException for any other kind of object
	 */
	public static @Nullable TreeValue from(@Nullable Object decoded) {
		return from(decoded, "");
	}

	private static @Nullable TreeValue from(@Nullable Object decoded, String path) {
		if (decoded == null) {
			return null;
		} else if (decoded instanceof TreeValue value) {
			return value;
		} else if (decoded instanceof String text) {
			return new Scalar(text);
		} else if (decoded instanceof Number || decoded instanceof Boolean) {
			return new Scalar(decoded.toString());
		} else if (decoded instanceof List<?> list) {
			List<TreeValue> items = new ArrayList<>(list.size());
			for (int i = 0; i < list.size(); i++) {
				items.add(from(list.get(i), path + "/" + i));
			}
			return new Sequence(items);
		} else if (decoded instanceof Map<?, ?> map) {
			List<Mapping.Entry> entries = new ArrayList<>(map.size());
			map.forEach((k, v) -> {
				String key = String.valueOf(k);
				entries.add(new Mapping.Entry(key, from(v, path + "/" + key)));
			});
			return new Mapping(entries);
		} else {
			throw new UnsupportedTypeException(path.isEmpty() ? "/" : path, decoded.getClass());
		}
	}
}
