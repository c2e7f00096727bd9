package works.consoletree;

import java.util.ArrayList;
import java.util.List;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * An ordered list of keyed child values. Drawn in entry order.
 * <p>
 * Keys are not checked for uniqueness; a repeated key simply produces another row.
 */
public record Mapping(List<Entry> entries) implements TreeValue {
	public Mapping {
		entries = unmodifiableList(new ArrayList<>(entries));
		entries.forEach(e -> requireNonNull(e, "entry"));
	}

	/**
	 * @return a single-entry mapping with <code>value</code> under <code>name</code>,
	 * which gives any value the single root that rendering requires.
	 */
	public static Mapping root(String name, TreeValue value) {
		return new Mapping(List.of(new Entry(name, value)));
	}

	/**
	 * @param value may be null; see {@link Sequence}.
	 */
	public record Entry(String key, TreeValue value) {
		public Entry {
			requireNonNull(key, "key");
		}
	}
}
