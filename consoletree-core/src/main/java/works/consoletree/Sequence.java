package works.consoletree;

import java.util.ArrayList;
import java.util.List;

import static java.util.Collections.unmodifiableList;

/**
 * An ordered list of child values. Drawn in index order.
 * <p>
 * Items may be null: a decoder can pass along a JSON {@code null} as-is,
 * and rendering rejects it with {@link works.consoletree.exceptions.UnsupportedTypeException}.
 */
public record Sequence(List<TreeValue> items) implements TreeValue {
	public Sequence {
		// List.copyOf would reject nulls
		items = unmodifiableList(new ArrayList<>(items));
	}
}
