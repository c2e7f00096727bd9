package works.consoletree;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

@Value
@Builder(toBuilder = true)
public class RenderSettings {
	public static final RenderSettings DEFAULT = RenderSettings.builder().build();

	/**
	 * When true, sequence items are drawn directly in place of their sequence,
	 * without index rows.
	 */
	@Default boolean simpleMode = false;

	/**
	 * If set, the value is drawn as the only child of a root with this name.
	 * Use this when the value isn't already a mapping with a single entry.
	 */
	@Nullable String rootName;
}
