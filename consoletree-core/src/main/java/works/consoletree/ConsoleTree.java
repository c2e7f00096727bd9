package works.consoletree;

import org.jetbrains.annotations.Nullable;
import works.consoletree.exceptions.TreeRenderException;
import works.consoletree.layout.TreeRenderer;

/**
 * Draws a {@link TreeValue} as text, in the style of a filesystem tree listing:
 *
 * <pre>
 * root
 * └───items
 *     ├────0
 *     │    └one
 *     └────1
 *          └two
 * </pre>
 *
 * Each cell is padded to its column's width, so lines can carry trailing spaces.
 */
public final class ConsoleTree {
	private ConsoleTree() {}

	public static String render(@Nullable TreeValue value) {
		return render(value, RenderSettings.DEFAULT);
	}

	/**
	 * @throws TreeRenderException if the value can't be drawn
	 */
	public static String render(@Nullable TreeValue value, RenderSettings settings) {
		TreeValue root = settings.getRootName() == null
			? value
			: Mapping.root(settings.getRootName(), value);
		return TreeRenderer.render(root, settings.isSimpleMode());
	}
}
