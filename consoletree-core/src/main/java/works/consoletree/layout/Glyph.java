package works.consoletree.layout;

/**
 * Box-drawing characters used to connect parents to their children.
 * <p>
 * {@link #VERTICAL} and {@link #HORIZONTAL} are the strokes passed to
 * {@link GridCanvas#draw}; {@link #VERTICAL}, {@link #CORNER} and {@link #JUNCTION}
 * are what a {@link Cell.Drawable drawable cell} can end up starting with.
 */
public enum Glyph {
	VERTICAL('│'),
	CORNER('└'),
	JUNCTION('├'),
	HORIZONTAL('─');

	private final char character;

	Glyph(char character) {
		this.character = character;
	}

	public char character() {
		return character;
	}
}
