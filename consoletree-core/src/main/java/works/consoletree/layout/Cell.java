package works.consoletree.layout;

import org.jetbrains.annotations.Nullable;

import static works.consoletree.layout.Glyph.HORIZONTAL;
import static works.consoletree.layout.Glyph.VERTICAL;

/**
 * One slot of a {@link Grid}.
 * <p>
 * A {@link Label} holds tree text and never changes.
 * A {@link Drawable} starts blank and can receive connector glyphs.
 * Neither stores a width: the column width is applied when the cell is rendered.
 */
public sealed interface Cell permits Cell.Label, Cell.Drawable {

	/**
	 * @return the number of code points this cell needs before any padding
	 */
	int contentWidth();

	/**
	 * @param width the column width; at least {@link #contentWidth()}
	 */
	String render(int width);

	record Label(String text) implements Cell {
		@Override
		public int contentWidth() {
			return text.codePointCount(0, text.length());
		}

		@Override
		public String render(int width) {
			return text + " ".repeat(width - contentWidth());
		}
	}

	final class Drawable implements Cell {
		/**
		 * Null while blank; otherwise {@link Glyph#VERTICAL VERTICAL},
		 * {@link Glyph#CORNER CORNER} or {@link Glyph#JUNCTION JUNCTION}.
		 */
		private @Nullable Glyph lead;

		public @Nullable Glyph lead() {
			return lead;
		}

		void lead(Glyph lead) {
			this.lead = lead;
		}

		public boolean isBlank() {
			return lead == null;
		}

		@Override
		public int contentWidth() {
			return 0;
		}

		@Override
		public String render(int width) {
			if (lead == null) {
				return " ".repeat(width);
			}
			int rest = Math.max(0, width - 1);
			if (lead == VERTICAL) {
				return lead.character() + " ".repeat(rest);
			} else {
				// CORNER and JUNCTION both lead into the child on their right
				return lead.character() + String.valueOf(HORIZONTAL.character()).repeat(rest);
			}
		}

		@Override
		public String toString() {
			return "Drawable(" + lead + ")";
		}
	}
}
