package igcse;

/**
 * Renders the source line an error points at, with a caret under the column.
 */
public final class SourceExcerpt {
	private SourceExcerpt() {
	}

	/**
	 * @param line   1-based
	 * @param column 1-based
	 * @return {@code "<line text>\n<spaces>^"}, or an empty string when the line does not exist
	 */
	public static String caret(String source, int line, int column) {
		if (source == null || line < 1) {
			return "";
		}
		String[] lines = source.split("\r?\n", -1);
		if (line > lines.length) {
			return "";
		}
		String text = lines[line - 1];
		StringBuilder pad = new StringBuilder();
		int upTo = Math.min(Math.max(column, 1) - 1, text.length());
		for (int i = 0; i < upTo; i++) {
			// keep tabs so the caret lines up in a terminal
			pad.append(text.charAt(i) == '\t' ? '\t' : ' ');
		}
		return text + "\n" + pad + "^";
	}
}
