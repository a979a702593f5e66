package igcse.ast;

/**
 * Source span for diagnostics.
 *
 * Offsets are 0-based character indices into the original source text; line and
 * column are 1-based and describe the start of the span.
 */
public record SourceSpan(int startOffset, int endOffset, int line, int column) {
	public static final SourceSpan NONE = new SourceSpan(-1, -1, 0, 0);

	/**
	 * Span starting where this one starts and ending where {@code end} ends.
	 */
	public SourceSpan to(SourceSpan end) {
		return new SourceSpan(startOffset, end.endOffset(), line, column);
	}
}
