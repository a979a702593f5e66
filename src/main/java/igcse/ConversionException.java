package igcse;

import igcse.ast.SourceSpan;

/**
 * Base of every failure raised while converting source to pseudocode.
 *
 * Line and column are 1-based; 0 when no position is known.
 */
public class ConversionException extends RuntimeException {
	private final int line;
	private final int column;

	public ConversionException(String message, int line, int column) {
		super(message);
		this.line = line;
		this.column = column;
	}

	public ConversionException(String message, SourceSpan span) {
		this(message, span.line(), span.column());
	}

	public int line() {
		return line;
	}

	public int column() {
		return column;
	}

	public boolean hasPosition() {
		return line > 0;
	}
}
