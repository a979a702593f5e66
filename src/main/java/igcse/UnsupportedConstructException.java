package igcse;

import igcse.ast.SourceSpan;

/**
 * Thrown when a node has no pseudocode lowering.
 */
public class UnsupportedConstructException extends ConversionException {
	public UnsupportedConstructException(String message, int line, int column) {
		super(message, line, column);
	}

	public UnsupportedConstructException(String message, SourceSpan span) {
		super(message, span);
	}
}
