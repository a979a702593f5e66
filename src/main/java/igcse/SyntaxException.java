package igcse;

import igcse.ast.SourceSpan;

/**
 * Thrown by the parser on an unexpected or missing token.
 */
public class SyntaxException extends ConversionException {
	public SyntaxException(String message, int line, int column) {
		super(message, line, column);
	}

	public SyntaxException(String message, SourceSpan span) {
		super(message, span);
	}
}
