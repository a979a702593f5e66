package igcse;

import igcse.ast.SourceSpan;

/**
 * Thrown by the lexer on a character it cannot start a token with.
 */
public class LexicalException extends ConversionException {
	public LexicalException(String message, int line, int column) {
		super(message, line, column);
	}

	public LexicalException(String message, SourceSpan span) {
		super(message, span);
	}
}
