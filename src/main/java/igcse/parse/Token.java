package igcse.parse;

import igcse.ast.SourceSpan;

public record Token(TokenType type, String text, SourceSpan span) {
	public boolean is(TokenType expectedType, String expectedText) {
		return type == expectedType && text.equals(expectedText);
	}
}
