package igcse.ast;

/**
 * Literal value. For strings and chars {@code text} is the lexeme including its quotes.
 */
public record Literal(LiteralKind literalKind, String text, SourceSpan span) implements Expression {
	@Override
	public NodeKind kind() {
		return NodeKind.LITERAL;
	}
}
