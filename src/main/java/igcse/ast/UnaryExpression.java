package igcse.ast;

public record UnaryExpression(String operator, Expression operand, SourceSpan span) implements Expression {
	@Override
	public NodeKind kind() {
		return NodeKind.UNARY_EXPRESSION;
	}
}
