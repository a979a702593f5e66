package igcse.ast;

public record BinaryExpression(Expression left, String operator, Expression right, SourceSpan span) implements Expression {
	@Override
	public NodeKind kind() {
		return NodeKind.BINARY_EXPRESSION;
	}
}
