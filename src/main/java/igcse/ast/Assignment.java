package igcse.ast;

/**
 * Plain or compound assignment; {@code operator} is one of {@code = += -= *= /= %=}.
 */
public record Assignment(Expression target, String operator, Expression value, SourceSpan span)
		implements Expression {
	@Override
	public NodeKind kind() {
		return NodeKind.ASSIGNMENT;
	}

	public boolean isCompound() {
		return !operator.equals("=");
	}
}
