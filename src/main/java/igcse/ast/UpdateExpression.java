package igcse.ast;

/**
 * {@code ++} or {@code --}, prefix or postfix.
 */
public record UpdateExpression(String operator, Expression target, boolean prefix, SourceSpan span)
		implements Expression {
	@Override
	public NodeKind kind() {
		return NodeKind.UPDATE_EXPRESSION;
	}

	public boolean isIncrement() {
		return operator.equals("++");
	}
}
