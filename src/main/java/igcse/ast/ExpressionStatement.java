package igcse.ast;

public record ExpressionStatement(Expression expression, SourceSpan span) implements Statement {
	@Override
	public NodeKind kind() {
		return NodeKind.EXPRESSION_STATEMENT;
	}
}
