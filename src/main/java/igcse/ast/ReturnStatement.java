package igcse.ast;

/**
 * @param value null for a bare {@code return;}
 */
public record ReturnStatement(Expression value, SourceSpan span) implements Statement {
	@Override
	public NodeKind kind() {
		return NodeKind.RETURN_STATEMENT;
	}
}
