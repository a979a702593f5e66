package igcse.ast;

public record DoWhileStatement(Statement body, Expression condition, SourceSpan span) implements Statement {
	@Override
	public NodeKind kind() {
		return NodeKind.DO_WHILE_STATEMENT;
	}
}
