package igcse.ast;

public record WhileStatement(Expression condition, Statement body, SourceSpan span) implements Statement {
	@Override
	public NodeKind kind() {
		return NodeKind.WHILE_STATEMENT;
	}
}
