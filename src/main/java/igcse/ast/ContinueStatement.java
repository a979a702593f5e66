package igcse.ast;

public record ContinueStatement(SourceSpan span) implements Statement {
	@Override
	public NodeKind kind() {
		return NodeKind.CONTINUE_STATEMENT;
	}
}
