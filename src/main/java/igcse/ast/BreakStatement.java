package igcse.ast;

public record BreakStatement(SourceSpan span) implements Statement {
	@Override
	public NodeKind kind() {
		return NodeKind.BREAK_STATEMENT;
	}
}
