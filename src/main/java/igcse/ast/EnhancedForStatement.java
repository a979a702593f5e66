package igcse.ast;

public record EnhancedForStatement(String variable, TypeRef variableType, Expression iterable, Statement body,
		SourceSpan span) implements Statement {
	@Override
	public NodeKind kind() {
		return NodeKind.ENHANCED_FOR_STATEMENT;
	}
}
