package igcse.ast;

public record ArrayAccess(Expression array, Expression index, SourceSpan span) implements Expression {
	@Override
	public NodeKind kind() {
		return NodeKind.ARRAY_ACCESS;
	}
}
