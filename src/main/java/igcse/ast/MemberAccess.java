package igcse.ast;

public record MemberAccess(Expression target, String name, SourceSpan span) implements Expression {
	@Override
	public NodeKind kind() {
		return NodeKind.MEMBER_ACCESS;
	}
}
