package igcse.ast;

public record Cast(TypeRef type, Expression operand, SourceSpan span) implements Expression {
	@Override
	public NodeKind kind() {
		return NodeKind.CAST;
	}
}
