package igcse.ast;

public record Identifier(String name, SourceSpan span) implements Expression {
	@Override
	public NodeKind kind() {
		return NodeKind.IDENTIFIER;
	}
}
