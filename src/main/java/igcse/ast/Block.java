package igcse.ast;

import java.util.List;

public record Block(List<Statement> statements, SourceSpan span) implements Statement {
	@Override
	public NodeKind kind() {
		return NodeKind.BLOCK;
	}
}
