package igcse.ast;

import java.util.List;

public record Program(List<Statement> body, SourceSpan span) implements Node {
	@Override
	public NodeKind kind() {
		return NodeKind.PROGRAM;
	}
}
