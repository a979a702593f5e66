package igcse.ast;

import java.util.List;

public record SwitchStatement(Expression discriminant, List<SwitchCase> cases, SourceSpan span) implements Statement {
	@Override
	public NodeKind kind() {
		return NodeKind.SWITCH_STATEMENT;
	}
}
