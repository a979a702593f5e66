package igcse.ast;

import java.util.List;

/**
 * One {@code case} or {@code default} label with the statements that follow it.
 * Falls through to the next case unless {@code body} ends with break or return.
 *
 * @param label null for {@code default}
 */
public record SwitchCase(Expression label, List<Statement> body, SourceSpan span) implements Node {
	@Override
	public NodeKind kind() {
		return NodeKind.SWITCH_CASE;
	}

	public boolean isDefault() {
		return label == null;
	}
}
