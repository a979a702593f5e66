package igcse.ast;

import java.util.List;

/**
 * Three-clause for loop. Any clause may be empty; {@code condition} is then null.
 */
public record ForStatement(List<Statement> init, Expression condition, List<Expression> updates, Statement body,
		SourceSpan span) implements Statement {
	@Override
	public NodeKind kind() {
		return NodeKind.FOR_STATEMENT;
	}
}
