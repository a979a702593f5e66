package igcse.ast;

/**
 * An {@code else if} chain is an {@code elseBranch} that is itself an IfStatement.
 *
 * @param elseBranch null when there is no else
 */
public record IfStatement(Expression condition, Statement thenBranch, Statement elseBranch, SourceSpan span)
		implements Statement {
	@Override
	public NodeKind kind() {
		return NodeKind.IF_STATEMENT;
	}
}
