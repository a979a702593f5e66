package igcse.ast;

/**
 * Root of the AST. Nodes form a strict tree; the pair of {@link #kind()} and
 * {@link #span()} identifies a node structurally.
 */
public sealed interface Node permits Program, Statement, Expression, SwitchCase {
	NodeKind kind();

	SourceSpan span();
}
