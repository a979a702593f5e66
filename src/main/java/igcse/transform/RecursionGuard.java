package igcse.transform;

import igcse.CycleDetectedException;
import igcse.RecursionLimitExceededException;
import igcse.ast.Node;

import java.util.function.Function;

/**
 * Depth limit plus cycle check around every node visit.
 */
final class RecursionGuard {
	private RecursionGuard() {
	}

	static <T> T visit(Node node, ConversionContext ctx, Function<ConversionContext, T> body) {
		if (ctx.depth() >= ctx.options().maxDepth()) {
			throw new RecursionLimitExceededException(
					"Nesting deeper than " + ctx.options().maxDepth() + " levels at " + node.kind(), node.span());
		}
		if (!ctx.path().mark(node)) {
			throw new CycleDetectedException("Node " + ActivePath.identity(node) + " is its own ancestor",
					node.span());
		}
		try {
			return body.apply(ctx.descend());
		} finally {
			ctx.path().unmark(node);
		}
	}
}
