package igcse.ast;

import java.util.List;

/**
 * @param receiver null for an unqualified call such as {@code foo(1)}
 */
public record MethodCall(Expression receiver, String name, List<Expression> arguments, SourceSpan span)
		implements Expression {
	@Override
	public NodeKind kind() {
		return NodeKind.METHOD_CALL;
	}
}
