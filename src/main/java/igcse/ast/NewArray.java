package igcse.ast;

import java.util.List;

/**
 * {@code new int[n][m]} or {@code new int[] {1, 2}}.
 *
 * @param initializer null unless the creation has a brace initializer
 */
public record NewArray(TypeRef elementType, List<Expression> dimensions, ArrayLiteral initializer, SourceSpan span)
		implements Expression {
	@Override
	public NodeKind kind() {
		return NodeKind.NEW_ARRAY;
	}
}
