package igcse.ast;

import java.util.List;

public record ArrayLiteral(List<Expression> elements, SourceSpan span) implements Expression {
	@Override
	public NodeKind kind() {
		return NodeKind.ARRAY_LITERAL;
	}
}
