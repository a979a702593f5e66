package igcse.ast;

import java.util.List;

public record NewObject(TypeRef type, List<Expression> arguments, SourceSpan span) implements Expression {
	@Override
	public NodeKind kind() {
		return NodeKind.NEW_OBJECT;
	}
}
