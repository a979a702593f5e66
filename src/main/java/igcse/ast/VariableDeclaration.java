package igcse.ast;

import java.util.List;

/**
 * Single declarator. {@code int a = 1, b;} yields two of these.
 *
 * @param type        null when the source has no annotation (TypeScript)
 * @param initializer null when the variable is not initialized
 */
public record VariableDeclaration(String name, TypeRef type, List<String> modifiers, Expression initializer,
		SourceSpan span) implements Statement {
	@Override
	public NodeKind kind() {
		return NodeKind.VARIABLE_DECLARATION;
	}

	public boolean hasModifier(String modifier) {
		return modifiers.contains(modifier);
	}
}
