package igcse.ast;

import java.util.List;

/**
 * Method, function or constructor declaration.
 *
 * @param returnType null for constructors and for TypeScript functions without a return annotation
 */
public record MethodDeclaration(String name, List<String> modifiers, TypeRef returnType, List<Parameter> parameters,
		Block body, SourceSpan span) implements Statement {
	@Override
	public NodeKind kind() {
		return NodeKind.METHOD_DECLARATION;
	}

	public boolean hasModifier(String modifier) {
		return modifiers.contains(modifier);
	}
}
