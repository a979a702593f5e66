package igcse.ast;

import java.util.List;

/**
 * @param superclass null when the class extends nothing
 */
public record ClassDeclaration(String name, List<String> modifiers, String superclass, List<String> interfaces,
		List<Statement> members, SourceSpan span) implements Statement {
	@Override
	public NodeKind kind() {
		return NodeKind.CLASS_DECLARATION;
	}
}
