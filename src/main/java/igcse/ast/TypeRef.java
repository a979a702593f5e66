package igcse.ast;

/**
 * A declared type as written in the source. Generic arguments are erased;
 * {@code dimensions} counts the trailing {@code []} pairs.
 */
public record TypeRef(String name, int dimensions, SourceSpan span) {
	public boolean isArray() {
		return dimensions > 0;
	}

	public boolean isVoid() {
		return dimensions == 0 && name.equals("void");
	}

	public TypeRef elementType() {
		return new TypeRef(name, Math.max(0, dimensions - 1), span);
	}
}
