package igcse.ast;

/**
 * Method parameter. {@code type} is null for an unannotated TypeScript parameter.
 */
public record Parameter(String name, TypeRef type, SourceSpan span) {
}
