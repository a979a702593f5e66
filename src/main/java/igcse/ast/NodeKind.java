package igcse.ast;

public enum NodeKind {
	PROGRAM,
	CLASS_DECLARATION,
	METHOD_DECLARATION,
	VARIABLE_DECLARATION,
	BLOCK,
	EXPRESSION_STATEMENT,
	IF_STATEMENT,
	FOR_STATEMENT,
	ENHANCED_FOR_STATEMENT,
	WHILE_STATEMENT,
	DO_WHILE_STATEMENT,
	SWITCH_STATEMENT,
	SWITCH_CASE,
	BREAK_STATEMENT,
	CONTINUE_STATEMENT,
	RETURN_STATEMENT,
	ASSIGNMENT,
	BINARY_EXPRESSION,
	UNARY_EXPRESSION,
	UPDATE_EXPRESSION,
	METHOD_CALL,
	MEMBER_ACCESS,
	ARRAY_ACCESS,
	NEW_OBJECT,
	NEW_ARRAY,
	ARRAY_LITERAL,
	CAST,
	LITERAL,
	IDENTIFIER
}
