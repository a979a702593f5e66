package igcse.ast;

public sealed interface Statement extends Node permits ClassDeclaration, MethodDeclaration, VariableDeclaration, Block,
		ExpressionStatement, IfStatement, ForStatement, EnhancedForStatement, WhileStatement, DoWhileStatement,
		SwitchStatement, BreakStatement, ContinueStatement, ReturnStatement {
}
