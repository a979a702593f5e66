package igcse.ast;

public sealed interface Expression extends Node permits Assignment, BinaryExpression, UnaryExpression,
		UpdateExpression, MethodCall, MemberAccess, ArrayAccess, NewObject, NewArray, ArrayLiteral, Cast, Literal,
		Identifier {
}
