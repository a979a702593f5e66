package igcse.transform;

import igcse.Severity;
import igcse.UnsupportedConstructException;
import igcse.WarningCode;
import igcse.ast.ArrayAccess;
import igcse.ast.Assignment;
import igcse.ast.BinaryExpression;
import igcse.ast.Cast;
import igcse.ast.Expression;
import igcse.ast.Identifier;
import igcse.ast.Literal;
import igcse.ast.LiteralKind;
import igcse.ast.MemberAccess;
import igcse.ast.MethodCall;
import igcse.ast.UnaryExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Expression AST to pseudocode text, with the small type inference that decides
 * between {@code +} and {@code &}.
 */
final class ExpressionTranslator {
	private static final Set<String> COMPARISONS = Set.of("==", "===", "!=", "!==", "<", ">", "<=", ">=");

	private static final List<String> TEXT_NAME_HINTS = List.of(
			"name", "str", "text", "message", "msg", "word", "line", "title", "label");

	String render(Expression e, ConversionContext ctx) {
		return renderPrec(e, ctx).text();
	}

	Rendered renderPrec(Expression e, ConversionContext ctx) {
		return RecursionGuard.visit(e, ctx, inner -> translate(e, inner));
	}

	/**
	 * Renders {@code e} when the caller has already entered it through the guard.
	 */
	Rendered translate(Expression e, ConversionContext ctx) {
		return switch (e.kind()) {
			case LITERAL -> literal((Literal) e);
			case IDENTIFIER -> identifier((Identifier) e);
			case BINARY_EXPRESSION -> binary((BinaryExpression) e, ctx);
			case UNARY_EXPRESSION -> unary((UnaryExpression) e, ctx);
			case METHOD_CALL -> call((MethodCall) e, ctx);
			case MEMBER_ACCESS -> member((MemberAccess) e, ctx);
			case ARRAY_ACCESS -> arrayAccess((ArrayAccess) e, ctx);
			case CAST -> cast((Cast) e, ctx);
			case ASSIGNMENT -> throw new UnsupportedConstructException("assignment inside an expression", e.span());
			case UPDATE_EXPRESSION ->
				throw new UnsupportedConstructException("increment or decrement inside an expression", e.span());
			case NEW_OBJECT -> throw new UnsupportedConstructException("object creation", e.span());
			case NEW_ARRAY, ARRAY_LITERAL ->
				throw new UnsupportedConstructException("array value outside a declaration", e.span());
			default -> throw new IllegalStateException("Not an expression: " + e.kind());
		};
	}

	private static Rendered literal(Literal l) {
		return switch (l.literalKind()) {
			case BOOLEAN -> Rendered.atom(l.text().toUpperCase(Locale.ROOT));
			case NULL -> Rendered.atom("NULL");
			default -> Rendered.atom(l.text());
		};
	}

	private static Rendered identifier(Identifier id) {
		if (id.name().equals("this")) {
			throw new UnsupportedConstructException("'this' used as a value", id.span());
		}
		return Rendered.atom(id.name());
	}

	private Rendered binary(BinaryExpression b, ConversionContext ctx) {
		boolean text = b.operator().equals("+") && (isText(b.left(), ctx) || isText(b.right(), ctx));
		String op = OperatorTable.spell(b.operator(), text, ctx.options().forceIntegerDivision());
		return compose(renderPrec(b.left(), ctx), op, renderPrec(b.right(), ctx));
	}

	private Rendered unary(UnaryExpression u, ConversionContext ctx) {
		Rendered operand = renderPrec(u.operand(), ctx);
		return switch (u.operator()) {
			case "!" -> new Rendered("NOT " + operand.within(OperatorTable.UNARY), OperatorTable.UNARY);
			case "-" -> new Rendered("-" + operand.within(OperatorTable.UNARY), OperatorTable.UNARY);
			case "+" -> operand;
			default -> throw new UnsupportedConstructException("unary operator " + u.operator(), u.span());
		};
	}

	private Rendered call(MethodCall call, ConversionContext ctx) {
		Rendered builtin = BuiltinCalls.translate(call, this, ctx);
		if (builtin != null) {
			return builtin;
		}
		if (BuiltinCalls.isOutput(call)) {
			throw new UnsupportedConstructException("output inside an expression", call.span());
		}
		if (BuiltinCalls.isRead(call)) {
			throw new UnsupportedConstructException("input inside an expression", call.span());
		}
		return Rendered.atom(callee(call, ctx) + "(" + arguments(call.arguments(), ctx) + ")");
	}

	/**
	 * Name used after {@code CALL} or in an expression, without the argument list.
	 */
	String callee(MethodCall call, ConversionContext ctx) {
		if (call.receiver() == null || isThis(call.receiver())) {
			return call.name();
		}
		return renderPrec(call.receiver(), ctx).within(OperatorTable.ATOM) + "." + call.name();
	}

	String arguments(List<Expression> args, ConversionContext ctx) {
		List<String> parts = new ArrayList<>();
		for (Expression arg : args) {
			parts.add(render(arg, ctx));
		}
		return String.join(", ", parts);
	}

	private Rendered member(MemberAccess m, ConversionContext ctx) {
		if (isThis(m.target())) {
			return Rendered.atom(m.name());
		}
		if (m.name().equals("length")) {
			return Rendered.atom("LENGTH(" + render(m.target(), ctx) + ")");
		}
		return Rendered.atom(renderPrec(m.target(), ctx).within(OperatorTable.ATOM) + "." + m.name());
	}

	/**
	 * {@code a[i][j]} becomes {@code a[i, j]}.
	 */
	private Rendered arrayAccess(ArrayAccess access, ConversionContext ctx) {
		List<Expression> indices = new ArrayList<>();
		Expression base = access;
		while (base instanceof ArrayAccess a) {
			indices.add(0, a.index());
			base = a.array();
		}
		return Rendered.atom(renderPrec(base, ctx).within(OperatorTable.ATOM) + "[" + arguments(indices, ctx) + "]");
	}

	private Rendered cast(Cast cast, ConversionContext ctx) {
		Rendered operand = renderPrec(cast.operand(), ctx);
		String target = TypeTable.lookup(cast.type().name(), ctx.options().customMappings());
		if (TypeTable.INTEGER.equals(target)) {
			return Rendered.atom("INT(" + operand.text() + ")");
		}
		if (TypeTable.CHAR.equals(target)) {
			return Rendered.atom("CHR(" + operand.text() + ")");
		}
		if (target == null) {
			ctx.warn(WarningCode.APPROXIMATION, "Cast to " + cast.type().name() + " dropped", Severity.WARNING,
					cast.span());
		}
		return operand;
	}

	/**
	 * Joins two rendered operands, parenthesizing whichever side binds looser than {@code op}.
	 */
	static Rendered compose(Rendered left, String op, Rendered right) {
		int p = OperatorTable.precedence(op);
		String l = left.within(p);
		String r = right.precedence() < p || (right.precedence() == p && !OperatorTable.isAssociative(op))
				? "(" + right.text() + ")"
				: right.text();
		return new Rendered(l + " " + op + " " + r, p);
	}

	/**
	 * {@code e + delta} with integer literals folded. A fold that would overflow
	 * {@code int} is left symbolic.
	 */
	Rendered plus(Expression e, int delta, ConversionContext ctx) {
		Integer value = intValue(e);
		if (value != null) {
			try {
				return Rendered.atom(String.valueOf(Math.addExact(value, delta)));
			} catch (ArithmeticException overflow) {
				return shifted(renderPrec(e, ctx), delta);
			}
		}
		// n + 1 shifted by -1 is n
		if (e instanceof BinaryExpression b && (b.operator().equals("+") || b.operator().equals("-"))
				&& intValue(b.right()) != null && !isText(b.left(), ctx)) {
			Integer offset = foldedOffset(b, delta);
			if (offset != null) {
				return RecursionGuard.visit(b, ctx, inner -> plus(b.left(), offset, inner));
			}
		}
		return shifted(renderPrec(e, ctx), delta);
	}

	/**
	 * @return the literal right operand of {@code b} plus {@code delta}, or null on overflow
	 */
	private static Integer foldedOffset(BinaryExpression b, int delta) {
		int right = intValue(b.right());
		try {
			return Math.addExact(b.operator().equals("+") ? right : Math.negateExact(right), delta);
		} catch (ArithmeticException overflow) {
			return null;
		}
	}

	private static Rendered shifted(Rendered base, int delta) {
		if (delta == 0) {
			return base;
		}
		return compose(base, delta > 0 ? "+" : "-", Rendered.atom(Long.toString(Math.abs((long) delta))));
	}

	static Integer intValue(Expression e) {
		if (e instanceof Literal l && l.literalKind() == LiteralKind.INTEGER) {
			try {
				return Integer.valueOf(l.text());
			} catch (NumberFormatException ex) {
				return null;
			}
		}
		if (e instanceof UnaryExpression u && u.operator().equals("-")) {
			Integer inner = intValue(u.operand());
			return inner == null ? null : -inner;
		}
		return null;
	}

	/**
	 * Output items for {@code OUTPUT}: a top-level text concatenation becomes separate items.
	 */
	List<String> outputItems(List<Expression> args, ConversionContext ctx) {
		List<String> items = new ArrayList<>();
		for (Expression arg : args) {
			flatten(arg, ctx, items);
		}
		return items;
	}

	private void flatten(Expression e, ConversionContext ctx, List<String> out) {
		if (e instanceof BinaryExpression b && b.operator().equals("+") && TypeTable.STRING.equals(inferType(b, ctx))) {
			RecursionGuard.visit(b, ctx, inner -> {
				flatten(b.left(), inner, out);
				flatten(b.right(), inner, out);
				return null;
			});
			return;
		}
		out.add(render(e, ctx));
	}

	Rendered negate(Expression condition, ConversionContext ctx) {
		return ConditionNegator.negate(condition, this, ctx);
	}

	boolean isText(Expression e, ConversionContext ctx) {
		String type = inferType(e, ctx);
		return TypeTable.STRING.equals(type) || TypeTable.CHAR.equals(type);
	}

	/**
	 * Best-effort IGCSE type of an expression, or null when it cannot be told.
	 */
	String inferType(Expression e, ConversionContext ctx) {
		switch (e.kind()) {
			case LITERAL: {
				return switch (((Literal) e).literalKind()) {
					case INTEGER -> TypeTable.INTEGER;
					case REAL -> TypeTable.REAL;
					case STRING -> TypeTable.STRING;
					case CHAR -> TypeTable.CHAR;
					case BOOLEAN -> TypeTable.BOOLEAN;
					case NULL -> null;
				};
			}
			case IDENTIFIER: {
				String name = ((Identifier) e).name();
				Scope.Symbol symbol = ctx.scope().lookup(name);
				if (symbol != null) {
					return symbol.dimensions() == 0 ? symbol.type() : null;
				}
				if (ctx.options().nameHeuristicConcatenation() && looksLikeText(name)) {
					return TypeTable.STRING;
				}
				return null;
			}
			case BINARY_EXPRESSION: {
				BinaryExpression b = (BinaryExpression) e;
				String op = b.operator();
				if (COMPARISONS.contains(op) || op.equals("&&") || op.equals("||")) {
					return TypeTable.BOOLEAN;
				}
				if (op.equals("&")) {
					return TypeTable.STRING;
				}
				if (op.equals("+") && (isText(b.left(), ctx) || isText(b.right(), ctx))) {
					return TypeTable.STRING;
				}
				return numeric(inferType(b.left(), ctx), inferType(b.right(), ctx));
			}
			case UNARY_EXPRESSION: {
				UnaryExpression u = (UnaryExpression) e;
				return u.operator().equals("!") ? TypeTable.BOOLEAN : inferType(u.operand(), ctx);
			}
			case UPDATE_EXPRESSION:
				return TypeTable.INTEGER;
			case ASSIGNMENT:
				return inferType(((Assignment) e).value(), ctx);
			case METHOD_CALL: {
				MethodCall call = (MethodCall) e;
				String builtin = BuiltinCalls.resultType(call);
				if (builtin != null) {
					return builtin;
				}
				if (call.receiver() == null || isThis(call.receiver())) {
					Scope.Symbol fn = ctx.scope().lookup(call.name());
					return fn != null && fn.dimensions() == 0 ? fn.type() : null;
				}
				return null;
			}
			case MEMBER_ACCESS: {
				MemberAccess m = (MemberAccess) e;
				if (isThis(m.target())) {
					return inferType(new Identifier(m.name(), m.span()), ctx);
				}
				return m.name().equals("length") ? TypeTable.INTEGER : null;
			}
			case ARRAY_ACCESS: {
				Expression base = e;
				while (base instanceof ArrayAccess a) {
					base = a.array();
				}
				if (base instanceof Identifier id) {
					Scope.Symbol symbol = ctx.scope().lookup(id.name());
					return symbol != null && symbol.dimensions() > 0 ? symbol.type() : null;
				}
				return null;
			}
			case CAST:
				return TypeTable.lookup(((Cast) e).type().name(), ctx.options().customMappings());
			default:
				return null;
		}
	}

	private static String numeric(String left, String right) {
		if (TypeTable.REAL.equals(left) || TypeTable.REAL.equals(right)) {
			return TypeTable.REAL;
		}
		if (TypeTable.INTEGER.equals(left) && TypeTable.INTEGER.equals(right)) {
			return TypeTable.INTEGER;
		}
		return null;
	}

	private static boolean looksLikeText(String name) {
		String lower = name.toLowerCase(Locale.ROOT);
		for (String hint : TEXT_NAME_HINTS) {
			if (lower.contains(hint)) {
				return true;
			}
		}
		return false;
	}

	static boolean isThis(Expression e) {
		return e instanceof Identifier id && id.name().equals("this");
	}
}
