package igcse.transform;

import igcse.ast.Expression;
import igcse.ast.Identifier;
import igcse.ast.MemberAccess;
import igcse.ast.MethodCall;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Library calls with a direct IGCSE counterpart, plus recognition of console
 * output and input.
 */
final class BuiltinCalls {
	private static final Set<String> PRINT_METHODS = Set.of("println", "print", "printf");

	private static final Map<String, String> READ_TYPES = Map.of(
			"nextInt", TypeTable.INTEGER,
			"nextLong", TypeTable.INTEGER,
			"nextDouble", TypeTable.REAL,
			"nextFloat", TypeTable.REAL,
			"nextBoolean", TypeTable.BOOLEAN,
			"nextLine", TypeTable.STRING,
			"next", TypeTable.STRING,
			"readLine", TypeTable.STRING);

	/**
	 * Number parsers that may wrap a read; {@code Integer.parseInt(sc.nextLine())} is still input.
	 */
	private static final Map<String, String> PARSE_TYPES = Map.of(
			"parseInt", TypeTable.INTEGER,
			"parseLong", TypeTable.INTEGER,
			"parseDouble", TypeTable.REAL,
			"parseFloat", TypeTable.REAL,
			"Number", TypeTable.REAL);

	private static final Map<String, String> MATH_FUNCTIONS = Map.of(
			"abs", "ABS",
			"sqrt", "SQRT",
			"max", "MAX",
			"min", "MIN");

	private static final Map<String, String> RESULT_TYPES = Map.ofEntries(
			Map.entry("length", TypeTable.INTEGER),
			Map.entry("toUpperCase", TypeTable.STRING),
			Map.entry("toLowerCase", TypeTable.STRING),
			Map.entry("substring", TypeTable.STRING),
			Map.entry("charAt", TypeTable.CHAR),
			Map.entry("equals", TypeTable.BOOLEAN),
			Map.entry("equalsIgnoreCase", TypeTable.BOOLEAN),
			Map.entry("toString", TypeTable.STRING),
			Map.entry("trim", TypeTable.STRING));

	private BuiltinCalls() {
	}

	static boolean isOutput(MethodCall call) {
		Expression r = call.receiver();
		if (PRINT_METHODS.contains(call.name()) && r instanceof MemberAccess m && m.name().equals("out")
				&& isName(m.target(), "System")) {
			return true;
		}
		return call.name().equals("log") && isName(r, "console");
	}

	static boolean isRead(MethodCall call) {
		if (call.name().equals("prompt")) {
			return call.receiver() == null || isName(call.receiver(), "window");
		}
		return call.receiver() != null && READ_TYPES.containsKey(call.name());
	}

	/**
	 * The console read inside {@code e}, looking through number parsers, or null.
	 */
	static MethodCall readIn(Expression e) {
		if (!(e instanceof MethodCall call)) {
			return null;
		}
		if (isRead(call)) {
			return call;
		}
		if (isParser(call)) {
			return readIn(call.arguments().get(0));
		}
		return null;
	}

	/**
	 * IGCSE type of the value a read expression yields.
	 */
	static String readType(Expression e) {
		MethodCall call = (MethodCall) e;
		if (isParser(call)) {
			return PARSE_TYPES.get(call.name());
		}
		return call.name().equals("prompt") ? TypeTable.STRING : READ_TYPES.get(call.name());
	}

	private static boolean isParser(MethodCall call) {
		if (!PARSE_TYPES.containsKey(call.name()) || call.arguments().isEmpty()) {
			return false;
		}
		Expression r = call.receiver();
		return r == null || isName(r, "Integer") || isName(r, "Long") || isName(r, "Double")
				|| isName(r, "Float") || isName(r, "Number");
	}

	static String resultType(MethodCall call) {
		if (isName(call.receiver(), "Math")) {
			return switch (call.name()) {
				case "random", "pow", "sqrt" -> TypeTable.REAL;
				case "round", "floor" -> TypeTable.INTEGER;
				default -> null;
			};
		}
		if (readIn(call) != null) {
			return readType(call);
		}
		if (isParser(call)) {
			return PARSE_TYPES.get(call.name());
		}
		return call.receiver() == null ? null : RESULT_TYPES.get(call.name());
	}

	/**
	 * @return the pseudocode for a recognized call, or null
	 */
	static Rendered translate(MethodCall call, ExpressionTranslator t, ConversionContext ctx) {
		Rendered custom = customMapping(call, t, ctx);
		if (custom != null) {
			return custom;
		}
		List<Expression> args = call.arguments();
		if (isName(call.receiver(), "Math")) {
			return math(call, args, t, ctx);
		}
		if (call.receiver() == null || ExpressionTranslator.isThis(call.receiver())) {
			return null;
		}

		Rendered target = t.renderPrec(call.receiver(), ctx);
		switch (call.name()) {
			case "length":
				return args.isEmpty() ? Rendered.atom("LENGTH(" + target.text() + ")") : null;
			case "toUpperCase":
				return args.isEmpty() ? Rendered.atom("UCASE(" + target.text() + ")") : null;
			case "toLowerCase":
				return args.isEmpty() ? Rendered.atom("LCASE(" + target.text() + ")") : null;
			case "charAt":
				if (args.size() != 1) {
					return null;
				}
				return Rendered.atom("SUBSTRING(" + target.text() + ", " + t.plus(args.get(0), 1, ctx).text() + ", 1)");
			case "substring":
				return substring(target, args, t, ctx);
			case "equals":
				if (args.size() != 1) {
					return null;
				}
				return ExpressionTranslator.compose(target, "=", t.renderPrec(args.get(0), ctx));
			case "equalsIgnoreCase":
				if (args.size() != 1) {
					return null;
				}
				return ExpressionTranslator.compose(Rendered.atom("UCASE(" + target.text() + ")"), "=",
						Rendered.atom("UCASE(" + t.render(args.get(0), ctx) + ")"));
			default:
				return null;
		}
	}

	/**
	 * {@code s.substring(a, b)} takes {@code b - a} characters from 1-based position {@code a + 1}.
	 */
	private static Rendered substring(Rendered target, List<Expression> args, ExpressionTranslator t,
			ConversionContext ctx) {
		if (args.isEmpty() || args.size() > 2) {
			return null;
		}
		Expression from = args.get(0);
		String start = t.plus(from, 1, ctx).text();
		String length;
		if (args.size() == 2) {
			Expression to = args.get(1);
			Integer a = ExpressionTranslator.intValue(from);
			Integer b = ExpressionTranslator.intValue(to);
			if (a != null && b != null && fitsInt((long) b - a)) {
				length = String.valueOf(b - a);
			} else if (a != null && a == 0) {
				length = t.render(to, ctx);
			} else {
				length = ExpressionTranslator.compose(t.renderPrec(to, ctx), "-", t.renderPrec(from, ctx)).text();
			}
		} else {
			Rendered whole = Rendered.atom("LENGTH(" + target.text() + ")");
			Integer a = ExpressionTranslator.intValue(from);
			length = a != null && a == 0 ? whole.text()
					: ExpressionTranslator.compose(whole, "-", t.renderPrec(from, ctx)).text();
		}
		return Rendered.atom("SUBSTRING(" + target.text() + ", " + start + ", " + length + ")");
	}

	private static boolean fitsInt(long value) {
		return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
	}

	private static Rendered math(MethodCall call, List<Expression> args, ExpressionTranslator t,
			ConversionContext ctx) {
		switch (call.name()) {
			case "random":
				return args.isEmpty() ? Rendered.atom("RANDOM()") : null;
			case "round":
				return args.size() == 1 ? Rendered.atom("ROUND(" + t.render(args.get(0), ctx) + ", 0)") : null;
			case "floor":
				return args.size() == 1 ? Rendered.atom("INT(" + t.render(args.get(0), ctx) + ")") : null;
			case "pow":
				if (args.size() != 2) {
					return null;
				}
				return ExpressionTranslator.compose(t.renderPrec(args.get(0), ctx), "^", t.renderPrec(args.get(1), ctx));
			default:
				String function = MATH_FUNCTIONS.get(call.name());
				if (function == null) {
					return null;
				}
				return Rendered.atom(function + "(" + t.arguments(args, ctx) + ")");
		}
	}

	/**
	 * A mapping keyed by {@code Receiver.name} or plain {@code name}. An instance
	 * receiver becomes the first argument.
	 */
	private static Rendered customMapping(MethodCall call, ExpressionTranslator t, ConversionContext ctx) {
		Map<String, String> mappings = ctx.options().customMappings();
		if (mappings.isEmpty()) {
			return null;
		}
		Expression r = call.receiver();
		if (r instanceof Identifier id) {
			String qualified = mappings.get(id.name() + "." + call.name());
			if (qualified != null) {
				return Rendered.atom(qualified + "(" + t.arguments(call.arguments(), ctx) + ")");
			}
		}
		String mapped = mappings.get(call.name());
		if (mapped == null) {
			return null;
		}
		String args = t.arguments(call.arguments(), ctx);
		if (r != null && !ExpressionTranslator.isThis(r)) {
			String receiver = t.render(r, ctx);
			args = args.isEmpty() ? receiver : receiver + ", " + args;
		}
		return Rendered.atom(mapped + "(" + args + ")");
	}

	private static boolean isName(Expression e, String name) {
		return e instanceof Identifier id && id.name().equals(name);
	}
}
