package igcse.transform;

import igcse.ast.Assignment;
import igcse.ast.BinaryExpression;
import igcse.ast.Expression;
import igcse.ast.ExpressionStatement;
import igcse.ast.ForStatement;
import igcse.ast.Identifier;
import igcse.ast.Statement;
import igcse.ast.UpdateExpression;
import igcse.ast.VariableDeclaration;

import java.util.Map;
import java.util.Set;

/**
 * Recognizes three-clause {@code for} loops that count a single variable in fixed steps.
 */
final class ForLoopBounds {
	/**
	 * @param variable   the loop counter
	 * @param start      initial value
	 * @param bound      right-hand side of the condition
	 * @param boundShift added to {@code bound} to get the inclusive last value
	 * @param step       step size, null for a unit step
	 * @param descending the counter moves down
	 */
	record CountingLoop(String variable, Expression start, Expression bound, int boundShift, Expression step,
			boolean descending) {
	}

	private static final Map<String, Integer> ASCENDING_SHIFT = Map.of("<", -1, "<=", 0);
	private static final Map<String, Integer> DESCENDING_SHIFT = Map.of(">", 1, ">=", 0);

	private static final Set<String> COUNTER_TYPES = Set.of(
			"int", "long", "short", "byte", "Integer", "Long", "number", "var");

	private ForLoopBounds() {
	}

	/**
	 * @return the counting shape, or null when the loop needs the WHILE rewrite
	 */
	static CountingLoop analyze(ForStatement loop) {
		if (loop.init().size() != 1 || loop.condition() == null || loop.updates().size() != 1) {
			return null;
		}

		String variable;
		Expression start;
		Statement init = loop.init().get(0);
		if (init instanceof VariableDeclaration v && v.initializer() != null
				&& (v.type() == null || (!v.type().isArray() && COUNTER_TYPES.contains(v.type().name())))) {
			variable = v.name();
			start = v.initializer();
		} else if (init instanceof ExpressionStatement es && es.expression() instanceof Assignment a
				&& !a.isCompound() && a.target() instanceof Identifier id) {
			variable = id.name();
			start = a.value();
		} else {
			return null;
		}

		if (!(loop.condition() instanceof BinaryExpression cond) || !isName(cond.left(), variable)) {
			return null;
		}

		Step step = step(loop.updates().get(0), variable);
		if (step == null) {
			return null;
		}

		Integer shift = (step.descending ? DESCENDING_SHIFT : ASCENDING_SHIFT).get(cond.operator());
		if (shift == null) {
			return null;
		}
		if (ControlFlowScan.writes(loop.body(), variable) || ControlFlowScan.writes(cond.right(), variable)) {
			return null;
		}
		return new CountingLoop(variable, start, cond.right(), shift, step.size, step.descending);
	}

	private record Step(Expression size, boolean descending) {
	}

	private static Step step(Expression update, String variable) {
		if (update instanceof UpdateExpression u && isName(u.target(), variable)) {
			return new Step(null, !u.isIncrement());
		}
		if (!(update instanceof Assignment a) || !isName(a.target(), variable)) {
			return null;
		}
		switch (a.operator()) {
			case "+=":
				return signed(a.value(), false);
			case "-=":
				return signed(a.value(), true);
			case "=":
				// i = i + k, i = i - k
				if (a.value() instanceof BinaryExpression b && isName(b.left(), variable)) {
					if (b.operator().equals("+")) {
						return signed(b.right(), false);
					}
					if (b.operator().equals("-")) {
						return signed(b.right(), true);
					}
				}
				return null;
			default:
				return null;
		}
	}

	private static Step signed(Expression size, boolean subtract) {
		Integer value = ExpressionTranslator.intValue(size);
		if (value != null && value == 0) {
			return null;
		}
		boolean negativeLiteral = value != null && value < 0;
		return new Step(size, subtract != negativeLiteral);
	}

	private static boolean isName(Expression e, String name) {
		return e instanceof Identifier id && id.name().equals(name);
	}
}
