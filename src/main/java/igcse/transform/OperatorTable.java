package igcse.transform;

import java.util.Map;
import java.util.Set;

/**
 * Operator spelling and binding strength on the pseudocode side.
 */
final class OperatorTable {
	static final int OR = 1;
	static final int AND = 2;
	static final int COMPARISON = 3;
	static final int CONCAT = 4;
	static final int ADDITIVE = 5;
	static final int MULTIPLICATIVE = 6;
	static final int POWER = 7;
	static final int UNARY = 8;
	static final int ATOM = 10;

	private static final Map<String, String> SPELLING = Map.ofEntries(
			Map.entry("==", "="),
			Map.entry("===", "="),
			Map.entry("!=", "<>"),
			Map.entry("!==", "<>"),
			Map.entry("&&", "AND"),
			Map.entry("||", "OR"),
			Map.entry("%", "MOD"));

	private static final Map<String, Integer> PRECEDENCE = Map.ofEntries(
			Map.entry("OR", OR),
			Map.entry("AND", AND),
			Map.entry("=", COMPARISON),
			Map.entry("<>", COMPARISON),
			Map.entry("<", COMPARISON),
			Map.entry(">", COMPARISON),
			Map.entry("<=", COMPARISON),
			Map.entry(">=", COMPARISON),
			Map.entry("&", CONCAT),
			Map.entry("+", ADDITIVE),
			Map.entry("-", ADDITIVE),
			Map.entry("*", MULTIPLICATIVE),
			Map.entry("/", MULTIPLICATIVE),
			Map.entry("DIV", MULTIPLICATIVE),
			Map.entry("MOD", MULTIPLICATIVE),
			Map.entry("^", POWER));

	private static final Set<String> ASSOCIATIVE = Set.of("OR", "AND", "&", "+", "*");

	private static final Map<String, String> NEGATED = Map.of(
			"<", ">=",
			">=", "<",
			">", "<=",
			"<=", ">",
			"=", "<>",
			"<>", "=");

	private OperatorTable() {
	}

	/**
	 * @param text         an operand of {@code +} is text, so {@code +} concatenates
	 * @param integerDivision {@code /} divides integers
	 */
	static String spell(String sourceOperator, boolean text, boolean integerDivision) {
		if (sourceOperator.equals("+")) {
			return text ? "&" : "+";
		}
		if (sourceOperator.equals("/")) {
			return integerDivision ? "DIV" : "/";
		}
		return SPELLING.getOrDefault(sourceOperator, sourceOperator);
	}

	static int precedence(String pseudoOperator) {
		Integer p = PRECEDENCE.get(pseudoOperator);
		if (p == null) {
			throw new IllegalArgumentException("Unknown operator: " + pseudoOperator);
		}
		return p;
	}

	static boolean isAssociative(String pseudoOperator) {
		return ASSOCIATIVE.contains(pseudoOperator);
	}

	/**
	 * @return the comparison that is true exactly when {@code pseudoOperator} is false, or null
	 */
	static String negatedComparison(String pseudoOperator) {
		return NEGATED.get(pseudoOperator);
	}
}
