package igcse.transform;

/**
 * Rendered pseudocode expression and the binding strength of its outermost operator.
 */
record Rendered(String text, int precedence) {
	static Rendered atom(String text) {
		return new Rendered(text, OperatorTable.ATOM);
	}

	/**
	 * Text, parenthesized when this binds looser than {@code context}.
	 */
	String within(int context) {
		return precedence < context ? "(" + text + ")" : text;
	}
}
