package igcse.transform;

import java.util.HashMap;
import java.util.Map;

/**
 * Pseudocode types of the names visible at a point of the conversion.
 *
 * Scopes follow classes and methods; blocks share their method's scope.
 */
public final class Scope {
	public record Symbol(String type, int dimensions) {
	}

	private final Scope parent;
	private final Map<String, Symbol> symbols = new HashMap<>();

	private Scope(Scope parent) {
		this.parent = parent;
	}

	public static Scope global() {
		return new Scope(null);
	}

	public Scope child() {
		return new Scope(this);
	}

	public void declare(String name, String type, int dimensions) {
		symbols.put(name, new Symbol(type, dimensions));
	}

	/**
	 * @return the innermost symbol with that name, or null
	 */
	public Symbol lookup(String name) {
		for (Scope s = this; s != null; s = s.parent) {
			Symbol symbol = s.symbols.get(name);
			if (symbol != null) {
				return symbol;
			}
		}
		return null;
	}

	public boolean isDeclaredHere(String name) {
		return symbols.containsKey(name);
	}

	/**
	 * Copy of the names declared directly here, for {@link #restore(Map)}.
	 */
	Map<String, Symbol> snapshot() {
		return new HashMap<>(symbols);
	}

	/**
	 * Drops every declaration made since {@code saved} was taken.
	 */
	void restore(Map<String, Symbol> saved) {
		symbols.clear();
		symbols.putAll(saved);
	}
}
