package igcse.transform;

import java.util.Map;
import java.util.Set;

/**
 * Source type names to IGCSE data types.
 */
final class TypeTable {
	static final String INTEGER = "INTEGER";
	static final String REAL = "REAL";
	static final String STRING = "STRING";
	static final String CHAR = "CHAR";
	static final String BOOLEAN = "BOOLEAN";

	private static final Map<String, String> TYPES = Map.ofEntries(
			Map.entry("int", INTEGER),
			Map.entry("long", INTEGER),
			Map.entry("short", INTEGER),
			Map.entry("byte", INTEGER),
			Map.entry("Integer", INTEGER),
			Map.entry("Long", INTEGER),
			Map.entry("Short", INTEGER),
			Map.entry("Byte", INTEGER),
			Map.entry("double", REAL),
			Map.entry("float", REAL),
			Map.entry("Double", REAL),
			Map.entry("Float", REAL),
			Map.entry("number", REAL),
			Map.entry("String", STRING),
			Map.entry("string", STRING),
			Map.entry("char", CHAR),
			Map.entry("Character", CHAR),
			Map.entry("boolean", BOOLEAN),
			Map.entry("Boolean", BOOLEAN));

	/**
	 * Types whose declarations only open console input and have no pseudocode form.
	 */
	static final Set<String> INPUT_STREAM_TYPES = Set.of("Scanner", "BufferedReader", "InputStreamReader");

	/**
	 * Names that ask for the type to be taken from the initializer.
	 */
	static final Set<String> INFERRED = Set.of("var", "let", "any");

	private TypeTable() {
	}

	/**
	 * @return the IGCSE type, or null when the name is not known
	 */
	static String lookup(String sourceName, Map<String, String> customMappings) {
		String custom = customMappings.get(sourceName);
		if (custom != null) {
			return custom;
		}
		return TYPES.get(sourceName);
	}
}
