package igcse;

import com.typesafe.config.Config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Knobs for a single conversion.
 *
 * @param indentSize                 spaces per nesting level
 * @param includeComments            emit descriptive comments such as {@code // class Name}
 * @param strictMode                 fail instead of degrading on unsupported constructs and unknown types
 * @param maxDepth                   maximum AST nesting the engine will descend into
 * @param forceIntegerDivision       render {@code /} as {@code DIV}
 * @param nameHeuristicConcatenation treat identifiers with text-like names as strings when choosing between
 *                                   {@code +} and {@code &}
 * @param customMappings             type and call names replaced before the built-in tables are consulted
 */
public record ConversionOptions(int indentSize, boolean includeComments, boolean strictMode, int maxDepth,
		boolean forceIntegerDivision, boolean nameHeuristicConcatenation, Map<String, String> customMappings) {
	public ConversionOptions {
		if (indentSize < 0) {
			throw new IllegalArgumentException("indentSize must not be negative: " + indentSize);
		}
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
		}
		customMappings = customMappings == null ? Map.of() : Map.copyOf(customMappings);
	}

	/**
	 * Options from {@link ConverterConfig#load()}.
	 */
	public static ConversionOptions defaults() {
		return fromConfig(ConverterConfig.load());
	}

	/**
	 * Reads the {@code java2igcse} block of an already resolved config.
	 */
	public static ConversionOptions fromConfig(Config root) {
		Config c = root.getConfig(ConverterConfig.ROOT_PATH);
		Map<String, String> mappings = new LinkedHashMap<>();
		if (c.hasPath("custom-mappings")) {
			c.getObject("custom-mappings").unwrapped()
					.forEach((key, value) -> mappings.put(key, String.valueOf(value)));
		}
		return new ConversionOptions(
				c.getInt("indent-size"),
				c.getBoolean("include-comments"),
				c.getBoolean("strict-mode"),
				c.getInt("max-depth"),
				c.getBoolean("force-integer-division"),
				c.getBoolean("name-heuristic-concatenation"),
				mappings);
	}

	public ConversionOptions withIndentSize(int value) {
		return new ConversionOptions(value, includeComments, strictMode, maxDepth, forceIntegerDivision,
				nameHeuristicConcatenation, customMappings);
	}

	public ConversionOptions withIncludeComments(boolean value) {
		return new ConversionOptions(indentSize, value, strictMode, maxDepth, forceIntegerDivision,
				nameHeuristicConcatenation, customMappings);
	}

	public ConversionOptions withStrictMode(boolean value) {
		return new ConversionOptions(indentSize, includeComments, value, maxDepth, forceIntegerDivision,
				nameHeuristicConcatenation, customMappings);
	}

	public ConversionOptions withMaxDepth(int value) {
		return new ConversionOptions(indentSize, includeComments, strictMode, value, forceIntegerDivision,
				nameHeuristicConcatenation, customMappings);
	}

	public ConversionOptions withForceIntegerDivision(boolean value) {
		return new ConversionOptions(indentSize, includeComments, strictMode, maxDepth, value,
				nameHeuristicConcatenation, customMappings);
	}

	public ConversionOptions withNameHeuristicConcatenation(boolean value) {
		return new ConversionOptions(indentSize, includeComments, strictMode, maxDepth, forceIntegerDivision,
				value, customMappings);
	}

	public ConversionOptions withCustomMappings(Map<String, String> value) {
		return new ConversionOptions(indentSize, includeComments, strictMode, maxDepth, forceIntegerDivision,
				nameHeuristicConcatenation, value);
	}
}
