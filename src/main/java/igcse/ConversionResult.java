package igcse;

import java.util.List;

/**
 * Outcome of one conversion. On failure {@code pseudocode} is empty and the
 * warnings hold an ERROR describing why.
 */
public record ConversionResult(String pseudocode, List<Warning> warnings, boolean success,
		ConversionMetadata metadata) {
	public ConversionResult {
		warnings = List.copyOf(warnings);
	}

	public boolean hasWarning(WarningCode code) {
		return warnings.stream().anyMatch(w -> w.code() == code);
	}
}
