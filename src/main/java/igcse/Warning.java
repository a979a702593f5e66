package igcse;

/**
 * A diagnostic attached to a {@link ConversionResult}.
 *
 * @param line 1-based source line, or 0 when the diagnostic has no source position
 */
public record Warning(WarningCode code, String message, Severity severity, int line) {
	public Warning {
		if (code == null || message == null || severity == null) {
			throw new IllegalArgumentException("code, message and severity are required");
		}
	}

	public boolean hasLine() {
		return line > 0;
	}

	@Override
	public String toString() {
		String where = hasLine() ? " (line " + line + ")" : "";
		return severity + " " + code + where + ": " + message;
	}
}
