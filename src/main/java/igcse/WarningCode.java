package igcse;

/**
 * Stable identifiers for the diagnostics a conversion can report.
 */
public enum WarningCode {
	LEXICAL_ERROR,
	SYNTAX_ERROR,
	UNSUPPORTED_CONSTRUCT,
	RECURSION_LIMIT,
	CYCLE_DETECTED,
	UNKNOWN_TYPE,
	APPROXIMATION,
	INPUT_STREAM_DROPPED,
	FOR_LOOP_REWRITTEN,
	SWITCH_BREAK_DROPPED,
	FORMAT_MISMATCH
}
