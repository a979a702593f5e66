package igcse;

import igcse.ast.SourceSpan;

/**
 * Thrown when conversion descends deeper than the configured maximum depth.
 */
public class RecursionLimitExceededException extends ConversionException {
	public RecursionLimitExceededException(String message, int line, int column) {
		super(message, line, column);
	}

	public RecursionLimitExceededException(String message, SourceSpan span) {
		super(message, span);
	}
}
