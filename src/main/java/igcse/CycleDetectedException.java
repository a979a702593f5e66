package igcse;

import igcse.ast.SourceSpan;

/**
 * Thrown when a node is reached again on the path that is currently being converted.
 */
public class CycleDetectedException extends ConversionException {
	public CycleDetectedException(String message, int line, int column) {
		super(message, line, column);
	}

	public CycleDetectedException(String message, SourceSpan span) {
		super(message, span);
	}
}
