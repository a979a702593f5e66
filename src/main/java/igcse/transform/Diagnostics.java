package igcse.transform;

import igcse.Severity;
import igcse.Warning;
import igcse.WarningCode;
import igcse.ast.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Warnings and feature names collected during one conversion call.
 */
public final class Diagnostics {
	private final List<Warning> warnings = new ArrayList<>();
	private final SortedSet<String> features = new TreeSet<>();

	public void add(Warning warning) {
		warnings.add(warning);
	}

	public void warn(WarningCode code, String message, Severity severity, SourceSpan span) {
		warn(code, message, severity, span == null ? 0 : span.line());
	}

	public void warn(WarningCode code, String message, Severity severity, int line) {
		warnings.add(new Warning(code, message, severity, Math.max(0, line)));
	}

	public void feature(String name) {
		features.add(name);
	}

	public List<Warning> warnings() {
		return List.copyOf(warnings);
	}

	public SortedSet<String> features() {
		return Collections.unmodifiableSortedSet(new TreeSet<>(features));
	}
}
