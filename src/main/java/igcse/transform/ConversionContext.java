package igcse.transform;

import igcse.ConversionOptions;
import igcse.Severity;
import igcse.WarningCode;
import igcse.ast.SourceSpan;

/**
 * Per-node view of a conversion call.
 *
 * Every descent makes a shallow copy, so depth, indentation, scope, loop frame and
 * switch state stay local to one path. The active path and the diagnostics are
 * shared by all copies made from the same root.
 */
public final class ConversionContext {
	private final ConversionOptions options;
	private final Diagnostics diagnostics;
	private final ActivePath path;
	private final int depth;
	private final int indentLevel;
	private final Scope scope;
	private final LoopFrame loop;
	private final boolean inSwitch;

	private ConversionContext(ConversionOptions options, Diagnostics diagnostics, ActivePath path, int depth,
			int indentLevel, Scope scope, LoopFrame loop, boolean inSwitch) {
		this.options = options;
		this.diagnostics = diagnostics;
		this.path = path;
		this.depth = depth;
		this.indentLevel = indentLevel;
		this.scope = scope;
		this.loop = loop;
		this.inSwitch = inSwitch;
	}

	public static ConversionContext root(ConversionOptions options, Diagnostics diagnostics) {
		return new ConversionContext(options, diagnostics, new ActivePath(), 0, 0, Scope.global(), null, false);
	}

	public ConversionOptions options() {
		return options;
	}

	public Diagnostics diagnostics() {
		return diagnostics;
	}

	ActivePath path() {
		return path;
	}

	public int depth() {
		return depth;
	}

	public int indentLevel() {
		return indentLevel;
	}

	public Scope scope() {
		return scope;
	}

	LoopFrame loop() {
		return loop;
	}

	boolean inSwitch() {
		return inSwitch;
	}

	ConversionContext descend() {
		return new ConversionContext(options, diagnostics, path, depth + 1, indentLevel, scope, loop, inSwitch);
	}

	ConversionContext indented() {
		return indented(1);
	}

	ConversionContext indented(int levels) {
		return new ConversionContext(options, diagnostics, path, depth, indentLevel + levels, scope, loop,
				inSwitch);
	}

	ConversionContext withScope(Scope newScope) {
		return new ConversionContext(options, diagnostics, path, depth, indentLevel, newScope, loop, inSwitch);
	}

	/**
	 * Entering a loop also leaves any enclosing switch.
	 */
	ConversionContext withLoop(LoopFrame frame) {
		return new ConversionContext(options, diagnostics, path, depth, indentLevel, scope, frame, false);
	}

	ConversionContext withSwitch() {
		return new ConversionContext(options, diagnostics, path, depth, indentLevel, scope, loop, true);
	}

	String line(String text) {
		return " ".repeat(indentLevel * options.indentSize()) + text;
	}

	void warn(WarningCode code, String message, Severity severity, SourceSpan span) {
		diagnostics.warn(code, message, severity, span);
	}

	void feature(String name) {
		diagnostics.feature(name);
	}
}
