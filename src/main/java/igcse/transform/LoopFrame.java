package igcse.transform;

/**
 * Sentinel variables of the innermost enclosing loop.
 *
 * @param level    loop nesting level, 1 for an outermost loop
 * @param exitFlag set by {@code break}, or null when the body never breaks
 * @param skipFlag set by {@code continue}, or null when the body never continues
 */
record LoopFrame(int level, String exitFlag, String skipFlag) {
	static LoopFrame enter(LoopFrame outer, boolean breaks, boolean continues) {
		int level = outer == null ? 1 : outer.level() + 1;
		String suffix = level == 1 ? "" : String.valueOf(level);
		return new LoopFrame(level, breaks ? "loopExit" + suffix : null, continues ? "skipRest" + suffix : null);
	}

	boolean hasExit() {
		return exitFlag != null;
	}

	boolean hasSkip() {
		return skipFlag != null;
	}
}
