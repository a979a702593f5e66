package igcse;

import igcse.ast.Program;
import igcse.parse.Parser;
import igcse.print.PseudocodeFormatter;
import igcse.transform.ConversionContext;
import igcse.transform.ConversionEngine;
import igcse.transform.Diagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Public entrypoint for Java and TypeScript to IGCSE pseudocode conversion.
 *
 * Each call parses, lowers and formats independently, so one instance can be
 * shared between threads.
 */
public final class PseudocodeConverter {
	private static final Logger LOG = LoggerFactory.getLogger(PseudocodeConverter.class);

	private final ConversionOptions defaultOptions;

	public PseudocodeConverter() {
		this(ConversionOptions.defaults());
	}

	public PseudocodeConverter(ConversionOptions defaultOptions) {
		if (defaultOptions == null) {
			throw new IllegalArgumentException("options must not be null");
		}
		this.defaultOptions = defaultOptions;
	}

	public ConversionResult convertJava(String sourceCode) {
		return convert(sourceCode, SourceLanguage.JAVA, defaultOptions);
	}

	public ConversionResult convertTypeScript(String sourceCode) {
		return convert(sourceCode, SourceLanguage.TYPESCRIPT, defaultOptions);
	}

	public ConversionResult convert(String sourceCode, SourceLanguage language) {
		return convert(sourceCode, language, defaultOptions);
	}

	public ConversionResult convert(String sourceCode, SourceLanguage language, ConversionOptions options) {
		if (sourceCode == null) {
			throw new IllegalArgumentException("sourceCode must not be null");
		}
		if (language == null) {
			throw new IllegalArgumentException("language must not be null");
		}
		ConversionOptions effective = options != null ? options : defaultOptions;

		long started = System.nanoTime();
		Diagnostics diagnostics = new Diagnostics();
		String pseudocode;
		boolean success;
		try {
			Program program = new Parser(language).parse(sourceCode);
			List<String> lines = new ConversionEngine().convert(program, ConversionContext.root(effective, diagnostics));
			List<Warning> formatWarnings = new ArrayList<>();
			pseudocode = new PseudocodeFormatter().format(lines, formatWarnings);
			formatWarnings.forEach(diagnostics::add);
			success = true;
		} catch (ConversionException e) {
			LOG.warn("{} conversion failed at line {}: {}", language, e.line(), e.getMessage());
			diagnostics.add(failure(e, sourceCode));
			pseudocode = "";
			success = false;
		}

		long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
		int lines = countLines(sourceCode);
		LOG.debug("Converted {} lines of {} in {} ms", lines, language, elapsedMs);

		ConversionMetadata metadata = new ConversionMetadata(language, elapsedMs, lines, diagnostics.features());
		return new ConversionResult(pseudocode, diagnostics.warnings(), success, metadata);
	}

	private static Warning failure(ConversionException e, String source) {
		String message = e.getMessage();
		if (e.hasPosition()) {
			String excerpt = SourceExcerpt.caret(source, e.line(), e.column());
			message = message + " (line " + e.line() + ", column " + e.column() + ")"
					+ (excerpt.isEmpty() ? "" : "\n" + excerpt);
		}
		return new Warning(codeFor(e), message, Severity.ERROR, e.line());
	}

	private static WarningCode codeFor(ConversionException e) {
		if (e instanceof LexicalException) {
			return WarningCode.LEXICAL_ERROR;
		}
		if (e instanceof SyntaxException) {
			return WarningCode.SYNTAX_ERROR;
		}
		if (e instanceof RecursionLimitExceededException) {
			return WarningCode.RECURSION_LIMIT;
		}
		if (e instanceof CycleDetectedException) {
			return WarningCode.CYCLE_DETECTED;
		}
		return WarningCode.UNSUPPORTED_CONSTRUCT;
	}

	private static int countLines(String source) {
		if (source.isEmpty()) {
			return 0;
		}
		return source.split("\r?\n", -1).length - (source.endsWith("\n") ? 1 : 0);
	}
}
