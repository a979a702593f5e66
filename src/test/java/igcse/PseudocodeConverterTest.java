package igcse;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PseudocodeConverterTest {
	private static final ConversionOptions OPTIONS = new ConversionOptions(3, true, false, 50, false, false, Map.of());

	private final PseudocodeConverter converter = new PseudocodeConverter(OPTIONS);

	@Test
	void convertsJavaSnippet() {
		ConversionResult result = converter.convertJava("int x = 5;\nSystem.out.println(x);\n");

		assertTrue(result.success());
		assertEquals("DECLARE x : INTEGER\nx ← 5\nOUTPUT x", result.pseudocode());
		assertEquals(List.of(), result.warnings());
		assertEquals(SourceLanguage.JAVA, result.metadata().sourceLanguage());
		assertEquals(2, result.metadata().linesProcessed());
		assertEquals(List.of("output"), List.copyOf(result.metadata().featuresUsed()));
	}

	@Test
	void convertsTypeScriptSnippet() {
		ConversionResult result = converter.convertTypeScript("let message: string = 'hi';\nconsole.log(message);");

		assertTrue(result.success());
		assertEquals("DECLARE message : STRING\nmessage ← \"hi\"\nOUTPUT message", result.pseudocode());
		assertEquals(SourceLanguage.TYPESCRIPT, result.metadata().sourceLanguage());
	}

	@Test
	void syntaxErrorFailsWithCaretExcerpt() {
		ConversionResult result = converter.convertJava("int x = 5\nint y = 6;");

		assertFalse(result.success());
		assertEquals("", result.pseudocode());
		assertEquals(1, result.warnings().size());
		Warning error = result.warnings().get(0);
		assertEquals(WarningCode.SYNTAX_ERROR, error.code());
		assertEquals(Severity.ERROR, error.severity());
		assertEquals(2, error.line());
		assertEquals("Expected ';' but found 'int' (line 2, column 1)\nint y = 6;\n^", error.message());
	}

	@Test
	void lexicalErrorIsReported() {
		ConversionResult result = converter.convertTypeScript("let s = `template`;");

		assertFalse(result.success());
		assertTrue(result.hasWarning(WarningCode.LEXICAL_ERROR));
	}

	@Test
	void recursionLimitIsReported() {
		String deep = "if (a) { ".repeat(40) + "x = 1;" + " }".repeat(40);

		ConversionResult result = converter.convert(deep, SourceLanguage.JAVA, OPTIONS.withMaxDepth(10));

		assertFalse(result.success());
		assertTrue(result.hasWarning(WarningCode.RECURSION_LIMIT));
	}

	@Test
	void deeplyNestedSourceFailsInsteadOfOverflowingTheStack() {
		String parens = "int x = " + "(".repeat(20_000) + "1" + ")".repeat(20_000) + ";";
		String negations = "int y = " + "- ".repeat(20_000) + "1;";

		for (String source : List.of(parens, negations)) {
			ConversionResult result = converter.convertJava(source);

			assertFalse(result.success());
			assertEquals("", result.pseudocode());
			assertTrue(result.hasWarning(WarningCode.RECURSION_LIMIT));
		}
	}

	@Test
	void strictModeTurnsUnsupportedConstructIntoFailure() {
		String source = "items.add(new Item());";

		ConversionResult lenient = converter.convertJava(source);
		assertTrue(lenient.success());
		assertTrue(lenient.hasWarning(WarningCode.UNSUPPORTED_CONSTRUCT));

		ConversionResult strict = converter.convert(source, SourceLanguage.JAVA, OPTIONS.withStrictMode(true));
		assertFalse(strict.success());
		assertTrue(strict.hasWarning(WarningCode.UNSUPPORTED_CONSTRUCT));
	}

	@Test
	void nullOptionsFallBackToConverterDefaults() {
		ConversionResult result = converter.convert("if (a) { x = 1; }", SourceLanguage.JAVA, null);

		assertEquals("IF a THEN\n   x ← 1\nENDIF", result.pseudocode());
	}

	@Test
	void emptySourceConvertsToEmptyPseudocode() {
		ConversionResult result = converter.convertJava("");

		assertTrue(result.success());
		assertEquals("", result.pseudocode());
		assertEquals(0, result.metadata().linesProcessed());
	}

	@Test
	void rejectsNullArguments() {
		assertThrows(IllegalArgumentException.class, () -> converter.convertJava(null));
		assertThrows(IllegalArgumentException.class, () -> converter.convert("int x;", null));
		assertThrows(IllegalArgumentException.class, () -> new PseudocodeConverter(null));
	}

	@Test
	void sameSourceConvertsToSameResult() {
		String source = "for (int i = 0; i < 3; i++) { System.out.println(i); }";

		assertEquals(converter.convertJava(source).pseudocode(), converter.convertJava(source).pseudocode());
	}
}
