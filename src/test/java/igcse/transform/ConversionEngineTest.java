package igcse.transform;

import igcse.ConversionOptions;
import igcse.CycleDetectedException;
import igcse.RecursionLimitExceededException;
import igcse.Severity;
import igcse.SourceLanguage;
import igcse.UnsupportedConstructException;
import igcse.Warning;
import igcse.WarningCode;
import igcse.ast.Block;
import igcse.ast.Program;
import igcse.ast.SourceSpan;
import igcse.ast.Statement;
import igcse.parse.Parser;
import igcse.print.PseudocodeFormatter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConversionEngineTest {
	private static final ConversionOptions OPTIONS = new ConversionOptions(3, true, false, 50, false, false, Map.of());

	@Test
	void declaresAndAssignsInitializedVariable() {
		assertEquals(lines("DECLARE x : INTEGER", "x ← 5"), java("int x = 5;"));
	}

	@Test
	void indentsIfBodyByThreeSpaces() {
		assertEquals(
				lines("IF x > 0 THEN", "   OUTPUT x", "ENDIF"),
				java("if (x > 0) { System.out.println(x); }"));
	}

	@Test
	void flattensElseIfChainUnderOneEndif() {
		String out = java("""
				if (score >= 90) { grade = 'A'; }
				else if (score >= 80) { grade = 'B'; }
				else { grade = 'C'; }
				""");

		assertEquals(lines(
				"IF score >= 90 THEN",
				"   grade ← 'A'",
				"ELSE IF score >= 80 THEN",
				"   grade ← 'B'",
				"ELSE",
				"   grade ← 'C'",
				"ENDIF"), out);
	}

	@Test
	void countingForLoopBecomesForNext() {
		assertEquals(
				lines("FOR i ← 0 TO 9", "   OUTPUT i", "NEXT i"),
				java("for (int i = 0; i < 10; i++) { System.out.println(i); }"));
	}

	@Test
	void nestedForLoopsCloseInnermostFirst() {
		String out = java("""
				for (int i = 1; i <= 3; i++) {
					for (int j = 1; j <= 3; j++) {
						System.out.println(i * j);
					}
				}
				""");

		assertEquals(lines(
				"FOR i ← 1 TO 3",
				"   FOR j ← 1 TO 3",
				"      OUTPUT i * j",
				"   NEXT j",
				"NEXT i"), out);
	}

	@Test
	void descendingLoopGetsNegativeStep() {
		assertEquals(
				lines("FOR i ← 10 TO 1 STEP -1", "   OUTPUT i", "NEXT i"),
				java("for (int i = 10; i > 0; i--) { System.out.println(i); }"));
		assertEquals(
				lines("FOR i ← 0 TO n STEP 2", "   OUTPUT i", "NEXT i"),
				java("for (int i = 0; i <= n; i += 2) { System.out.println(i); }"));
	}

	@Test
	void boundsThatWouldOverflowStaySymbolic() {
		assertEquals(
				lines("FOR i ← 10 TO 2147483647 + 1 STEP -1", "   OUTPUT i", "NEXT i"),
				java("for (int i = 10; i > 2147483647; i--) { System.out.println(i); }"));
		assertEquals(
				lines("FOR i ← 0 TO -2147483647 - 2", "   OUTPUT i", "NEXT i"),
				java("for (int i = 0; i < -2147483647 - 1; i++) { System.out.println(i); }"));
		assertEquals(
				lines("DECLARE t : STRING", "t ← SUBSTRING(s, -2147483646, 2147483647 - -2147483647)"),
				java("String t = s.substring(-2147483647, 2147483647);"));
	}

	@Test
	void irregularForLoopIsRewrittenAsWhile() {
		Diagnostics diagnostics = new Diagnostics();
		String out = convert(SourceLanguage.JAVA, "for (int i = 1; i < n; i *= 2) { System.out.println(i); }",
				OPTIONS, diagnostics);

		assertEquals(lines(
				"DECLARE i : INTEGER",
				"i ← 1",
				"WHILE i < n DO",
				"   OUTPUT i",
				"   i ← i * 2",
				"ENDWHILE"), out);
		assertTrue(has(diagnostics, WarningCode.FOR_LOOP_REWRITTEN));
	}

	@Test
	void doWhileBecomesRepeatWithNegatedCondition() {
		String out = java("int count = 0; do { count++; } while (count < 3);");

		assertEquals(lines(
				"DECLARE count : INTEGER",
				"count ← 0",
				"REPEAT",
				"   count ← count + 1",
				"UNTIL count >= 3"), out);
	}

	@Test
	void negatesCompoundConditionsAlgebraically() {
		String out = java("do { n--; } while (n > 0 && !done);");

		assertEquals(lines("REPEAT", "   n ← n - 1", "UNTIL n <= 0 OR done"), out);
	}

	@Test
	void groupsCaseLabelsAndMovesOtherwiseLast() {
		String out = java("""
				switch (day) {
					default:
						System.out.println("Weekday");
						break;
					case 1:
					case 7:
						System.out.println("Weekend");
						break;
					case 2:
						x = 1;
						y = 2;
						break;
				}
				""");

		assertEquals(lines(
				"CASE OF day",
				"   1, 7 : OUTPUT \"Weekend\"",
				"   2 :",
				"      x ← 1",
				"      y ← 2",
				"   OTHERWISE : OUTPUT \"Weekday\"",
				"ENDCASE"), out);
	}

	@Test
	void warnsAboutBreakInsideCaseBody() {
		Diagnostics diagnostics = new Diagnostics();
		convert(SourceLanguage.JAVA, """
				switch (n) {
					case 1:
						if (flag) {
							break;
						}
						x = 1;
						break;
				}
				""", OPTIONS, diagnostics);

		assertTrue(has(diagnostics, WarningCode.SWITCH_BREAK_DROPPED));
	}

	@Test
	void breakInsideWhileUsesExitSentinel() {
		String out = java("""
				int i = 0;
				while (i < 10) {
					if (i == 5) {
						break;
					}
					i++;
				}
				""");

		assertEquals(lines(
				"DECLARE i : INTEGER",
				"i ← 0",
				"DECLARE loopExit : BOOLEAN",
				"loopExit ← FALSE",
				"WHILE i < 10 AND NOT loopExit DO",
				"   IF i = 5 THEN",
				"      loopExit ← TRUE",
				"   ENDIF",
				"   IF NOT loopExit THEN",
				"      i ← i + 1",
				"   ENDIF",
				"ENDWHILE"), out);
	}

	@Test
	void breakInsideForSkipsRemainingIterations() {
		String out = java("""
				for (int i = 0; i < 10; i++) {
					if (i == 3) {
						break;
					}
					System.out.println(i);
				}
				""");

		assertEquals(lines(
				"DECLARE loopExit : BOOLEAN",
				"loopExit ← FALSE",
				"FOR i ← 0 TO 9",
				"   IF NOT loopExit THEN",
				"      IF i = 3 THEN",
				"         loopExit ← TRUE",
				"      ENDIF",
				"      IF NOT loopExit THEN",
				"         OUTPUT i",
				"      ENDIF",
				"   ENDIF",
				"NEXT i"), out);
	}

	@Test
	void continueUsesSkipSentinelResetEachIteration() {
		String out = java("""
				for (int i = 0; i < 5; i++) {
					if (i == 2) {
						continue;
					}
					System.out.println(i);
				}
				""");

		assertEquals(lines(
				"DECLARE skipRest : BOOLEAN",
				"FOR i ← 0 TO 4",
				"   skipRest ← FALSE",
				"   IF i = 2 THEN",
				"      skipRest ← TRUE",
				"   ENDIF",
				"   IF NOT skipRest THEN",
				"      OUTPUT i",
				"   ENDIF",
				"NEXT i"), out);
	}

	@Test
	void repeatWithBreakStopsOnExitFlag() {
		String out = java("do { if (x > 5) { break; } x++; } while (x < 10);");

		assertEquals(lines(
				"DECLARE loopExit : BOOLEAN",
				"loopExit ← FALSE",
				"REPEAT",
				"   IF x > 5 THEN",
				"      loopExit ← TRUE",
				"   ENDIF",
				"   IF NOT loopExit THEN",
				"      x ← x + 1",
				"   ENDIF",
				"UNTIL x >= 10 OR loopExit"), out);
	}

	@Test
	void sentinelIsDeclaredOncePerScope() {
		String out = java("while (true) { break; } while (true) { break; }");

		assertEquals(lines(
				"DECLARE loopExit : BOOLEAN",
				"loopExit ← FALSE",
				"WHILE TRUE AND NOT loopExit DO",
				"   loopExit ← TRUE",
				"ENDWHILE",
				"loopExit ← FALSE",
				"WHILE TRUE AND NOT loopExit DO",
				"   loopExit ← TRUE",
				"ENDWHILE"), out);
	}

	@Test
	void sentinelOfDiscardedLoopIsDeclaredAgain() {
		String out = java("""
				while (i++ < 5) {
					if (a) {
						break;
					}
				}
				while (j < 3) {
					if (a) {
						break;
					}
					j = j + 1;
				}
				""");

		assertEquals(lines(
				"// unsupported: increment or decrement inside an expression",
				"DECLARE loopExit : BOOLEAN",
				"loopExit ← FALSE",
				"WHILE j < 3 AND NOT loopExit DO",
				"   IF a THEN",
				"      loopExit ← TRUE",
				"   ENDIF",
				"   IF NOT loopExit THEN",
				"      j ← j + 1",
				"   ENDIF",
				"ENDWHILE"), out);
	}

	@Test
	void innerLoopSentinelCarriesNestingLevel() {
		String out = java("""
				for (int i = 0; i < 3; i++) {
					while (true) {
						break;
					}
				}
				""");

		assertEquals(lines(
				"FOR i ← 0 TO 2",
				"   DECLARE loopExit2 : BOOLEAN",
				"   loopExit2 ← FALSE",
				"   WHILE TRUE AND NOT loopExit2 DO",
				"      loopExit2 ← TRUE",
				"   ENDWHILE",
				"NEXT i"), out);
	}

	@Test
	void switchBreakInsideLoopDoesNotNeedSentinel() {
		String out = java("""
				while (running) {
					switch (choice) {
						case 1:
							System.out.println("one");
							break;
						default:
							running = false;
					}
				}
				""");

		assertEquals(lines(
				"WHILE running DO",
				"   CASE OF choice",
				"      1 : OUTPUT \"one\"",
				"      OTHERWISE : running ← FALSE",
				"   ENDCASE",
				"ENDWHILE"), out);
	}

	@Test
	void declaresArraysWithZeroBasedBounds() {
		String out = java("""
				int[] nums = {3, 1, 2};
				String[] names = new String[5];
				int[][] grid = new int[3][4];
				grid[1][2] = nums[0];
				""");

		assertEquals(lines(
				"DECLARE nums : ARRAY[0:2] OF INTEGER",
				"nums[0] ← 3",
				"nums[1] ← 1",
				"nums[2] ← 2",
				"DECLARE names : ARRAY[0:4] OF STRING",
				"DECLARE grid : ARRAY[0:2, 0:3] OF INTEGER",
				"grid[1, 2] ← nums[0]"), out);
	}

	@Test
	void arrayOfUnknownSizeIsApproximated() {
		Diagnostics diagnostics = new Diagnostics();
		String out = convert(SourceLanguage.JAVA, "int[] data;", OPTIONS, diagnostics);

		assertEquals("DECLARE data : ARRAY OF INTEGER", out);
		assertTrue(has(diagnostics, WarningCode.APPROXIMATION));
	}

	@Test
	void forEachOverArrayTakesElementType() {
		String out = java("""
				int total = 0;
				int[] nums = {4, 5};
				for (int n : nums) {
					total += n;
				}
				""");

		assertEquals(lines(
				"DECLARE total : INTEGER",
				"total ← 0",
				"DECLARE nums : ARRAY[0:1] OF INTEGER",
				"nums[0] ← 4",
				"nums[1] ← 5",
				"FOR EACH n IN nums",
				"   total ← total + n",
				"NEXT n"), out);
	}

	@Test
	void scannerReadsBecomeInputStatements() {
		Diagnostics diagnostics = new Diagnostics();
		String out = convert(SourceLanguage.JAVA, """
				Scanner sc = new Scanner(System.in);
				String name = sc.nextLine();
				int age = Integer.parseInt(sc.nextLine());
				System.out.println("Hello " + name);
				""", OPTIONS, diagnostics);

		assertEquals(lines(
				"DECLARE name : STRING",
				"INPUT name",
				"DECLARE age : INTEGER",
				"INPUT age",
				"OUTPUT \"Hello \", name"), out);
		Warning dropped = diagnostics.warnings().get(0);
		assertEquals(WarningCode.INPUT_STREAM_DROPPED, dropped.code());
		assertEquals(Severity.INFO, dropped.severity());
		assertEquals(1, dropped.line());
	}

	@Test
	void promptOutputsItsMessageBeforeInput() {
		assertEquals(
				lines("DECLARE name : STRING", "OUTPUT \"Name?\"", "INPUT name"),
				ts("let name = prompt(\"Name?\");"));
	}

	@Test
	void textConcatenationUsesAmpersand() {
		String out = java("int x = 2; String s = \"a\" + x;");

		assertEquals(lines("DECLARE x : INTEGER", "x ← 2", "DECLARE s : STRING", "s ← \"a\" & x"), out);
	}

	@Test
	void nameHeuristicTreatsTextLikeNamesAsStrings() {
		ConversionOptions options = OPTIONS.withNameHeuristicConcatenation(true);

		assertEquals("s ← greeting & userName",
				convert(SourceLanguage.JAVA, "s = greeting + userName;", options, new Diagnostics()));
		assertEquals("s ← greeting + userName", java("s = greeting + userName;"));
	}

	@Test
	void spellsOperatorsAndKeepsNeededParentheses() {
		String out = java("""
				if (a == b && c != d || !e) { y = (a + b) * c; }
				if (x % 2 == 0) { y = a - (b - c); }
				""");

		assertEquals(lines(
				"IF a = b AND c <> d OR NOT e THEN",
				"   y ← (a + b) * c",
				"ENDIF",
				"IF x MOD 2 = 0 THEN",
				"   y ← a - (b - c)",
				"ENDIF"), out);
	}

	@Test
	void forcedIntegerDivisionUsesDiv() {
		ConversionOptions options = OPTIONS.withForceIntegerDivision(true);

		assertEquals("q ← a DIV b", convert(SourceLanguage.JAVA, "q = a / b;", options, new Diagnostics()));
		assertEquals("q ← a / b", java("q = a / b;"));
	}

	@Test
	void honoursIndentSize() {
		ConversionOptions options = OPTIONS.withIndentSize(4);

		assertEquals(lines("IF a THEN", "    x ← 1", "ENDIF"),
				convert(SourceLanguage.JAVA, "if (a) { x = 1; }", options, new Diagnostics()));
	}

	@Test
	void translatesLibraryCalls() {
		String out = java("""
				double r = Math.sqrt(x);
				char c = s.charAt(0);
				String t = s.substring(1, 3);
				int n = s.length();
				String u = s.toUpperCase();
				int p = (int) Math.pow(2, 3);
				int d = (int) (Math.random() * 6) + 1;
				""");

		assertEquals(lines(
				"DECLARE r : REAL",
				"r ← SQRT(x)",
				"DECLARE c : CHAR",
				"c ← SUBSTRING(s, 1, 1)",
				"DECLARE t : STRING",
				"t ← SUBSTRING(s, 2, 2)",
				"DECLARE n : INTEGER",
				"n ← LENGTH(s)",
				"DECLARE u : STRING",
				"u ← UCASE(s)",
				"DECLARE p : INTEGER",
				"p ← INT(2 ^ 3)",
				"DECLARE d : INTEGER",
				"d ← INT(RANDOM() * 6) + 1"), out);
	}

	@Test
	void finalAndConstLiteralsBecomeConstants() {
		assertEquals("CONSTANT PI = 3.14", java("final double PI = 3.14;"));
		assertEquals("CONSTANT MAX = 10", ts("const MAX = 10;"));
	}

	@Test
	void staticMethodsBecomeFunctionsAndMainIsInlined() {
		String out = java("""
				public class Calc {
					public static int square(int n) {
						return n * n;
					}

					public static void main(String[] args) {
						int result = square(4);
						System.out.println(result);
					}
				}
				""");

		assertEquals(lines(
				"// class Calc",
				"// static",
				"FUNCTION square(n : INTEGER) RETURNS INTEGER",
				"   RETURN n * n",
				"ENDFUNCTION",
				"// main program",
				"DECLARE result : INTEGER",
				"result ← square(4)",
				"OUTPUT result"), out);
	}

	@Test
	void voidMethodBecomesProcedureCalledWithCall() {
		String out = convert(SourceLanguage.JAVA, """
				static void greet(String name) {
					System.out.println("Hi " + name);
				}
				greet("Bob");
				""", OPTIONS.withIncludeComments(false), new Diagnostics());

		assertEquals(lines(
				"PROCEDURE greet(name : STRING)",
				"   OUTPUT \"Hi \", name",
				"ENDPROCEDURE",
				"CALL greet(\"Bob\")"), out);
	}

	@Test
	void infersReturnTypeOfUntypedTypeScriptFunction() {
		assertEquals(
				lines("FUNCTION twice(x : REAL) RETURNS REAL", "   RETURN x * 2", "ENDFUNCTION"),
				ts("function twice(x: number) { return x * 2; }"));
	}

	@Test
	void convertsTypeScriptClassMembers() {
		String out = convert(SourceLanguage.TYPESCRIPT, """
				class Counter {
					count: number = 0;
					increment(): void {
						this.count++;
					}
				}
				""", OPTIONS.withIncludeComments(false), new Diagnostics());

		assertEquals(lines(
				"DECLARE count : INTEGER",
				"count ← 0",
				"PROCEDURE increment()",
				"   count ← count + 1",
				"ENDPROCEDURE"), out);
	}

	@Test
	void convertsTypeScriptLoopOverArrayLiteral() {
		String out = ts("""
				let total: number = 0;
				const values = [1, 2, 3];
				for (const v of values) {
					total += v;
				}
				console.log("Total: " + total);
				""");

		assertEquals(lines(
				"DECLARE total : INTEGER",
				"total ← 0",
				"DECLARE values : ARRAY[0:2] OF INTEGER",
				"values[0] ← 1",
				"values[1] ← 2",
				"values[2] ← 3",
				"FOR EACH v IN values",
				"   total ← total + v",
				"NEXT v",
				"OUTPUT \"Total: \", total"), out);
	}

	@Test
	void appliesCustomMappings() {
		ConversionOptions options = OPTIONS.withCustomMappings(Map.of(
				"Money", "REAL",
				"Utils.shout", "SHOUT",
				"log", "WRITELOG"));

		String out = convert(SourceLanguage.JAVA, """
				Money m;
				String s = Utils.shout("x");
				log("hi");
				""", options, new Diagnostics());

		assertEquals(lines(
				"DECLARE m : REAL",
				"DECLARE s : STRING",
				"s ← SHOUT(\"x\")",
				"CALL WRITELOG(\"hi\")"), out);
	}

	@Test
	void unknownTypeFallsBackToStringWithWarning() {
		Diagnostics diagnostics = new Diagnostics();
		String out = convert(SourceLanguage.JAVA, "Widget w;", OPTIONS, diagnostics);

		assertEquals("DECLARE w : STRING", out);
		assertTrue(has(diagnostics, WarningCode.UNKNOWN_TYPE));
	}

	@Test
	void unknownTypeFailsInStrictMode() {
		assertThrows(UnsupportedConstructException.class,
				() -> convert(SourceLanguage.JAVA, "Widget w;", OPTIONS.withStrictMode(true), new Diagnostics()));
	}

	@Test
	void unsupportedStatementBecomesPlaceholderComment() {
		Diagnostics diagnostics = new Diagnostics();
		String out = convert(SourceLanguage.JAVA, "items.add(new Item());\nx = 1;", OPTIONS, diagnostics);

		assertEquals(lines("// unsupported: object creation", "x ← 1"), out);
		Warning warning = diagnostics.warnings().get(0);
		assertEquals(WarningCode.UNSUPPORTED_CONSTRUCT, warning.code());
		assertEquals(1, warning.line());
	}

	@Test
	void unsupportedStatementFailsInStrictMode() {
		assertThrows(UnsupportedConstructException.class, () -> convert(SourceLanguage.JAVA,
				"items.add(new Item());", OPTIONS.withStrictMode(true), new Diagnostics()));
	}

	@Test
	void breakOutsideLoopIsUnsupported() {
		Diagnostics diagnostics = new Diagnostics();
		String out = convert(SourceLanguage.JAVA, "break;", OPTIONS, diagnostics);

		assertEquals("// unsupported: break outside a loop", out);
	}

	@Test
	void nestingBeyondMaxDepthFails() {
		String source = "if (a) { ".repeat(60) + "x = 1;" + " }".repeat(60);

		assertThrows(RecursionLimitExceededException.class,
				() -> convert(SourceLanguage.JAVA, source, OPTIONS, new Diagnostics()));
	}

	@Test
	void nodeThatContainsItselfIsReportedAsCycle() {
		List<Statement> statements = new ArrayList<>();
		Block loop = new Block(statements, new SourceSpan(0, 10, 1, 1));
		statements.add(loop);

		ConversionContext ctx = ConversionContext.root(OPTIONS, new Diagnostics());
		assertThrows(CycleDetectedException.class, () -> new ConversionEngine().convert(loop, ctx));
	}

	@Test
	void identicalSiblingSubtreesAreNotCycles() {
		List<Statement> statements = new ArrayList<>();
		Block inner = new Block(List.of(), new SourceSpan(0, 2, 1, 1));
		statements.add(inner);
		statements.add(inner);
		Block outer = new Block(statements, new SourceSpan(0, 10, 1, 1));

		ConversionContext ctx = ConversionContext.root(OPTIONS, new Diagnostics());
		assertEquals(List.of(), new ConversionEngine().convert(outer, ctx));
	}

	@Test
	void recordsFeaturesUsed() {
		Diagnostics diagnostics = new Diagnostics();
		convert(SourceLanguage.JAVA, "for (int i = 0; i < 3; i++) { if (i > 1) { System.out.println(i); } }",
				OPTIONS, diagnostics);

		assertEquals(List.of("for", "if", "output"), new ArrayList<>(diagnostics.features()));
	}

	private static String java(String source) {
		return convert(SourceLanguage.JAVA, source, OPTIONS, new Diagnostics());
	}

	private static String ts(String source) {
		return convert(SourceLanguage.TYPESCRIPT, source, OPTIONS, new Diagnostics());
	}

	private static String convert(SourceLanguage language, String source, ConversionOptions options,
			Diagnostics diagnostics) {
		Program program = new Parser(language).parse(source);
		List<String> lines = new ConversionEngine().convert(program, ConversionContext.root(options, diagnostics));
		return new PseudocodeFormatter().format(lines);
	}

	private static boolean has(Diagnostics diagnostics, WarningCode code) {
		return diagnostics.warnings().stream().anyMatch(w -> w.code() == code);
	}

	private static String lines(String... lines) {
		return String.join("\n", lines);
	}
}
