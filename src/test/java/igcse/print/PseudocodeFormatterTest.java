package igcse.print;

import igcse.Warning;
import igcse.WarningCode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PseudocodeFormatterTest {
	private final PseudocodeFormatter formatter = new PseudocodeFormatter();

	@Test
	void stripsTrailingWhitespaceAndTrailingBlankLines() {
		String out = formatter.format(List.of("IF a THEN   ", "   x ← 1", "ENDIF", "", ""));

		assertEquals("IF a THEN\n   x ← 1\nENDIF", out);
	}

	@Test
	void splitsEmbeddedNewlines() {
		assertEquals("// first\n// second\nx ← 1", formatter.format(List.of("// first\n// second", "x ← 1")));
	}

	@Test
	void formattingIsIdempotent() {
		List<String> lines = List.of("WHILE x < 3 DO", "   x ← x + 1", "ENDWHILE  ");

		String once = formatter.format(lines);
		String twice = formatter.format(List.of(once.split("\n")));

		assertEquals(once, twice);
	}

	@Test
	void balancedBlocksProduceNoWarnings() {
		List<Warning> warnings = new ArrayList<>();
		formatter.format(List.of(
				"FUNCTION f(n : INTEGER) RETURNS INTEGER",
				"   IF n > 0 THEN",
				"      RETURN n",
				"   ELSE",
				"      RETURN 0",
				"   ENDIF",
				"ENDFUNCTION",
				"CASE OF n",
				"   1 : OUTPUT \"one\"",
				"ENDCASE",
				"REPEAT",
				"   n ← n - 1",
				"UNTIL n = 0"), warnings);

		assertEquals(List.of(), warnings);
	}

	@Test
	void reportsMismatchedCloser() {
		List<Warning> warnings = new ArrayList<>();
		formatter.format(List.of("WHILE TRUE DO", "   x ← 1", "ENDIF"), warnings);

		assertEquals(1, warnings.size());
		assertEquals(WarningCode.FORMAT_MISMATCH, warnings.get(0).code());
		assertEquals("Output line 3: ENDIF closes WHILE opened on line 1", warnings.get(0).message());
	}

	@Test
	void reportsMisalignedCloserAndUnclosedBlock() {
		List<Warning> warnings = new ArrayList<>();
		formatter.format(List.of("FOR i ← 1 TO 3", "   OUTPUT i", "  NEXT i", "IF a THEN"), warnings);

		assertEquals(2, warnings.size());
		assertTrue(warnings.get(0).message().contains("not aligned"));
		assertEquals("Output line 4: IF is never closed", warnings.get(1).message());
	}

	@Test
	void leavesTextUnchangedWhenUnbalanced() {
		assertEquals("ENDWHILE", formatter.format(List.of("ENDWHILE")));
	}
}
