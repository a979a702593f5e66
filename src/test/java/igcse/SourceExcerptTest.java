package igcse;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class SourceExcerptTest {
	@Test
	void pointsCaretAtColumn() {
		assertEquals("int y = 6;\n    ^", SourceExcerpt.caret("int x;\nint y = 6;", 2, 5));
	}

	@Test
	void keepsTabsInPadding() {
		assertEquals("\tx = ;\n\t    ^", SourceExcerpt.caret("\tx = ;", 1, 6));
	}

	@Test
	void returnsEmptyForMissingLine() {
		assertEquals("", SourceExcerpt.caret("one line", 3, 1));
		assertEquals("", SourceExcerpt.caret("one line", 0, 1));
	}
}
