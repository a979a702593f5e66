package igcse;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GoldenConvertTest {
	private static final ConversionOptions OPTIONS = new ConversionOptions(3, true, false, 50, false, false, Map.of());

	@Test
	void convertsSampleJavaToExpectedPseudocode() throws Exception {
		Path sourcePath = Path.of("src", "test", "resources", "golden", "Sample.java");
		Path expectedPath = Path.of("src", "test", "resources", "golden", "Sample.pseudo");

		ConversionResult result = new PseudocodeConverter(OPTIONS).convertJava(Files.readString(sourcePath));

		assertTrue(result.success());
		assertTrue(result.warnings().stream().allMatch(w -> w.severity() == Severity.INFO), result.warnings()::toString);
		assertEquals(normalize(Files.readString(expectedPath)), normalize(result.pseudocode()));
	}

	@Test
	void convertsSampleTypeScriptToExpectedPseudocode() throws Exception {
		Path sourcePath = Path.of("src", "test", "resources", "golden", "Sample.ts");
		Path expectedPath = Path.of("src", "test", "resources", "golden", "SampleTs.pseudo");

		ConversionResult result = new PseudocodeConverter(OPTIONS).convertTypeScript(Files.readString(sourcePath));

		assertTrue(result.success());
		assertEquals(normalize(Files.readString(expectedPath)), normalize(result.pseudocode()));
	}

	private static String normalize(String s) {
		String normalized = s.replace("\r\n", "\n");
		if (!normalized.endsWith("\n")) {
			normalized += "\n";
		}
		return normalized;
	}
}
