package igcse;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConverterConfigTest {
	@Test
	void referenceDefaultsMatchDocumentedValues(@TempDir Path dir) {
		ConversionOptions options = ConversionOptions.fromConfig(ConverterConfig.load(dir.resolve("missing.conf")));

		assertEquals(3, options.indentSize());
		assertTrue(options.includeComments());
		assertFalse(options.strictMode());
		assertEquals(50, options.maxDepth());
		assertFalse(options.forceIntegerDivision());
		assertFalse(options.nameHeuristicConcatenation());
		assertEquals(Map.of(), options.customMappings());
	}

	@Test
	void fileOverridesReferenceDefaults(@TempDir Path dir) throws Exception {
		Path file = dir.resolve(ConverterConfig.CONFIG_FILE_NAME);
		Files.writeString(file, """
				java2igcse {
				  indent-size = 4
				  strict-mode = true
				  custom-mappings {
				    ArrayList = ARRAY
				  }
				}
				""");

		ConversionOptions options = ConversionOptions.fromConfig(ConverterConfig.load(file));

		assertEquals(4, options.indentSize());
		assertTrue(options.strictMode());
		assertTrue(options.includeComments());
		assertEquals(Map.of("ArrayList", "ARRAY"), options.customMappings());
	}

	@Test
	void readsQuotedDottedMappingKeys() {
		Config config = ConfigFactory.parseString("""
				java2igcse {
				  indent-size = 2
				  include-comments = false
				  strict-mode = false
				  max-depth = 20
				  force-integer-division = true
				  name-heuristic-concatenation = true
				  custom-mappings { "Utils.shout" = SHOUT }
				}
				""");

		ConversionOptions options = ConversionOptions.fromConfig(config);

		assertEquals(2, options.indentSize());
		assertEquals(20, options.maxDepth());
		assertTrue(options.forceIntegerDivision());
		assertEquals("SHOUT", options.customMappings().get("Utils.shout"));
	}

	@Test
	void rejectsInvalidOptionValues() {
		ConversionOptions options = new ConversionOptions(3, true, false, 50, false, false, Map.of());

		assertThrows(IllegalArgumentException.class, () -> options.withIndentSize(-1));
		assertThrows(IllegalArgumentException.class, () -> options.withMaxDepth(0));
	}
}
