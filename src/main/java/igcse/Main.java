package igcse;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line harness: converts each file named on the command line and prints
 * the pseudocode followed by any warnings.
 */
public final class Main {
	private Main() {
	}

	public static void main(String[] args) throws IOException {
		if (args.length < 1) {
			System.err.println("Usage: Main <file.java|file.ts>...");
			System.exit(2);
		}
		PseudocodeConverter converter = new PseudocodeConverter();
		boolean failed = false;
		for (String arg : args) {
			Path file = Path.of(arg);
			SourceLanguage language = SourceLanguage.forFileName(file.getFileName().toString());
			if (language == null) {
				System.err.println(arg + ": not a .java or .ts file");
				failed = true;
				continue;
			}
			ConversionResult result = converter.convert(Files.readString(file), language);
			if (args.length > 1) {
				System.out.println("== " + arg);
			}
			if (!result.pseudocode().isEmpty()) {
				System.out.println(result.pseudocode());
			}
			for (Warning warning : result.warnings()) {
				System.err.println(arg + ": " + warning);
			}
			failed |= !result.success();
		}
		if (failed) {
			System.exit(1);
		}
	}
}
