package igcse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Converts a tree of .java and .ts files to a parallel tree of .pseudo files.
 *
 * Important: this does NOT merge files; each input file produces one output file.
 */
public final class ProjectConverter {
	private static final Logger LOG = LoggerFactory.getLogger(ProjectConverter.class);

	public static final String OUTPUT_EXTENSION = ".pseudo";

	private final PseudocodeConverter converter;

	public ProjectConverter() {
		this(new PseudocodeConverter());
	}

	public ProjectConverter(PseudocodeConverter converter) {
		this.converter = converter;
	}

	/**
	 * @return one result per converted file, in path order; a failed file is written empty
	 */
	public List<ConversionResult> convertTree(Path sourceRoot, Path outRoot) throws IOException {
		List<ConversionResult> results = new ArrayList<>();
		try (Stream<Path> paths = Files.walk(sourceRoot)) {
			paths
					.filter(Files::isRegularFile)
					.filter(p -> SourceLanguage.forFileName(p.getFileName().toString()) != null)
					.sorted()
					.forEach(p -> {
						try {
							results.add(convertOne(sourceRoot, outRoot, p));
						} catch (IOException e) {
							throw new UncheckedIOException(e);
						}
					});
		} catch (UncheckedIOException ex) {
			throw ex.getCause();
		}
		return results;
	}

	private ConversionResult convertOne(Path sourceRoot, Path outRoot, Path sourceFile) throws IOException {
		Path rel = sourceRoot.relativize(sourceFile);
		String fileName = rel.getFileName().toString();
		SourceLanguage language = SourceLanguage.forFileName(fileName);
		String base = fileName.substring(0, fileName.length() - language.extension().length());
		Path outRel = rel.getParent() == null ? Path.of(base + OUTPUT_EXTENSION)
				: rel.getParent().resolve(base + OUTPUT_EXTENSION);
		Path outFile = outRoot.resolve(outRel);

		Files.createDirectories(outFile.getParent());
		ConversionResult result = converter.convert(Files.readString(sourceFile), language);
		if (!result.success()) {
			LOG.warn("Could not convert {}: {}", rel, result.warnings());
		}
		Files.writeString(outFile, result.pseudocode().isEmpty() ? "" : result.pseudocode() + "\n");
		return result;
	}
}
