package igcse;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * @param featuresUsed construct names met during conversion, sorted
 */
public record ConversionMetadata(SourceLanguage sourceLanguage, long conversionTimeMs, int linesProcessed,
		SortedSet<String> featuresUsed) {
	public ConversionMetadata {
		featuresUsed = Collections.unmodifiableSortedSet(new TreeSet<>(featuresUsed));
	}
}
