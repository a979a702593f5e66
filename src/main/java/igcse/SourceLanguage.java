package igcse;

import java.util.Locale;

public enum SourceLanguage {
	JAVA(".java"),
	TYPESCRIPT(".ts");

	private final String extension;

	SourceLanguage(String extension) {
		this.extension = extension;
	}

	public String extension() {
		return extension;
	}

	public static SourceLanguage fromName(String name) {
		return switch (name.toLowerCase(Locale.ROOT)) {
			case "java" -> JAVA;
			case "typescript", "ts" -> TYPESCRIPT;
			default -> throw new IllegalArgumentException("Unknown source language: " + name);
		};
	}

	/**
	 * Language for a file name by extension, or null when neither matches.
	 */
	public static SourceLanguage forFileName(String fileName) {
		for (SourceLanguage language : values()) {
			if (fileName.endsWith(language.extension)) {
				return language;
			}
		}
		return null;
	}
}
