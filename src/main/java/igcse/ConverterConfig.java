package igcse;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads converter settings. Precedence, highest first:
 * 1. Java system properties ({@code -Djava2igcse.indent-size=4})
 * 2. {@code java2igcse.conf} in the working directory, when present
 * 3. {@code reference.conf} on the classpath
 */
public final class ConverterConfig {
	private static final Logger LOG = LoggerFactory.getLogger(ConverterConfig.class);

	public static final String ROOT_PATH = "java2igcse";
	public static final String CONFIG_FILE_NAME = "java2igcse.conf";

	private ConverterConfig() {
	}

	public static Config load() {
		return load(Path.of(CONFIG_FILE_NAME));
	}

	public static Config load(Path configFile) {
		Config fileConfig;
		if (Files.isRegularFile(configFile)) {
			LOG.info("Loading configuration from file: {}", configFile.toAbsolutePath());
			fileConfig = ConfigFactory.parseFile(configFile.toFile());
		} else {
			LOG.debug("Configuration file '{}' not found, using defaults", configFile);
			fileConfig = ConfigFactory.empty();
		}

		Config defaults = ConfigFactory.parseResources("reference.conf");

		return ConfigFactory.systemProperties()
				.withFallback(fileConfig)
				.withFallback(defaults)
				.resolve();
	}
}
