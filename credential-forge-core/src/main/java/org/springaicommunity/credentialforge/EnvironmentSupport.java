package org.springaicommunity.credentialforge;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves environment variables from the system environment and a {@code .env} file in
 * the current working directory. The {@code .env} file is loaded once and cached for the
 * lifetime of the process; a variable set in the system environment takes precedence.
 */
public final class EnvironmentSupport {

	/**
	 * Path of a regex database file replacing the built-in one.
	 */
	public static final String REGEX_DB = "CREDENTIALFORGE_REGEX_DB";

	/**
	 * Memory ceiling in megabytes used to size the worker pool.
	 */
	public static final String MEMORY_LIMIT_MB = "CREDENTIALFORGE_MEMORY_LIMIT_MB";

	private static final Dotenv DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	@Nullable
	public static String get(String name) {
		String value = DOTENV.get(name);
		if (value == null || value.isBlank()) {
			return null;
		}
		return value.trim();
	}

	/**
	 * Apply environment overrides to properties.
	 * @param properties properties to update
	 * @return the same properties instance
	 * @throws ConfigurationException if a value cannot be parsed
	 */
	public static ForgeProperties applyTo(ForgeProperties properties) {
		String regexDb = get(REGEX_DB);
		if (regexDb != null) {
			properties.setRegexDbPath(regexDb);
		}
		String memoryLimit = get(MEMORY_LIMIT_MB);
		if (memoryLimit != null) {
			properties.setMemoryLimitBytes(parseMegabytes(MEMORY_LIMIT_MB, memoryLimit));
		}
		return properties;
	}

	static long parseMegabytes(String name, String value) {
		try {
			long megabytes = Long.parseLong(value);
			if (megabytes <= 0) {
				throw new ConfigurationException(name + " must be positive, got: " + value);
			}
			return megabytes * 1024 * 1024;
		}
		catch (NumberFormatException e) {
			throw new ConfigurationException(name + " must be a whole number of megabytes, got: " + value);
		}
	}

}
