package org.springaicommunity.github.contributions;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves configuration secrets such as {@code GITHUB_TOKEN}. The {@code .env} files are
 * loaded once and cached for the lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>System environment variable ({@link System#getenv})</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 */
public final class EnvironmentSupport {

	public static final String GITHUB_TOKEN = "GITHUB_TOKEN";

	public static final String CACHE_DIR = "CONTRIBUTIONS_CACHE_DIR";

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value. Blank values count as missing.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	@Nullable
	public static String get(String name) {
		// Dotenv.get falls back to System.getenv for keys the file does not define
		String value = blankToNull(CWD_DOTENV.get(name));
		if (value == null) {
			value = blankToNull(HOME_DOTENV.get(name));
		}
		return value;
	}

	/**
	 * Get a required environment variable value.
	 * @param name the variable name
	 * @return the value
	 * @throws IllegalStateException if the variable is not set
	 */
	public static String require(String name) {
		String value = get(name);
		if (value == null) {
			throw new IllegalStateException(name + " is required. Set it in the environment or in a .env file.");
		}
		return value;
	}

	private static @Nullable String blankToNull(@Nullable String value) {
		return value == null || value.isBlank() ? null : value.trim();
	}

}
