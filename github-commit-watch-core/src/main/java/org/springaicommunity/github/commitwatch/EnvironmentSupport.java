package org.springaicommunity.github.commitwatch;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves configuration variables such as {@code GITHUB_TOKEN} and
 * {@code CHECK_INTERVAL}. The {@code .env} files are read once and cached for the
 * lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} in the working directory</li>
 * <li>process environment</li>
 * <li>{@code .env} in the user's home directory</li>
 * </ol>
 */
public final class EnvironmentSupport {

	// dotenv-java merges System.getenv() into every instance, which gives the middle step
	private static final Dotenv WORKING_DIR = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	@Nullable
	private static final Dotenv USER_HOME = loadFromUserHome();

	private EnvironmentSupport() {
	}

	@Nullable
	private static Dotenv loadFromUserHome() {
		String home = System.getProperty("user.home");
		if (home == null) {
			return null;
		}
		return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
	}

	/**
	 * Look up a variable.
	 * @param name the variable name
	 * @return the value, or {@code null} if it is defined nowhere
	 */
	@Nullable
	public static String get(String name) {
		String value = WORKING_DIR.get(name);
		if (value == null && USER_HOME != null) {
			value = USER_HOME.get(name);
		}
		return value;
	}

}
