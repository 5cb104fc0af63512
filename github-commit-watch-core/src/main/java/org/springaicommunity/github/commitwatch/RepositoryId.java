package org.springaicommunity.github.commitwatch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identity of a watched repository in "owner/name" form.
 *
 * <p>
 * Identities are case-insensitive: both parts are normalized to lowercase so that
 * {@code Spring-Projects/Spring-AI} and {@code spring-projects/spring-ai} resolve to the
 * same storage key.
 *
 * @param owner the repository owner (user or organization), lowercase
 * @param name the repository name, lowercase
 */
public record RepositoryId(String owner, String name) {

	private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9._-]+");

	public RepositoryId {
		if (!SEGMENT.matcher(owner).matches() || !SEGMENT.matcher(name).matches()) {
			throw new IllegalArgumentException(
					"Invalid repository '" + owner + "/" + name + "'. Expected format: owner/repository-name");
		}
		owner = owner.toLowerCase(Locale.ROOT);
		name = name.toLowerCase(Locale.ROOT);
	}

	/**
	 * Parse a repository identity from "owner/name" text.
	 * @param fullName repository in "owner/name" format, surrounding whitespace ignored
	 * @return the normalized identity
	 * @throws IllegalArgumentException if the text does not contain exactly one '/'
	 * separating two non-empty segments
	 */
	@JsonCreator
	public static RepositoryId parse(String fullName) {
		String trimmed = fullName.trim();
		int slash = trimmed.indexOf('/');
		if (slash <= 0 || slash != trimmed.lastIndexOf('/') || slash == trimmed.length() - 1) {
			throw new IllegalArgumentException(
					"Invalid repository '" + fullName + "'. Expected format: owner/repository-name");
		}
		return new RepositoryId(trimmed.substring(0, slash), trimmed.substring(slash + 1));
	}

	/**
	 * Returns the normalized "owner/name" key.
	 * @return the full name
	 */
	@JsonValue
	public String fullName() {
		return owner + "/" + name;
	}

	/**
	 * Returns the browsable GitHub URL of the repository.
	 * @return the repository URL
	 */
	public String htmlUrl() {
		return "https://github.com/" + fullName();
	}

	@Override
	public String toString() {
		return fullName();
	}

}
