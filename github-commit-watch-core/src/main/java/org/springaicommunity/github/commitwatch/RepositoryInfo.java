package org.springaicommunity.github.commitwatch;

/**
 * Repository metadata resolved from the upstream API.
 *
 * @param defaultBranch the default branch name
 * @param htmlUrl the web URL for the repository
 */
public record RepositoryInfo(String defaultBranch, String htmlUrl) {

}
