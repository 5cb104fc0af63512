package org.springaicommunity.github.commitwatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * {@link RepositoryClient} backed by the GitHub REST API.
 *
 * <p>
 * New commits are found with the compare endpoint ({@code base...head}), whose
 * {@code status} also tells whether the stored cursor is still an ancestor of the branch
 * tip. Per-commit file counts come from the single-commit endpoint.
 *
 * <p>
 * At most {@code maxCommitsPerCheck} of the oldest new commits are returned per call;
 * the cursor then advances to the newest of those and the rest is listed next time.
 */
public class GitHubRepositoryClient implements RepositoryClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRepositoryClient.class);

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	private final int maxCommitsPerCheck;

	private final Clock clock;

	public GitHubRepositoryClient(GitHubClient httpClient, ObjectMapper objectMapper, int maxCommitsPerCheck) {
		this(httpClient, objectMapper, maxCommitsPerCheck, Clock.systemUTC());
	}

	public GitHubRepositoryClient(GitHubClient httpClient, ObjectMapper objectMapper, int maxCommitsPerCheck,
			Clock clock) {
		if (maxCommitsPerCheck < 1) {
			throw new IllegalArgumentException("maxCommitsPerCheck must be positive");
		}
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.maxCommitsPerCheck = maxCommitsPerCheck;
		this.clock = clock;
	}

	@Override
	public RepositoryInfo resolveDefaultBranch(RepositoryId repositoryId) {
		JsonNode repository = getJson(repositoryId, "/repos/" + repositoryId.fullName());
		String defaultBranch = repository.path("default_branch").asText("");
		if (defaultBranch.isEmpty()) {
			throw new RepositoryAccessException(FailureKind.TRANSIENT,
					"GitHub reported no default branch for " + repositoryId);
		}
		String htmlUrl = repository.path("html_url").asText(repositoryId.htmlUrl());
		logger.debug("Resolved default branch of {}: {}", repositoryId, defaultBranch);
		return new RepositoryInfo(defaultBranch, htmlUrl);
	}

	@Override
	public CommitListing listCommitsSince(RepositoryId repositoryId, String branch, @Nullable String cursor) {
		if (cursor == null) {
			return fetchTip(repositoryId, branch).map(tip -> CommitListing.of(List.of(tip)))
				.orElseGet(CommitListing::empty);
		}

		String path = "/repos/" + repositoryId.fullName() + "/compare/" + cursor + "..." + encode(branch);
		JsonNode comparison;
		try {
			comparison = readTree(httpClient.getWithQuery(path, "per_page=" + maxCommitsPerCheck));
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (e.getStatusCode() == 404 || e.getStatusCode() == 422) {
				// The cursor commit is gone or unrelated; rewritten if the branch still
				// resolves, otherwise the tip lookup reports the repository as missing.
				logger.info("Comparison {}...{} failed for {} ({}), checking branch tip", shortId(cursor), branch,
						repositoryId, e.getStatusCode());
				return rewrittenOrEmpty(repositoryId, branch, cursor);
			}
			throw translate(repositoryId, e);
		}

		String status = comparison.path("status").asText("");
		switch (status) {
			case "identical":
				return CommitListing.empty();
			case "ahead":
				return CommitListing.of(newCommits(repositoryId, comparison));
			case "behind":
			case "diverged":
				logger.info("Branch {} of {} is {} relative to cursor {}", branch, repositoryId, status,
						shortId(cursor));
				return rewrittenOrEmpty(repositoryId, branch, cursor);
			default:
				throw new RepositoryAccessException(FailureKind.TRANSIENT,
						"Unexpected comparison status '" + status + "' for " + repositoryId);
		}
	}

	private List<CommitRef> newCommits(RepositoryId repositoryId, JsonNode comparison) {
		List<CommitRef> oldestFirst = new ArrayList<>();
		for (JsonNode node : comparison.path("commits")) {
			if (oldestFirst.size() >= maxCommitsPerCheck) {
				break;
			}
			oldestFirst.add(withFileCounts(repositoryId, parseCommit(repositoryId, node)));
		}

		int aheadBy = comparison.path("ahead_by").asInt(oldestFirst.size());
		if (aheadBy > oldestFirst.size()) {
			logger.info("{} is {} commits ahead; reporting the oldest {}, the rest follow on the next check",
					repositoryId, aheadBy, oldestFirst.size());
		}

		Collections.reverse(oldestFirst);
		return oldestFirst;
	}

	private CommitListing rewrittenOrEmpty(RepositoryId repositoryId, String branch, String cursor) {
		Optional<CommitRef> tip = fetchTip(repositoryId, branch);
		if (tip.isEmpty()) {
			return CommitListing.empty();
		}
		if (tip.get().id().equals(cursor)) {
			return CommitListing.empty();
		}
		return CommitListing.rewritten(tip.get());
	}

	/**
	 * Fetch the tip commit of a branch, including file counts.
	 * @return the tip, or empty if the repository has no commits yet
	 */
	private Optional<CommitRef> fetchTip(RepositoryId repositoryId, String branch) {
		try {
			String response = httpClient.get("/repos/" + repositoryId.fullName() + "/commits/" + encode(branch));
			JsonNode node = readTree(response);
			return Optional.of(parseCommitWithFiles(repositoryId, node));
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (e.getStatusCode() == 409) {
				logger.info("Repository {} is empty", repositoryId);
				return Optional.empty();
			}
			throw translate(repositoryId, e);
		}
	}

	private CommitRef withFileCounts(RepositoryId repositoryId, CommitRef commit) {
		try {
			JsonNode detail = readTree(httpClient.get("/repos/" + repositoryId.fullName() + "/commits/" + commit.id()));
			return parseCommitWithFiles(repositoryId, detail);
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (e.getStatusCode() == 401 || e.isRateLimitError()) {
				throw translate(repositoryId, e);
			}
			logger.warn("Failed to get file details for commit {} in {}: {}", commit.shortId(), repositoryId,
					e.getMessage());
			return commit;
		}
	}

	private CommitRef parseCommitWithFiles(RepositoryId repositoryId, JsonNode node) {
		int added = 0;
		int removed = 0;
		int modified = 0;
		for (JsonNode file : node.path("files")) {
			switch (file.path("status").asText("")) {
				case "added" -> added++;
				case "removed" -> removed++;
				case "modified" -> modified++;
				default -> {
				}
			}
		}
		return parseCommit(repositoryId, node).withFileCounts(added, removed, modified);
	}

	private CommitRef parseCommit(RepositoryId repositoryId, JsonNode node) {
		String sha = node.path("sha").asText("");
		if (sha.isEmpty()) {
			throw new RepositoryAccessException(FailureKind.TRANSIENT, "Commit without sha in response for "
					+ repositoryId);
		}
		JsonNode commit = node.path("commit");
		JsonNode author = commit.path("author");
		String url = node.path("html_url").asText(repositoryId.htmlUrl() + "/commit/" + sha);
		return new CommitRef(sha, author.path("name").asText("unknown"), author.path("email").asText(""),
				parseTimestamp(author.path("date").asText(null)), commit.path("message").asText("").strip(), 0, 0, 0,
				url);
	}

	private Instant parseTimestamp(@Nullable String value) {
		if (value == null || value.isEmpty()) {
			return clock.instant();
		}
		try {
			return Instant.parse(value);
		}
		catch (DateTimeParseException e) {
			logger.warn("Unparseable commit date '{}', using current time", value);
			return clock.instant();
		}
	}

	private JsonNode getJson(RepositoryId repositoryId, String path) {
		try {
			return readTree(httpClient.get(path));
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			throw translate(repositoryId, e);
		}
	}

	private JsonNode readTree(String body) {
		try {
			return objectMapper.readTree(body);
		}
		catch (IOException e) {
			throw new RepositoryAccessException(FailureKind.TRANSIENT, "Malformed GitHub response: " + e.getMessage(),
					e);
		}
	}

	/**
	 * Classify an HTTP failure into the {@link FailureKind} taxonomy.
	 */
	RepositoryAccessException translate(RepositoryId repositoryId, GitHubHttpClient.GitHubApiException e) {
		int status = e.getStatusCode();
		if (status == 401) {
			return new RepositoryAccessException(FailureKind.AUTH, "GitHub rejected the credentials: " + e.getMessage(),
					e);
		}
		if (e.isRateLimitError()) {
			boolean accountWide = e.getRateLimitRemaining() == 0;
			return new RepositoryAccessException(FailureKind.RATE_LIMITED,
					"Rate limited while accessing " + repositoryId + ": " + e.getMessage(), retryAfter(e), accountWide,
					e);
		}
		if (status == 403 || status == 404 || status == 451) {
			return new RepositoryAccessException(FailureKind.NOT_FOUND,
					"Repository " + repositoryId + " not found or inaccessible (" + status + ")", e);
		}
		return new RepositoryAccessException(FailureKind.TRANSIENT,
				"GitHub request for " + repositoryId + " failed: " + e.getMessage(), e);
	}

	@Nullable
	private Duration retryAfter(GitHubHttpClient.GitHubApiException e) {
		if (e.getRetryAfterSeconds() > 0) {
			return Duration.ofSeconds(e.getRetryAfterSeconds());
		}
		if (e.getResetEpochSeconds() > 0) {
			long seconds = e.getResetEpochSeconds() - clock.instant().getEpochSecond() + 1;
			return Duration.ofSeconds(Math.max(1, seconds));
		}
		return null;
	}

	// Branch names may contain '/', which GitHub expects unescaped in ref paths
	private static String encode(String branch) {
		return URLEncoder.encode(branch, StandardCharsets.UTF_8).replace("%2F", "/");
	}

	private static String shortId(String commitId) {
		return commitId.length() <= CommitRef.SHORT_ID_LENGTH ? commitId
				: commitId.substring(0, CommitRef.SHORT_ID_LENGTH);
	}

}
