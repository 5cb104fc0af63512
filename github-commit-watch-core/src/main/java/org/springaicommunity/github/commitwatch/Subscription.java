package org.springaicommunity.github.commitwatch;

/**
 * One (subscriber, repository) edge of the {@link SubscriptionIndex}.
 *
 * @param subscriberId the chat or session id of the subscriber
 * @param repositoryId the subscribed repository
 */
public record Subscription(String subscriberId, RepositoryId repositoryId) {

}
