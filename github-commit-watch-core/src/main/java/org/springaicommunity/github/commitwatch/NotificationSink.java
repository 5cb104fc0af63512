package org.springaicommunity.github.commitwatch;

/**
 * Chat transport boundary: accepts notifications addressed to one subscriber.
 *
 * <p>
 * Implementations signal delivery failures (subscriber blocked the bot, transport down)
 * by throwing a runtime exception; the {@link NotificationDispatcher} contains them.
 */
@FunctionalInterface
public interface NotificationSink {

	void send(String subscriberId, Notification notification);

}
