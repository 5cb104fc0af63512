package org.springaicommunity.github.commitwatch;

/**
 * Thrown when a subscriber outside the configured admin list issues a command.
 */
public class UnauthorizedSubscriberException extends RuntimeException {

	private final String subscriberId;

	public UnauthorizedSubscriberException(String subscriberId) {
		super("Subscriber " + subscriberId + " is not allowed to use this bot");
		this.subscriberId = subscriberId;
	}

	public String getSubscriberId() {
		return subscriberId;
	}

}
