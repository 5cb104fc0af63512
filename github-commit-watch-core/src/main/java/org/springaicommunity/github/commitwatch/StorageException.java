package org.springaicommunity.github.commitwatch;

/**
 * Raised when a {@link CursorStore} or {@link SubscriptionIndex} cannot read or persist
 * its state. A failed write leaves the previously stored value in place.
 */
public class StorageException extends RuntimeException {

	public StorageException(String message, Throwable cause) {
		super(message, cause);
	}

}
