package org.springaicommunity.github.commitwatch;

/**
 * Reports whether the upstream API is reachable with the configured credentials.
 */
@FunctionalInterface
public interface ConnectionService {

	ConnectionStatus check();

}
