/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.backend;

import io.vmcp.auth.Credential;
import reactor.core.publisher.Mono;

/**
 * Creates backend connections. Each call performs the backend's session-establishment
 * handshake and returns a connection that already carries the backend-issued session
 * token. Session and factory code never branch on the concrete connector.
 */
@FunctionalInterface
public interface BackendConnector {

	/**
	 * Opens a new connection to {@code backend}.
	 * @param backend the backend to connect to
	 * @param credential the outgoing credential to present
	 * @return a Mono emitting the initialized connection
	 */
	Mono<BackendConnection> connect(Backend backend, Credential credential);

}
