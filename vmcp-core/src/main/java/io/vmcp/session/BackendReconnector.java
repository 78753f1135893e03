/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.session;

import io.vmcp.backend.Backend;
import io.vmcp.backend.BackendConnection;
import reactor.core.publisher.Mono;

/**
 * Opens a replacement connection for a session's backend. Credentials are resolved
 * anew on every call.
 */
@FunctionalInterface
public interface BackendReconnector {

	Mono<BackendConnection> reconnect(Backend backend);

}
