/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.auth;

import io.vmcp.backend.Backend;
import reactor.core.publisher.Mono;

/**
 * Decides which credential a session presents to a backend on behalf of a caller. It is
 * consulted whenever a connection is created, which includes recreation after a backend
 * rejected the previous credential.
 */
@FunctionalInterface
public interface OutgoingCredentialResolver {

	/**
	 * Resolves the credential for {@code backend}. An empty Mono means no credential.
	 * @param identity the caller
	 * @param backend the target backend
	 * @return the credential to present
	 */
	Mono<Credential> resolve(Identity identity, Backend backend);

	/**
	 * Signals that the backend rejected the credential last resolved for this pair.
	 * Implementations that cache must drop the cached value.
	 * @param identity the caller
	 * @param backend the backend that rejected the credential
	 */
	default void invalidate(Identity identity, Backend backend) {
	}

}
