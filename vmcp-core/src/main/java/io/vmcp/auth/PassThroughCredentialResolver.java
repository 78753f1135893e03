/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.auth;

import io.vmcp.backend.Backend;
import reactor.core.publisher.Mono;

/**
 * Forwards the caller's own bearer token to every backend.
 */
public class PassThroughCredentialResolver implements OutgoingCredentialResolver {

	@Override
	public Mono<Credential> resolve(Identity identity, Backend backend) {
		if (identity == null || identity.token() == null) {
			return Mono.just(Credential.NONE);
		}
		return Mono.just(Credential.bearer(identity.token()));
	}

}
