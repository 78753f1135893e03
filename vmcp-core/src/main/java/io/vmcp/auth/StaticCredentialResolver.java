/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.auth;

import java.util.Map;

import io.vmcp.backend.Backend;
import io.vmcp.util.Assert;
import reactor.core.publisher.Mono;

/**
 * Presents a fixed, per-backend credential regardless of the caller, for backends that
 * are reached with a service account.
 */
public class StaticCredentialResolver implements OutgoingCredentialResolver {

	private final Map<String, Credential> credentials;

	public StaticCredentialResolver(Map<String, Credential> credentials) {
		Assert.notNull(credentials, "credentials must not be null");
		this.credentials = Map.copyOf(credentials);
	}

	@Override
	public Mono<Credential> resolve(Identity identity, Backend backend) {
		return Mono.just(this.credentials.getOrDefault(backend.id(), Credential.NONE));
	}

}
