/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.backend;

import java.util.List;

import io.vmcp.auth.Identity;
import io.vmcp.util.Assert;
import reactor.core.publisher.Mono;

/**
 * A {@link BackendRegistry} that hands every caller the same, fixed backend list.
 */
public class StaticBackendRegistry implements BackendRegistry {

	private final List<Backend> backends;

	public StaticBackendRegistry(List<Backend> backends) {
		Assert.notNull(backends, "backends must not be null");
		this.backends = List.copyOf(backends);
	}

	@Override
	public Mono<List<Backend>> backendsFor(Identity identity) {
		return Mono.just(this.backends);
	}

}
