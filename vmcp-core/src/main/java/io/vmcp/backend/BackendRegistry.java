/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.backend;

import java.util.List;

import io.vmcp.auth.Identity;
import reactor.core.publisher.Mono;

/**
 * Supplies the backends a caller's session should fan out to.
 */
@FunctionalInterface
public interface BackendRegistry {

	Mono<List<Backend>> backendsFor(Identity identity);

}
