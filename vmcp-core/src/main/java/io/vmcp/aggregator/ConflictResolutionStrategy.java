/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.aggregator;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Decides the exposed names of tools and prompts when several backends are merged into
 * one namespace.
 */
public interface ConflictResolutionStrategy {

	/**
	 * Resolves exposed names for the given candidates.
	 * @param candidates one entry per backend operation, in backend priority order, each
	 * initially exposed under its original name
	 * @return the entries to route, with unique exposed names
	 */
	List<RoutingEntry> resolve(List<RoutingEntry> candidates);

	/**
	 * Maps an exposed name back to the backend it would belong to, even if that
	 * backend contributed nothing. Strategies that keep original names cannot tell.
	 * @param exposedName a name a client used
	 * @param backendIds the candidate backends
	 * @return the owning backend, if the name encodes one
	 */
	default Optional<String> owningBackend(String exposedName, Collection<String> backendIds) {
		return Optional.empty();
	}

}
