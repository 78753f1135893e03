/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.aggregator;

import java.util.Map;

import io.vmcp.backend.BackendConnection;
import reactor.core.publisher.Mono;

/**
 * Discovers what a set of backends expose and merges it into one namespace.
 */
@FunctionalInterface
public interface CapabilityAggregator {

	/**
	 * Aggregates the capabilities of the given connections.
	 * @param connections connections by backend id, in priority order
	 * @return the merged capabilities and routing table
	 */
	Mono<AggregatedCapabilities> aggregate(Map<String, BackendConnection> connections);

}
