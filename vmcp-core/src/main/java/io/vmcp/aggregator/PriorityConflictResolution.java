/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.aggregator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps original names; when two backends expose the same name the one earlier in the
 * priority order wins and the other is dropped.
 */
public class PriorityConflictResolution implements ConflictResolutionStrategy {

	private static final Logger logger = LoggerFactory.getLogger(PriorityConflictResolution.class);

	@Override
	public List<RoutingEntry> resolve(List<RoutingEntry> candidates) {
		Map<String, RoutingEntry> winners = new LinkedHashMap<>();
		for (RoutingEntry candidate : candidates) {
			RoutingEntry existing = winners.putIfAbsent(candidate.exposedName(), candidate);
			if (existing != null) {
				logger.warn("Operation {} of backend {} is shadowed by backend {}", candidate.originalName(),
						candidate.backendId(), existing.backendId());
			}
		}
		return new ArrayList<>(winners.values());
	}

}
