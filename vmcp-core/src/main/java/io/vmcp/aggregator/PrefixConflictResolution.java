/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.aggregator;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import io.vmcp.util.Assert;

/**
 * Exposes every operation as {@code <backendId><separator><name>}, which can never
 * collide across backends.
 */
public class PrefixConflictResolution implements ConflictResolutionStrategy {

	public static final String DEFAULT_SEPARATOR = "_";

	private final String separator;

	public PrefixConflictResolution() {
		this(DEFAULT_SEPARATOR);
	}

	public PrefixConflictResolution(String separator) {
		Assert.notNull(separator, "separator must not be null");
		Assert.isTrue(!separator.isEmpty(), "separator must not be empty");
		this.separator = separator;
	}

	@Override
	public List<RoutingEntry> resolve(List<RoutingEntry> candidates) {
		return candidates.stream().map(c -> c.exposedAs(exposedName(c.backendId(), c.originalName()))).toList();
	}

	@Override
	public Optional<String> owningBackend(String exposedName, Collection<String> backendIds) {
		if (exposedName == null) {
			return Optional.empty();
		}
		// longest match, so "db" does not claim "db_replica_query" when "db_replica" exists
		return backendIds.stream()
			.filter(id -> exposedName.startsWith(id + this.separator))
			.max((a, b) -> Integer.compare(a.length(), b.length()));
	}

	public String exposedName(String backendId, String originalName) {
		return backendId + this.separator + originalName;
	}

}
