/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.aggregator;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookup from exposed operation names to {@link RoutingEntry routing
 * entries}, one map per {@link OperationKind}. Resources are keyed by URI.
 */
public record RoutingTable(Map<String, RoutingEntry> tools, Map<String, RoutingEntry> resources,
		Map<String, RoutingEntry> prompts) {

	private static final RoutingTable EMPTY = new RoutingTable(Map.of(), Map.of(), Map.of());

	public RoutingTable {
		tools = tools == null ? Map.of() : Map.copyOf(tools);
		resources = resources == null ? Map.of() : Map.copyOf(resources);
		prompts = prompts == null ? Map.of() : Map.copyOf(prompts);
	}

	public static RoutingTable empty() {
		return EMPTY;
	}

	/**
	 * Looks up the entry for an exposed name.
	 * @param kind the operation family
	 * @param exposedName the name the client used
	 * @return the entry or {@code null} when nothing is routed under that name
	 */
	public RoutingEntry lookup(OperationKind kind, String exposedName) {
		if (exposedName == null) {
			return null;
		}
		return switch (kind) {
			case TOOL -> this.tools.get(exposedName);
			case RESOURCE -> this.resources.get(exposedName);
			case PROMPT -> this.prompts.get(exposedName);
		};
	}

	/**
	 * A copy holding only the entries that route to one of the given backends.
	 * @param backendIds the backends to keep
	 * @return the filtered table
	 */
	public RoutingTable retainBackends(Set<String> backendIds) {
		return new RoutingTable(retain(this.tools, backendIds), retain(this.resources, backendIds),
				retain(this.prompts, backendIds));
	}

	private static Map<String, RoutingEntry> retain(Map<String, RoutingEntry> entries, Set<String> backendIds) {
		Map<String, RoutingEntry> kept = new HashMap<>();
		entries.forEach((name, entry) -> {
			if (backendIds.contains(entry.backendId())) {
				kept.put(name, entry);
			}
		});
		return kept;
	}

	public boolean isEmpty() {
		return this.tools.isEmpty() && this.resources.isEmpty() && this.prompts.isEmpty();
	}

	/**
	 * Every backend referenced by at least one entry.
	 * @return the backend identifiers
	 */
	public Set<String> backendIds() {
		Set<String> ids = new HashSet<>();
		this.tools.values().forEach(e -> ids.add(e.backendId()));
		this.resources.values().forEach(e -> ids.add(e.backendId()));
		this.prompts.values().forEach(e -> ids.add(e.backendId()));
		return Set.copyOf(ids);
	}

}
