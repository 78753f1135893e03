/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.aggregator;

import java.util.List;
import java.util.Map;

import io.vmcp.spec.McpSchema;

/**
 * The merged view over a set of backend connections.
 *
 * @param tools tools under their exposed names
 * @param resources resources, keyed by URI in the routing table
 * @param prompts prompts under their exposed names
 * @param routingTable where each exposed operation goes
 * @param backendErrors discovery failures by backend; those backends contribute no
 * capabilities
 */
public record AggregatedCapabilities(List<McpSchema.Tool> tools, List<McpSchema.Resource> resources,
		List<McpSchema.Prompt> prompts, RoutingTable routingTable, Map<String, Throwable> backendErrors) {

	private static final AggregatedCapabilities EMPTY = new AggregatedCapabilities(List.of(), List.of(), List.of(),
			RoutingTable.empty(), Map.of());

	public AggregatedCapabilities {
		tools = tools == null ? List.of() : List.copyOf(tools);
		resources = resources == null ? List.of() : List.copyOf(resources);
		prompts = prompts == null ? List.of() : List.copyOf(prompts);
		routingTable = routingTable == null ? RoutingTable.empty() : routingTable;
		backendErrors = backendErrors == null ? Map.of() : Map.copyOf(backendErrors);
	}

	public static AggregatedCapabilities empty() {
		return EMPTY;
	}

}
