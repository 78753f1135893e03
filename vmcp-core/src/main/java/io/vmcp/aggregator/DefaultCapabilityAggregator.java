/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.aggregator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

import io.vmcp.backend.BackendConnection;
import io.vmcp.spec.McpError;
import io.vmcp.spec.McpSchema;
import io.vmcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Lists tools, resources and prompts of every connection in parallel and merges them
 * with a {@link ConflictResolutionStrategy}.
 *
 * <p>
 * A backend that answers a list call with method-not-found simply contributes nothing
 * of that kind. Any other discovery failure excludes the backend entirely and is
 * reported in {@link AggregatedCapabilities#backendErrors()}.
 * </p>
 */
public class DefaultCapabilityAggregator implements CapabilityAggregator {

	private static final Logger logger = LoggerFactory.getLogger(DefaultCapabilityAggregator.class);

	private final ConflictResolutionStrategy conflictResolution;

	public DefaultCapabilityAggregator() {
		this(new PrefixConflictResolution());
	}

	public DefaultCapabilityAggregator(ConflictResolutionStrategy conflictResolution) {
		Assert.notNull(conflictResolution, "conflictResolution must not be null");
		this.conflictResolution = conflictResolution;
	}

	public ConflictResolutionStrategy conflictResolution() {
		return this.conflictResolution;
	}

	@Override
	public Mono<AggregatedCapabilities> aggregate(Map<String, BackendConnection> connections) {
		if (connections == null || connections.isEmpty()) {
			return Mono.just(AggregatedCapabilities.empty());
		}
		return Flux.fromIterable(connections.entrySet())
			.flatMapSequential(e -> discover(e.getKey(), e.getValue()))
			.collectList()
			.map(this::merge);
	}

	private Mono<Discovery> discover(String backendId, BackendConnection connection) {
		Mono<List<McpSchema.Tool>> tools = orEmpty(connection.listTools());
		Mono<List<McpSchema.Resource>> resources = orEmpty(connection.listResources());
		Mono<List<McpSchema.Prompt>> prompts = orEmpty(connection.listPrompts());
		return Mono.zip(tools, resources, prompts)
			.map(t -> new Discovery(backendId, t.getT1(), t.getT2(), t.getT3(), null))
			.onErrorResume(error -> {
				logger.warn("Capability discovery failed for backend {}: {}", backendId, error.getMessage());
				return Mono.just(new Discovery(backendId, List.of(), List.of(), List.of(), error));
			});
	}

	private static <T> Mono<List<T>> orEmpty(Mono<List<T>> listing) {
		return listing.defaultIfEmpty(List.of())
			.onErrorResume(e -> e instanceof McpError mcpError && mcpError.isMethodNotFound(),
					e -> Mono.just(List.of()));
	}

	private AggregatedCapabilities merge(List<Discovery> discoveries) {
		Map<String, Throwable> errors = new LinkedHashMap<>();
		List<RoutingEntry> toolCandidates = new ArrayList<>();
		List<RoutingEntry> promptCandidates = new ArrayList<>();
		Map<String, McpSchema.Tool> toolsByOrigin = new LinkedHashMap<>();
		Map<String, McpSchema.Prompt> promptsByOrigin = new LinkedHashMap<>();
		Map<String, RoutingEntry> resourceRoutes = new LinkedHashMap<>();
		List<McpSchema.Resource> resources = new ArrayList<>();

		for (Discovery discovery : discoveries) {
			if (discovery.error() != null) {
				errors.put(discovery.backendId(), discovery.error());
				continue;
			}
			for (McpSchema.Tool tool : discovery.tools()) {
				toolCandidates.add(RoutingEntry.unchanged(discovery.backendId(), tool.name()));
				toolsByOrigin.put(origin(discovery.backendId(), tool.name()), tool);
			}
			for (McpSchema.Prompt prompt : discovery.prompts()) {
				promptCandidates.add(RoutingEntry.unchanged(discovery.backendId(), prompt.name()));
				promptsByOrigin.put(origin(discovery.backendId(), prompt.name()), prompt);
			}
			for (McpSchema.Resource resource : discovery.resources()) {
				RoutingEntry existing = resourceRoutes.putIfAbsent(resource.uri(),
						RoutingEntry.unchanged(discovery.backendId(), resource.uri()));
				if (existing == null) {
					resources.add(resource);
				}
				else {
					logger.warn("Resource {} of backend {} is shadowed by backend {}", resource.uri(),
							discovery.backendId(), existing.backendId());
				}
			}
		}

		Map<String, RoutingEntry> toolRoutes = new LinkedHashMap<>();
		List<McpSchema.Tool> tools = expose(this.conflictResolution.resolve(toolCandidates), toolsByOrigin, toolRoutes,
				McpSchema.Tool::withName);
		Map<String, RoutingEntry> promptRoutes = new LinkedHashMap<>();
		List<McpSchema.Prompt> prompts = expose(this.conflictResolution.resolve(promptCandidates), promptsByOrigin,
				promptRoutes, McpSchema.Prompt::withName);

		RoutingTable table = new RoutingTable(toolRoutes, resourceRoutes, promptRoutes);
		return new AggregatedCapabilities(tools, resources, prompts, table, errors);
	}

	private static <T> List<T> expose(List<RoutingEntry> entries, Map<String, T> byOrigin,
			Map<String, RoutingEntry> routes, BiFunction<T, String, T> rename) {
		List<T> exposed = new ArrayList<>();
		for (RoutingEntry entry : entries) {
			T descriptor = byOrigin.get(origin(entry.backendId(), entry.originalName()));
			if (descriptor == null || routes.putIfAbsent(entry.exposedName(), entry) != null) {
				continue;
			}
			exposed.add(rename.apply(descriptor, entry.exposedName()));
		}
		return exposed;
	}

	private static String origin(String backendId, String name) {
		return backendId + '\u0000' + name;
	}

	private record Discovery(String backendId, List<McpSchema.Tool> tools, List<McpSchema.Resource> resources,
			List<McpSchema.Prompt> prompts, Throwable error) {
	}

}
