/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.session;

import java.util.List;
import java.util.Map;
import java.util.Set;

import io.vmcp.aggregator.RoutingTable;
import io.vmcp.auth.Identity;
import io.vmcp.spec.AsyncCloseable;
import io.vmcp.spec.McpSchema;
import reactor.core.publisher.Mono;

/**
 * A client's view over its own set of backend connections.
 *
 * <p>
 * A session owns its connections exclusively and routes each call to the backend that
 * implements the requested operation, under the backend's original operation name.
 * Every collection it returns is an immutable snapshot. Once closed, a session rejects
 * all calls with {@link io.vmcp.spec.SessionClosedException} and never reopens.
 * </p>
 */
public interface Session extends AsyncCloseable {

	String id();

	Identity identity();

	List<McpSchema.Tool> tools();

	List<McpSchema.Resource> resources();

	List<McpSchema.Prompt> prompts();

	RoutingTable routingTable();

	/**
	 * Backend-issued session tokens by backend id, for backends that issued one.
	 * @return a snapshot of the tokens
	 */
	Map<String, String> backendSessionIds();

	Set<String> connectedBackends();

	/**
	 * Backends that were requested but could not be initialized when the session was
	 * created.
	 * @return the failed backend ids
	 */
	Set<String> failedBackends();

	boolean isClosed();

	Mono<McpSchema.CallToolResult> callTool(String name, Map<String, Object> arguments);

	Mono<McpSchema.ReadResourceResult> readResource(String uri);

	Mono<McpSchema.GetPromptResult> getPrompt(String name, Map<String, Object> arguments);

	/**
	 * Pings every connection that supports it and proactively re-initializes backends
	 * whose session expired. Never fails.
	 * @return a Mono that completes when every probe finished
	 */
	Mono<Void> keepAlive();

}
