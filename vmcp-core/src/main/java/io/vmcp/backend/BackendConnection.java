/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.backend;

import java.util.List;
import java.util.Optional;

import io.vmcp.spec.AsyncCloseable;
import io.vmcp.spec.McpSchema;
import reactor.core.publisher.Mono;

/**
 * One initialized, stateful link from a session to a backend.
 *
 * <p>
 * A connection is owned by exactly one session for its whole life and is never pooled
 * or shared. Implementations report a backend that no longer knows the connection's
 * session with {@link io.vmcp.spec.BackendSessionExpiredException} and rejected
 * credentials with {@link io.vmcp.spec.BackendAuthorizationException}; everything else
 * the backend reports through JSON-RPC is raised as {@link io.vmcp.spec.McpError}.
 * </p>
 */
public interface BackendConnection extends AsyncCloseable {

	String backendId();

	String endpoint();

	/**
	 * The session token the backend issued during the handshake, if it issued one.
	 * @return the backend's own session identifier
	 */
	Optional<String> backendSessionId();

	Mono<List<McpSchema.Tool>> listTools();

	Mono<List<McpSchema.Resource>> listResources();

	Mono<List<McpSchema.Prompt>> listPrompts();

	Mono<McpSchema.CallToolResult> callTool(McpSchema.CallToolRequest request);

	Mono<McpSchema.ReadResourceResult> readResource(McpSchema.ReadResourceRequest request);

	Mono<McpSchema.GetPromptResult> getPrompt(McpSchema.GetPromptRequest request);

	/**
	 * Low-cost liveness probe. Backends that do not implement {@code ping} answer with a
	 * method-not-found {@link io.vmcp.spec.McpError}.
	 * @return a Mono that completes when the backend answered
	 */
	Mono<Void> ping();

}
