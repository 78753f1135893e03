/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.server;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

import io.vmcp.session.Session;
import io.vmcp.spec.McpSchema;
import reactor.core.publisher.Mono;

/**
 * A session's capabilities in registration form: every exposed tool, resource and
 * prompt paired with the handler that serves it.
 *
 * @param tools tool registrations
 * @param resources resource registrations
 * @param prompts prompt registrations
 */
public record SessionCapabilities(List<ToolRegistration> tools, List<ResourceRegistration> resources,
		List<PromptRegistration> prompts) {

	public SessionCapabilities {
		tools = List.copyOf(tools);
		resources = List.copyOf(resources);
		prompts = List.copyOf(prompts);
	}

	/**
	 * Translates a session's capability lists. Each handler simply calls the session.
	 * @param session the session
	 * @return the registrations
	 */
	public static SessionCapabilities from(Session session) {
		List<ToolRegistration> tools = session.tools()
			.stream()
			.map(tool -> new ToolRegistration(tool, arguments -> session.callTool(tool.name(), arguments)))
			.toList();
		List<ResourceRegistration> resources = session.resources()
			.stream()
			.map(resource -> new ResourceRegistration(resource, request -> session.readResource(request.uri())))
			.toList();
		List<PromptRegistration> prompts = session.prompts()
			.stream()
			.map(prompt -> new PromptRegistration(prompt,
					request -> session.getPrompt(prompt.name(), request.arguments())))
			.toList();
		return new SessionCapabilities(tools, resources, prompts);
	}

	public McpSchema.ServerCapabilities serverCapabilities() {
		return McpSchema.ServerCapabilities.of(!this.tools.isEmpty(), !this.resources.isEmpty(),
				!this.prompts.isEmpty());
	}

	public record ToolRegistration(McpSchema.Tool tool,
			Function<Map<String, Object>, Mono<McpSchema.CallToolResult>> handler) {
	}

	public record ResourceRegistration(McpSchema.Resource resource,
			Function<McpSchema.ReadResourceRequest, Mono<McpSchema.ReadResourceResult>> handler) {
	}

	public record PromptRegistration(McpSchema.Prompt prompt,
			Function<McpSchema.GetPromptRequest, Mono<McpSchema.GetPromptResult>> handler) {
	}

}
