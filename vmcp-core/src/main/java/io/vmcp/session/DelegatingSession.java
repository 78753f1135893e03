/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.session;

import java.util.List;
import java.util.Map;
import java.util.Set;

import io.vmcp.aggregator.RoutingTable;
import io.vmcp.auth.Identity;
import io.vmcp.spec.McpSchema;
import io.vmcp.util.Assert;
import reactor.core.publisher.Mono;

/**
 * Base class for session decorators. Every method forwards to the wrapped session;
 * subclasses override only the operations they intercept.
 */
public abstract class DelegatingSession implements Session {

	private final Session delegate;

	protected DelegatingSession(Session delegate) {
		Assert.notNull(delegate, "delegate must not be null");
		this.delegate = delegate;
	}

	public Session getDelegate() {
		return this.delegate;
	}

	@Override
	public String id() {
		return this.delegate.id();
	}

	@Override
	public Identity identity() {
		return this.delegate.identity();
	}

	@Override
	public List<McpSchema.Tool> tools() {
		return this.delegate.tools();
	}

	@Override
	public List<McpSchema.Resource> resources() {
		return this.delegate.resources();
	}

	@Override
	public List<McpSchema.Prompt> prompts() {
		return this.delegate.prompts();
	}

	@Override
	public RoutingTable routingTable() {
		return this.delegate.routingTable();
	}

	@Override
	public Map<String, String> backendSessionIds() {
		return this.delegate.backendSessionIds();
	}

	@Override
	public Set<String> connectedBackends() {
		return this.delegate.connectedBackends();
	}

	@Override
	public Set<String> failedBackends() {
		return this.delegate.failedBackends();
	}

	@Override
	public boolean isClosed() {
		return this.delegate.isClosed();
	}

	@Override
	public Mono<McpSchema.CallToolResult> callTool(String name, Map<String, Object> arguments) {
		return this.delegate.callTool(name, arguments);
	}

	@Override
	public Mono<McpSchema.ReadResourceResult> readResource(String uri) {
		return this.delegate.readResource(uri);
	}

	@Override
	public Mono<McpSchema.GetPromptResult> getPrompt(String name, Map<String, Object> arguments) {
		return this.delegate.getPrompt(name, arguments);
	}

	@Override
	public Mono<Void> keepAlive() {
		return this.delegate.keepAlive();
	}

	@Override
	public Mono<Void> closeGracefully() {
		return this.delegate.closeGracefully();
	}

	@Override
	public void close() {
		this.delegate.close();
	}

}
