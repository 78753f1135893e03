/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.backend;

import java.util.Map;

import io.vmcp.util.Assert;

/**
 * One downstream MCP server the proxy aggregates.
 *
 * @param id stable identifier, also used as the routing key and the default naming
 * prefix
 * @param endpoint where the backend is reached, interpreted by the
 * {@link BackendConnector}
 * @param metadata free-form attributes such as the transport type or credential hints
 */
public record Backend(String id, String endpoint, Map<String, String> metadata) {

	public Backend {
		Assert.hasText(id, "Backend id must not be empty");
		Assert.hasText(endpoint, "Backend endpoint must not be empty");
		metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
	}

	public static Backend of(String id, String endpoint) {
		return new Backend(id, endpoint, Map.of());
	}

}
