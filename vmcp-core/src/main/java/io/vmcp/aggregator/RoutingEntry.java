/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.aggregator;

import io.vmcp.util.Assert;

/**
 * Maps one exposed operation to the backend implementing it.
 *
 * @param exposedName the name the client sees, possibly rewritten to resolve a
 * collision
 * @param backendId the owning backend
 * @param originalName the name the backend itself uses; backends always receive this
 * one
 */
public record RoutingEntry(String exposedName, String backendId, String originalName) {

	public RoutingEntry {
		Assert.hasText(exposedName, "exposedName must not be empty");
		Assert.hasText(backendId, "backendId must not be empty");
		Assert.hasText(originalName, "originalName must not be empty");
	}

	/**
	 * An entry that exposes the backend's own name unchanged.
	 * @param backendId the owning backend
	 * @param name the backend's name for the operation
	 * @return the entry
	 */
	public static RoutingEntry unchanged(String backendId, String name) {
		return new RoutingEntry(name, backendId, name);
	}

	public RoutingEntry exposedAs(String exposedName) {
		return new RoutingEntry(exposedName, this.backendId, this.originalName);
	}

}
