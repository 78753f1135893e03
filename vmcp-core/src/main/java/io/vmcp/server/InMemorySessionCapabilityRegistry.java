/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.server;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.vmcp.util.Assert;

public class InMemorySessionCapabilityRegistry implements SessionCapabilityRegistry {

	private final ConcurrentHashMap<String, SessionCapabilities> registrations = new ConcurrentHashMap<>();

	@Override
	public void register(String sessionId, SessionCapabilities capabilities) {
		Assert.hasText(sessionId, "sessionId must not be empty");
		Assert.notNull(capabilities, "capabilities must not be null");
		this.registrations.put(sessionId, capabilities);
	}

	@Override
	public void unregister(String sessionId) {
		this.registrations.remove(sessionId);
	}

	@Override
	public Optional<SessionCapabilities> capabilities(String sessionId) {
		return Optional.ofNullable(this.registrations.get(sessionId));
	}

	public int size() {
		return this.registrations.size();
	}

}
