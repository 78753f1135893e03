/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.server;

import java.util.Optional;

/**
 * Where the protocol front end looks up the handlers of a session's capabilities.
 */
public interface SessionCapabilityRegistry {

	SessionCapabilityRegistry NOOP = new SessionCapabilityRegistry() {

		@Override
		public void register(String sessionId, SessionCapabilities capabilities) {
		}

		@Override
		public void unregister(String sessionId) {
		}

		@Override
		public Optional<SessionCapabilities> capabilities(String sessionId) {
			return Optional.empty();
		}

	};

	void register(String sessionId, SessionCapabilities capabilities);

	void unregister(String sessionId);

	Optional<SessionCapabilities> capabilities(String sessionId);

}
