/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.store;

import reactor.core.publisher.Mono;

/**
 * TTL-based persistence of {@link SessionMetadata}. Implementations may be local to the
 * process or shared between instances; callers must not depend on which.
 */
public interface SessionStore {

	/**
	 * Stores or replaces the metadata of a session.
	 * @param id the session identifier
	 * @param metadata the metadata
	 * @return a Mono that completes once stored
	 */
	Mono<Void> add(String id, SessionMetadata metadata);

	/**
	 * Loads the metadata of a session and extends its TTL.
	 * @param id the session identifier
	 * @return the touched metadata, or an empty Mono if the session is unknown or
	 * expired
	 */
	Mono<SessionMetadata> get(String id);

	Mono<Void> delete(String id);

	void setExpirationListener(SessionExpirationListener listener);

	/**
	 * Releases resources held by the store, such as a sweep thread.
	 * @return a Mono that completes once the store is shut down
	 */
	default Mono<Void> closeGracefully() {
		return Mono.empty();
	}

}
