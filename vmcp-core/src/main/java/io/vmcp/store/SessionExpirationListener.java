/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.store;

import reactor.core.publisher.Mono;

/**
 * Notified by a {@link SessionStore} when a record's TTL runs out. The record is removed
 * only after the returned Mono terminates, so the listener can release everything the
 * session owns first.
 */
@FunctionalInterface
public interface SessionExpirationListener {

	Mono<Void> sessionExpired(SessionMetadata metadata);

}
