/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.session;

import java.util.List;

import io.vmcp.auth.Identity;
import io.vmcp.backend.Backend;
import reactor.core.publisher.Mono;

/**
 * Builds fully formed sessions.
 *
 * <p>
 * Building a session never fails because some or all backends could not be reached:
 * those backends are left out, and when none is left the session is empty.
 * </p>
 */
public interface SessionFactory {

	/**
	 * Builds a session under a freshly generated identifier.
	 * @param identity the caller
	 * @param backends the backends to connect to, in priority order
	 * @return the session
	 */
	Mono<Session> makeSession(Identity identity, List<Backend> backends);

	/**
	 * Builds a session under an identifier that was issued earlier.
	 * @param id the identifier
	 * @param identity the caller
	 * @param backends the backends to connect to, in priority order
	 * @return the session
	 */
	Mono<Session> makeSessionWithId(String id, Identity identity, List<Backend> backends);

	/**
	 * Generates a new, globally unique session identifier.
	 * @return the identifier
	 */
	String generateId();

}
