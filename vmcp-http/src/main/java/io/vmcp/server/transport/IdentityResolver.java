/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.server.transport;

import java.util.Map;

import io.vmcp.auth.Identity;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Derives the caller's identity from an incoming request. Authentication itself happens
 * before the servlet; this only reads what it established.
 */
@FunctionalInterface
public interface IdentityResolver {

	/**
	 * Uses the bearer token of the {@code Authorization} header, if any, under the
	 * subject {@code anonymous}.
	 */
	IdentityResolver BEARER_TOKEN = request -> {
		String authorization = request.getHeader("Authorization");
		if (authorization != null && authorization.regionMatches(true, 0, "Bearer ", 0, 7)) {
			return new Identity(Identity.ANONYMOUS.subject(), authorization.substring(7).trim(), Map.of());
		}
		return Identity.ANONYMOUS;
	};

	Identity resolve(HttpServletRequest request);

}
