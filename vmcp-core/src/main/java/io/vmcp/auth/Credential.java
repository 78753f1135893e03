/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.auth;

import java.util.Map;

/**
 * Outgoing credential presented to a backend, expressed as request headers.
 *
 * @param headers headers to add to every request sent to the backend
 */
public record Credential(Map<String, String> headers) {

	public static final Credential NONE = new Credential(Map.of());

	public Credential {
		headers = headers == null ? Map.of() : Map.copyOf(headers);
	}

	public static Credential bearer(String token) {
		return new Credential(Map.of("Authorization", "Bearer " + token));
	}

	@Override
	public String toString() {
		return "Credential[headers=" + this.headers.keySet() + "]";
	}

}
