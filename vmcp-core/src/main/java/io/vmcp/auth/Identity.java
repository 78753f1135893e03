/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.auth;

import java.util.Map;

import io.vmcp.util.Assert;

/**
 * The authenticated caller behind a session. The session core treats it as opaque and
 * only hands it to the {@link OutgoingCredentialResolver}.
 *
 * @param subject stable caller identifier, persisted as the identity reference
 * @param token the caller's bearer token, may be {@code null}
 * @param claims additional attributes from the incoming authentication
 */
public record Identity(String subject, String token, Map<String, Object> claims) {

	public static final Identity ANONYMOUS = new Identity("anonymous", null, Map.of());

	public Identity {
		Assert.hasText(subject, "subject must not be empty");
		claims = claims == null ? Map.of() : Map.copyOf(claims);
	}

	public static Identity of(String subject, String token) {
		return new Identity(subject, token, Map.of());
	}

	/**
	 * The serializable reference stored with session metadata.
	 * @return the subject
	 */
	public String reference() {
		return this.subject;
	}

	@Override
	public String toString() {
		return "Identity[subject=" + this.subject + ", token=" + (this.token != null ? "***" : "none") + "]";
	}

}
