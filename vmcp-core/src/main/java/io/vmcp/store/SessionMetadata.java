/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.vmcp.util.Assert;

/**
 * The serializable part of a session. Live connections and routing data are never part
 * of it.
 *
 * @param id the session identifier
 * @param createdAt creation time in epoch milliseconds
 * @param lastTouchedAt last access time in epoch milliseconds, drives the TTL
 * @param identityReference reference to the caller, {@code null} while the session is
 * only a placeholder
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionMetadata( // @formatter:off
	@JsonProperty("id") String id,
	@JsonProperty("createdAt") long createdAt,
	@JsonProperty("lastTouchedAt") long lastTouchedAt,
	@JsonProperty("identityReference") String identityReference) { // @formatter:on

	public SessionMetadata {
		Assert.hasText(id, "id must not be empty");
	}

	/**
	 * Metadata stored when an identifier is issued, before the caller is known.
	 * @param id the issued identifier
	 * @param now the current time in epoch milliseconds
	 * @return the placeholder metadata
	 */
	public static SessionMetadata placeholder(String id, long now) {
		return new SessionMetadata(id, now, now, null);
	}

	@JsonIgnore
	public boolean isPlaceholder() {
		return this.identityReference == null;
	}

	public SessionMetadata populated(String identityReference, long now) {
		return new SessionMetadata(this.id, this.createdAt, now, identityReference);
	}

	public SessionMetadata touchedAt(long now) {
		return new SessionMetadata(this.id, this.createdAt, now, this.identityReference);
	}

}
