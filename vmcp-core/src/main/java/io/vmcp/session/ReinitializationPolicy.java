/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.session;

import java.time.Duration;

import io.vmcp.util.Assert;

/**
 * Limits for recreating backend connections inside an active session.
 *
 * @param authorizationAttempts how many times a connection is recreated with freshly
 * resolved credentials before giving up
 * @param minBackoff first delay between authorization recovery attempts
 * @param maxBackoff upper bound of that delay
 * @param breakerFailureThreshold consecutive recreation failures that open a
 * backend's circuit breaker
 * @param breakerOpenDuration how long an open breaker refuses recreation
 */
public record ReinitializationPolicy(int authorizationAttempts, Duration minBackoff, Duration maxBackoff,
		int breakerFailureThreshold, Duration breakerOpenDuration) {

	public static final ReinitializationPolicy DEFAULT = new ReinitializationPolicy(2, Duration.ofMillis(100),
			Duration.ofSeconds(2), 3, Duration.ofSeconds(30));

	public ReinitializationPolicy {
		Assert.isTrue(authorizationAttempts > 0, "authorizationAttempts must be positive");
		Assert.isPositive(minBackoff, "minBackoff must be positive");
		Assert.isPositive(maxBackoff, "maxBackoff must be positive");
		Assert.isTrue(minBackoff.compareTo(maxBackoff) <= 0, "minBackoff must not exceed maxBackoff");
		Assert.isTrue(breakerFailureThreshold > 0, "breakerFailureThreshold must be positive");
		Assert.isPositive(breakerOpenDuration, "breakerOpenDuration must be positive");
	}

	CircuitBreaker newCircuitBreaker() {
		return new CircuitBreaker(this.breakerFailureThreshold, this.breakerOpenDuration);
	}

}
