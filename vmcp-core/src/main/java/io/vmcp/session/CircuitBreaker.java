/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.session;

import java.time.Duration;
import java.util.function.LongSupplier;

import io.vmcp.util.Assert;

/**
 * Consecutive-failure circuit breaker guarding connection recreation for one backend.
 *
 * <p>
 * After {@code failureThreshold} consecutive failures the breaker opens and refuses
 * attempts for {@code openDuration}. It then lets a single trial attempt through; the
 * trial's outcome closes or re-opens it.
 * </p>
 */
public class CircuitBreaker {

	public enum State {

		CLOSED, OPEN, HALF_OPEN

	}

	private final int failureThreshold;

	private final long openDurationMillis;

	private final LongSupplier currentTimeMillisSupplier;

	private State state = State.CLOSED;

	private int consecutiveFailures;

	private long openedAt;

	private boolean trialInProgress;

	public CircuitBreaker(int failureThreshold, Duration openDuration) {
		this(failureThreshold, openDuration, System::currentTimeMillis);
	}

	public CircuitBreaker(int failureThreshold, Duration openDuration, LongSupplier currentTimeMillisSupplier) {
		Assert.isTrue(failureThreshold > 0, "failureThreshold must be positive");
		Assert.isPositive(openDuration, "openDuration must be positive");
		Assert.notNull(currentTimeMillisSupplier, "currentTimeMillisSupplier must not be null");
		this.failureThreshold = failureThreshold;
		this.openDurationMillis = openDuration.toMillis();
		this.currentTimeMillisSupplier = currentTimeMillisSupplier;
	}

	/**
	 * Asks for permission to make an attempt. Every permitted attempt must be followed by
	 * {@link #recordSuccess()} or {@link #recordFailure()}.
	 * @return whether the attempt may proceed
	 */
	public synchronized boolean tryAcquire() {
		switch (this.state) {
			case CLOSED:
				return true;
			case OPEN:
				if (this.currentTimeMillisSupplier.getAsLong() - this.openedAt < this.openDurationMillis) {
					return false;
				}
				this.state = State.HALF_OPEN;
				this.trialInProgress = true;
				return true;
			default:
				if (this.trialInProgress) {
					return false;
				}
				this.trialInProgress = true;
				return true;
		}
	}

	public synchronized void recordSuccess() {
		this.state = State.CLOSED;
		this.consecutiveFailures = 0;
		this.trialInProgress = false;
	}

	public synchronized void recordFailure() {
		this.consecutiveFailures++;
		this.trialInProgress = false;
		if (this.state == State.HALF_OPEN || this.consecutiveFailures >= this.failureThreshold) {
			this.state = State.OPEN;
			this.openedAt = this.currentTimeMillisSupplier.getAsLong();
		}
	}

	public synchronized State state() {
		return this.state;
	}

}
