/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.observability;

import java.time.Duration;
import java.util.Set;

import io.vmcp.aggregator.OperationKind;

/**
 * Receives lifecycle events from the session core. Every callback has an empty default
 * so implementations only override what they record. Callbacks run on the thread that
 * produced the event and must not block.
 */
public interface SessionObserver {

	SessionObserver NOOP = new SessionObserver() {
	};

	/**
	 * A session finished construction.
	 * @param sessionId the session
	 * @param connected backends with a live connection
	 * @param failed backends that could not be initialized
	 */
	default void sessionCreated(String sessionId, Set<String> connected, Set<String> failed) {
	}

	/**
	 * One backend connection attempt finished during session creation.
	 * @param sessionId the session
	 * @param backendId the backend
	 * @param latency time spent connecting
	 * @param error the failure or {@code null} on success
	 */
	default void backendInitialized(String sessionId, String backendId, Duration latency, Throwable error) {
	}

	/**
	 * A connection of an active session was recreated.
	 * @param sessionId the session
	 * @param backendId the backend
	 * @param reason what triggered the recreation
	 * @param error the failure or {@code null} on success
	 */
	default void backendReinitialized(String sessionId, String backendId, String reason, Throwable error) {
	}

	default void operationCompleted(String sessionId, String backendId, OperationKind kind, String operation,
			Duration latency, Throwable error) {
	}

	default void sessionClosed(String sessionId, Throwable error) {
	}

	/**
	 * A new session was refused because the active-session cap was reached.
	 * @param activeSessions the number of active sessions at the time
	 */
	default void sessionRejected(int activeSessions) {
	}

}
