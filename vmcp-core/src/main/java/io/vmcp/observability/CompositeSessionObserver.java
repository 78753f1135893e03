/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.observability;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import io.vmcp.aggregator.OperationKind;
import io.vmcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards every event to a list of observers. A failing observer is logged and does
 * not prevent the others from being notified.
 */
public class CompositeSessionObserver implements SessionObserver {

	private static final Logger logger = LoggerFactory.getLogger(CompositeSessionObserver.class);

	private final List<SessionObserver> observers;

	public CompositeSessionObserver(List<SessionObserver> observers) {
		Assert.notNull(observers, "observers must not be null");
		this.observers = List.copyOf(observers);
	}

	public static SessionObserver of(SessionObserver... observers) {
		return new CompositeSessionObserver(List.of(observers));
	}

	@Override
	public void sessionCreated(String sessionId, Set<String> connected, Set<String> failed) {
		forEach(o -> o.sessionCreated(sessionId, connected, failed));
	}

	@Override
	public void backendInitialized(String sessionId, String backendId, Duration latency, Throwable error) {
		forEach(o -> o.backendInitialized(sessionId, backendId, latency, error));
	}

	@Override
	public void backendReinitialized(String sessionId, String backendId, String reason, Throwable error) {
		forEach(o -> o.backendReinitialized(sessionId, backendId, reason, error));
	}

	@Override
	public void operationCompleted(String sessionId, String backendId, OperationKind kind, String operation,
			Duration latency, Throwable error) {
		forEach(o -> o.operationCompleted(sessionId, backendId, kind, operation, latency, error));
	}

	@Override
	public void sessionClosed(String sessionId, Throwable error) {
		forEach(o -> o.sessionClosed(sessionId, error));
	}

	@Override
	public void sessionRejected(int activeSessions) {
		forEach(o -> o.sessionRejected(activeSessions));
	}

	private void forEach(Consumer<SessionObserver> event) {
		for (SessionObserver observer : this.observers) {
			try {
				event.accept(observer);
			}
			catch (RuntimeException e) {
				logger.warn("Session observer {} failed", observer.getClass().getName(), e);
			}
		}
	}

}
