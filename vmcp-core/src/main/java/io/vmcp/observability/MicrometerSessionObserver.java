/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.observability;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.vmcp.aggregator.OperationKind;
import io.vmcp.util.Assert;

/**
 * Records session metrics in a Micrometer {@link MeterRegistry}.
 *
 * <ul>
 * <li>{@code vmcp.sessions.active}: gauge of sessions created and not yet closed</li>
 * <li>{@code vmcp.sessions.rejected}: sessions refused by the session cap</li>
 * <li>{@code vmcp.backend.init}: connection latency, tagged by backend and outcome</li>
 * <li>{@code vmcp.backend.reinit}: connection recreations, tagged by backend, reason
 * and outcome</li>
 * <li>{@code vmcp.operation.calls}: call latency, tagged by backend, kind, operation
 * and outcome</li>
 * </ul>
 */
public class MicrometerSessionObserver implements SessionObserver {

	public static final String ACTIVE_SESSIONS = "vmcp.sessions.active";

	public static final String REJECTED_SESSIONS = "vmcp.sessions.rejected";

	public static final String BACKEND_INIT = "vmcp.backend.init";

	public static final String BACKEND_REINIT = "vmcp.backend.reinit";

	public static final String OPERATION_CALLS = "vmcp.operation.calls";

	private final MeterRegistry registry;

	private final AtomicInteger activeSessions = new AtomicInteger();

	private final Counter rejected;

	public MicrometerSessionObserver(MeterRegistry registry) {
		Assert.notNull(registry, "registry must not be null");
		this.registry = registry;
		Gauge.builder(ACTIVE_SESSIONS, this.activeSessions, AtomicInteger::get)
			.description("Sessions created and not yet closed")
			.register(registry);
		this.rejected = Counter.builder(REJECTED_SESSIONS)
			.description("Session creations refused by the active-session cap")
			.register(registry);
	}

	@Override
	public void sessionCreated(String sessionId, Set<String> connected, Set<String> failed) {
		this.activeSessions.incrementAndGet();
	}

	@Override
	public void sessionClosed(String sessionId, Throwable error) {
		this.activeSessions.updateAndGet(n -> Math.max(0, n - 1));
	}

	@Override
	public void sessionRejected(int activeSessions) {
		this.rejected.increment();
	}

	@Override
	public void backendInitialized(String sessionId, String backendId, Duration latency, Throwable error) {
		Timer.builder(BACKEND_INIT)
			.description("Backend connection latency during session creation")
			.tag("backend", backendId)
			.tag("outcome", outcome(error))
			.register(this.registry)
			.record(latency);
	}

	@Override
	public void backendReinitialized(String sessionId, String backendId, String reason, Throwable error) {
		Counter.builder(BACKEND_REINIT)
			.description("Backend connections recreated within an active session")
			.tag("backend", backendId)
			.tag("reason", reason)
			.tag("outcome", outcome(error))
			.register(this.registry)
			.increment();
	}

	@Override
	public void operationCompleted(String sessionId, String backendId, OperationKind kind, String operation,
			Duration latency, Throwable error) {
		Timer.builder(OPERATION_CALLS)
			.description("Latency of calls routed to backends")
			.tag("backend", backendId)
			.tag("kind", kind.label())
			.tag("operation", operation)
			.tag("outcome", outcome(error))
			.register(this.registry)
			.record(latency);
	}

	private static String outcome(Throwable error) {
		return error == null ? "success" : "error";
	}

}
