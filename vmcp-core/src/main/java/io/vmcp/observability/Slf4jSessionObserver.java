/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.observability;

import java.time.Duration;
import java.util.Set;

import io.vmcp.aggregator.OperationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * Writes session events as structured SLF4J records. The {@code event} key carries the
 * event name and identifiers are attached as key/value pairs so log pipelines can
 * index them.
 */
public class Slf4jSessionObserver implements SessionObserver {

	private static final Logger logger = LoggerFactory.getLogger("io.vmcp.events");

	@Override
	public void sessionCreated(String sessionId, Set<String> connected, Set<String> failed) {
		logger.atInfo()
			.addKeyValue("event", "session_created")
			.addKeyValue("session_id", sessionId)
			.addKeyValue("connected_backends", connected)
			.addKeyValue("failed_backends", failed)
			.log("Session {} created with {} of {} backends", sessionId, connected.size(),
					connected.size() + failed.size());
	}

	@Override
	public void backendInitialized(String sessionId, String backendId, Duration latency, Throwable error) {
		LoggingEventBuilder event = error == null ? logger.atInfo() : logger.atWarn();
		event.addKeyValue("event", "backend_initialized")
			.addKeyValue("session_id", sessionId)
			.addKeyValue("backend_id", backendId)
			.addKeyValue("latency_ms", latency.toMillis())
			.addKeyValue("success", error == null);
		if (error != null) {
			event.addKeyValue("error", error.getMessage())
				.log("Backend {} failed to initialize for session {}", backendId, sessionId);
		}
		else {
			event.log("Backend {} initialized for session {}", backendId, sessionId);
		}
	}

	@Override
	public void backendReinitialized(String sessionId, String backendId, String reason, Throwable error) {
		LoggingEventBuilder event = error == null ? logger.atInfo() : logger.atWarn();
		event.addKeyValue("event", "backend_reinitialized")
			.addKeyValue("session_id", sessionId)
			.addKeyValue("backend_id", backendId)
			.addKeyValue("reason", reason)
			.addKeyValue("success", error == null);
		if (error != null) {
			event.addKeyValue("error", error.getMessage());
		}
		event.log("Backend {} re-initialized for session {} ({})", backendId, sessionId, reason);
	}

	@Override
	public void operationCompleted(String sessionId, String backendId, OperationKind kind, String operation,
			Duration latency, Throwable error) {
		if (!logger.isDebugEnabled()) {
			return;
		}
		logger.atDebug()
			.addKeyValue("event", "operation_completed")
			.addKeyValue("session_id", sessionId)
			.addKeyValue("backend_id", backendId)
			.addKeyValue("kind", kind.label())
			.addKeyValue("operation", operation)
			.addKeyValue("latency_ms", latency.toMillis())
			.addKeyValue("success", error == null)
			.log("{} {} on backend {} took {}ms", kind.label(), operation, backendId, latency.toMillis());
	}

	@Override
	public void sessionClosed(String sessionId, Throwable error) {
		LoggingEventBuilder event = error == null ? logger.atInfo() : logger.atWarn();
		event.addKeyValue("event", "session_closed").addKeyValue("session_id", sessionId);
		if (error != null) {
			event.addKeyValue("error", error.getMessage());
		}
		event.log("Session {} closed", sessionId);
	}

	@Override
	public void sessionRejected(int activeSessions) {
		logger.atWarn()
			.addKeyValue("event", "session_rejected")
			.addKeyValue("active_sessions", activeSessions)
			.log("Session rejected, {} sessions active", activeSessions);
	}

}
