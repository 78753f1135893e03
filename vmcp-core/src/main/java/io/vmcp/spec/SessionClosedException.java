/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.spec;

/**
 * A call reached a session after it started closing.
 */
public class SessionClosedException extends VmcpException {

	private static final long serialVersionUID = 1L;

	public SessionClosedException(String sessionId) {
		super(ErrorCategory.SESSION_CLOSED, "Session " + sessionId + " is closed");
	}

}
