/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.spec;

/**
 * Base class of every failure raised by the session core. The {@link ErrorCategory}
 * decides how the failure is reported to the client.
 */
public class VmcpException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final ErrorCategory category;

	public VmcpException(ErrorCategory category, String message) {
		super(message);
		this.category = category;
	}

	public VmcpException(ErrorCategory category, String message, Throwable cause) {
		super(message, cause);
		this.category = category;
	}

	public ErrorCategory category() {
		return this.category;
	}

	public int code() {
		return this.category.code();
	}

}
