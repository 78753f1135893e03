/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.spec;

/**
 * The client asked for a tool, resource or prompt that is not in the session's routing
 * table. The session stays usable.
 */
public class OperationNotFoundException extends VmcpException {

	private static final long serialVersionUID = 1L;

	private final String operation;

	public OperationNotFoundException(String kind, String operation) {
		super(ErrorCategory.OPERATION_NOT_FOUND, "Unknown " + kind + ": " + operation);
		this.operation = operation;
	}

	public String operation() {
		return this.operation;
	}

}
