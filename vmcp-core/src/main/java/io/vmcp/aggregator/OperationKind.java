/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.aggregator;

/**
 * The three families of operations a session routes.
 */
public enum OperationKind {

	TOOL("tool"),

	RESOURCE("resource"),

	PROMPT("prompt");

	private final String label;

	OperationKind(String label) {
		this.label = label;
	}

	public String label() {
		return this.label;
	}

}
