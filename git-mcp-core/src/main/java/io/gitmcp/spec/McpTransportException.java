/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.spec;

/**
 * Base class for failures raised by the transport layer.
 */
public class McpTransportException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public McpTransportException(String message) {
		super(message);
	}

	public McpTransportException(String message, Throwable cause) {
		super(message, cause);
	}

}
