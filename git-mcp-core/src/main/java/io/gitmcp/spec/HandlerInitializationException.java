/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.spec;

/**
 * The protocol handler of a new session failed before the session could be registered.
 * Nothing of the attempted session remains when this is thrown.
 */
public class HandlerInitializationException extends McpTransportException {

	private static final long serialVersionUID = 1L;

	public HandlerInitializationException(String message, Throwable cause) {
		super(message, cause);
	}

}
