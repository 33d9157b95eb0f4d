/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.config;

import java.util.Locale;

/**
 * How the HTTP transport maps requests to protocol handlers.
 */
public enum SessionMode {

	/** Every request needs a session created by an initialize request. */
	STATEFUL,

	/** Every request gets a fresh protocol handler. */
	STATELESS,

	/** Sessions when the client uses them, stateless handling for requests without one. */
	AUTO;

	public String value() {
		return name().toLowerCase(Locale.ROOT);
	}

	public static SessionMode fromValue(String value) {
		for (SessionMode mode : values()) {
			if (mode.value().equalsIgnoreCase(value.trim())) {
				return mode;
			}
		}
		throw new IllegalArgumentException("Unknown session mode: " + value);
	}

}
