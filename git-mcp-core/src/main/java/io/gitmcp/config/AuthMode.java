/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.config;

import java.util.Locale;

public enum AuthMode {

	NONE, BEARER;

	public String value() {
		return name().toLowerCase(Locale.ROOT);
	}

	public static AuthMode fromValue(String value) {
		for (AuthMode mode : values()) {
			if (mode.value().equalsIgnoreCase(value.trim())) {
				return mode;
			}
		}
		throw new IllegalArgumentException("Unknown auth mode: " + value);
	}

}
