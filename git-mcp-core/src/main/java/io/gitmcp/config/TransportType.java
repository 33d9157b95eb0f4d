/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.config;

import java.util.Locale;

public enum TransportType {

	HTTP, STDIO;

	public String value() {
		return name().toLowerCase(Locale.ROOT);
	}

	public static TransportType fromValue(String value) {
		for (TransportType type : values()) {
			if (type.value().equalsIgnoreCase(value.trim())) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown transport type: " + value);
	}

}
