/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.util;

import java.util.Arrays;
import java.util.List;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Splits a comma separated list, trimming entries and dropping blank ones.
	 * @param value the raw value (may be {@code null})
	 * @return the entries, never {@code null}
	 */
	public static List<String> commaSeparated(@Nullable String value) {
		if (!hasText(value)) {
			return List.of();
		}
		return Arrays.stream(value.split(",")).map(String::trim).filter(Utils::hasText).toList();
	}

}
