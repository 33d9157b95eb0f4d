/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.transport;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import reactor.util.annotation.Nullable;

/**
 * Validates the {@code Origin} header of incoming requests against an allow-list.
 * <p>
 * Requests without an {@code Origin} header, typically non-browser clients, are always
 * accepted. An empty allow-list accepts every origin. Comparison is case-insensitive.
 * <p>
 * Servers bound to localhost should configure an allow-list: browsers send the
 * {@code Origin} header, and rejecting unknown ones prevents DNS rebinding attacks from
 * reaching the local server.
 *
 * @see <a href="https://en.wikipedia.org/wiki/DNS_rebinding">DNS Rebinding Attack</a>
 */
public class OriginValidator {

	private final Set<String> allowedOrigins;

	public OriginValidator(Collection<String> allowedOrigins) {
		Set<String> origins = new HashSet<>();
		if (allowedOrigins != null) {
			allowedOrigins.stream().map(o -> o.trim().toLowerCase(Locale.ROOT)).forEach(origins::add);
		}
		this.allowedOrigins = Collections.unmodifiableSet(origins);
	}

	/**
	 * Whether any origin is accepted.
	 * @return true when the allow-list is empty or contains {@code *}
	 */
	public boolean isWildcard() {
		return this.allowedOrigins.isEmpty() || this.allowedOrigins.contains("*");
	}

	/**
	 * Validates an {@code Origin} header value.
	 * @param origin the header value, may be null
	 * @return true if the request may proceed
	 */
	public boolean isAllowed(@Nullable String origin) {
		if (origin == null || isWildcard()) {
			return true;
		}
		return this.allowedOrigins.contains(origin.trim().toLowerCase(Locale.ROOT));
	}

}
