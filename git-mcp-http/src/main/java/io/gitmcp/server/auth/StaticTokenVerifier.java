/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.auth;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import io.gitmcp.common.AuthInfo;
import io.gitmcp.util.Assert;
import io.gitmcp.util.Utils;

/**
 * {@link TokenVerifier} over a fixed set of tokens. Entries have the form
 * {@code token|clientId|tenantId|scope scope}; everything after the token is optional.
 */
public class StaticTokenVerifier implements TokenVerifier {

	private final Map<String, AuthInfo> tokens;

	public StaticTokenVerifier(Map<String, AuthInfo> tokens) {
		Assert.notNull(tokens, "tokens must not be null");
		this.tokens = Collections.unmodifiableMap(new HashMap<>(tokens));
	}

	/**
	 * Parses token entries.
	 * @param entries entries of the form {@code token|clientId|tenantId|scope scope}
	 * @return the verifier
	 * @throws IllegalArgumentException if an entry has no token
	 */
	public static StaticTokenVerifier fromEntries(List<String> entries) {
		Map<String, AuthInfo> tokens = new HashMap<>();
		for (String entry : entries) {
			String[] parts = entry.split("\\|", -1);
			String token = parts[0].trim();
			Assert.hasText(token, "Token entry without token: " + entry);
			String clientId = part(parts, 1);
			String tenantId = part(parts, 2);
			Set<String> scopes = new LinkedHashSet<>();
			String rawScopes = part(parts, 3);
			if (rawScopes != null) {
				Arrays.stream(rawScopes.split("\\s+")).filter(Utils::hasText).forEach(scopes::add);
			}
			String subject = clientId != null ? clientId : "anonymous";
			tokens.put(token, new AuthInfo(subject, clientId, tenantId, scopes, null));
		}
		return new StaticTokenVerifier(tokens);
	}

	@Override
	public CompletableFuture<AuthInfo> verify(String token) {
		return CompletableFuture.completedFuture(this.tokens.get(token));
	}

	public int size() {
		return this.tokens.size();
	}

	private static String part(String[] parts, int index) {
		if (parts.length <= index) {
			return null;
		}
		String value = parts[index].trim();
		return value.isEmpty() ? null : value;
	}

}
