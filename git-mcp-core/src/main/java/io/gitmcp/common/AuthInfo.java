/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.common;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import io.gitmcp.spec.McpError;
import io.gitmcp.spec.McpSchema;
import reactor.util.annotation.Nullable;

/**
 * Authentication details established for one request by the authentication layer.
 *
 * @param subject the authenticated principal, may be null
 * @param clientId the OAuth client the token was issued to, may be null
 * @param tenantId the tenant the principal belongs to, may be null
 * @param scopes granted scopes, never null
 * @param expiresAt token expiry in epoch seconds, null if the token does not expire
 */
public record AuthInfo(@Nullable String subject, @Nullable String clientId, @Nullable String tenantId,
		Set<String> scopes, @Nullable Long expiresAt) {

	public AuthInfo {
		scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
	}

	public boolean hasScope(String scope) {
		return scopes.contains(scope);
	}

	/**
	 * Checks that every required scope was granted.
	 * @param required the scopes the caller needs
	 * @throws McpError with {@link McpSchema.ErrorCodes#SERVER_ERROR} naming the missing
	 * scopes
	 */
	public void requireScopes(Collection<String> required) {
		Set<String> missing = new TreeSet<>(required);
		missing.removeAll(scopes);
		if (!missing.isEmpty()) {
			throw new McpError(new McpSchema.JSONRPCResponse.JSONRPCError(McpSchema.ErrorCodes.SERVER_ERROR,
					"Insufficient scope", List.copyOf(missing)));
		}
	}

	public boolean isExpired(long nowEpochSeconds) {
		return expiresAt != null && expiresAt < nowEpochSeconds;
	}

}
