/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.auth;

import java.util.concurrent.CompletableFuture;
import java.util.function.LongSupplier;

import io.gitmcp.common.AuthInfo;
import io.gitmcp.util.Assert;

/**
 * Authenticator for {@code Authorization: Bearer} headers.
 */
public class BearerAuthenticator {

	private static final String BEARER_PREFIX = "Bearer ";

	private final TokenVerifier tokenVerifier;

	private final LongSupplier epochSeconds;

	public BearerAuthenticator(TokenVerifier tokenVerifier) {
		this(tokenVerifier, () -> System.currentTimeMillis() / 1000);
	}

	public BearerAuthenticator(TokenVerifier tokenVerifier, LongSupplier epochSeconds) {
		Assert.notNull(tokenVerifier, "tokenVerifier must not be null");
		Assert.notNull(epochSeconds, "epochSeconds must not be null");
		this.tokenVerifier = tokenVerifier;
		this.epochSeconds = epochSeconds;
	}

	/**
	 * Authenticate a request using a bearer token.
	 * @param authHeader The Authorization header value
	 * @return A CompletableFuture that resolves to the authenticated identity
	 */
	public CompletableFuture<AuthInfo> authenticate(String authHeader) {
		if (authHeader == null || !authHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
			return CompletableFuture
				.failedFuture(new AuthenticationException("Missing or invalid Authorization header"));
		}

		String token = authHeader.substring(BEARER_PREFIX.length()).trim();
		if (token.isEmpty()) {
			return CompletableFuture.failedFuture(new AuthenticationException("Empty bearer token"));
		}

		return this.tokenVerifier.verify(token).thenCompose(authInfo -> {
			if (authInfo == null) {
				return CompletableFuture.failedFuture(new AuthenticationException("Invalid access token"));
			}
			if (authInfo.isExpired(this.epochSeconds.getAsLong())) {
				return CompletableFuture.failedFuture(new AuthenticationException("Access token has expired"));
			}
			return CompletableFuture.completedFuture(authInfo);
		});
	}

	/**
	 * Exception thrown when bearer authentication fails.
	 */
	public static class AuthenticationException extends Exception {

		private static final long serialVersionUID = 1L;

		public AuthenticationException(String message) {
			super(message);
		}

	}

}
