/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.auth;

import java.util.concurrent.CompletableFuture;

import io.gitmcp.common.AuthInfo;

/**
 * Resolves bearer tokens to the identity they grant.
 */
@FunctionalInterface
public interface TokenVerifier {

	/**
	 * Verify a token.
	 * @param token the raw bearer token
	 * @return a future resolving to the auth info, or to null if the token is unknown
	 */
	CompletableFuture<AuthInfo> verify(String token);

}
