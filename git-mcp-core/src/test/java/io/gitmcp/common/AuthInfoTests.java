/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.common;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import io.gitmcp.spec.McpError;
import io.gitmcp.spec.McpSchema;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthInfoTests {

	@Test
	void scopesDefaultToEmptyAndAreCopied() {
		Set<String> scopes = new HashSet<>(Set.of("repo:read"));
		AuthInfo authInfo = new AuthInfo("alice", null, null, scopes, null);
		scopes.add("repo:write");

		assertThat(new AuthInfo(null, null, null, null, null).scopes()).isEmpty();
		assertThat(authInfo.scopes()).containsExactly("repo:read");
		assertThat(authInfo.hasScope("repo:read")).isTrue();
		assertThat(authInfo.hasScope("repo:write")).isFalse();
	}

	@Test
	void requireScopesNamesTheMissingOnes() {
		AuthInfo authInfo = new AuthInfo("alice", null, null, Set.of("repo:read"), null);

		assertThatCode(() -> authInfo.requireScopes(List.of("repo:read"))).doesNotThrowAnyException();
		assertThatThrownBy(() -> authInfo.requireScopes(List.of("repo:write", "repo:read", "admin")))
			.isInstanceOfSatisfying(McpError.class, e -> {
				assertThat(e.getJsonRpcError().code()).isEqualTo(McpSchema.ErrorCodes.SERVER_ERROR);
				assertThat(e.getJsonRpcError().data()).isEqualTo(List.of("admin", "repo:write"));
			});
	}

	@Test
	void expiryIsComparedInEpochSeconds() {
		AuthInfo expiring = new AuthInfo(null, null, null, null, 1_000L);

		assertThat(expiring.isExpired(999)).isFalse();
		assertThat(expiring.isExpired(1_000)).isFalse();
		assertThat(expiring.isExpired(1_001)).isTrue();
		assertThat(new AuthInfo(null, null, null, null, null).isExpired(Long.MAX_VALUE)).isFalse();
	}

}
