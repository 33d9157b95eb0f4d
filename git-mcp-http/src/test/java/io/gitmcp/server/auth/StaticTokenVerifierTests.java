/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.auth;

import java.util.List;

import io.gitmcp.common.AuthInfo;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

class StaticTokenVerifierTests {

	@Test
	void entriesAreParsed() {
		StaticTokenVerifier verifier = StaticTokenVerifier
			.fromEntries(List.of("t1|client-a|tenant-a|repo:read repo:write", "t2", "t3||tenant-c"));

		assertThat(verifier.size()).isEqualTo(3);

		AuthInfo full = verifier.verify("t1").join();
		assertThat(full.subject()).isEqualTo("client-a");
		assertThat(full.clientId()).isEqualTo("client-a");
		assertThat(full.tenantId()).isEqualTo("tenant-a");
		assertThat(full.scopes()).containsExactlyInAnyOrder("repo:read", "repo:write");
		assertThat(full.expiresAt()).isNull();

		AuthInfo bare = verifier.verify("t2").join();
		assertThat(bare.subject()).isEqualTo("anonymous");
		assertThat(bare.clientId()).isNull();
		assertThat(bare.scopes()).isEmpty();

		assertThat(verifier.verify("t3").join().tenantId()).isEqualTo("tenant-c");
	}

	@Test
	void unknownTokenResolvesToNull() {
		assertThat(StaticTokenVerifier.fromEntries(List.of("t1")).verify("t2").join()).isNull();
	}

	@Test
	void entryWithoutTokenIsRejected() {
		assertThatIllegalArgumentException().isThrownBy(() -> StaticTokenVerifier.fromEntries(List.of("|client")));
	}

}
