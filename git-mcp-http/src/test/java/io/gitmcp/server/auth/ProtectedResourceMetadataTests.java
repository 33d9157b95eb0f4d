/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gitmcp.config.McpServerProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProtectedResourceMetadataTests {

	@Test
	void absentWithoutIssuer() {
		assertThat(ProtectedResourceMetadata.from(McpServerProperties.builder().build(), "http://localhost/mcp"))
			.isNull();
	}

	@Test
	void configuredResourceIdentifierWins() {
		McpServerProperties properties = McpServerProperties.builder()
			.oauthIssuerUrl("https://auth.example.com")
			.resourceIdentifier("https://git.example.com/mcp")
			.build();

		ProtectedResourceMetadata metadata = ProtectedResourceMetadata.from(properties, "http://localhost/mcp");

		assertThat(metadata.resource()).isEqualTo("https://git.example.com/mcp");
		assertThat(metadata.authorizationServers()).containsExactly("https://auth.example.com");
	}

	@Test
	void serializesWithSnakeCaseNames() {
		McpServerProperties properties = McpServerProperties.builder().oauthIssuerUrl("https://auth.example.com").build();

		JsonNode json = new ObjectMapper()
			.valueToTree(ProtectedResourceMetadata.from(properties, "http://localhost:3015/mcp"));

		assertThat(json.path("resource").asText()).isEqualTo("http://localhost:3015/mcp");
		assertThat(json.has("authorization_servers")).isTrue();
		assertThat(json.has("bearer_methods_supported")).isTrue();
		assertThat(json.has("resource_signing_alg_values_supported")).isTrue();
	}

}
