/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.auth;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.gitmcp.config.McpServerProperties;
import io.gitmcp.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * OAuth 2.0 Protected Resource Metadata, served from
 * {@code /.well-known/oauth-protected-resource}.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc9728">RFC 9728</a>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProtectedResourceMetadata( // @formatter:off
	@JsonProperty("resource") String resource,
	@JsonProperty("authorization_servers") List<String> authorizationServers,
	@JsonProperty("bearer_methods_supported") List<String> bearerMethodsSupported,
	@JsonProperty("resource_signing_alg_values_supported") List<String> resourceSigningAlgValuesSupported) { // @formatter:on

	/**
	 * Metadata for the configured issuer.
	 * @param properties server properties
	 * @param defaultResource resource identifier used when none is configured
	 * @return the metadata, or null when no issuer is configured
	 */
	@Nullable
	public static ProtectedResourceMetadata from(McpServerProperties properties, String defaultResource) {
		if (!Utils.hasText(properties.oauthIssuerUrl())) {
			return null;
		}
		String resource = Utils.hasText(properties.resourceIdentifier()) ? properties.resourceIdentifier()
				: defaultResource;
		return new ProtectedResourceMetadata(resource, List.of(properties.oauthIssuerUrl()), List.of("header"),
				List.of("RS256", "ES256", "PS256"));
	}

}
