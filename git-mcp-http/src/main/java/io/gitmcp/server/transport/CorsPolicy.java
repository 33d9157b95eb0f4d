/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.transport;

import io.gitmcp.spec.HttpHeaders;
import jakarta.servlet.http.HttpServletResponse;
import reactor.util.annotation.Nullable;

/**
 * Adds the CORS headers of the MCP endpoint to responses.
 */
public class CorsPolicy {

	static final String ALLOWED_METHODS = "GET, POST, DELETE, OPTIONS";

	static final String ALLOWED_HEADERS = String.join(", ", HttpHeaders.CONTENT_TYPE, HttpHeaders.AUTHORIZATION,
			HttpHeaders.MCP_SESSION_ID, HttpHeaders.MCP_PROTOCOL_VERSION, HttpHeaders.LAST_EVENT_ID);

	private final OriginValidator originValidator;

	public CorsPolicy(OriginValidator originValidator) {
		this.originValidator = originValidator;
	}

	/**
	 * Writes the CORS headers for a request with the given origin. Nothing is written
	 * for requests without an origin or with a rejected one. Without an allow-list every
	 * origin gets {@code *} and credentials are not allowed.
	 * @param origin the request's {@code Origin} header, may be null
	 * @param response the response
	 */
	public void apply(@Nullable String origin, HttpServletResponse response) {
		if (origin == null || !this.originValidator.isAllowed(origin)) {
			return;
		}
		if (this.originValidator.isWildcard()) {
			response.setHeader("Access-Control-Allow-Origin", "*");
		}
		else {
			response.setHeader("Access-Control-Allow-Origin", origin);
			response.setHeader("Access-Control-Allow-Credentials", "true");
			response.addHeader("Vary", "Origin");
		}
		response.setHeader("Access-Control-Allow-Methods", ALLOWED_METHODS);
		response.setHeader("Access-Control-Allow-Headers", ALLOWED_HEADERS);
		response.setHeader("Access-Control-Expose-Headers", HttpHeaders.MCP_SESSION_ID);
	}

}
