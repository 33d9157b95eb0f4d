/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.transport;

import com.fasterxml.jackson.databind.JsonNode;
import io.gitmcp.spec.McpSchema;
import io.gitmcp.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * Classification of a POST to the MCP endpoint, decided before any routing.
 */
public sealed interface InboundRequest
		permits InboundRequest.Initialize, InboundRequest.Sessioned, InboundRequest.Anonymous {

	/**
	 * Classifies a request. A session id wins over the body: an initialize request sent
	 * on an existing session goes to that session.
	 * @param sessionId the {@code Mcp-Session-Id} header, may be null
	 * @param body the parsed body
	 * @return the classification
	 */
	static InboundRequest classify(@Nullable String sessionId, JsonNode body) {
		if (Utils.hasText(sessionId)) {
			return new Sessioned(sessionId.trim());
		}
		if (McpSchema.isInitializeRequest(body)) {
			return new Initialize();
		}
		return new Anonymous();
	}

	/** Initialize request without a session id. */
	record Initialize() implements InboundRequest {
	}

	/**
	 * Request carrying a session id.
	 *
	 * @param sessionId the session id
	 */
	record Sessioned(String sessionId) implements InboundRequest {
	}

	/** Non-initialize request without a session id. */
	record Anonymous() implements InboundRequest {
	}

}
