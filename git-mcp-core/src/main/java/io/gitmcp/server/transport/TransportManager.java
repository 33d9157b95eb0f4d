/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.transport;

import com.fasterxml.jackson.databind.JsonNode;
import io.gitmcp.common.RequestContext;
import reactor.core.publisher.Mono;

/**
 * Turns the parsed body of one MCP request into a {@link TransportResponse}.
 * <p>
 * Expected outcomes, including unknown sessions, are returned as responses. Only
 * unexpected failures are signalled as errors.
 */
public interface TransportManager {

	/**
	 * Handle a request.
	 * @param headers request headers
	 * @param body the parsed JSON body, a single message or a batch
	 * @param context the request context
	 * @return the response
	 */
	Mono<TransportResponse> handleRequest(TransportHeaders headers, JsonNode body, RequestContext context);

	/**
	 * Release every resource held by this manager.
	 * @return a Mono completing once everything was released
	 */
	Mono<Void> shutdown();

}
