/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server;

import io.gitmcp.common.RequestContext;
import io.gitmcp.spec.AsyncCloseable;
import io.gitmcp.spec.McpSchema;
import reactor.core.publisher.Mono;

/**
 * One protocol-handler instance: interprets MCP messages and dispatches tool calls. The
 * transports treat it as a black box. A stateful session keeps one instance for its
 * whole life, stateless handling creates one per request.
 */
public interface McpProtocolHandler extends AsyncCloseable {

	/**
	 * Handle the request and produce its response. Protocol-level failures are answered
	 * with a JSON-RPC error response; an error signal means the instance itself failed.
	 * @param context the request context
	 * @param request the request
	 * @return a Mono with the response
	 */
	Mono<McpSchema.JSONRPCResponse> handleRequest(RequestContext context, McpSchema.JSONRPCRequest request);

	/**
	 * Handle a notification.
	 * @param context the request context
	 * @param notification the notification
	 * @return a Mono completing when the notification was processed
	 */
	Mono<Void> handleNotification(RequestContext context, McpSchema.JSONRPCNotification notification);

	/**
	 * Whether {@link #closeGracefully()} was already called.
	 * @return true once closed
	 */
	boolean isClosed();

	/**
	 * Creates protocol-handler instances.
	 */
	@FunctionalInterface
	interface Factory {

		McpProtocolHandler create();

	}

}
