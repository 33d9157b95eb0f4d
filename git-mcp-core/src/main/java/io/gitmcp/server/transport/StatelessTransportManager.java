/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.transport;

import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gitmcp.common.RequestContext;
import io.gitmcp.server.McpProtocolHandler;
import io.gitmcp.spec.HttpHeaders;
import io.gitmcp.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Serves every request with a brand-new protocol handler that is disposed once the
 * request completed, failed or was cancelled. No session is registered or required; a
 * session id supplied by the client is echoed back but never used for routing.
 */
public class StatelessTransportManager extends AbstractTransportManager {

	private static final Logger logger = LoggerFactory.getLogger(StatelessTransportManager.class);

	private final AtomicLong handledRequests = new AtomicLong();

	public StatelessTransportManager(ObjectMapper objectMapper, McpProtocolHandler.Factory handlerFactory) {
		super(objectMapper, handlerFactory);
	}

	@Override
	public Mono<TransportResponse> handleRequest(TransportHeaders headers, JsonNode body, RequestContext context) {
		ParsedBody parsed;
		try {
			parsed = parse(body);
		}
		catch (InvalidBodyException e) {
			return Mono.just(errorResponse(400, McpSchema.ErrorCodes.INVALID_REQUEST, e.getMessage()));
		}
		String clientSessionId = headers.get(HttpHeaders.MCP_SESSION_ID);
		return Mono
			.usingWhen(Mono.fromSupplier(this.handlerFactory::create),
					handler -> dispatch(handler, parsed, headers, context), this::dispose)
			.doOnSubscribe(s -> logger.debug("Handling stateless request (requestId={})", context.requestId()))
			.doOnSuccess(r -> this.handledRequests.incrementAndGet())
			.map(response -> response.withSessionId(clientSessionId))
			.onErrorResume(e -> {
				logger.error("Stateless request failed (requestId={})", context.requestId(), e);
				return Mono.just(errorResponse(500, McpSchema.ErrorCodes.INTERNAL_ERROR, "Internal error"));
			});
	}

	/**
	 * Number of requests completed so far.
	 * @return the count
	 */
	public long getHandledRequestCount() {
		return this.handledRequests.get();
	}

	@Override
	public Mono<Void> shutdown() {
		// handlers never outlive their request
		return Mono.empty();
	}

	private Mono<Void> dispose(McpProtocolHandler handler) {
		return handler.closeGracefully().onErrorResume(e -> {
			logger.warn("Failed to dispose stateless protocol handler", e);
			return Mono.empty();
		});
	}

}
