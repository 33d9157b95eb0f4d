/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.transport;

import java.nio.charset.StandardCharsets;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gitmcp.common.RequestContext;
import io.gitmcp.server.McpProtocolHandler;
import io.gitmcp.spec.HttpHeaders;
import io.gitmcp.spec.McpSchema;
import io.gitmcp.spec.McpSchema.JSONRPCMessage;
import io.gitmcp.spec.McpSchema.JSONRPCResponse;
import io.gitmcp.spec.McpTransportException;
import io.gitmcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Base class for transport managers. Feeds the messages of one request body through a
 * protocol handler and encodes the results, either as a buffered JSON body or as a
 * Server-Sent Events stream.
 */
public abstract class AbstractTransportManager implements TransportManager {

	private static final Logger logger = LoggerFactory.getLogger(AbstractTransportManager.class);

	public static final String APPLICATION_JSON = "application/json";

	public static final String TEXT_EVENT_STREAM = "text/event-stream";

	public static final String MESSAGE_EVENT_TYPE = "message";

	protected final ObjectMapper objectMapper;

	protected final McpProtocolHandler.Factory handlerFactory;

	protected AbstractTransportManager(ObjectMapper objectMapper, McpProtocolHandler.Factory handlerFactory) {
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(handlerFactory, "handlerFactory must not be null");
		this.objectMapper = objectMapper;
		this.handlerFactory = handlerFactory;
	}

	/**
	 * Parses a request body. An initialize request must be the only message of its body.
	 * @param body the JSON body
	 * @return the parsed body
	 * @throws InvalidBodyException if the body is not a valid JSON-RPC message or batch
	 */
	protected ParsedBody parse(JsonNode body) {
		if (body == null || body.isMissingNode() || body.isNull()) {
			throw new InvalidBodyException("Request body is required");
		}
		List<JSONRPCMessage> messages;
		try {
			messages = McpSchema.parseMessages(this.objectMapper, body);
		}
		catch (Exception e) {
			throw new InvalidBodyException("Invalid JSON-RPC message: " + e.getMessage());
		}
		if (messages.size() > 1 && McpSchema.isInitializeRequest(messages)) {
			throw new InvalidBodyException("Initialize request must not be sent in a batch with other messages");
		}
		return new ParsedBody(messages, body.isArray());
	}

	/**
	 * Feeds every message to the handler, in body order, and encodes the responses.
	 * @param handler the protocol handler
	 * @param body the parsed body
	 * @param headers request headers, used to pick the response encoding
	 * @param context the request context
	 * @return the encoded response
	 */
	protected Mono<TransportResponse> dispatch(McpProtocolHandler handler, ParsedBody body, TransportHeaders headers,
			RequestContext context) {
		return Flux.fromIterable(body.messages())
			.concatMap(message -> handleMessage(handler, message, context))
			.collectList()
			.map(responses -> encode(responses, body.batch(), headers));
	}

	private Mono<JSONRPCResponse> handleMessage(McpProtocolHandler handler, JSONRPCMessage message,
			RequestContext context) {
		if (message instanceof McpSchema.JSONRPCRequest request) {
			return handler.handleRequest(context.withOperation(request.method()), request);
		}
		if (message instanceof McpSchema.JSONRPCNotification notification) {
			return handler.handleNotification(context.withOperation(notification.method()), notification)
				.then(Mono.empty());
		}
		logger.debug("Ignoring client response message (requestId={})", context.requestId());
		return Mono.empty();
	}

	/**
	 * Encodes handler responses. No responses means the body only carried notifications
	 * or responses and yields a 204.
	 * @param responses the responses in request order
	 * @param batch whether the request body was a batch
	 * @param headers request headers
	 * @return the encoded response
	 */
	protected TransportResponse encode(List<JSONRPCResponse> responses, boolean batch, TransportHeaders headers) {
		if (responses.isEmpty()) {
			return TransportResponse.noContent();
		}
		if (headers.prefersEventStream()) {
			Flux<byte[]> events = Flux.fromIterable(responses).map(this::toEvent);
			return TransportResponse.stream(200, events).withHeader(HttpHeaders.CONTENT_TYPE, TEXT_EVENT_STREAM);
		}
		Object body = batch ? responses : responses.get(0);
		return TransportResponse.body(200, body).withHeader(HttpHeaders.CONTENT_TYPE, APPLICATION_JSON);
	}

	private byte[] toEvent(JSONRPCResponse response) {
		try {
			String data = this.objectMapper.writeValueAsString(response);
			return ("event: " + MESSAGE_EVENT_TYPE + "\ndata: " + data + "\n\n").getBytes(StandardCharsets.UTF_8);
		}
		catch (JsonProcessingException e) {
			throw new McpTransportException("Failed to serialize response", e);
		}
	}

	protected static TransportResponse errorResponse(int status, int code, String message) {
		return errorResponse(status, code, message, null);
	}

	protected static TransportResponse errorResponse(int status, int code, String message, @Nullable Object id) {
		return TransportResponse.body(status, McpSchema.JSONRPCErrorResponse.of(code, message, null, id))
			.withHeader(HttpHeaders.CONTENT_TYPE, APPLICATION_JSON);
	}

	/**
	 * The messages of one request body.
	 *
	 * @param messages messages in body order
	 * @param batch whether the body was a JSON array
	 */
	protected record ParsedBody(List<JSONRPCMessage> messages, boolean batch) {

		@Nullable
		McpSchema.JSONRPCRequest initializeRequest() {
			for (JSONRPCMessage message : this.messages) {
				if (message instanceof McpSchema.JSONRPCRequest request
						&& McpSchema.METHOD_INITIALIZE.equals(request.method())) {
					return request;
				}
			}
			return null;
		}

	}

	/**
	 * A request body that is not a valid JSON-RPC message or batch.
	 */
	protected static class InvalidBodyException extends RuntimeException {

		private static final long serialVersionUID = 1L;

		InvalidBodyException(String message) {
			super(message);
		}

	}

}
