/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.transport;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gitmcp.common.AuthInfo;
import io.gitmcp.common.RequestContext;
import io.gitmcp.server.McpProtocolHandler;
import io.gitmcp.server.session.SessionListener;
import io.gitmcp.server.session.SessionManager;
import io.gitmcp.spec.HandlerInitializationException;
import io.gitmcp.spec.HttpHeaders;
import io.gitmcp.spec.McpSchema;
import io.gitmcp.spec.McpSchema.JSONRPCResponse;
import io.gitmcp.util.Assert;
import io.gitmcp.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Owns one protocol handler per MCP session.
 * <p>
 * A session comes to life when its initialize exchange succeeds: only then is it
 * registered with the {@link SessionManager} and its handler stored. A failed
 * initialize leaves nothing behind. Every path that removes a binding from the handler
 * map also disposes its handler, and only the caller whose removal succeeded does so,
 * so a handler is never disposed twice nor left reachable after disposal. Sessions
 * expired by the {@link SessionManager} are released through the
 * {@link SessionListener} callback.
 */
public class StatefulTransportManager extends AbstractTransportManager implements SessionListener {

	private static final Logger logger = LoggerFactory.getLogger(StatefulTransportManager.class);

	public static final String SESSION_EXPIRED_MESSAGE = "Session expired or invalid. Please reinitialize.";

	public static final String SESSION_ID_REQUIRED_MESSAGE = "Mcp-Session-Id header is required";

	private final SessionManager sessionManager;

	private final ConcurrentHashMap<String, SessionBinding> bindings = new ConcurrentHashMap<>();

	private final Supplier<String> sessionIdGenerator;

	public StatefulTransportManager(ObjectMapper objectMapper, McpProtocolHandler.Factory handlerFactory,
			SessionManager sessionManager) {
		this(objectMapper, handlerFactory, sessionManager, () -> UUID.randomUUID().toString());
	}

	public StatefulTransportManager(ObjectMapper objectMapper, McpProtocolHandler.Factory handlerFactory,
			SessionManager sessionManager, Supplier<String> sessionIdGenerator) {
		super(objectMapper, handlerFactory);
		Assert.notNull(sessionManager, "sessionManager must not be null");
		Assert.notNull(sessionIdGenerator, "sessionIdGenerator must not be null");
		this.sessionManager = sessionManager;
		this.sessionIdGenerator = sessionIdGenerator;
		this.sessionManager.addSessionListener(this);
	}

	public SessionManager getSessionManager() {
		return this.sessionManager;
	}

	/**
	 * Creates a session from an initialize request. On success the response carries
	 * the new session id. When the handler answers with a JSON-RPC error the handler is
	 * disposed and a 400 with that error is returned; when the handler fails the
	 * handler is disposed and a {@link HandlerInitializationException} is signalled.
	 * @param headers request headers
	 * @param body body carrying exactly one initialize request
	 * @param context the request context
	 * @return the response
	 */
	public Mono<TransportResponse> initializeAndHandle(TransportHeaders headers, JsonNode body,
			RequestContext context) {
		ParsedBody parsed;
		try {
			parsed = parse(body);
		}
		catch (InvalidBodyException e) {
			return Mono.just(errorResponse(400, McpSchema.ErrorCodes.INVALID_REQUEST, e.getMessage()));
		}
		McpSchema.JSONRPCRequest initializeRequest = parsed.initializeRequest();
		if (initializeRequest == null) {
			return Mono.just(errorResponse(400, McpSchema.ErrorCodes.INVALID_REQUEST, "Expected an initialize request"));
		}

		return Mono.defer(() -> {
			String sessionId = this.sessionIdGenerator.get();
			SessionBinding binding = new SessionBinding(sessionId, this.handlerFactory.create());
			RequestContext sessionContext = context.withSessionId(sessionId).withOperation(McpSchema.METHOD_INITIALIZE);
			logger.debug("Initializing session {} (requestId={})", sessionId, context.requestId());

			return binding.handler()
				.handleRequest(sessionContext, initializeRequest)
				.switchIfEmpty(Mono.error(() -> new IllegalStateException("No response to initialize request")))
				.onErrorResume(e -> binding.close()
					.then(Mono.<JSONRPCResponse>error(
							new HandlerInitializationException("Failed to initialize session " + sessionId, e))))
				.flatMap(response -> {
					if (response.error() != null) {
						logger.warn("Initialize rejected by protocol handler: {}", response.error().message());
						return binding.close()
							.thenReturn(TransportResponse.body(400, response)
								.withHeader(HttpHeaders.CONTENT_TYPE, APPLICATION_JSON));
					}
					register(binding, context.authInfo().orElse(null));
					return Mono.just(encode(List.of(response), parsed.batch(), headers).withSessionId(sessionId));
				});
		});
	}

	@Override
	public Mono<TransportResponse> handleRequest(TransportHeaders headers, JsonNode body, RequestContext context) {
		return handleRequest(headers, body, context, context.sessionId().orElse(null));
	}

	/**
	 * Serves a request on an existing session. A missing, unknown or expired session
	 * yields a 404 and never creates a session.
	 * @param headers request headers
	 * @param body the parsed JSON body
	 * @param context the request context
	 * @param sessionId the session id sent by the client
	 * @return the response
	 */
	public Mono<TransportResponse> handleRequest(TransportHeaders headers, JsonNode body, RequestContext context,
			@Nullable String sessionId) {
		if (!Utils.hasText(sessionId)) {
			return Mono.just(errorResponse(400, McpSchema.ErrorCodes.INVALID_REQUEST, SESSION_ID_REQUIRED_MESSAGE));
		}
		if (!this.sessionManager.isSessionValid(sessionId)) {
			logger.warn("Request for invalid or expired session {} (requestId={})", sessionId, context.requestId());
			return Mono.just(sessionNotFound());
		}
		SessionBinding binding = this.bindings.get(sessionId);
		if (binding == null || !binding.isActive()) {
			logger.warn("No active protocol handler for session {}", sessionId);
			this.sessionManager.terminateSession(sessionId);
			return Mono.just(sessionNotFound());
		}
		ParsedBody parsed;
		try {
			parsed = parse(body);
		}
		catch (InvalidBodyException e) {
			return Mono.just(errorResponse(400, McpSchema.ErrorCodes.INVALID_REQUEST, e.getMessage()));
		}
		this.sessionManager.touchSession(sessionId);
		return dispatch(binding.handler(), parsed, headers, context.withSessionId(sessionId))
			.map(response -> response.withSessionId(sessionId))
			.onErrorResume(e -> {
				logger.error("Protocol handler failed, closing session {}", sessionId, e);
				return closeSession(sessionId).then(Mono.error(e));
			});
	}

	/**
	 * Terminates a session on client request.
	 * @param sessionId the session id sent by the client
	 * @param context the request context
	 * @return 204 when the session was terminated, 400 without id, 404 when unknown
	 */
	public Mono<TransportResponse> handleDeleteRequest(@Nullable String sessionId, RequestContext context) {
		if (!Utils.hasText(sessionId)) {
			return Mono.just(errorResponse(400, McpSchema.ErrorCodes.INVALID_REQUEST, SESSION_ID_REQUIRED_MESSAGE));
		}
		if (!this.sessionManager.isSessionValid(sessionId)) {
			logger.debug("DELETE for unknown session {} (requestId={})", sessionId, context.requestId());
			return Mono.just(errorResponse(404, McpSchema.ErrorCodes.SESSION_NOT_FOUND, "Session not found"));
		}
		return closeSession(sessionId).then(Mono.fromSupplier(() -> {
			logger.info("Session {} terminated by client", sessionId);
			return TransportResponse.noContent();
		}));
	}

	/**
	 * Current lifecycle state of a session's handler.
	 * @param sessionId the session id
	 * @return the state, {@link SessionState#ABSENT} when no binding exists
	 */
	public SessionState getSessionState(String sessionId) {
		SessionBinding binding = this.bindings.get(sessionId);
		return binding != null ? binding.state() : SessionState.ABSENT;
	}

	public int getActiveSessionCount() {
		return this.bindings.size();
	}

	@Override
	public void onSessionRemoved(String sessionId, RemovalCause cause) {
		SessionBinding binding = this.bindings.remove(sessionId);
		if (binding != null) {
			logger.debug("Session {} removed ({}), disposing its protocol handler", sessionId, cause);
			binding.close().subscribe();
		}
	}

	/**
	 * Closes every session and disposes every handler.
	 */
	@Override
	public Mono<Void> shutdown() {
		return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(this.bindings.keySet())))
			.flatMap(this::closeSession)
			.then()
			.doOnSubscribe(s -> logger.info("Closing {} active sessions", this.bindings.size()));
	}

	private void register(SessionBinding binding, @Nullable AuthInfo authInfo) {
		String sessionId = binding.sessionId();
		this.sessionManager.createSession(sessionId, authInfo != null ? authInfo.clientId() : null,
				authInfo != null ? authInfo.tenantId() : null);
		binding.activate();
		this.bindings.put(sessionId, binding);
		logger.info("Session {} initialized", sessionId);
	}

	private Mono<Void> closeSession(String sessionId) {
		return Mono.defer(() -> {
			SessionBinding binding = this.bindings.remove(sessionId);
			this.sessionManager.terminateSession(sessionId);
			return binding != null ? binding.close() : Mono.empty();
		});
	}

	private static TransportResponse sessionNotFound() {
		return errorResponse(404, McpSchema.ErrorCodes.SESSION_NOT_FOUND, SESSION_EXPIRED_MESSAGE);
	}

}
