/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.transport;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gitmcp.common.AuthInfo;
import io.gitmcp.common.RequestContext;
import io.gitmcp.config.McpServerProperties;
import io.gitmcp.config.SessionMode;
import io.gitmcp.server.auth.BearerAuthenticator;
import io.gitmcp.server.auth.ProtectedResourceMetadata;
import io.gitmcp.spec.HttpHeaders;
import io.gitmcp.spec.McpError;
import io.gitmcp.spec.McpSchema;
import io.gitmcp.spec.McpSessionNotFoundException;
import io.gitmcp.spec.ProtocolVersionUnsupportedException;
import io.gitmcp.spec.ProtocolVersions;
import io.gitmcp.util.Assert;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Servlet entrypoint of the MCP Streamable HTTP transport.
 * <p>
 * Every request passes origin validation and gets CORS headers. Requests to the MCP
 * endpoint then go through protocol-version negotiation, bearer authentication when
 * configured, session resolution and dispatch to the stateful or stateless
 * {@link TransportManager}. The resulting {@link TransportResponse} is written either as
 * a JSON body or piped chunk by chunk when it carries a stream. Every failure ends in
 * the {@link HttpErrorHandler}.
 * <p>
 * Also serves {@code GET /healthz}, a status document on {@code GET} of the MCP
 * endpoint and the OAuth protected resource metadata.
 */
@WebServlet(asyncSupported = true)
public class McpHttpServlet extends HttpServlet {

	private static final long serialVersionUID = 1L;

	private static final Logger logger = LoggerFactory.getLogger(McpHttpServlet.class);

	public static final String HEALTH_PATH = "/healthz";

	public static final String PROTECTED_RESOURCE_METADATA_PATH = "/.well-known/oauth-protected-resource";

	private final transient ObjectMapper objectMapper;

	private final transient McpServerProperties properties;

	@Nullable
	private final transient StatefulTransportManager statefulTransportManager;

	@Nullable
	private final transient StatelessTransportManager statelessTransportManager;

	@Nullable
	private final transient BearerAuthenticator authenticator;

	private final transient OriginValidator originValidator;

	private final transient CorsPolicy corsPolicy;

	private final transient HttpErrorHandler errorHandler;

	private McpHttpServlet(Builder builder) {
		this.objectMapper = builder.objectMapper;
		this.properties = builder.properties;
		this.statefulTransportManager = builder.statefulTransportManager;
		this.statelessTransportManager = builder.statelessTransportManager;
		this.authenticator = builder.authenticator;
		this.originValidator = new OriginValidator(this.properties.allowedOrigins());
		this.corsPolicy = new CorsPolicy(this.originValidator);
		this.errorHandler = new HttpErrorHandler(this.objectMapper);
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	protected void service(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		String origin = request.getHeader(HttpHeaders.ORIGIN);
		if (!this.originValidator.isAllowed(origin)) {
			logger.warn("Rejected request from disallowed origin {}", origin);
			this.errorHandler.writeError(response, HttpServletResponse.SC_FORBIDDEN, McpSchema.ErrorCodes.SERVER_ERROR,
					"Forbidden: origin not allowed", null, null);
			return;
		}
		this.corsPolicy.apply(origin, response);
		super.service(request, response);
	}

	@Override
	protected void doOptions(HttpServletRequest request, HttpServletResponse response) {
		response.setStatus(HttpServletResponse.SC_NO_CONTENT);
	}

	@Override
	protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
		String path = path(request);
		if (HEALTH_PATH.equals(path)) {
			writeJson(response, HttpServletResponse.SC_OK, Map.of("status", "ok"));
		}
		else if (PROTECTED_RESOURCE_METADATA_PATH.equals(path)) {
			ProtectedResourceMetadata metadata = ProtectedResourceMetadata.from(this.properties,
					request.getRequestURL().toString().replace(path, this.properties.endpointPath()));
			if (metadata == null) {
				writeJson(response, HttpServletResponse.SC_NOT_FOUND,
						Map.of("error", "OAuth not configured on this server"));
			}
			else {
				writeJson(response, HttpServletResponse.SC_OK, metadata);
			}
		}
		else if (this.properties.endpointPath().equals(path)) {
			writeJson(response, HttpServletResponse.SC_OK, status());
		}
		else {
			notFound(response);
		}
	}

	@Override
	protected void doPost(HttpServletRequest request, HttpServletResponse response) throws IOException {
		if (!this.properties.endpointPath().equals(path(request))) {
			notFound(response);
			return;
		}
		JsonNode body = null;
		try {
			RequestContext context = createContext(request, "mcp.post");
			body = this.objectMapper.readTree(request.getInputStream());
			TransportHeaders headers = headers(request);
			String sessionId = headers.get(HttpHeaders.MCP_SESSION_ID);
			InboundRequest inbound = InboundRequest.classify(sessionId, body);
			logger.debug("Dispatching {} in {} mode (requestId={})", inbound, this.properties.sessionMode().value(),
					context.requestId());
			writeResponse(await(route(inbound, headers, body, context)), response);
		}
		catch (Exception e) {
			this.errorHandler.handle(e, body, response);
		}
	}

	@Override
	protected void doDelete(HttpServletRequest request, HttpServletResponse response) throws IOException {
		if (!this.properties.endpointPath().equals(path(request))) {
			notFound(response);
			return;
		}
		try {
			RequestContext context = createContext(request, "mcp.delete");
			if (this.properties.sessionMode() == SessionMode.STATELESS) {
				Map<String, Object> body = new LinkedHashMap<>();
				body.put("status", "stateless_mode");
				body.put("message", "No sessions to delete");
				writeJson(response, HttpServletResponse.SC_OK, body);
				return;
			}
			String sessionId = request.getHeader(HttpHeaders.MCP_SESSION_ID);
			writeResponse(await(statefulManager().handleDeleteRequest(sessionId, context)), response);
		}
		catch (Exception e) {
			this.errorHandler.handle(e, null, response);
		}
	}

	private Mono<TransportResponse> route(InboundRequest inbound, TransportHeaders headers, JsonNode body,
			RequestContext context) {
		if (this.properties.sessionMode() == SessionMode.STATELESS) {
			return statelessManager().handleRequest(headers, body, context);
		}
		if (inbound instanceof InboundRequest.Sessioned sessioned) {
			String sessionId = sessioned.sessionId();
			if (!statefulManager().getSessionManager().isSessionValid(sessionId)) {
				throw new McpSessionNotFoundException(sessionId);
			}
			return statefulManager().handleRequest(headers, body, context.withSessionId(sessionId), sessionId);
		}
		if (inbound instanceof InboundRequest.Initialize) {
			return statefulManager().initializeAndHandle(headers, body, context);
		}
		if (this.properties.sessionMode() == SessionMode.STATEFUL) {
			throw new McpError(McpSchema.ErrorCodes.INVALID_REQUEST, StatefulTransportManager.SESSION_ID_REQUIRED_MESSAGE);
		}
		return statelessManager().handleRequest(headers, body, context);
	}

	private RequestContext createContext(HttpServletRequest request, String operation) {
		String protocolVersion = request.getHeader(HttpHeaders.MCP_PROTOCOL_VERSION);
		if (protocolVersion == null || protocolVersion.isBlank()) {
			protocolVersion = ProtocolVersions.DEFAULT_NEGOTIATED;
		}
		else if (!ProtocolVersions.isSupported(protocolVersion.trim())) {
			throw new ProtocolVersionUnsupportedException(protocolVersion.trim());
		}
		RequestContext context = RequestContext.create(operation)
			.withProtocolVersion(protocolVersion.trim())
			.with("remoteAddress", String.valueOf(request.getRemoteAddr()));
		if (this.authenticator != null) {
			AuthInfo authInfo = this.authenticator.authenticate(request.getHeader(HttpHeaders.AUTHORIZATION)).join();
			context = context.withAuthInfo(authInfo);
		}
		return context;
	}

	private void writeResponse(TransportResponse transportResponse, HttpServletResponse response)
			throws IOException {
		response.setStatus(transportResponse.statusCode());
		transportResponse.headers().forEach(response::setHeader);
		if (transportResponse.sessionId() != null) {
			response.setHeader(HttpHeaders.MCP_SESSION_ID, transportResponse.sessionId());
		}
		if (transportResponse.isStream()) {
			if (transportResponse.statusCode() == HttpServletResponse.SC_NO_CONTENT) {
				return;
			}
			response.setCharacterEncoding("UTF-8");
			response.setHeader("Cache-Control", "no-cache");
			ServletOutputStream out = response.getOutputStream();
			response.flushBuffer();
			for (byte[] chunk : transportResponse.stream().toIterable()) {
				out.write(chunk);
				out.flush();
			}
			return;
		}
		writeJson(response, transportResponse.statusCode(), transportResponse.body());
	}

	private void writeJson(HttpServletResponse response, int status, Object body) throws IOException {
		response.setStatus(status);
		response.setContentType(AbstractTransportManager.APPLICATION_JSON);
		response.setCharacterEncoding("UTF-8");
		JsonNode node = this.objectMapper.valueToTree(body);
		if (!node.isContainerNode()) {
			// never hand a bare scalar to JSON-RPC clients
			node = this.objectMapper.valueToTree(Collections.singletonMap("result", body));
		}
		this.objectMapper.writeValue(response.getOutputStream(), node);
	}

	private void notFound(HttpServletResponse response) throws IOException {
		this.errorHandler.writeError(response, HttpServletResponse.SC_NOT_FOUND,
				McpSchema.ErrorCodes.RESOURCE_NOT_FOUND, "Not found", null, null);
	}

	private Map<String, Object> status() {
		Map<String, Object> server = new LinkedHashMap<>();
		server.put("name", this.properties.serverName());
		server.put("version", this.properties.serverVersion());
		server.put("transport", this.properties.transportType().value());
		server.put("sessionMode", this.properties.sessionMode().value());
		server.put("activeSessions", this.statefulTransportManager != null
				? this.statefulTransportManager.getSessionManager().getActiveSessionCount() : 0);
		Map<String, Object> status = new LinkedHashMap<>();
		status.put("status", "ok");
		status.put("server", server);
		return status;
	}

	private StatefulTransportManager statefulManager() {
		if (this.statefulTransportManager == null) {
			throw new IllegalStateException("No stateful transport manager configured");
		}
		return this.statefulTransportManager;
	}

	private StatelessTransportManager statelessManager() {
		if (this.statelessTransportManager == null) {
			throw new IllegalStateException("No stateless transport manager configured");
		}
		return this.statelessTransportManager;
	}

	private static TransportResponse await(Mono<TransportResponse> response) {
		TransportResponse result = response.block();
		if (result == null) {
			throw new IllegalStateException("Transport manager produced no response");
		}
		return result;
	}

	private static TransportHeaders headers(HttpServletRequest request) {
		Map<String, String> headers = new LinkedHashMap<>();
		for (String name : Collections.list(request.getHeaderNames())) {
			headers.put(name, request.getHeader(name));
		}
		return TransportHeaders.of(headers);
	}

	private static String path(HttpServletRequest request) {
		return request.getRequestURI().substring(request.getContextPath().length());
	}

	@Override
	public void destroy() {
		logger.info("MCP servlet destroyed");
		super.destroy();
	}

	/**
	 * Builder for {@link McpHttpServlet}. Stateful and auto modes need a
	 * {@link StatefulTransportManager}, stateless and auto modes a
	 * {@link StatelessTransportManager}.
	 */
	public static class Builder {

		private ObjectMapper objectMapper;

		private McpServerProperties properties;

		private StatefulTransportManager statefulTransportManager;

		private StatelessTransportManager statelessTransportManager;

		private BearerAuthenticator authenticator;

		private Builder() {
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder properties(McpServerProperties properties) {
			Assert.notNull(properties, "properties must not be null");
			this.properties = properties;
			return this;
		}

		public Builder statefulTransportManager(StatefulTransportManager statefulTransportManager) {
			this.statefulTransportManager = statefulTransportManager;
			return this;
		}

		public Builder statelessTransportManager(StatelessTransportManager statelessTransportManager) {
			this.statelessTransportManager = statelessTransportManager;
			return this;
		}

		/**
		 * Enables bearer authentication on the MCP endpoint.
		 * @param authenticator the authenticator, null disables authentication
		 * @return this builder
		 */
		public Builder authenticator(@Nullable BearerAuthenticator authenticator) {
			this.authenticator = authenticator;
			return this;
		}

		public McpHttpServlet build() {
			Assert.notNull(this.objectMapper, "objectMapper must be set");
			Assert.notNull(this.properties, "properties must be set");
			SessionMode mode = this.properties.sessionMode();
			if (mode != SessionMode.STATELESS) {
				Assert.notNull(this.statefulTransportManager, mode.value() + " mode needs a stateful transport manager");
			}
			if (mode != SessionMode.STATEFUL) {
				Assert.notNull(this.statelessTransportManager,
						mode.value() + " mode needs a stateless transport manager");
			}
			return new McpHttpServlet(this);
		}

	}

}
