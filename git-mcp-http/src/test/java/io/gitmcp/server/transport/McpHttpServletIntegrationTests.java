/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.transport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gitmcp.config.AuthMode;
import io.gitmcp.config.McpServerProperties;
import io.gitmcp.config.SessionMode;
import io.gitmcp.server.DefaultMcpProtocolHandler;
import io.gitmcp.server.InMemoryToolsRepository;
import io.gitmcp.server.ToolSpecification;
import io.gitmcp.server.auth.BearerAuthenticator;
import io.gitmcp.server.auth.StaticTokenVerifier;
import io.gitmcp.server.session.SessionManager;
import io.gitmcp.spec.HttpHeaders;
import io.gitmcp.spec.McpSchema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests of {@link McpHttpServlet} running in embedded Tomcat.
 */
class McpHttpServletIntegrationTests {

	private static final String INITIALIZE = """
			{"jsonrpc":"2.0","id":1,"method":"initialize","params":{"protocolVersion":"2025-06-18",\
			"capabilities":{},"clientInfo":{"name":"test-client","version":"1.0.0"}}}""";

	private static final String TOOLS_LIST = """
			{"jsonrpc":"2.0","id":2,"method":"tools/list","params":{}}""";

	private static final String TOOLS_CALL = """
			{"jsonrpc":"2.0","id":3,"method":"tools/call","params":{"name":"tenant","arguments":{}}}""";

	private static final String INITIALIZED_NOTIFICATION = """
			{"jsonrpc":"2.0","method":"notifications/initialized"}""";

	private final ObjectMapper objectMapper = new ObjectMapper();

	private final HttpClient httpClient = HttpClient.newBuilder()
		.version(HttpClient.Version.HTTP_1_1)
		.connectTimeout(Duration.ofSeconds(5))
		.build();

	private SessionManager sessionManager;

	private StatefulTransportManager statefulTransportManager;

	private McpHttpServer server;

	private String baseUrl;

	@AfterEach
	void tearDown() {
		if (this.server != null) {
			this.server.stop();
		}
		if (this.statefulTransportManager != null) {
			this.statefulTransportManager.shutdown().block();
		}
		if (this.sessionManager != null) {
			this.sessionManager.stop();
		}
	}

	@Test
	void initializeReturnsSessionIdAndServesFollowUpRequests() throws Exception {
		startServer(SessionMode.STATEFUL);

		HttpResponse<String> initialize = post(INITIALIZE, null);

		assertThat(initialize.statusCode()).isEqualTo(200);
		assertThat(initialize.headers().firstValue("Content-Type")).hasValueSatisfying(
				contentType -> assertThat(contentType).startsWith("application/json"));
		String sessionId = initialize.headers().firstValue(HttpHeaders.MCP_SESSION_ID).orElseThrow();
		JsonNode result = json(initialize).path("result");
		assertThat(result.path("protocolVersion").asText()).isEqualTo("2025-06-18");
		assertThat(result.path("serverInfo").path("name").asText()).isEqualTo("git-mcp-it");

		assertThat(post(INITIALIZED_NOTIFICATION, sessionId).statusCode()).isEqualTo(204);

		HttpResponse<String> tools = post(TOOLS_LIST, sessionId);
		assertThat(tools.statusCode()).isEqualTo(200);
		assertThat(tools.headers().firstValue(HttpHeaders.MCP_SESSION_ID)).contains(sessionId);
		assertThat(json(tools).path("result").path("tools").get(0).path("name").asText()).isEqualTo("tenant");
	}

	@Test
	void missingProtocolVersionHeaderFallsBackToDefault() throws Exception {
		startServer(SessionMode.STATEFUL);

		HttpResponse<String> response = send(request().POST(HttpRequest.BodyPublishers.ofString(INITIALIZE)));

		assertThat(response.statusCode()).isEqualTo(200);
	}

	@Test
	void unsupportedProtocolVersionIsRejected() throws Exception {
		startServer(SessionMode.STATEFUL);

		HttpResponse<String> response = send(request().header(HttpHeaders.MCP_PROTOCOL_VERSION, "1999-01-01")
			.POST(HttpRequest.BodyPublishers.ofString(INITIALIZE)));

		assertThat(response.statusCode()).isEqualTo(400);
		JsonNode error = json(response).path("error");
		assertThat(error.path("code").asInt()).isEqualTo(McpSchema.ErrorCodes.SERVER_ERROR);
		assertThat(error.path("data").path("requested").asText()).isEqualTo("1999-01-01");
		List<String> supported = new ArrayList<>();
		error.path("data").path("supported").forEach(version -> supported.add(version.asText()));
		assertThat(supported).containsExactly("2025-03-26", "2025-06-18");
		assertThat(this.sessionManager.getActiveSessionCount()).isZero();
	}

	@Test
	void requestWithBlankMethodKeepsSessionAlive() throws Exception {
		startServer(SessionMode.STATEFUL);
		String sessionId = initialize();

		HttpResponse<String> rejected = post("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"\"}", sessionId);

		assertThat(rejected.statusCode()).isEqualTo(400);
		assertThat(json(rejected).path("error").path("code").asInt()).isEqualTo(McpSchema.ErrorCodes.INVALID_REQUEST);
		assertThat(this.sessionManager.isSessionValid(sessionId)).isTrue();
		assertThat(post(TOOLS_LIST, sessionId).statusCode()).isEqualTo(200);
	}

	@Test
	void unknownSessionIsNotFound() throws Exception {
		startServer(SessionMode.STATEFUL);

		HttpResponse<String> response = post(TOOLS_LIST, "does-not-exist");

		assertSessionExpired(response);
		assertThat(this.sessionManager.getActiveSessionCount()).isZero();
	}

	@Test
	void deletedSessionIsGone() throws Exception {
		startServer(SessionMode.STATEFUL);
		String sessionId = initialize();

		HttpResponse<String> deleted = delete(sessionId);
		assertThat(deleted.statusCode()).isEqualTo(204);
		assertThat(deleted.body()).isEmpty();

		assertSessionExpired(post(TOOLS_LIST, sessionId));
		assertThat(delete(sessionId).statusCode()).isEqualTo(404);
	}

	@Test
	void deleteWithoutSessionIdIsBadRequest() throws Exception {
		startServer(SessionMode.STATEFUL);

		assertThat(delete(null).statusCode()).isEqualTo(400);
	}

	@Test
	void statefulModeRequiresSessionForNonInitializeRequests() throws Exception {
		startServer(SessionMode.STATEFUL);

		HttpResponse<String> response = post(TOOLS_LIST, null);

		assertThat(response.statusCode()).isEqualTo(400);
		assertThat(json(response).path("error").path("message").asText())
			.isEqualTo("Mcp-Session-Id header is required");
		assertThat(json(response).path("id").asInt()).isEqualTo(2);
	}

	@Test
	void autoModeServesAnonymousRequestsStatelessly() throws Exception {
		startServer(SessionMode.AUTO);

		HttpResponse<String> response = post(TOOLS_LIST, null);

		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.headers().firstValue(HttpHeaders.MCP_SESSION_ID)).isEmpty();
		assertThat(this.sessionManager.getActiveSessionCount()).isZero();

		String sessionId = initialize();
		assertThat(post(TOOLS_LIST, sessionId).statusCode()).isEqualTo(200);
		assertThat(this.sessionManager.getActiveSessionCount()).isEqualTo(1);
	}

	@Test
	void statelessModeNeverCreatesSessions() throws Exception {
		startServer(SessionMode.STATELESS);

		HttpResponse<String> initialize = post(INITIALIZE, null);
		HttpResponse<String> tools = post(TOOLS_LIST, "client-chosen");

		assertThat(initialize.statusCode()).isEqualTo(200);
		assertThat(initialize.headers().firstValue(HttpHeaders.MCP_SESSION_ID)).isEmpty();
		assertThat(tools.statusCode()).isEqualTo(200);
		assertThat(tools.headers().firstValue(HttpHeaders.MCP_SESSION_ID)).contains("client-chosen");
	}

	@Test
	void statelessModeAcknowledgesDelete() throws Exception {
		startServer(SessionMode.STATELESS);

		HttpResponse<String> response = delete("anything");

		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(json(response).path("status").asText()).isEqualTo("stateless_mode");
		assertThat(json(response).path("message").asText()).isEqualTo("No sessions to delete");
	}

	@Test
	void notificationOnlyBodyReturnsNoContent() throws Exception {
		startServer(SessionMode.AUTO);

		HttpResponse<String> response = post(INITIALIZED_NOTIFICATION, null);

		assertThat(response.statusCode()).isEqualTo(204);
		assertThat(response.body()).isEmpty();
	}

	@Test
	void malformedJsonIsParseError() throws Exception {
		startServer(SessionMode.STATEFUL);

		HttpResponse<String> response = post("{\"jsonrpc\":", null);

		assertThat(response.statusCode()).isEqualTo(400);
		assertThat(json(response).path("error").path("code").asInt()).isEqualTo(McpSchema.ErrorCodes.PARSE_ERROR);
	}

	@Test
	void eventStreamIsUsedWhenRequested() throws Exception {
		startServer(SessionMode.STATEFUL);
		String sessionId = initialize();

		HttpResponse<String> response = send(request().header(HttpHeaders.MCP_SESSION_ID, sessionId)
			.header(HttpHeaders.ACCEPT, "text/event-stream")
			.POST(HttpRequest.BodyPublishers.ofString(TOOLS_LIST)));

		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.headers().firstValue("Content-Type"))
			.hasValueSatisfying(contentType -> assertThat(contentType).startsWith("text/event-stream"));
		assertThat(response.body()).startsWith("event: message\ndata: ").contains("\"id\":2").endsWith("\n\n");
	}

	@Test
	void healthAndStatusEndpoints() throws Exception {
		startServer(SessionMode.AUTO);
		initialize();

		HttpResponse<String> health = send(request("/healthz").GET());
		HttpResponse<String> status = send(request().GET());

		assertThat(health.statusCode()).isEqualTo(200);
		assertThat(json(health).path("status").asText()).isEqualTo("ok");
		assertThat(status.statusCode()).isEqualTo(200);
		JsonNode server = json(status).path("server");
		assertThat(server.path("name").asText()).isEqualTo("git-mcp-it");
		assertThat(server.path("sessionMode").asText()).isEqualTo("auto");
		assertThat(server.path("activeSessions").asInt()).isEqualTo(1);
	}

	@Test
	void unknownPathIsNotFound() throws Exception {
		startServer(SessionMode.AUTO);

		assertThat(send(request("/other").GET()).statusCode()).isEqualTo(404);
		assertThat(send(request("/other").POST(HttpRequest.BodyPublishers.ofString(TOOLS_LIST))).statusCode())
			.isEqualTo(404);
	}

	@Test
	void protectedResourceMetadataRequiresIssuer() throws Exception {
		startServer(SessionMode.AUTO);

		HttpResponse<String> response = send(request(McpHttpServlet.PROTECTED_RESOURCE_METADATA_PATH).GET());

		assertThat(response.statusCode()).isEqualTo(404);
		assertThat(json(response).path("error").asText()).isEqualTo("OAuth not configured on this server");
	}

	@Test
	void protectedResourceMetadataNamesIssuer() throws Exception {
		startServer(SessionMode.AUTO, builder -> builder.oauthIssuerUrl("https://auth.example.com"));

		HttpResponse<String> response = send(request(McpHttpServlet.PROTECTED_RESOURCE_METADATA_PATH).GET());

		assertThat(response.statusCode()).isEqualTo(200);
		JsonNode metadata = json(response);
		assertThat(metadata.path("resource").asText()).isEqualTo(this.baseUrl + "/mcp");
		assertThat(metadata.path("authorization_servers").get(0).asText()).isEqualTo("https://auth.example.com");
		assertThat(metadata.path("bearer_methods_supported").get(0).asText()).isEqualTo("header");
	}

	@Test
	void preflightFromAllowedOriginGetsCorsHeaders() throws Exception {
		startServer(SessionMode.AUTO, builder -> builder.allowedOrigins(List.of("http://localhost:5173")));

		HttpResponse<String> response = send(request().header(HttpHeaders.ORIGIN, "http://localhost:5173")
			.method("OPTIONS", HttpRequest.BodyPublishers.noBody()));

		assertThat(response.statusCode()).isEqualTo(204);
		assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).contains("http://localhost:5173");
		assertThat(response.headers().firstValue("Access-Control-Allow-Methods"))
			.contains("GET, POST, DELETE, OPTIONS");
		assertThat(response.headers().firstValue("Access-Control-Expose-Headers")).contains("Mcp-Session-Id");
	}

	@Test
	void requestFromDisallowedOriginIsForbidden() throws Exception {
		startServer(SessionMode.AUTO, builder -> builder.allowedOrigins(List.of("http://localhost:5173")));

		HttpResponse<String> response = send(request().header(HttpHeaders.ORIGIN, "http://evil.example")
			.POST(HttpRequest.BodyPublishers.ofString(INITIALIZE)));

		assertThat(response.statusCode()).isEqualTo(403);
		assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).isEmpty();
		assertThat(this.sessionManager.getActiveSessionCount()).isZero();
	}

	@Test
	void bearerAuthenticationRejectsMissingAndUnknownTokens() throws Exception {
		startServer(SessionMode.STATEFUL, builder -> builder.authMode(AuthMode.BEARER)
			.authTokens(List.of("secret-token|client-a|tenant-a|repo:read")));

		HttpResponse<String> missing = post(INITIALIZE, null);
		HttpResponse<String> unknown = send(request().header(HttpHeaders.AUTHORIZATION, "Bearer nope")
			.POST(HttpRequest.BodyPublishers.ofString(INITIALIZE)));

		assertThat(missing.statusCode()).isEqualTo(401);
		assertThat(missing.headers().firstValue("WWW-Authenticate")).contains("Bearer");
		assertThat(json(missing).path("error").path("message").asText())
			.isEqualTo("Unauthorized: Missing or invalid Authorization header");
		assertThat(unknown.statusCode()).isEqualTo(401);
		assertThat(this.sessionManager.getActiveSessionCount()).isZero();
	}

	@Test
	void bearerAuthenticationCarriesTenantToSessionAndTools() throws Exception {
		startServer(SessionMode.STATEFUL, builder -> builder.authMode(AuthMode.BEARER)
			.authTokens(List.of("secret-token|client-a|tenant-a|repo:read")));

		HttpResponse<String> initialize = send(request().header(HttpHeaders.AUTHORIZATION, "Bearer secret-token")
			.POST(HttpRequest.BodyPublishers.ofString(INITIALIZE)));
		String sessionId = initialize.headers().firstValue(HttpHeaders.MCP_SESSION_ID).orElseThrow();
		HttpResponse<String> call = send(request().header(HttpHeaders.AUTHORIZATION, "Bearer secret-token")
			.header(HttpHeaders.MCP_SESSION_ID, sessionId)
			.POST(HttpRequest.BodyPublishers.ofString(TOOLS_CALL)));

		assertThat(this.sessionManager.getSessionMetadata(sessionId).tenantId()).isEqualTo("tenant-a");
		assertThat(json(call).path("result").path("content").get(0).path("text").asText()).isEqualTo("tenant-a");
	}

	private void startServer(SessionMode mode) {
		startServer(mode, builder -> {
		});
	}

	private void startServer(SessionMode mode, Consumer<McpServerProperties.Builder> customizer) {
		McpServerProperties.Builder builder = McpServerProperties.builder()
			.sessionMode(mode)
			.serverName("git-mcp-it")
			.port(0);
		customizer.accept(builder);
		McpServerProperties properties = builder.build();

		InMemoryToolsRepository tools = new InMemoryToolsRepository();
		tools.addTool(new ToolSpecification(new McpSchema.Tool("tenant", "Returns the caller's tenant", null),
				(context, request) -> Mono
					.just(McpSchema.CallToolResult.text(context.tenantId().orElse("none")))));

		this.sessionManager = SessionManager.builder().build();
		this.statefulTransportManager = new StatefulTransportManager(this.objectMapper,
				() -> handlerBuilder(properties, tools).build(), this.sessionManager);
		StatelessTransportManager statelessTransportManager = new StatelessTransportManager(this.objectMapper,
				() -> handlerBuilder(properties, tools).requireInitialization(false).build());

		McpHttpServlet.Builder servlet = McpHttpServlet.builder()
			.objectMapper(this.objectMapper)
			.properties(properties)
			.statefulTransportManager(this.statefulTransportManager)
			.statelessTransportManager(statelessTransportManager);
		if (properties.authMode() == AuthMode.BEARER) {
			servlet.authenticator(new BearerAuthenticator(StaticTokenVerifier.fromEntries(properties.authTokens())));
		}

		this.server = new McpHttpServer(servlet.build(), "127.0.0.1", 0, 0, Duration.ZERO);
		int port = this.server.start();
		this.baseUrl = "http://127.0.0.1:" + port;
	}

	private DefaultMcpProtocolHandler.Builder handlerBuilder(McpServerProperties properties,
			InMemoryToolsRepository tools) {
		return DefaultMcpProtocolHandler.builder(this.objectMapper)
			.serverInfo(properties.serverName(), properties.serverVersion())
			.toolsRepository(tools);
	}

	private String initialize() throws Exception {
		HttpResponse<String> response = post(INITIALIZE, null);
		assertThat(response.statusCode()).isEqualTo(200);
		return response.headers().firstValue(HttpHeaders.MCP_SESSION_ID).orElseThrow();
	}

	private HttpResponse<String> post(String body, String sessionId) throws Exception {
		HttpRequest.Builder builder = request().header(HttpHeaders.MCP_PROTOCOL_VERSION, "2025-06-18")
			.header(HttpHeaders.CONTENT_TYPE, "application/json")
			.header(HttpHeaders.ACCEPT, "application/json, text/event-stream");
		if (sessionId != null) {
			builder.header(HttpHeaders.MCP_SESSION_ID, sessionId);
		}
		return send(builder.POST(HttpRequest.BodyPublishers.ofString(body)));
	}

	private HttpResponse<String> delete(String sessionId) throws Exception {
		HttpRequest.Builder builder = request().DELETE();
		if (sessionId != null) {
			builder.header(HttpHeaders.MCP_SESSION_ID, sessionId);
		}
		return send(builder);
	}

	private HttpRequest.Builder request() {
		return request("/mcp");
	}

	private HttpRequest.Builder request(String path) {
		return HttpRequest.newBuilder(URI.create(this.baseUrl + path)).timeout(Duration.ofSeconds(10));
	}

	private HttpResponse<String> send(HttpRequest.Builder builder) throws IOException, InterruptedException {
		return this.httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
	}

	private void assertSessionExpired(HttpResponse<String> response) throws IOException {
		assertThat(response.statusCode()).isEqualTo(404);
		JsonNode error = json(response).path("error");
		assertThat(error.path("code").asInt()).isEqualTo(McpSchema.ErrorCodes.SESSION_NOT_FOUND);
		assertThat(error.path("message").asText()).isEqualTo("Session expired or invalid. Please reinitialize.");
	}

	private JsonNode json(HttpResponse<String> response) throws IOException {
		return this.objectMapper.readTree(response.body());
	}

}
