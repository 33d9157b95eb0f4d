/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.gitmcp.common.RequestContext;
import io.gitmcp.spec.McpError;
import io.gitmcp.spec.McpSchema;
import io.gitmcp.spec.McpSchema.JSONRPCResponse;
import io.gitmcp.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import io.gitmcp.spec.ProtocolVersions;
import io.gitmcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Protocol handler serving the MCP lifecycle and the tools feature:
 * {@code initialize}, {@code ping}, {@code tools/list} and {@code tools/call}.
 * <p>
 * When initialization is required, every request other than {@code initialize} and
 * {@code ping} is rejected until an {@code initialize} request succeeded, and a second
 * {@code initialize} is rejected. Stateless handling builds instances that do not
 * require it, since each instance only ever sees one request.
 */
public class DefaultMcpProtocolHandler implements McpProtocolHandler {

	private static final Logger logger = LoggerFactory.getLogger(DefaultMcpProtocolHandler.class);

	private final ObjectMapper objectMapper;

	private final McpSchema.Implementation serverInfo;

	private final McpSchema.ServerCapabilities serverCapabilities;

	private final String instructions;

	private final ToolsRepository toolsRepository;

	private final boolean requireInitialization;

	private final Map<String, RequestHandler> requestHandlers = new HashMap<>();

	private final AtomicBoolean initialized = new AtomicBoolean();

	private final AtomicBoolean closed = new AtomicBoolean();

	private DefaultMcpProtocolHandler(Builder builder) {
		this.objectMapper = builder.objectMapper;
		this.serverInfo = builder.serverInfo;
		this.instructions = builder.instructions;
		this.toolsRepository = builder.toolsRepository;
		this.requireInitialization = builder.requireInitialization;
		this.serverCapabilities = new McpSchema.ServerCapabilities(null,
				new McpSchema.ServerCapabilities.ToolCapabilities(false));

		this.requestHandlers.put(McpSchema.METHOD_INITIALIZE, this::initialize);
		this.requestHandlers.put(McpSchema.METHOD_PING, (context, params) -> Mono.just(Map.of()));
		this.requestHandlers.put(McpSchema.METHOD_TOOLS_LIST, this::listTools);
		this.requestHandlers.put(McpSchema.METHOD_TOOLS_CALL, this::callTool);
	}

	public static Builder builder(ObjectMapper objectMapper) {
		return new Builder(objectMapper);
	}

	@Override
	public Mono<JSONRPCResponse> handleRequest(RequestContext context, McpSchema.JSONRPCRequest request) {
		if (this.closed.get()) {
			return Mono.just(JSONRPCResponse.error(request.id(), McpSchema.ErrorCodes.INTERNAL_ERROR,
					"Protocol handler is closed"));
		}
		RequestHandler requestHandler = this.requestHandlers.get(request.method());
		if (requestHandler == null) {
			return Mono.just(JSONRPCResponse.error(request.id(), McpSchema.ErrorCodes.METHOD_NOT_FOUND,
					"Method not found: " + request.method()));
		}
		if (this.requireInitialization && !this.initialized.get() && !isLifecycleMethod(request.method())) {
			return Mono.just(JSONRPCResponse.error(request.id(), McpSchema.ErrorCodes.INVALID_REQUEST,
					"Server not initialized"));
		}
		return Mono.defer(() -> requestHandler.handle(context, request.params()))
			.map(result -> JSONRPCResponse.success(request.id(), result))
			.onErrorResume(t -> {
				JSONRPCError error;
				if (t instanceof McpError mcpError && mcpError.getJsonRpcError() != null) {
					error = mcpError.getJsonRpcError();
				}
				else {
					logger.error("Request {} failed (requestId={})", request.method(), context.requestId(), t);
					error = new JSONRPCError(McpSchema.ErrorCodes.INTERNAL_ERROR, "Internal error", null);
				}
				return Mono.just(new JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), null, error));
			});
	}

	@Override
	public Mono<Void> handleNotification(RequestContext context, McpSchema.JSONRPCNotification notification) {
		if (McpSchema.METHOD_NOTIFICATION_INITIALIZED.equals(notification.method())) {
			logger.debug("Client initialized (sessionId={})", context.sessionId().orElse(null));
		}
		else {
			logger.debug("Ignoring notification {}", notification.method());
		}
		return Mono.empty();
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			if (this.closed.compareAndSet(false, true)) {
				logger.debug("Protocol handler closed");
			}
		});
	}

	@Override
	public boolean isClosed() {
		return this.closed.get();
	}

	private Mono<?> initialize(RequestContext context, Object params) {
		McpSchema.InitializeRequest request = convert(params, McpSchema.InitializeRequest.class);
		if (this.requireInitialization && !this.initialized.compareAndSet(false, true)) {
			return Mono.error(new McpError(McpSchema.ErrorCodes.INVALID_REQUEST, "Server already initialized"));
		}
		this.initialized.set(true);
		String requested = request != null ? request.protocolVersion() : null;
		String negotiated = ProtocolVersions.isSupported(requested) ? requested : ProtocolVersions.LATEST;
		if (request != null && request.clientInfo() != null) {
			logger.info("Client initialize request - Protocol: {}, Client: {} {}", requested,
					request.clientInfo().name(), request.clientInfo().version());
		}
		return Mono.just(new McpSchema.InitializeResult(negotiated, this.serverCapabilities, this.serverInfo,
				this.instructions));
	}

	private Mono<?> listTools(RequestContext context, Object params) {
		String cursor = null;
		if (params instanceof Map<?, ?> map && map.get("cursor") instanceof String c) {
			cursor = c;
		}
		return this.toolsRepository.listTools(context, cursor)
			.map(result -> new McpSchema.ListToolsResult(result.tools(), result.nextCursor()));
	}

	private Mono<?> callTool(RequestContext context, Object params) {
		McpSchema.CallToolRequest request = convert(params, McpSchema.CallToolRequest.class);
		if (request == null || request.name() == null) {
			return Mono.error(new McpError(McpSchema.ErrorCodes.INVALID_PARAMS, "Tool name is required"));
		}
		RequestContext toolContext = context.withOperation("tools/call:" + request.name());
		return this.toolsRepository.resolveToolForCall(request.name(), toolContext)
			.switchIfEmpty(Mono.error(
					() -> new McpError(McpSchema.ErrorCodes.INVALID_PARAMS, "Unknown tool: " + request.name())))
			.flatMap(tool -> Mono.defer(() -> tool.callHandler().apply(toolContext, request))
				.onErrorResume(t -> !(t instanceof McpError), t -> {
					logger.warn("Tool {} failed (requestId={})", request.name(), context.requestId(), t);
					return Mono.just(McpSchema.CallToolResult.error(String.valueOf(t.getMessage())));
				}));
	}

	private static boolean isLifecycleMethod(String method) {
		return McpSchema.METHOD_INITIALIZE.equals(method) || McpSchema.METHOD_PING.equals(method);
	}

	private <T> T convert(Object params, Class<T> type) {
		if (params == null) {
			return null;
		}
		try {
			return this.objectMapper.convertValue(params, type);
		}
		catch (IllegalArgumentException e) {
			throw new McpError(McpSchema.ErrorCodes.INVALID_PARAMS, "Invalid params: " + e.getMessage());
		}
	}

	@FunctionalInterface
	private interface RequestHandler {

		Mono<?> handle(RequestContext context, Object params);

	}

	/**
	 * Builder for {@link DefaultMcpProtocolHandler}. Once configured, {@link #build()}
	 * can serve as a {@link McpProtocolHandler.Factory}.
	 */
	public static class Builder {

		private final ObjectMapper objectMapper;

		private McpSchema.Implementation serverInfo = new McpSchema.Implementation("git-mcp-server", "1.0.0");

		private String instructions;

		private ToolsRepository toolsRepository = new InMemoryToolsRepository();

		private boolean requireInitialization = true;

		private Builder(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
		}

		public Builder serverInfo(String name, String version) {
			Assert.hasText(name, "name must not be empty");
			Assert.hasText(version, "version must not be empty");
			this.serverInfo = new McpSchema.Implementation(name, version);
			return this;
		}

		public Builder instructions(String instructions) {
			this.instructions = instructions;
			return this;
		}

		public Builder toolsRepository(ToolsRepository toolsRepository) {
			Assert.notNull(toolsRepository, "toolsRepository must not be null");
			this.toolsRepository = toolsRepository;
			return this;
		}

		/**
		 * Whether requests must be preceded by a successful {@code initialize}.
		 * Defaults to true.
		 * @param requireInitialization false for handlers used for one request only
		 * @return this builder
		 */
		public Builder requireInitialization(boolean requireInitialization) {
			this.requireInitialization = requireInitialization;
			return this;
		}

		public DefaultMcpProtocolHandler build() {
			return new DefaultMcpProtocolHandler(this);
		}

	}

}
