/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.gitmcp.config.AuthMode;
import io.gitmcp.config.McpServerProperties;
import io.gitmcp.config.McpServerPropertiesLoader;
import io.gitmcp.config.SessionMode;
import io.gitmcp.config.TransportType;
import io.gitmcp.server.DefaultMcpProtocolHandler;
import io.gitmcp.server.InMemoryToolsRepository;
import io.gitmcp.server.ToolsRepository;
import io.gitmcp.server.auth.BearerAuthenticator;
import io.gitmcp.server.auth.StaticTokenVerifier;
import io.gitmcp.server.session.SessionManager;
import io.gitmcp.server.transport.McpHttpServer;
import io.gitmcp.server.transport.McpHttpServlet;
import io.gitmcp.server.transport.StatefulTransportManager;
import io.gitmcp.server.transport.StatelessTransportManager;
import io.gitmcp.server.transport.StdioServerTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the git MCP server on the configured transport and wires the shutdown hook.
 */
public class GitMcpServerApplication {

	private static final Logger logger = LoggerFactory.getLogger(GitMcpServerApplication.class);

	private final McpServerProperties properties;

	private final ObjectMapper objectMapper;

	private final ToolsRepository toolsRepository;

	private SessionManager sessionManager;

	private StatefulTransportManager statefulTransportManager;

	private McpHttpServer httpServer;

	private StdioServerTransport stdioTransport;

	public GitMcpServerApplication(McpServerProperties properties, ObjectMapper objectMapper,
			ToolsRepository toolsRepository) {
		this.properties = properties;
		this.objectMapper = objectMapper;
		this.toolsRepository = toolsRepository;
	}

	public static void main(String[] args) {
		McpServerProperties properties = new McpServerPropertiesLoader().load();
		GitMcpServerApplication application = new GitMcpServerApplication(properties, new ObjectMapper(),
				new InMemoryToolsRepository());
		Runtime.getRuntime().addShutdownHook(new Thread(application::stop, "mcp-shutdown"));
		application.start();
		application.await();
	}

	/**
	 * Starts the configured transport.
	 */
	public synchronized void start() {
		logger.info("Starting {} {} ({} transport)", this.properties.serverName(), this.properties.serverVersion(),
				this.properties.transportType().value());
		if (this.properties.transportType() == TransportType.STDIO) {
			this.stdioTransport = new StdioServerTransport(this.objectMapper, handlerBuilder(true).build());
			this.stdioTransport.start();
			return;
		}

		SessionMode mode = this.properties.sessionMode();
		McpHttpServlet.Builder servlet = McpHttpServlet.builder()
			.objectMapper(this.objectMapper)
			.properties(this.properties);
		if (mode != SessionMode.STATELESS) {
			this.sessionManager = SessionManager.builder()
				.staleTimeout(this.properties.staleSessionTimeout())
				.cleanupInterval(this.properties.sessionCleanupInterval())
				.build();
			this.sessionManager.start();
			DefaultMcpProtocolHandler.Builder stateful = handlerBuilder(true);
			this.statefulTransportManager = new StatefulTransportManager(this.objectMapper, stateful::build,
					this.sessionManager);
			servlet.statefulTransportManager(this.statefulTransportManager);
		}
		if (mode != SessionMode.STATEFUL) {
			DefaultMcpProtocolHandler.Builder stateless = handlerBuilder(false);
			servlet.statelessTransportManager(new StatelessTransportManager(this.objectMapper, stateless::build));
		}
		if (this.properties.authMode() == AuthMode.BEARER) {
			StaticTokenVerifier verifier = StaticTokenVerifier.fromEntries(this.properties.authTokens());
			logger.info("Bearer authentication enabled with {} static tokens", verifier.size());
			servlet.authenticator(new BearerAuthenticator(verifier));
		}
		else {
			logger.info("Authentication is disabled; MCP endpoint is unprotected");
		}

		this.httpServer = new McpHttpServer(servlet.build(), this.properties.host(), this.properties.port(),
				this.properties.maxPortRetries(), this.properties.portRetryDelay());
		int port = this.httpServer.start();
		logger.info("MCP endpoint available at http://{}:{}{} (sessionMode={})", this.properties.host(), port,
				this.properties.endpointPath(), mode.value());
	}

	/**
	 * Blocks until the transport terminates.
	 */
	public void await() {
		if (this.stdioTransport != null) {
			this.stdioTransport.awaitTermination().block();
		}
		else if (this.httpServer != null) {
			this.httpServer.await();
		}
	}

	/**
	 * Stops the transport, closes every session and stops the session sweep.
	 */
	public synchronized void stop() {
		logger.info("Shutting down {}", this.properties.serverName());
		if (this.httpServer != null) {
			this.httpServer.stop();
			this.httpServer = null;
		}
		if (this.statefulTransportManager != null) {
			this.statefulTransportManager.shutdown().block();
			this.statefulTransportManager = null;
		}
		if (this.sessionManager != null) {
			this.sessionManager.stopCleanupInterval();
			this.sessionManager = null;
		}
		if (this.stdioTransport != null) {
			this.stdioTransport.closeGracefully().block();
			this.stdioTransport = null;
		}
	}

	public synchronized int getHttpPort() {
		return this.httpServer != null ? this.httpServer.getPort() : -1;
	}

	public ToolsRepository getToolsRepository() {
		return this.toolsRepository;
	}

	private DefaultMcpProtocolHandler.Builder handlerBuilder(boolean requireInitialization) {
		return DefaultMcpProtocolHandler.builder(this.objectMapper)
			.serverInfo(this.properties.serverName(), this.properties.serverVersion())
			.toolsRepository(this.toolsRepository)
			.requireInitialization(requireInitialization);
	}

}
