/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.transport;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import io.gitmcp.util.Assert;
import jakarta.servlet.http.HttpServlet;
import org.apache.catalina.Context;
import org.apache.catalina.LifecycleException;
import org.apache.catalina.LifecycleState;
import org.apache.catalina.Wrapper;
import org.apache.catalina.connector.Connector;
import org.apache.catalina.startup.Tomcat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedded Tomcat hosting an {@link McpHttpServlet}. When the configured port is taken
 * the next one is tried, up to a maximum number of retries.
 */
public class McpHttpServer {

	private static final Logger logger = LoggerFactory.getLogger(McpHttpServer.class);

	private static final String SERVLET_NAME = "mcpServlet";

	private final HttpServlet servlet;

	private final String host;

	private final int initialPort;

	private final int maxPortRetries;

	private final Duration portRetryDelay;

	private Tomcat tomcat;

	private int port = -1;

	public McpHttpServer(HttpServlet servlet, String host, int initialPort, int maxPortRetries,
			Duration portRetryDelay) {
		Assert.notNull(servlet, "servlet must not be null");
		Assert.hasText(host, "host must not be empty");
		this.servlet = servlet;
		this.host = host;
		this.initialPort = initialPort;
		this.maxPortRetries = maxPortRetries;
		this.portRetryDelay = portRetryDelay;
	}

	/**
	 * Starts Tomcat on the first free port.
	 * @return the port Tomcat listens on
	 * @throws IllegalStateException if no port could be bound
	 */
	public synchronized int start() {
		Assert.isTrue(this.tomcat == null, "Server already started");
		int candidate = this.initialPort;
		for (int attempt = 0; attempt <= this.maxPortRetries; attempt++) {
			if (candidate != 0 && isPortInUse(candidate)) {
				logger.warn("Port {} is in use, retrying (attempt {}/{})", candidate, attempt + 1,
						this.maxPortRetries + 1);
				pause();
				candidate++;
				continue;
			}
			Tomcat server = createTomcat(candidate);
			try {
				server.start();
				Connector connector = server.getConnector();
				if (connector.getState() == LifecycleState.STARTED && connector.getLocalPort() > 0) {
					this.tomcat = server;
					this.port = connector.getLocalPort();
					logger.info("HTTP transport listening at http://{}:{}", this.host, this.port);
					return this.port;
				}
				logger.warn("Failed to bind port {}, retrying", candidate);
			}
			catch (LifecycleException e) {
				logger.warn("Failed to start Tomcat on port {}", candidate, e);
			}
			destroyQuietly(server);
			pause();
			candidate++;
		}
		throw new IllegalStateException(
				"Failed to bind to any port after " + this.maxPortRetries + " retries starting at " + this.initialPort);
	}

	/**
	 * Stops Tomcat. Does nothing if the server is not running.
	 */
	public synchronized void stop() {
		if (this.tomcat == null) {
			return;
		}
		logger.info("Stopping HTTP transport on port {}", this.port);
		try {
			this.tomcat.stop();
			this.tomcat.destroy();
		}
		catch (LifecycleException e) {
			logger.error("Error during Tomcat shutdown", e);
		}
		finally {
			this.tomcat = null;
			this.port = -1;
		}
	}

	/**
	 * Blocks until the server shuts down.
	 */
	public void await() {
		Tomcat server;
		synchronized (this) {
			server = this.tomcat;
		}
		if (server != null) {
			server.getServer().await();
		}
	}

	public synchronized int getPort() {
		return this.port;
	}

	private Tomcat createTomcat(int port) {
		Tomcat server = new Tomcat();
		server.setHostname(this.host);
		server.setPort(port);

		String baseDir = baseDir();
		server.setBaseDir(baseDir);
		Context context = server.addContext("", baseDir);

		Wrapper wrapper = context.createWrapper();
		wrapper.setName(SERVLET_NAME);
		wrapper.setServlet(this.servlet);
		wrapper.setLoadOnStartup(1);
		wrapper.setAsyncSupported(true);
		context.addChild(wrapper);
		context.addServletMappingDecoded("/*", SERVLET_NAME);

		Connector connector = server.getConnector();
		connector.setProperty("address", this.host);
		connector.setThrowOnFailure(true);
		return server;
	}

	private boolean isPortInUse(int port) {
		try (ServerSocket socket = new ServerSocket()) {
			socket.setReuseAddress(true);
			socket.bind(new InetSocketAddress(InetAddress.getByName(this.host), port));
			return false;
		}
		catch (IOException e) {
			return true;
		}
	}

	private void pause() {
		try {
			Thread.sleep(this.portRetryDelay.toMillis());
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while waiting to retry port binding", e);
		}
	}

	private static void destroyQuietly(Tomcat server) {
		try {
			server.stop();
			server.destroy();
		}
		catch (LifecycleException e) {
			logger.debug("Failed to clean up Tomcat after bind failure", e);
		}
	}

	private static String baseDir() {
		try {
			return Files.createTempDirectory("git-mcp-tomcat").toString();
		}
		catch (IOException e) {
			logger.warn("Failed to create Tomcat base directory, using java.io.tmpdir", e);
			return System.getProperty("java.io.tmpdir");
		}
	}

}
