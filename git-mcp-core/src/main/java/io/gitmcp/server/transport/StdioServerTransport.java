/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.transport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gitmcp.common.RequestContext;
import io.gitmcp.server.McpProtocolHandler;
import io.gitmcp.spec.AsyncCloseable;
import io.gitmcp.spec.McpSchema;
import io.gitmcp.spec.McpSchema.JSONRPCMessage;
import io.gitmcp.spec.McpSchema.JSONRPCResponse;
import io.gitmcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Serves a single client over newline-delimited JSON-RPC on a pair of streams, usually
 * stdin and stdout, with one long-lived protocol handler.
 * <p>
 * Nothing but JSON-RPC messages is ever written to the output stream; logging must go
 * elsewhere. The transport stops on end of input or on {@link #closeGracefully()}.
 */
public class StdioServerTransport implements AsyncCloseable {

	private static final Logger logger = LoggerFactory.getLogger(StdioServerTransport.class);

	private final ObjectMapper objectMapper;

	private final McpProtocolHandler handler;

	private final InputStream inputStream;

	private final OutputStream outputStream;

	private final Scheduler inboundScheduler;

	private final Sinks.Empty<Void> terminated = Sinks.empty();

	private final AtomicBoolean started = new AtomicBoolean();

	private final AtomicBoolean closing = new AtomicBoolean();

	public StdioServerTransport(ObjectMapper objectMapper, McpProtocolHandler handler) {
		this(objectMapper, handler, System.in, System.out);
	}

	public StdioServerTransport(ObjectMapper objectMapper, McpProtocolHandler handler, InputStream inputStream,
			OutputStream outputStream) {
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(handler, "handler must not be null");
		Assert.notNull(inputStream, "inputStream must not be null");
		Assert.notNull(outputStream, "outputStream must not be null");
		this.objectMapper = objectMapper;
		this.handler = handler;
		this.inputStream = inputStream;
		this.outputStream = outputStream;
		this.inboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(runnable -> {
			Thread thread = new Thread(runnable, "mcp-stdio-inbound");
			thread.setDaemon(true);
			return thread;
		}), "mcp-stdio-inbound");
	}

	/**
	 * Starts reading from the input stream on a dedicated thread.
	 */
	public void start() {
		if (!this.started.compareAndSet(false, true)) {
			throw new IllegalStateException("Transport already started");
		}
		this.inboundScheduler.schedule(this::readLoop);
		logger.info("Stdio transport started");
	}

	/**
	 * Completes once the transport stopped, on end of input or after close.
	 * @return a Mono completing on termination
	 */
	public Mono<Void> awaitTermination() {
		return this.terminated.asMono();
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			if (!this.closing.compareAndSet(false, true)) {
				return this.terminated.asMono();
			}
			logger.info("Closing stdio transport");
			return this.handler.closeGracefully().doFinally(signal -> {
				this.inboundScheduler.dispose();
				this.terminated.tryEmitEmpty();
			});
		});
	}

	private void readLoop() {
		try (BufferedReader reader = new BufferedReader(
				new InputStreamReader(this.inputStream, StandardCharsets.UTF_8))) {
			String line;
			while (!this.closing.get() && (line = reader.readLine()) != null) {
				if (!line.isBlank()) {
					handleLine(line);
				}
			}
			logger.info("Stdio input closed");
		}
		catch (IOException e) {
			if (!this.closing.get()) {
				logger.error("Error reading stdio input", e);
			}
		}
		catch (RuntimeException e) {
			logger.error("Stdio transport stopped unexpectedly", e);
		}
		finally {
			closeGracefully().subscribe(null, e -> logger.warn("Failed to close stdio transport", e));
		}
	}

	void handleLine(String line) {
		JsonNode body;
		try {
			body = this.objectMapper.readTree(line);
		}
		catch (IOException e) {
			logger.warn("Discarding unparseable stdio input: {}", e.getMessage());
			write(McpSchema.JSONRPCErrorResponse.of(McpSchema.ErrorCodes.PARSE_ERROR, "Parse error"));
			return;
		}
		List<JSONRPCMessage> messages;
		try {
			messages = McpSchema.parseMessages(this.objectMapper, body);
		}
		catch (IOException | IllegalArgumentException e) {
			logger.warn("Discarding invalid JSON-RPC input: {}", e.getMessage());
			write(McpSchema.JSONRPCErrorResponse.of(McpSchema.ErrorCodes.INVALID_REQUEST, "Invalid Request"));
			return;
		}

		List<JSONRPCResponse> responses = new ArrayList<>();
		for (JSONRPCMessage message : messages) {
			JSONRPCResponse response = handleMessage(message);
			if (response != null) {
				responses.add(response);
			}
		}
		if (responses.isEmpty()) {
			return;
		}
		write(body.isArray() ? responses : responses.get(0));
	}

	private JSONRPCResponse handleMessage(JSONRPCMessage message) {
		if (message instanceof McpSchema.JSONRPCRequest request) {
			try {
				RequestContext context = RequestContext.create(request.method());
				return this.handler.handleRequest(context, request).block();
			}
			catch (RuntimeException e) {
				logger.error("Protocol handler failed on {} (id={})", request.method(), request.id(), e);
				return JSONRPCResponse.error(request.id(), McpSchema.ErrorCodes.INTERNAL_ERROR, "Internal error");
			}
		}
		if (message instanceof McpSchema.JSONRPCNotification notification) {
			try {
				this.handler.handleNotification(RequestContext.create(notification.method()), notification).block();
			}
			catch (RuntimeException e) {
				logger.warn("Notification {} failed", notification.method(), e);
			}
		}
		return null;
	}

	private synchronized void write(Object payload) {
		try {
			String json = this.objectMapper.writeValueAsString(payload);
			this.outputStream.write(json.getBytes(StandardCharsets.UTF_8));
			this.outputStream.write('\n');
			this.outputStream.flush();
		}
		catch (JsonProcessingException e) {
			logger.error("Failed to serialize outbound message", e);
		}
		catch (IOException e) {
			logger.error("Failed to write to stdio output", e);
		}
	}

}
