/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.transport;

import java.util.concurrent.atomic.AtomicReference;

import io.gitmcp.server.McpProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * A session id bound to the protocol handler that serves it. Closing is idempotent:
 * only the first {@link #close()} disposes the handler.
 */
final class SessionBinding {

	private static final Logger logger = LoggerFactory.getLogger(SessionBinding.class);

	private final String sessionId;

	private final McpProtocolHandler handler;

	private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.INITIALIZING);

	SessionBinding(String sessionId, McpProtocolHandler handler) {
		this.sessionId = sessionId;
		this.handler = handler;
	}

	String sessionId() {
		return this.sessionId;
	}

	McpProtocolHandler handler() {
		return this.handler;
	}

	SessionState state() {
		return this.state.get();
	}

	boolean isActive() {
		return this.state.get() == SessionState.ACTIVE;
	}

	boolean activate() {
		return this.state.compareAndSet(SessionState.INITIALIZING, SessionState.ACTIVE);
	}

	/**
	 * Moves the binding to {@link SessionState#CLOSED} and disposes the handler. Errors
	 * from the handler's teardown are logged, never propagated.
	 * @return a Mono completing once the handler was disposed
	 */
	Mono<Void> close() {
		return Mono.defer(() -> {
			if (this.state.getAndSet(SessionState.CLOSED) == SessionState.CLOSED) {
				return Mono.empty();
			}
			logger.debug("Closing protocol handler for session {}", this.sessionId);
			return this.handler.closeGracefully()
				.onErrorResume(e -> {
					logger.warn("Failed to close protocol handler for session {}", this.sessionId, e);
					return Mono.empty();
				});
		});
	}

}
