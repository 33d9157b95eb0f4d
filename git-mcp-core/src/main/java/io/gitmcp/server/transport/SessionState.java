/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.transport;

/**
 * Lifecycle of a stateful session as seen by {@link StatefulTransportManager}.
 */
public enum SessionState {

	/** No handler exists for the id. */
	ABSENT,

	/** Handler constructed, initialize exchange in flight, nothing registered yet. */
	INITIALIZING,

	/** Registered with the session manager and serving requests. */
	ACTIVE,

	/** Handler disposed. Terminal. */
	CLOSED

}
