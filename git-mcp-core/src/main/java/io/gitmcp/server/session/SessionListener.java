/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.session;

/**
 * Callback for sessions leaving the {@link SessionManager}.
 */
@FunctionalInterface
public interface SessionListener {

	/**
	 * Called after a session entry was removed. Invoked at most once per removed entry,
	 * never while internal locks are held.
	 * @param sessionId the removed session
	 * @param cause why it was removed
	 */
	void onSessionRemoved(String sessionId, RemovalCause cause);

	enum RemovalCause {

		/** Idle for longer than the stale timeout. */
		EXPIRED,

		/** Explicitly terminated, e.g. by a client DELETE. */
		TERMINATED,

		/** Dropped by {@link SessionManager#clearAllSessions()}, usually on shutdown. */
		SHUTDOWN

	}

}
