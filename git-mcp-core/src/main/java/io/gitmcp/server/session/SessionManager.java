/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.session;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

import io.gitmcp.server.session.SessionListener.RemovalCause;
import io.gitmcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Sole authority on MCP session existence and staleness.
 * <p>
 * Tracks session creation and activity, expires sessions lazily when they are checked
 * and eagerly from a background sweep so that idle sessions are reclaimed even when no
 * request references them again. Sessions live in memory only; nothing survives
 * {@link #stop()} followed by process exit.
 * <p>
 * Servers MUST answer 404 for expired sessions and clients MUST then re-initialize, so
 * an expired entry is never resurrected: once a check finds it stale it is gone.
 *
 * @see <a href=
 * "https://modelcontextprotocol.io/specification/2025-06-18/basic/transports#session-management">MCP
 * Session Management</a>
 */
public class SessionManager {

	private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

	public static final Duration DEFAULT_STALE_TIMEOUT = Duration.ofMinutes(30);

	public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofMinutes(5);

	private final ConcurrentHashMap<String, SessionEntry> sessions = new ConcurrentHashMap<>();

	private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

	private final long staleTimeoutMs;

	private final long cleanupIntervalMs;

	private final LongSupplier clock;

	private final Object lifecycleMonitor = new Object();

	private ScheduledExecutorService cleanupScheduler;

	private SessionManager(Builder builder) {
		this.staleTimeoutMs = builder.staleTimeout.toMillis();
		this.cleanupIntervalMs = builder.cleanupInterval.toMillis();
		this.clock = builder.clock;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Starts the background sweep. Calling it on a running manager does nothing.
	 */
	public void start() {
		synchronized (this.lifecycleMonitor) {
			if (this.cleanupScheduler != null) {
				return;
			}
			this.cleanupScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
				Thread thread = new Thread(r, "mcp-session-cleanup");
				thread.setDaemon(true);
				return thread;
			});
			this.cleanupScheduler.scheduleAtFixedRate(this::runCleanup, this.cleanupIntervalMs,
					this.cleanupIntervalMs, TimeUnit.MILLISECONDS);
		}
		logger.info("Session cleanup interval started (cleanupIntervalMs={}, staleTimeoutMs={})",
				this.cleanupIntervalMs, this.staleTimeoutMs);
	}

	/**
	 * Stops the background sweep. Must be called on graceful shutdown. Tracked sessions
	 * are kept; use {@link #clearAllSessions()} to drop them.
	 */
	public void stop() {
		ScheduledExecutorService scheduler;
		synchronized (this.lifecycleMonitor) {
			scheduler = this.cleanupScheduler;
			this.cleanupScheduler = null;
		}
		if (scheduler != null) {
			scheduler.shutdownNow();
			logger.info("Session cleanup interval stopped");
		}
	}

	/**
	 * Alias of {@link #stop()}.
	 */
	public void stopCleanupInterval() {
		stop();
	}

	public boolean isCleanupRunning() {
		synchronized (this.lifecycleMonitor) {
			return this.cleanupScheduler != null;
		}
	}

	public void addSessionListener(SessionListener listener) {
		Assert.notNull(listener, "listener must not be null");
		this.listeners.add(listener);
	}

	/**
	 * Creates a new session. A second call with the same id overwrites the first entry.
	 * @param sessionId unique session identifier
	 * @param clientId client identifier from the auth context, may be null
	 * @param tenantId tenant identifier from the auth context, may be null
	 * @return the session id
	 */
	public String createSession(String sessionId, @Nullable String clientId, @Nullable String tenantId) {
		Assert.hasText(sessionId, "sessionId must not be empty");
		long now = this.clock.getAsLong();
		this.sessions.put(sessionId, new SessionEntry(sessionId, now, clientId, tenantId));
		logger.debug("Created new MCP session {} (clientId={}, tenantId={}, totalSessions={})", sessionId, clientId,
				tenantId, this.sessions.size());
		return sessionId;
	}

	public String createSession(String sessionId) {
		return createSession(sessionId, null, null);
	}

	/**
	 * Checks that a session exists and is not stale. A stale entry is deleted by this
	 * call. Activity is not updated; see {@link #touchSession(String)}.
	 * @param sessionId session identifier to check
	 * @return true if the session exists and is not stale
	 */
	public boolean isSessionValid(@Nullable String sessionId) {
		if (sessionId == null) {
			return false;
		}
		long now = this.clock.getAsLong();
		SessionEntry[] expired = new SessionEntry[1];
		SessionEntry entry = this.sessions.computeIfPresent(sessionId, (id, current) -> {
			if (current.isStale(now, this.staleTimeoutMs)) {
				expired[0] = current;
				return null;
			}
			return current;
		});
		if (expired[0] != null) {
			logger.info("Session {} expired due to inactivity (ageMs={}, staleTimeoutMs={})", sessionId,
					now - expired[0].lastActivityAt(), this.staleTimeoutMs);
			notifyRemoved(sessionId, RemovalCause.EXPIRED);
			return false;
		}
		return entry != null;
	}

	/**
	 * Records activity on a session. Does nothing if the session is absent. The recorded
	 * time never moves backwards.
	 * @param sessionId session identifier to update
	 */
	public void touchSession(String sessionId) {
		SessionEntry entry = this.sessions.get(sessionId);
		if (entry != null) {
			entry.touch(this.clock.getAsLong());
		}
	}

	/**
	 * Explicitly terminates a session.
	 * @param sessionId session identifier to terminate
	 * @return true if the session existed
	 */
	public boolean terminateSession(String sessionId) {
		if (sessionId == null) {
			return false;
		}
		boolean existed = this.sessions.remove(sessionId) != null;
		if (existed) {
			logger.info("Session {} explicitly terminated (remainingSessions={})", sessionId, this.sessions.size());
			notifyRemoved(sessionId, RemovalCause.TERMINATED);
		}
		return existed;
	}

	/**
	 * Returns a copy of the session metadata if the session is valid.
	 * @param sessionId session identifier
	 * @return the metadata or null if the session is invalid or missing
	 */
	@Nullable
	public SessionMetadata getSessionMetadata(String sessionId) {
		if (!isSessionValid(sessionId)) {
			return null;
		}
		SessionEntry entry = this.sessions.get(sessionId);
		return entry != null ? entry.snapshot() : null;
	}

	public int getActiveSessionCount() {
		return this.sessions.size();
	}

	/**
	 * Removes every stale session. Runs periodically once {@link #start()} was called.
	 * @return the number of sessions removed
	 */
	public int cleanupStaleSessions() {
		long now = this.clock.getAsLong();
		int sessionsBefore = this.sessions.size();
		List<String> removed = new ArrayList<>();
		for (String sessionId : this.sessions.keySet()) {
			boolean[] stale = new boolean[1];
			this.sessions.computeIfPresent(sessionId, (id, current) -> {
				if (current.isStale(now, this.staleTimeoutMs)) {
					stale[0] = true;
					return null;
				}
				return current;
			});
			if (stale[0]) {
				removed.add(sessionId);
			}
		}
		removed.forEach(sessionId -> notifyRemoved(sessionId, RemovalCause.EXPIRED));
		if (!removed.isEmpty()) {
			logger.info("Cleaned up {} stale sessions (sessionsBefore={}, sessionsAfter={})", removed.size(),
					sessionsBefore, this.sessions.size());
		}
		else {
			logger.debug("No stale sessions found");
		}
		return removed.size();
	}

	/**
	 * Removes all sessions. Meant for tests and emergency cleanup.
	 */
	public void clearAllSessions() {
		List<String> ids = new ArrayList<>(this.sessions.keySet());
		int cleared = 0;
		for (String sessionId : ids) {
			if (this.sessions.remove(sessionId) != null) {
				cleared++;
				notifyRemoved(sessionId, RemovalCause.SHUTDOWN);
			}
		}
		logger.warn("All sessions cleared (clearedCount={})", cleared);
	}

	public long getStaleTimeoutMs() {
		return this.staleTimeoutMs;
	}

	public long getCleanupIntervalMs() {
		return this.cleanupIntervalMs;
	}

	private void runCleanup() {
		try {
			cleanupStaleSessions();
		}
		catch (RuntimeException e) {
			// an exception would cancel all future runs of the scheduled task
			logger.error("Stale session cleanup failed", e);
		}
	}

	private void notifyRemoved(String sessionId, RemovalCause cause) {
		for (SessionListener listener : this.listeners) {
			try {
				listener.onSessionRemoved(sessionId, cause);
			}
			catch (RuntimeException e) {
				logger.warn("Session listener failed for session {} ({})", sessionId, cause, e);
			}
		}
	}

	private static final class SessionEntry {

		private final String sessionId;

		private final long createdAt;

		private final AtomicLong lastActivityAt;

		private final String clientId;

		private final String tenantId;

		SessionEntry(String sessionId, long createdAt, String clientId, String tenantId) {
			this.sessionId = sessionId;
			this.createdAt = createdAt;
			this.lastActivityAt = new AtomicLong(createdAt);
			this.clientId = clientId;
			this.tenantId = tenantId;
		}

		long lastActivityAt() {
			return this.lastActivityAt.get();
		}

		void touch(long now) {
			this.lastActivityAt.accumulateAndGet(now, Math::max);
		}

		boolean isStale(long now, long staleTimeoutMs) {
			return now - this.lastActivityAt.get() > staleTimeoutMs;
		}

		SessionMetadata snapshot() {
			return new SessionMetadata(this.sessionId, this.createdAt, this.lastActivityAt.get(), this.clientId,
					this.tenantId);
		}

	}

	/**
	 * Builder for {@link SessionManager}.
	 */
	public static class Builder {

		private Duration staleTimeout = DEFAULT_STALE_TIMEOUT;

		private Duration cleanupInterval = DEFAULT_CLEANUP_INTERVAL;

		private LongSupplier clock = System::currentTimeMillis;

		private Builder() {
		}

		/**
		 * Sets how long a session may stay idle before it is considered expired.
		 * @param staleTimeout the idle timeout, must be positive
		 * @return this builder
		 */
		public Builder staleTimeout(Duration staleTimeout) {
			Assert.notNull(staleTimeout, "staleTimeout must not be null");
			Assert.isTrue(!staleTimeout.isNegative() && !staleTimeout.isZero(), "staleTimeout must be positive");
			this.staleTimeout = staleTimeout;
			return this;
		}

		/**
		 * Sets how often the background sweep runs.
		 * @param cleanupInterval the sweep interval, must be positive
		 * @return this builder
		 */
		public Builder cleanupInterval(Duration cleanupInterval) {
			Assert.notNull(cleanupInterval, "cleanupInterval must not be null");
			Assert.isTrue(!cleanupInterval.isNegative() && !cleanupInterval.isZero(),
					"cleanupInterval must be positive");
			this.cleanupInterval = cleanupInterval;
			return this;
		}

		/**
		 * Sets the time source, milliseconds since epoch.
		 * @param clock the clock
		 * @return this builder
		 */
		public Builder clock(LongSupplier clock) {
			Assert.notNull(clock, "clock must not be null");
			this.clock = clock;
			return this;
		}

		public SessionManager build() {
			return new SessionManager(this);
		}

	}

}
