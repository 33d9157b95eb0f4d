/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.session;

import reactor.util.annotation.Nullable;

/**
 * Point-in-time copy of the metadata tracked for one MCP session.
 *
 * @param sessionId unique session identifier
 * @param createdAt creation time, milliseconds since epoch
 * @param lastActivityAt last request referencing the session, milliseconds since epoch
 * @param clientId client identifier from the auth context at creation, may be null
 * @param tenantId tenant identifier from the auth context at creation, may be null
 */
public record SessionMetadata(String sessionId, long createdAt, long lastActivityAt, @Nullable String clientId,
		@Nullable String tenantId) {
}
