/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.common;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import io.gitmcp.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Immutable per-request context threaded from the HTTP entrypoint through the
 * transport managers down to the protocol handler and the tools it dispatches to.
 * <p>
 * Every {@code withX} method returns an extended copy; an instance is never changed
 * after construction, so concurrent requests cannot observe each other's state.
 */
public final class RequestContext {

	private final String requestId;

	private final long timestamp;

	private final String operation;

	@Nullable
	private final String sessionId;

	@Nullable
	private final String protocolVersion;

	@Nullable
	private final AuthInfo authInfo;

	private final Map<String, Object> attributes;

	private RequestContext(String requestId, long timestamp, String operation, @Nullable String sessionId,
			@Nullable String protocolVersion, @Nullable AuthInfo authInfo, Map<String, Object> attributes) {
		this.requestId = requestId;
		this.timestamp = timestamp;
		this.operation = operation;
		this.sessionId = sessionId;
		this.protocolVersion = protocolVersion;
		this.authInfo = authInfo;
		this.attributes = attributes;
	}

	/**
	 * Creates a root context with a fresh correlation id.
	 * @param operation name of the operation that starts the request
	 * @return the new context
	 */
	public static RequestContext create(String operation) {
		Assert.hasText(operation, "operation must not be empty");
		return new RequestContext(UUID.randomUUID().toString(), System.currentTimeMillis(), operation, null, null,
				null, Collections.emptyMap());
	}

	public String requestId() {
		return this.requestId;
	}

	public long timestamp() {
		return this.timestamp;
	}

	public String operation() {
		return this.operation;
	}

	public Optional<String> sessionId() {
		return Optional.ofNullable(this.sessionId);
	}

	public Optional<String> protocolVersion() {
		return Optional.ofNullable(this.protocolVersion);
	}

	public Optional<AuthInfo> authInfo() {
		return Optional.ofNullable(this.authInfo);
	}

	public Optional<String> tenantId() {
		return authInfo().map(AuthInfo::tenantId);
	}

	public Optional<String> clientId() {
		return authInfo().map(AuthInfo::clientId);
	}

	@Nullable
	public Object get(String key) {
		return this.attributes.get(key);
	}

	public Map<String, Object> attributes() {
		return this.attributes;
	}

	public RequestContext withOperation(String operation) {
		Assert.hasText(operation, "operation must not be empty");
		return new RequestContext(requestId, timestamp, operation, sessionId, protocolVersion, authInfo, attributes);
	}

	public RequestContext withSessionId(@Nullable String sessionId) {
		return new RequestContext(requestId, timestamp, operation, sessionId, protocolVersion, authInfo, attributes);
	}

	public RequestContext withProtocolVersion(@Nullable String protocolVersion) {
		return new RequestContext(requestId, timestamp, operation, sessionId, protocolVersion, authInfo, attributes);
	}

	public RequestContext withAuthInfo(@Nullable AuthInfo authInfo) {
		return new RequestContext(requestId, timestamp, operation, sessionId, protocolVersion, authInfo, attributes);
	}

	public RequestContext with(String key, Object value) {
		Assert.hasText(key, "key must not be empty");
		Assert.notNull(value, "value must not be null");
		Map<String, Object> copy = new HashMap<>(this.attributes);
		copy.put(key, value);
		return new RequestContext(requestId, timestamp, operation, sessionId, protocolVersion, authInfo,
				Collections.unmodifiableMap(copy));
	}

	@Override
	public String toString() {
		return "RequestContext{requestId=" + requestId + ", operation=" + operation + ", sessionId=" + sessionId
				+ ", tenantId=" + tenantId().orElse(null) + "}";
	}

}
