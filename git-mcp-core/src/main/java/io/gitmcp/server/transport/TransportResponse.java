/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.transport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.gitmcp.util.Assert;
import reactor.core.publisher.Flux;
import reactor.util.annotation.Nullable;

/**
 * The result of handling one request, independent of any HTTP framework. Carries either
 * a fully buffered body or a byte stream, never both.
 */
public final class TransportResponse {

	private final int statusCode;

	private final Map<String, String> headers;

	@Nullable
	private final Object body;

	@Nullable
	private final Flux<byte[]> stream;

	@Nullable
	private final String sessionId;

	private TransportResponse(int statusCode, Map<String, String> headers, @Nullable Object body,
			@Nullable Flux<byte[]> stream, @Nullable String sessionId) {
		Assert.isTrue((body == null) != (stream == null), "Exactly one of body or stream must be set");
		this.statusCode = statusCode;
		this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
		this.body = body;
		this.stream = stream;
		this.sessionId = sessionId;
	}

	public static TransportResponse body(int statusCode, Object body) {
		Assert.notNull(body, "body must not be null");
		return new TransportResponse(statusCode, Map.of(), body, null, null);
	}

	public static TransportResponse stream(int statusCode, Flux<byte[]> stream) {
		Assert.notNull(stream, "stream must not be null");
		return new TransportResponse(statusCode, Map.of(), null, stream, null);
	}

	/**
	 * A 204 response. Carries an empty stream.
	 * @return the response
	 */
	public static TransportResponse noContent() {
		return new TransportResponse(204, Map.of(), null, Flux.empty(), null);
	}

	public TransportResponse withHeader(String name, String value) {
		Assert.hasText(name, "header name must not be empty");
		Map<String, String> copy = new LinkedHashMap<>(this.headers);
		copy.put(name, value);
		return new TransportResponse(this.statusCode, copy, this.body, this.stream, this.sessionId);
	}

	public TransportResponse withSessionId(@Nullable String sessionId) {
		return new TransportResponse(this.statusCode, this.headers, this.body, this.stream, sessionId);
	}

	public int statusCode() {
		return this.statusCode;
	}

	public Map<String, String> headers() {
		return this.headers;
	}

	@Nullable
	public Object body() {
		return this.body;
	}

	@Nullable
	public Flux<byte[]> stream() {
		return this.stream;
	}

	public boolean isStream() {
		return this.stream != null;
	}

	@Nullable
	public String sessionId() {
		return this.sessionId;
	}

	@Override
	public String toString() {
		return "TransportResponse[statusCode=" + this.statusCode + ", headers=" + this.headers + ", "
				+ (isStream() ? "stream" : "body=" + this.body) + ", sessionId=" + this.sessionId + "]";
	}

}
