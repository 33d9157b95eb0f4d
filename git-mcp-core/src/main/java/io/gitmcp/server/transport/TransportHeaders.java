/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.transport;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import io.gitmcp.spec.HttpHeaders;
import reactor.util.annotation.Nullable;

/**
 * Immutable, case-insensitive view of the request headers a transport manager needs.
 */
public final class TransportHeaders {

	private static final TransportHeaders EMPTY = new TransportHeaders(Map.of());

	private final Map<String, String> headers;

	private TransportHeaders(Map<String, String> headers) {
		TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		copy.putAll(headers);
		this.headers = Collections.unmodifiableMap(copy);
	}

	public static TransportHeaders of(Map<String, String> headers) {
		return new TransportHeaders(headers);
	}

	public static TransportHeaders empty() {
		return EMPTY;
	}

	@Nullable
	public String get(String name) {
		return this.headers.get(name);
	}

	public Map<String, String> asMap() {
		return this.headers;
	}

	/**
	 * Whether the client asked for a Server-Sent Events stream: the {@code Accept} header
	 * lists {@code text/event-stream} but not {@code application/json}.
	 * @return true if the response should be streamed
	 */
	public boolean prefersEventStream() {
		String accept = get(HttpHeaders.ACCEPT);
		if (accept == null) {
			return false;
		}
		boolean eventStream = false;
		boolean json = false;
		for (String type : Arrays.stream(accept.split(",")).map(String::trim).toList()) {
			String mediaType = type.split(";")[0].trim();
			if (AbstractTransportManager.TEXT_EVENT_STREAM.equalsIgnoreCase(mediaType)) {
				eventStream = true;
			}
			else if (AbstractTransportManager.APPLICATION_JSON.equalsIgnoreCase(mediaType)) {
				json = true;
			}
		}
		return eventStream && !json;
	}

	@Override
	public String toString() {
		return this.headers.toString();
	}

}
