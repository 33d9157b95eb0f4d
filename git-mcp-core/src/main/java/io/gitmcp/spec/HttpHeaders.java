/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.spec;

/**
 * Names of HTTP headers in use by the MCP HTTP transport.
 */
public interface HttpHeaders {

	/**
	 * Identifies individual MCP sessions.
	 */
	String MCP_SESSION_ID = "Mcp-Session-Id";

	/**
	 * Identifies the MCP protocol version.
	 */
	String MCP_PROTOCOL_VERSION = "MCP-Protocol-Version";

	/**
	 * Identifies events within an SSE Stream.
	 */
	String LAST_EVENT_ID = "Last-Event-ID";

	String ACCEPT = "Accept";

	String AUTHORIZATION = "Authorization";

	String ORIGIN = "Origin";

	String CONTENT_TYPE = "Content-Type";

}
