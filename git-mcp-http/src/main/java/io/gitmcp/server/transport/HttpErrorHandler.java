/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.transport;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gitmcp.server.auth.BearerAuthenticator.AuthenticationException;
import io.gitmcp.spec.HandlerInitializationException;
import io.gitmcp.spec.McpError;
import io.gitmcp.spec.McpSchema;
import io.gitmcp.spec.McpSchema.ErrorCodes;
import io.gitmcp.spec.McpSessionNotFoundException;
import io.gitmcp.spec.ProtocolVersionUnsupportedException;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.util.annotation.Nullable;

/**
 * Single error boundary of the HTTP transport. Maps failures to an HTTP status and a
 * JSON-RPC error body. Internal details never reach the client; unexpected failures are
 * logged with their stack trace.
 */
public class HttpErrorHandler {

	private static final Logger logger = LoggerFactory.getLogger(HttpErrorHandler.class);

	static final String INTERNAL_ERROR_MESSAGE = "Internal error";

	private final ObjectMapper objectMapper;

	public HttpErrorHandler(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Writes the error response for a failure.
	 * @param error the failure
	 * @param body the parsed request body if it was read, used to echo the JSON-RPC id
	 * @param response the response to write
	 * @throws IOException if writing fails
	 */
	public void handle(Throwable error, @Nullable JsonNode body, HttpServletResponse response) throws IOException {
		Throwable cause = unwrap(error);
		Object id = extractId(body);

		if (cause instanceof ProtocolVersionUnsupportedException unsupported) {
			logger.warn("Unsupported MCP protocol version requested: {}", unsupported.getRequested());
			Map<String, Object> data = new LinkedHashMap<>();
			data.put("requested", unsupported.getRequested());
			data.put("supported", unsupported.getSupported());
			writeError(response, 400, ErrorCodes.SERVER_ERROR, unsupported.getMessage(), data, null);
		}
		else if (cause instanceof McpSessionNotFoundException notFound) {
			logger.warn("Session {} is invalid or expired", notFound.getSessionId());
			writeError(response, 404, ErrorCodes.SESSION_NOT_FOUND,
					"Session expired or invalid. Please reinitialize.", null, null);
		}
		else if (cause instanceof AuthenticationException) {
			logger.debug("Authentication failed: {}", cause.getMessage());
			response.setHeader("WWW-Authenticate", "Bearer");
			writeError(response, 401, ErrorCodes.SERVER_ERROR, "Unauthorized: " + cause.getMessage(), null, id);
		}
		else if (cause instanceof JsonProcessingException) {
			logger.debug("Invalid JSON body: {}", cause.getMessage());
			writeError(response, 400, ErrorCodes.PARSE_ERROR, "Parse error", null, null);
		}
		else if (cause instanceof McpError mcpError && mcpError.getJsonRpcError() != null) {
			McpSchema.JSONRPCResponse.JSONRPCError rpcError = mcpError.getJsonRpcError();
			int status = isClientError(rpcError.code()) ? 400 : 500;
			writeError(response, status, rpcError.code(), rpcError.message(), rpcError.data(), id);
		}
		else if (cause instanceof HandlerInitializationException) {
			logger.error("Failed to initialize MCP session", cause);
			writeError(response, 500, ErrorCodes.INTERNAL_ERROR, INTERNAL_ERROR_MESSAGE, null, id);
		}
		else {
			logger.error("Unexpected error while handling MCP request", cause);
			writeError(response, 500, ErrorCodes.INTERNAL_ERROR, INTERNAL_ERROR_MESSAGE, null, id);
		}
	}

	/**
	 * Writes a JSON-RPC error body.
	 * @param response the response
	 * @param status HTTP status
	 * @param code JSON-RPC error code
	 * @param message error message
	 * @param data error data, may be null
	 * @param id JSON-RPC id, may be null
	 * @throws IOException if writing fails
	 */
	public void writeError(HttpServletResponse response, int status, int code, String message, @Nullable Object data,
			@Nullable Object id) throws IOException {
		if (response.isCommitted()) {
			logger.warn("Response already committed, dropping error {} ({})", code, message);
			return;
		}
		response.setStatus(status);
		response.setContentType(AbstractTransportManager.APPLICATION_JSON);
		response.setCharacterEncoding("UTF-8");
		this.objectMapper.writeValue(response.getOutputStream(),
				McpSchema.JSONRPCErrorResponse.of(code, message, data, id));
	}

	private static boolean isClientError(Integer code) {
		return code != null && (code == ErrorCodes.INVALID_REQUEST || code == ErrorCodes.INVALID_PARAMS
				|| code == ErrorCodes.PARSE_ERROR || code == ErrorCodes.METHOD_NOT_FOUND);
	}

	private Object extractId(@Nullable JsonNode body) {
		if (body == null || !body.isObject()) {
			return null;
		}
		JsonNode id = body.get("id");
		if (id == null || id.isNull()) {
			return null;
		}
		return id.isNumber() ? id.numberValue() : id.asText();
	}

	static Throwable unwrap(Throwable error) {
		Throwable current = Exceptions.unwrap(error);
		while ((current instanceof CompletionException || current instanceof ExecutionException)
				&& current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}

}
