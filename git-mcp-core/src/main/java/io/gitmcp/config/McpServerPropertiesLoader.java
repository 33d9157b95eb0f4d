/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import io.gitmcp.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link McpServerProperties}. Each key is looked up, in decreasing priority, in
 * JVM system properties, environment variables, the optional classpath resource
 * {@value #PROPERTIES_RESOURCE}, and falls back to the built-in default.
 */
public final class McpServerPropertiesLoader {

	private static final Logger logger = LoggerFactory.getLogger(McpServerPropertiesLoader.class);

	public static final String PROPERTIES_RESOURCE = "git-mcp-server.properties";

	public static final String TRANSPORT_TYPE = "MCP_TRANSPORT_TYPE";

	public static final String SESSION_MODE = "MCP_SESSION_MODE";

	public static final String STALE_SESSION_TIMEOUT_MS = "MCP_STATEFUL_SESSION_STALE_TIMEOUT_MS";

	public static final String SESSION_CLEANUP_INTERVAL_MS = "MCP_SESSION_CLEANUP_INTERVAL_MS";

	public static final String HTTP_HOST = "MCP_HTTP_HOST";

	public static final String HTTP_PORT = "MCP_HTTP_PORT";

	public static final String HTTP_MAX_PORT_RETRIES = "MCP_HTTP_MAX_PORT_RETRIES";

	public static final String HTTP_PORT_RETRY_DELAY_MS = "MCP_HTTP_PORT_RETRY_DELAY_MS";

	public static final String HTTP_ENDPOINT_PATH = "MCP_HTTP_ENDPOINT_PATH";

	public static final String ALLOWED_ORIGINS = "MCP_ALLOWED_ORIGINS";

	public static final String AUTH_MODE = "MCP_AUTH_MODE";

	public static final String AUTH_TOKENS = "MCP_AUTH_TOKENS";

	public static final String SERVER_NAME = "MCP_SERVER_NAME";

	public static final String SERVER_VERSION = "MCP_SERVER_VERSION";

	public static final String OAUTH_ISSUER_URL = "MCP_OAUTH_ISSUER_URL";

	public static final String SERVER_RESOURCE_IDENTIFIER = "MCP_SERVER_RESOURCE_IDENTIFIER";

	private final UnaryOperator<String> systemProperties;

	private final UnaryOperator<String> environment;

	private final Properties fileProperties;

	public McpServerPropertiesLoader() {
		this(System::getProperty, System::getenv, loadResource(PROPERTIES_RESOURCE));
	}

	public McpServerPropertiesLoader(UnaryOperator<String> systemProperties, UnaryOperator<String> environment,
			Properties fileProperties) {
		this.systemProperties = systemProperties;
		this.environment = environment;
		this.fileProperties = fileProperties;
	}

	/**
	 * Resolves every key.
	 * @return the properties
	 * @throws IllegalArgumentException if a value is invalid
	 */
	public McpServerProperties load() {
		McpServerProperties.Builder builder = McpServerProperties.builder();
		apply(TRANSPORT_TYPE, TransportType::fromValue, builder::transportType);
		apply(SESSION_MODE, SessionMode::fromValue, builder::sessionMode);
		apply(STALE_SESSION_TIMEOUT_MS, v -> millis(STALE_SESSION_TIMEOUT_MS, v), builder::staleSessionTimeout);
		apply(SESSION_CLEANUP_INTERVAL_MS, v -> millis(SESSION_CLEANUP_INTERVAL_MS, v),
				builder::sessionCleanupInterval);
		apply(HTTP_HOST, String::trim, builder::host);
		apply(HTTP_PORT, v -> integer(HTTP_PORT, v), builder::port);
		apply(HTTP_MAX_PORT_RETRIES, v -> integer(HTTP_MAX_PORT_RETRIES, v), builder::maxPortRetries);
		apply(HTTP_PORT_RETRY_DELAY_MS, v -> millis(HTTP_PORT_RETRY_DELAY_MS, v), builder::portRetryDelay);
		apply(HTTP_ENDPOINT_PATH, String::trim, builder::endpointPath);
		apply(ALLOWED_ORIGINS, Utils::commaSeparated, builder::allowedOrigins);
		apply(AUTH_MODE, AuthMode::fromValue, builder::authMode);
		apply(AUTH_TOKENS, Utils::commaSeparated, builder::authTokens);
		apply(SERVER_NAME, String::trim, builder::serverName);
		apply(SERVER_VERSION, String::trim, builder::serverVersion);
		apply(OAUTH_ISSUER_URL, String::trim, builder::oauthIssuerUrl);
		apply(SERVER_RESOURCE_IDENTIFIER, String::trim, builder::resourceIdentifier);
		McpServerProperties properties = builder.build();
		logger.debug("Loaded configuration {}", properties);
		return properties;
	}

	/**
	 * Looks up a raw value.
	 * @param key the key
	 * @return the value of the highest priority source, or null
	 */
	public String resolve(String key) {
		String value = this.systemProperties.apply(key);
		if (!Utils.hasText(value)) {
			value = this.environment.apply(key);
		}
		if (!Utils.hasText(value)) {
			value = this.fileProperties.getProperty(key);
		}
		return Utils.hasText(value) ? value : null;
	}

	private <T> void apply(String key, Function<String, T> parser, Consumer<T> setter) {
		String value = resolve(key);
		if (value == null) {
			return;
		}
		try {
			setter.accept(parser.apply(value));
		}
		catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "' (" + e.getMessage() + ")",
					e);
		}
	}

	private static int integer(String key, String value) {
		try {
			return Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException(key + " must be an integer", e);
		}
	}

	private static Duration millis(String key, String value) {
		long millis;
		try {
			millis = Long.parseLong(value.trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException(key + " must be a number of milliseconds", e);
		}
		if (millis < 0) {
			throw new IllegalArgumentException(key + " must not be negative");
		}
		return Duration.ofMillis(millis);
	}

	static Properties loadResource(String resource) {
		Properties properties = new Properties();
		try (InputStream in = McpServerPropertiesLoader.class.getClassLoader().getResourceAsStream(resource)) {
			if (in != null) {
				properties.load(in);
				logger.debug("Loaded {} from classpath", resource);
			}
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read " + resource, e);
		}
		return properties;
	}

}
