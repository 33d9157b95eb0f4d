/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.config;

import java.time.Duration;
import java.util.List;

import io.gitmcp.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Immutable server configuration. Build it with {@link #builder()} or load it with
 * {@link McpServerPropertiesLoader}.
 */
public final class McpServerProperties {

	public static final String DEFAULT_SERVER_NAME = "git-mcp-server";

	public static final String DEFAULT_SERVER_VERSION = "1.0.0";

	public static final String DEFAULT_HOST = "127.0.0.1";

	public static final int DEFAULT_PORT = 3015;

	public static final int DEFAULT_MAX_PORT_RETRIES = 15;

	public static final Duration DEFAULT_PORT_RETRY_DELAY = Duration.ofMillis(50);

	public static final String DEFAULT_ENDPOINT_PATH = "/mcp";

	private final TransportType transportType;

	private final SessionMode sessionMode;

	private final Duration staleSessionTimeout;

	private final Duration sessionCleanupInterval;

	private final String host;

	private final int port;

	private final int maxPortRetries;

	private final Duration portRetryDelay;

	private final String endpointPath;

	private final List<String> allowedOrigins;

	private final AuthMode authMode;

	private final List<String> authTokens;

	private final String serverName;

	private final String serverVersion;

	@Nullable
	private final String oauthIssuerUrl;

	@Nullable
	private final String resourceIdentifier;

	private McpServerProperties(Builder builder) {
		this.transportType = builder.transportType;
		this.sessionMode = builder.sessionMode;
		this.staleSessionTimeout = builder.staleSessionTimeout;
		this.sessionCleanupInterval = builder.sessionCleanupInterval;
		this.host = builder.host;
		this.port = builder.port;
		this.maxPortRetries = builder.maxPortRetries;
		this.portRetryDelay = builder.portRetryDelay;
		this.endpointPath = builder.endpointPath;
		this.allowedOrigins = List.copyOf(builder.allowedOrigins);
		this.authMode = builder.authMode;
		this.authTokens = List.copyOf(builder.authTokens);
		this.serverName = builder.serverName;
		this.serverVersion = builder.serverVersion;
		this.oauthIssuerUrl = builder.oauthIssuerUrl;
		this.resourceIdentifier = builder.resourceIdentifier;
	}

	public static Builder builder() {
		return new Builder();
	}

	public TransportType transportType() {
		return this.transportType;
	}

	public SessionMode sessionMode() {
		return this.sessionMode;
	}

	public Duration staleSessionTimeout() {
		return this.staleSessionTimeout;
	}

	public Duration sessionCleanupInterval() {
		return this.sessionCleanupInterval;
	}

	public String host() {
		return this.host;
	}

	public int port() {
		return this.port;
	}

	public int maxPortRetries() {
		return this.maxPortRetries;
	}

	public Duration portRetryDelay() {
		return this.portRetryDelay;
	}

	public String endpointPath() {
		return this.endpointPath;
	}

	/**
	 * Origins allowed to call the server. Empty means any origin.
	 * @return the allowed origins
	 */
	public List<String> allowedOrigins() {
		return this.allowedOrigins;
	}

	public AuthMode authMode() {
		return this.authMode;
	}

	/**
	 * Static bearer tokens, each {@code token|clientId|tenantId|scope scope}.
	 * @return the token entries
	 */
	public List<String> authTokens() {
		return this.authTokens;
	}

	public String serverName() {
		return this.serverName;
	}

	public String serverVersion() {
		return this.serverVersion;
	}

	@Nullable
	public String oauthIssuerUrl() {
		return this.oauthIssuerUrl;
	}

	@Nullable
	public String resourceIdentifier() {
		return this.resourceIdentifier;
	}

	@Override
	public String toString() {
		return "McpServerProperties[transportType=" + this.transportType + ", sessionMode=" + this.sessionMode
				+ ", host=" + this.host + ", port=" + this.port + ", endpointPath=" + this.endpointPath + ", authMode="
				+ this.authMode + ", allowedOrigins=" + this.allowedOrigins + "]";
	}

	/**
	 * Builder for {@link McpServerProperties}. Every setter validates its argument and
	 * throws {@link IllegalArgumentException} for invalid values.
	 */
	public static final class Builder {

		private TransportType transportType = TransportType.HTTP;

		private SessionMode sessionMode = SessionMode.AUTO;

		private Duration staleSessionTimeout = Duration.ofMinutes(30);

		private Duration sessionCleanupInterval = Duration.ofMinutes(5);

		private String host = DEFAULT_HOST;

		private int port = DEFAULT_PORT;

		private int maxPortRetries = DEFAULT_MAX_PORT_RETRIES;

		private Duration portRetryDelay = DEFAULT_PORT_RETRY_DELAY;

		private String endpointPath = DEFAULT_ENDPOINT_PATH;

		private List<String> allowedOrigins = List.of();

		private AuthMode authMode = AuthMode.NONE;

		private List<String> authTokens = List.of();

		private String serverName = DEFAULT_SERVER_NAME;

		private String serverVersion = DEFAULT_SERVER_VERSION;

		private String oauthIssuerUrl;

		private String resourceIdentifier;

		private Builder() {
		}

		public Builder transportType(TransportType transportType) {
			Assert.notNull(transportType, "transportType must not be null");
			this.transportType = transportType;
			return this;
		}

		public Builder sessionMode(SessionMode sessionMode) {
			Assert.notNull(sessionMode, "sessionMode must not be null");
			this.sessionMode = sessionMode;
			return this;
		}

		public Builder staleSessionTimeout(Duration staleSessionTimeout) {
			this.staleSessionTimeout = positive(staleSessionTimeout, "staleSessionTimeout");
			return this;
		}

		public Builder sessionCleanupInterval(Duration sessionCleanupInterval) {
			this.sessionCleanupInterval = positive(sessionCleanupInterval, "sessionCleanupInterval");
			return this;
		}

		public Builder host(String host) {
			Assert.hasText(host, "host must not be empty");
			this.host = host;
			return this;
		}

		/**
		 * Sets the first port tried. Port 0 picks a free port.
		 * @param port the port
		 * @return this builder
		 */
		public Builder port(int port) {
			Assert.isTrue(port >= 0 && port <= 65535, "port must be between 0 and 65535");
			this.port = port;
			return this;
		}

		public Builder maxPortRetries(int maxPortRetries) {
			Assert.isTrue(maxPortRetries >= 0, "maxPortRetries must not be negative");
			this.maxPortRetries = maxPortRetries;
			return this;
		}

		public Builder portRetryDelay(Duration portRetryDelay) {
			Assert.notNull(portRetryDelay, "portRetryDelay must not be null");
			Assert.isTrue(!portRetryDelay.isNegative(), "portRetryDelay must not be negative");
			this.portRetryDelay = portRetryDelay;
			return this;
		}

		public Builder endpointPath(String endpointPath) {
			Assert.hasText(endpointPath, "endpointPath must not be empty");
			Assert.isTrue(endpointPath.startsWith("/"), "endpointPath must start with '/'");
			this.endpointPath = endpointPath;
			return this;
		}

		public Builder allowedOrigins(List<String> allowedOrigins) {
			Assert.notNull(allowedOrigins, "allowedOrigins must not be null");
			this.allowedOrigins = allowedOrigins;
			return this;
		}

		public Builder authMode(AuthMode authMode) {
			Assert.notNull(authMode, "authMode must not be null");
			this.authMode = authMode;
			return this;
		}

		public Builder authTokens(List<String> authTokens) {
			Assert.notNull(authTokens, "authTokens must not be null");
			this.authTokens = authTokens;
			return this;
		}

		public Builder serverName(String serverName) {
			Assert.hasText(serverName, "serverName must not be empty");
			this.serverName = serverName;
			return this;
		}

		public Builder serverVersion(String serverVersion) {
			Assert.hasText(serverVersion, "serverVersion must not be empty");
			this.serverVersion = serverVersion;
			return this;
		}

		public Builder oauthIssuerUrl(@Nullable String oauthIssuerUrl) {
			this.oauthIssuerUrl = oauthIssuerUrl;
			return this;
		}

		public Builder resourceIdentifier(@Nullable String resourceIdentifier) {
			this.resourceIdentifier = resourceIdentifier;
			return this;
		}

		public McpServerProperties build() {
			return new McpServerProperties(this);
		}

		private static Duration positive(Duration value, String name) {
			Assert.notNull(value, name + " must not be null");
			Assert.isTrue(!value.isNegative() && !value.isZero(), name + " must be positive");
			return value;
		}

	}

}
