/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server.transport;

import java.util.List;

import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class CorsPolicyTests {

	@Mock
	private HttpServletResponse response;

	@Test
	void allowedOriginIsEchoed() {
		CorsPolicy policy = new CorsPolicy(new OriginValidator(List.of("http://localhost:5173")));

		policy.apply("http://localhost:5173", this.response);

		verify(this.response).setHeader("Access-Control-Allow-Origin", "http://localhost:5173");
		verify(this.response).setHeader("Access-Control-Allow-Credentials", "true");
		verify(this.response).setHeader("Access-Control-Allow-Methods", CorsPolicy.ALLOWED_METHODS);
		verify(this.response).setHeader("Access-Control-Allow-Headers",
				"Content-Type, Authorization, Mcp-Session-Id, MCP-Protocol-Version, Last-Event-ID");
		verify(this.response).setHeader("Access-Control-Expose-Headers", "Mcp-Session-Id");
		verify(this.response).addHeader("Vary", "Origin");
	}

	@Test
	void anyOriginGetsWildcardWithoutCredentials() {
		CorsPolicy policy = new CorsPolicy(new OriginValidator(List.of()));

		policy.apply("http://anywhere.example", this.response);

		verify(this.response).setHeader("Access-Control-Allow-Origin", "*");
		verify(this.response, never()).setHeader(eq("Access-Control-Allow-Credentials"), anyString());
		verify(this.response).setHeader("Access-Control-Expose-Headers", "Mcp-Session-Id");
	}

	@Test
	void nothingIsWrittenWithoutOrigin() {
		new CorsPolicy(new OriginValidator(List.of())).apply(null, this.response);

		verifyNoInteractions(this.response);
	}

	@Test
	void rejectedOriginGetsNoHeaders() {
		new CorsPolicy(new OriginValidator(List.of("http://localhost:5173"))).apply("http://evil.example",
				this.response);

		verify(this.response, never()).setHeader(anyString(), anyString());
	}

}
