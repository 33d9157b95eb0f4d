/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server;

import java.util.function.BiFunction;

import io.gitmcp.common.RequestContext;
import io.gitmcp.spec.McpSchema;
import io.gitmcp.util.Assert;
import reactor.core.publisher.Mono;

/**
 * A tool together with the function executing it. The call handler receives the
 * {@link RequestContext} of the request so that tenant, session and auth information
 * reach the tool.
 *
 * @param tool the tool definition including name, description and input schema
 * @param callHandler the function implementing the tool
 */
public record ToolSpecification(McpSchema.Tool tool,
		BiFunction<RequestContext, McpSchema.CallToolRequest, Mono<McpSchema.CallToolResult>> callHandler) {

	public ToolSpecification {
		Assert.notNull(tool, "tool must not be null");
		Assert.hasText(tool.name(), "tool name must not be empty");
		Assert.notNull(callHandler, "callHandler must not be null");
	}

}
