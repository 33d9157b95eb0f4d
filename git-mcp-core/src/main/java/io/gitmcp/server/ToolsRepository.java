/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server;

import io.gitmcp.common.RequestContext;
import reactor.core.publisher.Mono;

/**
 * Source of the tools a protocol handler exposes.
 * <p>
 * Both lookups receive the {@link RequestContext}, so implementations may filter tools
 * per tenant or per client.
 */
public interface ToolsRepository {

	/**
	 * List tools visible in the given context.
	 * @param context the request context
	 * @param cursor an opaque pagination token, null for the first page
	 * @return a {@link Mono} emitting the visible tools
	 */
	Mono<ToolsListResult> listTools(RequestContext context, String cursor);

	/**
	 * Resolve a tool for execution. Implementations with access control return an
	 * empty Mono when the tool exists but may not be called in this context.
	 * @param name the tool name
	 * @param context the request context
	 * @return the specification if found and allowed, otherwise empty
	 */
	Mono<ToolSpecification> resolveToolForCall(String name, RequestContext context);

	void addTool(ToolSpecification tool);

	void removeTool(String name);

}
