/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server;

import java.util.List;

import io.gitmcp.spec.McpSchema;

/**
 * Result of listing a {@link ToolsRepository}.
 *
 * @param tools the tools visible to the caller
 * @param nextCursor opaque token for the next page, or null when there is none
 */
public record ToolsListResult(List<McpSchema.Tool> tools, String nextCursor) {
}
