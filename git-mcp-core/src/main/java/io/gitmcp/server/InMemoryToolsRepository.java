/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

import io.gitmcp.common.RequestContext;
import io.gitmcp.spec.McpSchema;
import io.gitmcp.util.Assert;
import reactor.core.publisher.Mono;

/**
 * {@link ToolsRepository} backed by a {@link ConcurrentHashMap}. Every registered tool
 * is visible in every context and the cursor is ignored.
 */
public class InMemoryToolsRepository implements ToolsRepository {

	private final ConcurrentHashMap<String, ToolSpecification> tools = new ConcurrentHashMap<>();

	public InMemoryToolsRepository() {
	}

	public InMemoryToolsRepository(List<ToolSpecification> initialTools) {
		if (initialTools != null) {
			initialTools.forEach(this::addTool);
		}
	}

	@Override
	public Mono<ToolsListResult> listTools(RequestContext context, String cursor) {
		// stable order, ConcurrentHashMap iteration order is undefined
		List<McpSchema.Tool> toolList = this.tools.values()
			.stream()
			.map(ToolSpecification::tool)
			.sorted(Comparator.comparing(McpSchema.Tool::name))
			.toList();
		return Mono.just(new ToolsListResult(toolList, null));
	}

	@Override
	public Mono<ToolSpecification> resolveToolForCall(String name, RequestContext context) {
		return Mono.justOrEmpty(this.tools.get(name));
	}

	@Override
	public void addTool(ToolSpecification tool) {
		Assert.notNull(tool, "tool must not be null");
		this.tools.put(tool.tool().name(), tool);
	}

	@Override
	public void removeTool(String name) {
		this.tools.remove(name);
	}

}
