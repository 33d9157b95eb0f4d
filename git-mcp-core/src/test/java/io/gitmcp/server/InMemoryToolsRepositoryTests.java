/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.gitmcp.server;

import java.util.List;

import io.gitmcp.common.RequestContext;
import io.gitmcp.spec.McpSchema;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

class InMemoryToolsRepositoryTests {

	private final RequestContext context = RequestContext.create("test");

	@Test
	void registeredToolsAreListedAndResolvable() {
		InMemoryToolsRepository repository = new InMemoryToolsRepository(List.of(tool("git_status"), tool("git_log")));

		StepVerifier.create(repository.listTools(this.context, null))
			.assertNext(result -> {
				assertThat(result.tools()).extracting(McpSchema.Tool::name).containsExactly("git_log", "git_status");
				assertThat(result.nextCursor()).isNull();
			})
			.verifyComplete();
		StepVerifier.create(repository.resolveToolForCall("git_log", this.context))
			.assertNext(spec -> assertThat(spec.tool().name()).isEqualTo("git_log"))
			.verifyComplete();
	}

	@Test
	void removedToolIsNoLongerResolvable() {
		InMemoryToolsRepository repository = new InMemoryToolsRepository();
		repository.addTool(tool("git_diff"));

		repository.removeTool("git_diff");

		StepVerifier.create(repository.resolveToolForCall("git_diff", this.context)).verifyComplete();
	}

	@Test
	void addingToolWithSameNameReplacesIt() {
		InMemoryToolsRepository repository = new InMemoryToolsRepository();
		repository.addTool(tool("git_show"));
		repository.addTool(new ToolSpecification(new McpSchema.Tool("git_show", "v2", null),
				(ctx, request) -> Mono.just(McpSchema.CallToolResult.text("v2"))));

		StepVerifier.create(repository.listTools(this.context, null))
			.assertNext(result -> assertThat(result.tools()).singleElement()
				.extracting(McpSchema.Tool::description)
				.isEqualTo("v2"))
			.verifyComplete();
	}

	@Test
	void toolWithoutNameIsRejected() {
		assertThatIllegalArgumentException().isThrownBy(() -> tool(""));
	}

	private static ToolSpecification tool(String name) {
		return new ToolSpecification(new McpSchema.Tool(name, "Runs " + name, null),
				(ctx, request) -> Mono.just(McpSchema.CallToolResult.text(name)));
	}

}
