/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.session;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vmcp.spec.McpSchema;
import io.vmcp.spec.SessionClosedException;
import io.vmcp.util.Assert;
import io.vmcp.util.Utils;
import reactor.core.publisher.Mono;

/**
 * Adds a synthetic {@value #FIND_TOOL} tool that ranks the session's tools by how many
 * query keywords appear in their name and description. Sessions with many backends
 * expose a lot of tools; this lets a client look up the few it needs.
 */
public class ToolSearchSession extends DelegatingSession {

	public static final String FIND_TOOL = "find_tool";

	static final int DEFAULT_LIMIT = 5;

	private static final McpSchema.Tool FIND_TOOL_DESCRIPTOR = new McpSchema.Tool(FIND_TOOL,
			"Finds the tools of this session that best match a keyword query",
			Map.of("type", "object", "properties",
					Map.of("query", Map.of("type", "string", "description", "keywords to look for"), "limit",
							Map.of("type", "integer", "description", "maximum number of matches")),
					"required", List.of("query")));

	private final ObjectMapper objectMapper;

	public ToolSearchSession(Session delegate) {
		this(delegate, new ObjectMapper());
	}

	public ToolSearchSession(Session delegate, ObjectMapper objectMapper) {
		super(delegate);
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.objectMapper = objectMapper;
	}

	@Override
	public List<McpSchema.Tool> tools() {
		List<McpSchema.Tool> tools = new ArrayList<>(super.tools());
		if (tools.stream().noneMatch(t -> FIND_TOOL.equals(t.name()))) {
			tools.add(FIND_TOOL_DESCRIPTOR);
		}
		return List.copyOf(tools);
	}

	@Override
	public Mono<McpSchema.CallToolResult> callTool(String name, Map<String, Object> arguments) {
		if (!FIND_TOOL.equals(name) || super.tools().stream().anyMatch(t -> FIND_TOOL.equals(t.name()))) {
			return super.callTool(name, arguments);
		}
		return Mono.fromCallable(() -> {
			if (isClosed()) {
				throw new SessionClosedException(id());
			}
			Object query = arguments != null ? arguments.get("query") : null;
			if (!(query instanceof String text) || !Utils.hasText(text)) {
				return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent("query must not be empty")),
						true);
			}
			List<Map<String, Object>> matches = search(text, limit(arguments));
			return McpSchema.CallToolResult.text(this.objectMapper.writeValueAsString(matches));
		}).onErrorMap(JsonProcessingException.class, e -> new IllegalStateException("Failed to encode matches", e));
	}

	List<Map<String, Object>> search(String query, int limit) {
		Set<String> keywords = tokenize(query);
		List<Match> matches = new ArrayList<>();
		for (McpSchema.Tool tool : super.tools()) {
			Set<String> words = tokenize(tool.name() + " " + (tool.description() != null ? tool.description() : ""));
			long score = keywords.stream().filter(words::contains).count();
			if (score > 0) {
				matches.add(new Match(tool, score));
			}
		}
		return matches.stream()
			.sorted(Comparator.comparingLong(Match::score).reversed().thenComparing(m -> m.tool().name()))
			.limit(limit)
			.map(m -> {
				Map<String, Object> entry = new LinkedHashMap<>();
				entry.put("name", m.tool().name());
				if (m.tool().description() != null) {
					entry.put("description", m.tool().description());
				}
				entry.put("score", m.score());
				return entry;
			})
			.toList();
	}

	private static int limit(Map<String, Object> arguments) {
		Object limit = arguments.get("limit");
		if (limit instanceof Number number && number.intValue() > 0) {
			return number.intValue();
		}
		return DEFAULT_LIMIT;
	}

	private static Set<String> tokenize(String text) {
		return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
			.filter(word -> !word.isEmpty())
			.collect(Collectors.toSet());
	}

	private record Match(McpSchema.Tool tool, long score) {
	}

}
