/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.client.transport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vmcp.backend.BackendConnection;
import io.vmcp.spec.BackendAuthorizationException;
import io.vmcp.spec.BackendSessionExpiredException;
import io.vmcp.spec.BackendUnavailableException;
import io.vmcp.spec.McpError;
import io.vmcp.spec.McpSchema;
import io.vmcp.spec.McpSchema.JSONRPCMessage;
import io.vmcp.spec.McpSchema.JSONRPCResponse;
import io.vmcp.spec.VmcpException;
import io.vmcp.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * A {@link BackendConnection} speaking Streamable HTTP to one backend.
 *
 * <p>
 * Every call is a POST of a single JSON-RPC message. The backend may answer with a JSON
 * body or with an event stream that carries the response; both are accepted. The
 * backend session identifier returned by {@code initialize} is sent with every later
 * request and released with a DELETE on close.
 * </p>
 *
 * <p>
 * HTTP failures are translated as follows: 404 (or 400 once a backend session exists)
 * means the backend forgot the session, 401 and 403 mean the credential was refused, any
 * other failure means the backend is unavailable. JSON-RPC errors are reported as
 * {@link McpError}.
 * </p>
 */
public class HttpBackendConnection implements BackendConnection {

	private static final Logger logger = LoggerFactory.getLogger(HttpBackendConnection.class);

	static final String MCP_SESSION_ID = "Mcp-Session-Id";

	private static final String APPLICATION_JSON = "application/json";

	private static final String TEXT_EVENT_STREAM = "text/event-stream";

	private static final String CONTENT_TYPE = "Content-Type";

	private static final String ACCEPT = "Accept";

	private final String backendId;

	private final URI endpoint;

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final Map<String, String> headers;

	private final Duration requestTimeout;

	private final AtomicReference<String> sessionId = new AtomicReference<>();

	private final AtomicLong requestCounter = new AtomicLong();

	private final AtomicBoolean closed = new AtomicBoolean();

	HttpBackendConnection(String backendId, URI endpoint, HttpClient httpClient, ObjectMapper objectMapper,
			Map<String, String> headers, Duration requestTimeout) {
		this.backendId = backendId;
		this.endpoint = endpoint;
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.headers = Map.copyOf(headers);
		this.requestTimeout = requestTimeout;
	}

	/**
	 * Runs the MCP handshake: {@code initialize}, then the {@code initialized}
	 * notification.
	 * @param clientInfo the name and version presented to the backend
	 * @param protocolVersion the protocol version requested
	 * @return this connection once the backend accepted it
	 */
	Mono<HttpBackendConnection> initialize(McpSchema.Implementation clientInfo, String protocolVersion) {
		McpSchema.InitializeRequest request = new McpSchema.InitializeRequest(protocolVersion, Map.of(), clientInfo);
		return this.request(McpSchema.METHOD_INITIALIZE, request, new TypeReference<McpSchema.InitializeResult>() {
		}).flatMap(result -> {
			logger.debug("Backend {} initialized with protocol {} (session {})", this.backendId,
					result.protocolVersion(), this.sessionId.get());
			return this.notify(McpSchema.METHOD_NOTIFICATION_INITIALIZED);
		}).thenReturn(this);
	}

	@Override
	public String backendId() {
		return this.backendId;
	}

	@Override
	public String endpoint() {
		return this.endpoint.toString();
	}

	@Override
	public Optional<String> backendSessionId() {
		return Optional.ofNullable(this.sessionId.get());
	}

	@Override
	public Mono<List<McpSchema.Tool>> listTools() {
		return this.toolsPage(null)
			.expand(result -> Utils.hasText(result.nextCursor()) ? this.toolsPage(result.nextCursor()) : Mono.empty())
			.concatMapIterable(result -> result.tools() != null ? result.tools() : List.of())
			.collectList();
	}

	@Override
	public Mono<List<McpSchema.Resource>> listResources() {
		return this.resourcesPage(null)
			.expand(result -> Utils.hasText(result.nextCursor()) ? this.resourcesPage(result.nextCursor())
					: Mono.empty())
			.concatMapIterable(result -> result.resources() != null ? result.resources() : List.of())
			.collectList();
	}

	@Override
	public Mono<List<McpSchema.Prompt>> listPrompts() {
		return this.promptsPage(null)
			.expand(result -> Utils.hasText(result.nextCursor()) ? this.promptsPage(result.nextCursor())
					: Mono.empty())
			.concatMapIterable(result -> result.prompts() != null ? result.prompts() : List.of())
			.collectList();
	}

	private Mono<McpSchema.ListToolsResult> toolsPage(String cursor) {
		return this.request(McpSchema.METHOD_TOOLS_LIST, new McpSchema.PaginatedRequest(cursor),
				new TypeReference<McpSchema.ListToolsResult>() {
				});
	}

	private Mono<McpSchema.ListResourcesResult> resourcesPage(String cursor) {
		return this.request(McpSchema.METHOD_RESOURCES_LIST, new McpSchema.PaginatedRequest(cursor),
				new TypeReference<McpSchema.ListResourcesResult>() {
				});
	}

	private Mono<McpSchema.ListPromptsResult> promptsPage(String cursor) {
		return this.request(McpSchema.METHOD_PROMPT_LIST, new McpSchema.PaginatedRequest(cursor),
				new TypeReference<McpSchema.ListPromptsResult>() {
				});
	}

	@Override
	public Mono<McpSchema.CallToolResult> callTool(McpSchema.CallToolRequest request) {
		return this.request(McpSchema.METHOD_TOOLS_CALL, request, new TypeReference<McpSchema.CallToolResult>() {
		});
	}

	@Override
	public Mono<McpSchema.ReadResourceResult> readResource(McpSchema.ReadResourceRequest request) {
		return this.request(McpSchema.METHOD_RESOURCES_READ, request,
				new TypeReference<McpSchema.ReadResourceResult>() {
				});
	}

	@Override
	public Mono<McpSchema.GetPromptResult> getPrompt(McpSchema.GetPromptRequest request) {
		return this.request(McpSchema.METHOD_PROMPT_GET, request, new TypeReference<McpSchema.GetPromptResult>() {
		});
	}

	@Override
	public Mono<Void> ping() {
		return this.request(McpSchema.METHOD_PING, null, new TypeReference<Object>() {
		}).then();
	}

	/**
	 * Releases the backend session with a DELETE. A backend that does not support
	 * explicit termination (405) or already forgot the session (404) is not an error.
	 */
	@Override
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			if (!this.closed.compareAndSet(false, true)) {
				return Mono.empty();
			}
			String id = this.sessionId.getAndSet(null);
			if (id == null) {
				return Mono.empty();
			}
			HttpRequest.Builder builder = this.requestBuilder().header(MCP_SESSION_ID, id).DELETE();
			return Mono.fromFuture(() -> this.httpClient.sendAsync(builder.build(), BodyHandlers.discarding()))
				.onErrorMap(e -> new BackendUnavailableException(this.backendId, "failed to release backend session",
						e))
				.flatMap(response -> {
					int status = response.statusCode();
					if (is2xx(status) || status == 404 || status == 405) {
						logger.debug("Released backend session {} on {}", id, this.backendId);
						return Mono.empty();
					}
					return Mono.error(new BackendUnavailableException(this.backendId,
							"backend session release answered HTTP " + status));
				});
		});
	}

	<T> Mono<T> request(String method, Object params, TypeReference<T> resultType) {
		return Mono.defer(() -> {
			if (this.closed.get()) {
				return Mono.error(new BackendUnavailableException(this.backendId, "connection closed"));
			}
			String id = this.backendId + "-" + this.requestCounter.incrementAndGet();
			McpSchema.JSONRPCRequest request = new McpSchema.JSONRPCRequest(McpSchema.JSONRPC_VERSION, method, id,
					params);
			return this.post(request).flatMap(response -> {
				JSONRPCResponse jsonRpcResponse = this.responseFor(id, response);
				if (jsonRpcResponse.error() != null) {
					return Mono.error(new McpError(jsonRpcResponse.error()));
				}
				return Mono.justOrEmpty(this.objectMapper.convertValue(jsonRpcResponse.result(), resultType));
			});
		});
	}

	private Mono<Void> notify(String method) {
		McpSchema.JSONRPCNotification notification = new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION,
				method, null);
		return this.post(notification).then();
	}

	private Mono<HttpResponse<String>> post(JSONRPCMessage message) {
		return Mono.defer(() -> {
			String body;
			try {
				body = this.objectMapper.writeValueAsString(message);
			}
			catch (JsonProcessingException e) {
				return Mono.error(new IllegalArgumentException("Failed to serialize message", e));
			}
			HttpRequest.Builder builder = this.requestBuilder()
				.header(CONTENT_TYPE, APPLICATION_JSON)
				.header(ACCEPT, APPLICATION_JSON + ", " + TEXT_EVENT_STREAM)
				.POST(BodyPublishers.ofString(body));
			String currentSession = this.sessionId.get();
			if (currentSession != null) {
				builder.header(MCP_SESSION_ID, currentSession);
			}
			return Mono.fromFuture(() -> this.httpClient.sendAsync(builder.build(), BodyHandlers.ofString()))
				.onErrorMap(e -> !(e instanceof VmcpException),
						e -> new BackendUnavailableException(this.backendId, "request failed: " + e.getMessage(), e))
				.flatMap(response -> {
					RuntimeException failure = this.statusError(response, currentSession);
					if (failure != null) {
						return Mono.error(failure);
					}
					response.headers().firstValue(MCP_SESSION_ID).ifPresent(this::captureSessionId);
					return Mono.just(response);
				});
		});
	}

	private HttpRequest.Builder requestBuilder() {
		HttpRequest.Builder builder = HttpRequest.newBuilder(this.endpoint).timeout(this.requestTimeout);
		this.headers.forEach(builder::header);
		return builder;
	}

	private void captureSessionId(String id) {
		if (this.sessionId.compareAndSet(null, id)) {
			logger.debug("Backend {} assigned session {}", this.backendId, id);
		}
	}

	private RuntimeException statusError(HttpResponse<String> response, String presentedSession) {
		int status = response.statusCode();
		if (is2xx(status)) {
			return null;
		}
		logger.debug("Backend {} answered HTTP {}: {}", this.backendId, status, response.body());
		if (status == 401 || status == 403) {
			return new BackendAuthorizationException(this.backendId, status);
		}
		if (presentedSession != null && (status == 404 || status == 400)) {
			this.sessionId.compareAndSet(presentedSession, null);
			return new BackendSessionExpiredException(this.backendId, presentedSession);
		}
		McpError jsonRpcError = this.jsonRpcError(response.body());
		if (jsonRpcError != null) {
			return new BackendUnavailableException(this.backendId, "backend answered HTTP " + status, jsonRpcError);
		}
		return new BackendUnavailableException(this.backendId, "backend answered HTTP " + status);
	}

	private McpError jsonRpcError(String body) {
		if (!Utils.hasText(body)) {
			return null;
		}
		try {
			JSONRPCMessage message = McpSchema.deserializeJsonRpcMessage(this.objectMapper, body);
			if (message instanceof JSONRPCResponse response && response.error() != null) {
				return new McpError(response.error());
			}
		}
		catch (IOException | IllegalArgumentException e) {
			logger.trace("Error body of backend {} is not JSON-RPC", this.backendId, e);
		}
		return null;
	}

	private JSONRPCResponse responseFor(String id, HttpResponse<String> response) {
		String contentType = response.headers().firstValue(CONTENT_TYPE).orElse("");
		List<String> payloads = contentType.startsWith(TEXT_EVENT_STREAM) ? eventData(response.body())
				: List.of(response.body());
		for (String payload : payloads) {
			try {
				JSONRPCMessage message = McpSchema.deserializeJsonRpcMessage(this.objectMapper, payload);
				if (message instanceof JSONRPCResponse jsonRpcResponse
						&& id.equals(String.valueOf(jsonRpcResponse.id()))) {
					return jsonRpcResponse;
				}
				logger.debug("Ignoring message from backend {} while waiting for {}: {}", this.backendId, id, message);
			}
			catch (IOException | IllegalArgumentException e) {
				throw new BackendUnavailableException(this.backendId, "unreadable response", e);
			}
		}
		throw new BackendUnavailableException(this.backendId, "no response to request " + id);
	}

	/**
	 * Extracts the data of every event in a {@code text/event-stream} body. Multi-line
	 * data is joined with newlines.
	 * @param body the raw stream
	 * @return one entry per event that carried data
	 */
	static List<String> eventData(String body) {
		List<String> events = new ArrayList<>();
		StringBuilder data = null;
		for (String line : body.split("\r\n|\r|\n", -1)) {
			if (line.isEmpty()) {
				if (data != null) {
					events.add(data.toString());
					data = null;
				}
			}
			else if (line.startsWith("data:")) {
				String value = line.substring(5);
				value = value.startsWith(" ") ? value.substring(1) : value;
				data = data == null ? new StringBuilder(value) : data.append('\n').append(value);
			}
		}
		if (data != null) {
			events.add(data.toString());
		}
		return events;
	}

	private static boolean is2xx(int status) {
		return status / 100 == 2;
	}

	@Override
	public String toString() {
		return "HttpBackendConnection[" + this.backendId + " -> " + this.endpoint + "]";
	}

}
