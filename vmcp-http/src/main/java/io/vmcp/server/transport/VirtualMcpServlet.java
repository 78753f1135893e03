/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.server.transport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vmcp.aggregator.OperationKind;
import io.vmcp.auth.Identity;
import io.vmcp.server.SessionCapabilities;
import io.vmcp.server.SessionCapabilityRegistry;
import io.vmcp.server.SessionManager;
import io.vmcp.session.Session;
import io.vmcp.spec.McpError;
import io.vmcp.spec.McpSchema;
import io.vmcp.spec.McpSchema.JSONRPCMessage;
import io.vmcp.spec.McpSchema.JSONRPCRequest;
import io.vmcp.spec.McpSchema.JSONRPCResponse;
import io.vmcp.spec.OperationNotFoundException;
import io.vmcp.spec.SessionLimitExceededException;
import io.vmcp.spec.SessionNotFoundException;
import io.vmcp.spec.VmcpException;
import io.vmcp.util.Assert;
import io.vmcp.util.Utils;
import jakarta.servlet.ServletException;
import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Streamable HTTP front end of the virtual MCP server.
 *
 * <p>
 * An {@code initialize} request without a session header creates a session through the
 * {@link SessionManager} and returns its identifier in the {@code Mcp-Session-Id}
 * header. Every other request must carry that header and is served from the session's
 * registered capabilities. {@code DELETE} terminates the session. Server-initiated
 * streams are not offered, so {@code GET} answers 405.
 * </p>
 *
 * <p>
 * An unknown or expired session answers 404 and a request over the session cap answers
 * 503 with {@code Retry-After}; both carry a JSON-RPC error body. Errors of an
 * individual operation are returned as JSON-RPC errors with status 200.
 * </p>
 */
@WebServlet(asyncSupported = false)
public class VirtualMcpServlet extends HttpServlet {

	private static final long serialVersionUID = 1L;

	private static final Logger logger = LoggerFactory.getLogger(VirtualMcpServlet.class);

	public static final String MCP_SESSION_ID = "Mcp-Session-Id";

	private static final String APPLICATION_JSON = "application/json";

	private static final String UTF_8 = "UTF-8";

	public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);

	private static final TypeReference<Map<String, Object>> PARAMS_TYPE = new TypeReference<>() {
	};

	private final transient SessionManager sessionManager;

	private final transient SessionCapabilityRegistry capabilityRegistry;

	private final transient ObjectMapper objectMapper;

	private final transient IdentityResolver identityResolver;

	private final transient McpSchema.Implementation serverInfo;

	private final Duration requestTimeout;

	private VirtualMcpServlet(Builder builder) {
		this.sessionManager = builder.sessionManager;
		this.capabilityRegistry = builder.capabilityRegistry;
		this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
		this.identityResolver = builder.identityResolver;
		this.serverInfo = builder.serverInfo;
		this.requestTimeout = builder.requestTimeout;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
		JSONRPCMessage message;
		try (BufferedReader reader = req.getReader()) {
			String body = reader.lines().collect(Collectors.joining("\n"));
			message = McpSchema.deserializeJsonRpcMessage(this.objectMapper, body);
		}
		catch (IOException | IllegalArgumentException e) {
			logger.debug("Rejecting unreadable request: {}", e.getMessage());
			writeResponse(resp, HttpServletResponse.SC_BAD_REQUEST,
					JSONRPCResponse.failure(null, McpSchema.ErrorCodes.PARSE_ERROR, "Invalid JSON-RPC message", null));
			return;
		}

		String sessionId = req.getHeader(MCP_SESSION_ID);
		if (message instanceof JSONRPCRequest request && McpSchema.METHOD_INITIALIZE.equals(request.method())) {
			handleInitialize(req, resp, request);
			return;
		}
		if (!Utils.hasText(sessionId)) {
			writeResponse(resp, HttpServletResponse.SC_BAD_REQUEST, JSONRPCResponse.failure(idOf(message),
					McpSchema.ErrorCodes.INVALID_REQUEST, "Missing " + MCP_SESSION_ID + " header", null));
			return;
		}

		Session session;
		try {
			session = this.sessionManager.getSession(sessionId).block(this.requestTimeout);
		}
		catch (RuntimeException e) {
			writeError(resp, idOf(message), e);
			return;
		}

		if (!(message instanceof JSONRPCRequest request)) {
			resp.setStatus(HttpServletResponse.SC_ACCEPTED);
			return;
		}
		resp.setHeader(MCP_SESSION_ID, sessionId);
		try {
			Object result = dispatch(session, request).block(this.requestTimeout);
			writeResponse(resp, HttpServletResponse.SC_OK, JSONRPCResponse.success(request.id(), result));
		}
		catch (RuntimeException e) {
			writeError(resp, request.id(), e);
		}
	}

	@Override
	protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
		resp.setHeader("Allow", "POST, DELETE");
		resp.sendError(HttpServletResponse.SC_METHOD_NOT_ALLOWED);
	}

	@Override
	protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
		String sessionId = req.getHeader(MCP_SESSION_ID);
		if (!Utils.hasText(sessionId)) {
			resp.sendError(HttpServletResponse.SC_BAD_REQUEST, "Missing " + MCP_SESSION_ID + " header");
			return;
		}
		try {
			this.sessionManager.validate(sessionId).block(this.requestTimeout);
		}
		catch (SessionNotFoundException e) {
			writeError(resp, null, e);
			return;
		}
		this.sessionManager.terminate(sessionId).block(this.requestTimeout);
		logger.debug("Session {} terminated by client", sessionId);
		resp.setStatus(HttpServletResponse.SC_NO_CONTENT);
	}

	@Override
	public void destroy() {
		this.sessionManager.closeGracefully().block(this.requestTimeout);
		super.destroy();
	}

	private void handleInitialize(HttpServletRequest req, HttpServletResponse resp, JSONRPCRequest request)
			throws IOException {
		Identity identity;
		Session session;
		try {
			identity = this.identityResolver.resolve(req);
			session = this.sessionManager.initialize(identity).block(this.requestTimeout);
		}
		catch (RuntimeException e) {
			writeError(resp, request.id(), e);
			return;
		}
		logger.info("Session {} initialized for {} with backends {}", session.id(), identity.subject(),
				session.connectedBackends());
		McpSchema.InitializeResult result = new McpSchema.InitializeResult(McpSchema.LATEST_PROTOCOL_VERSION,
				capabilitiesOf(session).serverCapabilities(), this.serverInfo, null);
		resp.setHeader(MCP_SESSION_ID, session.id());
		writeResponse(resp, HttpServletResponse.SC_OK, JSONRPCResponse.success(request.id(), result));
	}

	private Mono<?> dispatch(Session session, JSONRPCRequest request) {
		SessionCapabilities capabilities = capabilitiesOf(session);
		Map<String, Object> params = request.params() != null
				? this.objectMapper.convertValue(request.params(), PARAMS_TYPE) : Map.of();
		switch (request.method()) {
			case McpSchema.METHOD_PING:
				return Mono.just(Map.of());
			case McpSchema.METHOD_TOOLS_LIST:
				return Mono.just(new McpSchema.ListToolsResult(
						capabilities.tools().stream().map(SessionCapabilities.ToolRegistration::tool).toList(), null));
			case McpSchema.METHOD_RESOURCES_LIST:
				return Mono.just(new McpSchema.ListResourcesResult(capabilities.resources()
					.stream()
					.map(SessionCapabilities.ResourceRegistration::resource)
					.toList(), null));
			case McpSchema.METHOD_PROMPT_LIST:
				return Mono.just(new McpSchema.ListPromptsResult(
						capabilities.prompts().stream().map(SessionCapabilities.PromptRegistration::prompt).toList(),
						null));
			case McpSchema.METHOD_TOOLS_CALL: {
				McpSchema.CallToolRequest call = this.objectMapper.convertValue(params, McpSchema.CallToolRequest.class);
				Map<String, Object> arguments = call.arguments() != null ? call.arguments() : Map.of();
				return capabilities.tools()
					.stream()
					.filter(registration -> registration.tool().name().equals(call.name()))
					.findFirst()
					.map(registration -> registration.handler().apply(arguments))
					.orElseGet(() -> Mono.error(new OperationNotFoundException(OperationKind.TOOL.label(), call.name())));
			}
			case McpSchema.METHOD_RESOURCES_READ: {
				McpSchema.ReadResourceRequest read = this.objectMapper.convertValue(params,
						McpSchema.ReadResourceRequest.class);
				return capabilities.resources()
					.stream()
					.filter(registration -> registration.resource().uri().equals(read.uri()))
					.findFirst()
					.map(registration -> registration.handler().apply(read))
					.orElseGet(() -> Mono
						.error(new OperationNotFoundException(OperationKind.RESOURCE.label(), read.uri())));
			}
			case McpSchema.METHOD_PROMPT_GET: {
				McpSchema.GetPromptRequest get = this.objectMapper.convertValue(params,
						McpSchema.GetPromptRequest.class);
				return capabilities.prompts()
					.stream()
					.filter(registration -> registration.prompt().name().equals(get.name()))
					.findFirst()
					.map(registration -> registration.handler().apply(get))
					.orElseGet(() -> Mono
						.error(new OperationNotFoundException(OperationKind.PROMPT.label(), get.name())));
			}
			default:
				return Mono.error(new McpError(new JSONRPCResponse.JSONRPCError(McpSchema.ErrorCodes.METHOD_NOT_FOUND,
						"Method not found: " + request.method(), null)));
		}
	}

	private SessionCapabilities capabilitiesOf(Session session) {
		return this.capabilityRegistry.capabilities(session.id()).orElseGet(() -> SessionCapabilities.from(session));
	}

	private void writeError(HttpServletResponse resp, Object id, Throwable error) throws IOException {
		SessionLimitExceededException limit = Utils.findCause(error, SessionLimitExceededException.class);
		if (limit != null) {
			resp.setHeader("Retry-After", String.valueOf(Math.max(1, limit.retryAfter().toSeconds())));
			writeResponse(resp, HttpServletResponse.SC_SERVICE_UNAVAILABLE,
					JSONRPCResponse.failure(id, limit.code(), limit.getMessage(), null));
			return;
		}
		SessionNotFoundException notFound = Utils.findCause(error, SessionNotFoundException.class);
		if (notFound != null) {
			writeResponse(resp, HttpServletResponse.SC_NOT_FOUND,
					JSONRPCResponse.failure(id, notFound.code(), notFound.getMessage(), null));
			return;
		}
		if (error instanceof VmcpException vmcpException) {
			writeResponse(resp, HttpServletResponse.SC_OK,
					JSONRPCResponse.failure(id, vmcpException.code(), vmcpException.getMessage(), null));
			return;
		}
		McpError mcpError = Utils.findCause(error, McpError.class);
		if (mcpError != null) {
			writeResponse(resp, HttpServletResponse.SC_OK,
					new JSONRPCResponse(McpSchema.JSONRPC_VERSION, id, null, mcpError.getJsonRpcError()));
			return;
		}
		logger.error("Request failed", error);
		writeResponse(resp, HttpServletResponse.SC_OK,
				JSONRPCResponse.failure(id, McpSchema.ErrorCodes.INTERNAL_ERROR, "Internal error", null));
	}

	private void writeResponse(HttpServletResponse resp, int status, JSONRPCResponse response) throws IOException {
		resp.setStatus(status);
		resp.setContentType(APPLICATION_JSON);
		resp.setCharacterEncoding(UTF_8);
		PrintWriter writer = resp.getWriter();
		writer.write(this.objectMapper.writeValueAsString(response));
		writer.flush();
	}

	private static Object idOf(JSONRPCMessage message) {
		return message instanceof JSONRPCRequest request ? request.id() : null;
	}

	/**
	 * Builder for {@link VirtualMcpServlet}.
	 */
	public static class Builder {

		private SessionManager sessionManager;

		private SessionCapabilityRegistry capabilityRegistry = SessionCapabilityRegistry.NOOP;

		private ObjectMapper objectMapper;

		private IdentityResolver identityResolver = IdentityResolver.BEARER_TOKEN;

		private McpSchema.Implementation serverInfo = new McpSchema.Implementation("vmcp", "0.1.0");

		private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		private Builder() {
		}

		public Builder sessionManager(SessionManager sessionManager) {
			Assert.notNull(sessionManager, "sessionManager must not be null");
			this.sessionManager = sessionManager;
			return this;
		}

		/**
		 * Sets the registry the {@link SessionManager} registers capabilities with.
		 * Without one, capabilities are read from the session on every request.
		 * @param capabilityRegistry the registry
		 * @return this builder
		 */
		public Builder capabilityRegistry(SessionCapabilityRegistry capabilityRegistry) {
			Assert.notNull(capabilityRegistry, "capabilityRegistry must not be null");
			this.capabilityRegistry = capabilityRegistry;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder identityResolver(IdentityResolver identityResolver) {
			Assert.notNull(identityResolver, "identityResolver must not be null");
			this.identityResolver = identityResolver;
			return this;
		}

		public Builder serverInfo(McpSchema.Implementation serverInfo) {
			Assert.notNull(serverInfo, "serverInfo must not be null");
			this.serverInfo = serverInfo;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			Assert.isPositive(requestTimeout, "requestTimeout must be positive");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public VirtualMcpServlet build() {
			Assert.notNull(this.sessionManager, "sessionManager must be set");
			return new VirtualMcpServlet(this);
		}

	}

}
