/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.client.transport;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.function.Consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vmcp.auth.Credential;
import io.vmcp.backend.Backend;
import io.vmcp.backend.BackendConnection;
import io.vmcp.backend.BackendConnector;
import io.vmcp.spec.BackendUnavailableException;
import io.vmcp.spec.McpSchema;
import io.vmcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * {@link BackendConnector} for backends reachable over Streamable HTTP. All connections
 * share one {@link HttpClient}; each connection carries its own backend session and
 * credential headers.
 */
public class HttpBackendConnector implements BackendConnector {

	private static final Logger logger = LoggerFactory.getLogger(HttpBackendConnector.class);

	public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	public static final McpSchema.Implementation DEFAULT_CLIENT_INFO = new McpSchema.Implementation("vmcp",
			"0.1.0");

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final Duration requestTimeout;

	private final McpSchema.Implementation clientInfo;

	private final String protocolVersion;

	private HttpBackendConnector(Builder builder) {
		this.httpClient = builder.clientBuilder.build();
		this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
		this.requestTimeout = builder.requestTimeout;
		this.clientInfo = builder.clientInfo;
		this.protocolVersion = builder.protocolVersion;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public Mono<BackendConnection> connect(Backend backend, Credential credential) {
		return Mono.defer(() -> {
			URI endpoint;
			try {
				endpoint = URI.create(backend.endpoint());
			}
			catch (IllegalArgumentException e) {
				return Mono.error(new BackendUnavailableException(backend.id(), "invalid endpoint", e));
			}
			logger.debug("Connecting to backend {} at {}", backend.id(), endpoint);
			HttpBackendConnection connection = new HttpBackendConnection(backend.id(), endpoint, this.httpClient,
					this.objectMapper, credential.headers(), this.requestTimeout);
			return connection.initialize(this.clientInfo, this.protocolVersion)
				.onErrorResume(error -> connection.closeGracefully()
					.onErrorResume(closeError -> Mono.empty())
					.then(Mono.error(error)))
				.doOnCancel(() -> connection.closeGracefully()
					.subscribe(null, e -> logger.debug("Failed to release abandoned connection to {}", backend.id(),
							e)))
				.map(initialized -> (BackendConnection) initialized);
		});
	}

	/**
	 * Builder for {@link HttpBackendConnector}.
	 */
	public static class Builder {

		private HttpClient.Builder clientBuilder = HttpClient.newBuilder()
			.version(HttpClient.Version.HTTP_1_1)
			.connectTimeout(Duration.ofSeconds(10));

		private ObjectMapper objectMapper;

		private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		private McpSchema.Implementation clientInfo = DEFAULT_CLIENT_INFO;

		private String protocolVersion = McpSchema.LATEST_PROTOCOL_VERSION;

		private Builder() {
		}

		public Builder clientBuilder(HttpClient.Builder clientBuilder) {
			Assert.notNull(clientBuilder, "clientBuilder must not be null");
			this.clientBuilder = clientBuilder;
			return this;
		}

		/**
		 * Customizes the HTTP client builder.
		 * @param clientCustomizer the consumer to customize the HTTP client builder
		 * @return this builder
		 */
		public Builder customizeClient(Consumer<HttpClient.Builder> clientCustomizer) {
			Assert.notNull(clientCustomizer, "clientCustomizer must not be null");
			clientCustomizer.accept(this.clientBuilder);
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			Assert.isPositive(requestTimeout, "requestTimeout must be positive");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public Builder clientInfo(McpSchema.Implementation clientInfo) {
			Assert.notNull(clientInfo, "clientInfo must not be null");
			this.clientInfo = clientInfo;
			return this;
		}

		public Builder protocolVersion(String protocolVersion) {
			Assert.hasText(protocolVersion, "protocolVersion must not be empty");
			this.protocolVersion = protocolVersion;
			return this;
		}

		public HttpBackendConnector build() {
			return new HttpBackendConnector(this);
		}

	}

}
