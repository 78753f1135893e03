/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.session;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import io.vmcp.aggregator.AggregatedCapabilities;
import io.vmcp.aggregator.CapabilityAggregator;
import io.vmcp.aggregator.ConflictResolutionStrategy;
import io.vmcp.aggregator.DefaultCapabilityAggregator;
import io.vmcp.aggregator.PrefixConflictResolution;
import io.vmcp.auth.Credential;
import io.vmcp.auth.Identity;
import io.vmcp.auth.OutgoingCredentialResolver;
import io.vmcp.auth.PassThroughCredentialResolver;
import io.vmcp.backend.Backend;
import io.vmcp.backend.BackendConnection;
import io.vmcp.backend.BackendConnector;
import io.vmcp.observability.SessionObserver;
import io.vmcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Default {@link SessionFactory}.
 *
 * <p>
 * Connects to the requested backends in parallel, at most {@code maxConcurrency} at a
 * time and each within {@code backendTimeout}. Backends that fail are logged and left
 * out. The surviving connections are handed to the {@link CapabilityAggregator}; a
 * backend whose capabilities cannot be discovered is dropped as well. If the whole
 * creation exceeds {@code creationTimeout}, or the caller cancels it, every connection
 * opened so far is closed. A timed out creation yields an empty session.
 * </p>
 */
public class DefaultSessionFactory implements SessionFactory {

	private static final Logger logger = LoggerFactory.getLogger(DefaultSessionFactory.class);

	public static final int DEFAULT_MAX_CONCURRENCY = 10;

	public static final Duration DEFAULT_BACKEND_TIMEOUT = Duration.ofSeconds(5);

	public static final Duration DEFAULT_CREATION_TIMEOUT = Duration.ofSeconds(30);

	private final BackendConnector connector;

	private final OutgoingCredentialResolver credentialResolver;

	private final CapabilityAggregator aggregator;

	private final ConflictResolutionStrategy conflictResolution;

	private final SessionObserver observer;

	private final int maxConcurrency;

	private final Duration backendTimeout;

	private final Duration creationTimeout;

	private final ReinitializationPolicy reinitializationPolicy;

	private final Supplier<String> idGenerator;

	private DefaultSessionFactory(Builder builder) {
		this.connector = builder.connector;
		this.credentialResolver = builder.credentialResolver;
		this.conflictResolution = builder.conflictResolution;
		this.aggregator = builder.aggregator != null ? builder.aggregator
				: new DefaultCapabilityAggregator(builder.conflictResolution);
		this.observer = builder.observer;
		this.maxConcurrency = builder.maxConcurrency;
		this.backendTimeout = builder.backendTimeout;
		this.creationTimeout = builder.creationTimeout;
		this.reinitializationPolicy = builder.reinitializationPolicy;
		this.idGenerator = builder.idGenerator;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String generateId() {
		return this.idGenerator.get();
	}

	@Override
	public Mono<Session> makeSession(Identity identity, List<Backend> backends) {
		return makeSessionWithId(generateId(), identity, backends);
	}

	@Override
	public Mono<Session> makeSessionWithId(String id, Identity identity, List<Backend> backends) {
		Assert.hasText(id, "id must not be empty");
		Assert.notNull(identity, "identity must not be null");
		Assert.notNull(backends, "backends must not be null");
		return Mono.defer(() -> {
			List<Backend> requested = distinct(backends);
			Map<String, BackendConnection> opened = new ConcurrentHashMap<>();

			return Flux.fromIterable(requested)
				.flatMap(backend -> initialize(id, identity, backend)
					.doOnNext(connection -> opened.put(backend.id(), connection)), this.maxConcurrency)
				.then(Mono.defer(() -> discover(id, inRequestOrder(requested, opened))))
				.timeout(this.creationTimeout)
				.onErrorResume(error -> {
					logger.warn("Creation of session {} failed, continuing without backends: {}", id,
							error.toString());
					closeAll(opened.values());
					return Mono.just(new Discovered(Map.of(), AggregatedCapabilities.empty()));
				})
				.doOnCancel(() -> closeAll(opened.values()))
				.map(discovered -> {
					DefaultSession session = DefaultSession.builder()
						.id(id)
						.identity(identity)
						.backends(requested)
						.connections(discovered.connections())
						.capabilities(discovered.capabilities())
						.conflictResolution(this.conflictResolution)
						.reconnector(backend -> connect(backend, identity))
						.credentialResolver(this.credentialResolver)
						.reinitializationPolicy(this.reinitializationPolicy)
						.observer(this.observer)
						.build();
					this.observer.sessionCreated(id, session.connectedBackends(), session.failedBackends());
					return (Session) session;
				});
		});
	}

	/**
	 * Opens one connection with freshly resolved credentials, bounded by the per-backend
	 * timeout.
	 * @param backend the backend
	 * @param identity the caller
	 * @return the initialized connection
	 */
	public Mono<BackendConnection> connect(Backend backend, Identity identity) {
		return this.credentialResolver.resolve(identity, backend)
			.defaultIfEmpty(Credential.NONE)
			.flatMap(credential -> this.connector.connect(backend, credential))
			.timeout(this.backendTimeout);
	}

	private Mono<BackendConnection> initialize(String sessionId, Identity identity, Backend backend) {
		return Mono.defer(() -> {
			long start = System.nanoTime();
			return connect(backend, identity).doOnNext(connection -> {
				logger.debug("Backend {} initialized for session {} (backend session {})", backend.id(), sessionId,
						connection.backendSessionId().orElse("none"));
				this.observer.backendInitialized(sessionId, backend.id(), Duration.ofNanos(System.nanoTime() - start),
						null);
			}).onErrorResume(error -> {
				logger.warn("Backend {} failed to initialize for session {}: {}", backend.id(), sessionId,
						error.toString());
				this.observer.backendInitialized(sessionId, backend.id(), Duration.ofNanos(System.nanoTime() - start),
						error);
				return Mono.empty();
			});
		});
	}

	private Mono<Discovered> discover(String sessionId, Map<String, BackendConnection> connections) {
		if (connections.isEmpty()) {
			logger.warn("No backend could be initialized for session {}", sessionId);
			return Mono.just(new Discovered(Map.of(), AggregatedCapabilities.empty()));
		}
		return this.aggregator.aggregate(connections).map(capabilities -> {
			if (capabilities.backendErrors().isEmpty()) {
				return new Discovered(connections, capabilities);
			}
			Map<String, BackendConnection> usable = new LinkedHashMap<>(connections);
			List<BackendConnection> dropped = new ArrayList<>();
			capabilities.backendErrors().forEach((backendId, error) -> {
				logger.warn("Dropping backend {} from session {}, capability discovery failed: {}", backendId,
						sessionId, error.getMessage());
				BackendConnection connection = usable.remove(backendId);
				if (connection != null) {
					dropped.add(connection);
				}
			});
			closeAll(dropped);
			return new Discovered(usable, capabilities);
		}).onErrorResume(error -> {
			logger.warn("Capability aggregation failed for session {}, session has no capabilities", sessionId,
					error);
			return Mono.just(new Discovered(connections, AggregatedCapabilities.empty()));
		});
	}

	private static List<Backend> distinct(List<Backend> backends) {
		Map<String, Backend> byId = new LinkedHashMap<>();
		for (Backend backend : backends) {
			if (byId.putIfAbsent(backend.id(), backend) != null) {
				logger.warn("Ignoring duplicate backend {}", backend.id());
			}
		}
		return List.copyOf(byId.values());
	}

	private static Map<String, BackendConnection> inRequestOrder(List<Backend> requested,
			Map<String, BackendConnection> opened) {
		Map<String, BackendConnection> ordered = new LinkedHashMap<>();
		for (Backend backend : requested) {
			BackendConnection connection = opened.get(backend.id());
			if (connection != null) {
				ordered.put(backend.id(), connection);
			}
		}
		return ordered;
	}

	private static void closeAll(Iterable<BackendConnection> connections) {
		for (BackendConnection connection : connections) {
			connection.closeGracefully()
				.subscribe(null, e -> logger.debug("Failed to close connection to backend {}",
						connection.backendId(), e));
		}
	}

	private record Discovered(Map<String, BackendConnection> connections, AggregatedCapabilities capabilities) {
	}

	/**
	 * Builder for {@link DefaultSessionFactory}.
	 */
	public static class Builder {

		private BackendConnector connector;

		private OutgoingCredentialResolver credentialResolver = new PassThroughCredentialResolver();

		private CapabilityAggregator aggregator;

		private ConflictResolutionStrategy conflictResolution = new PrefixConflictResolution();

		private SessionObserver observer = SessionObserver.NOOP;

		private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;

		private Duration backendTimeout = DEFAULT_BACKEND_TIMEOUT;

		private Duration creationTimeout = DEFAULT_CREATION_TIMEOUT;

		private ReinitializationPolicy reinitializationPolicy = ReinitializationPolicy.DEFAULT;

		private Supplier<String> idGenerator = () -> UUID.randomUUID().toString();

		private Builder() {
		}

		public Builder connector(BackendConnector connector) {
			Assert.notNull(connector, "connector must not be null");
			this.connector = connector;
			return this;
		}

		public Builder credentialResolver(OutgoingCredentialResolver credentialResolver) {
			Assert.notNull(credentialResolver, "credentialResolver must not be null");
			this.credentialResolver = credentialResolver;
			return this;
		}

		/**
		 * Sets the aggregator. When none is set a {@link DefaultCapabilityAggregator}
		 * using the configured conflict resolution is created.
		 * @param aggregator the aggregator
		 * @return this builder
		 */
		public Builder aggregator(CapabilityAggregator aggregator) {
			Assert.notNull(aggregator, "aggregator must not be null");
			this.aggregator = aggregator;
			return this;
		}

		public Builder conflictResolution(ConflictResolutionStrategy conflictResolution) {
			Assert.notNull(conflictResolution, "conflictResolution must not be null");
			this.conflictResolution = conflictResolution;
			return this;
		}

		public Builder observer(SessionObserver observer) {
			Assert.notNull(observer, "observer must not be null");
			this.observer = observer;
			return this;
		}

		public Builder maxConcurrency(int maxConcurrency) {
			Assert.isTrue(maxConcurrency > 0, "maxConcurrency must be positive");
			this.maxConcurrency = maxConcurrency;
			return this;
		}

		public Builder backendTimeout(Duration backendTimeout) {
			Assert.isPositive(backendTimeout, "backendTimeout must be positive");
			this.backendTimeout = backendTimeout;
			return this;
		}

		public Builder creationTimeout(Duration creationTimeout) {
			Assert.isPositive(creationTimeout, "creationTimeout must be positive");
			this.creationTimeout = creationTimeout;
			return this;
		}

		public Builder reinitializationPolicy(ReinitializationPolicy reinitializationPolicy) {
			Assert.notNull(reinitializationPolicy, "reinitializationPolicy must not be null");
			this.reinitializationPolicy = reinitializationPolicy;
			return this;
		}

		public Builder idGenerator(Supplier<String> idGenerator) {
			Assert.notNull(idGenerator, "idGenerator must not be null");
			this.idGenerator = idGenerator;
			return this;
		}

		public DefaultSessionFactory build() {
			Assert.notNull(this.connector, "connector must be set");
			return new DefaultSessionFactory(this);
		}

	}

}
