/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.session;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiFunction;

import io.vmcp.aggregator.AggregatedCapabilities;
import io.vmcp.aggregator.ConflictResolutionStrategy;
import io.vmcp.aggregator.OperationKind;
import io.vmcp.aggregator.PrefixConflictResolution;
import io.vmcp.aggregator.RoutingEntry;
import io.vmcp.aggregator.RoutingTable;
import io.vmcp.auth.Identity;
import io.vmcp.auth.OutgoingCredentialResolver;
import io.vmcp.backend.Backend;
import io.vmcp.backend.BackendConnection;
import io.vmcp.observability.SessionObserver;
import io.vmcp.spec.BackendAuthorizationException;
import io.vmcp.spec.BackendSessionExpiredException;
import io.vmcp.spec.BackendUnavailableException;
import io.vmcp.spec.CredentialExpiredException;
import io.vmcp.spec.McpError;
import io.vmcp.spec.McpSchema;
import io.vmcp.spec.NoBackendsAvailableException;
import io.vmcp.spec.OperationNotFoundException;
import io.vmcp.spec.SessionCloseException;
import io.vmcp.spec.SessionClosedException;
import io.vmcp.spec.VmcpException;
import io.vmcp.util.Assert;
import io.vmcp.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.retry.Retry;

/**
 * Default {@link Session}.
 *
 * <p>
 * A read-write lock guards the connection map, the backend session tokens, the routing
 * table and the closed flag. Calls hold the read lock only to take a snapshot of what
 * they need and perform all I/O after releasing it. Connection recreation holds the
 * write lock only to swap map entries. The routing table only holds routes to backends
 * that currently have a connection; a backend whose recreation failed drops out of it
 * and is reconnected when one of its operations is called again.
 * </p>
 *
 * <p>
 * Every call, keepalive round and connection recreation registers itself as in flight
 * while holding the read lock, after checking the closed flag.
 * {@link #closeGracefully()} sets the flag under the write lock, so once it returns from
 * the lock no new call can register, and it waits for the in-flight count to reach zero
 * before closing any connection. A recreation that finishes after close has begun
 * closes its new connection instead of installing it.
 * </p>
 */
public class DefaultSession implements Session {

	private static final Logger logger = LoggerFactory.getLogger(DefaultSession.class);

	static final String REASON_SESSION_EXPIRED = "session_expired";

	static final String REASON_AUTHORIZATION = "authorization";

	static final String REASON_RECONNECT = "reconnect";

	static final String REASON_KEEPALIVE = "keepalive";

	private final String id;

	private final Identity identity;

	private final AggregatedCapabilities capabilities;

	private final Map<String, Backend> backends;

	private final Set<String> initiallyConnected;

	private final Set<String> failedBackends;

	private final ConflictResolutionStrategy conflictResolution;

	private final BackendReconnector reconnector;

	private final OutgoingCredentialResolver credentialResolver;

	private final ReinitializationPolicy policy;

	private final SessionObserver observer;

	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

	// guarded by lock
	private final Map<String, BackendConnection> connections;

	// guarded by lock
	private final Map<String, String> backendSessionIds;

	// guarded by lock; only routes to backends present in connections
	private RoutingTable routingTable;

	private final AtomicBoolean closed = new AtomicBoolean();

	private final AtomicInteger inFlight = new AtomicInteger();

	private final Sinks.Empty<Void> drained = Sinks.empty();

	private final Map<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();

	private final Map<String, Mono<BackendConnection>> pendingRecreations = new ConcurrentHashMap<>();

	private final Set<String> keepAliveUnsupported = ConcurrentHashMap.newKeySet();

	private final Mono<Void> closeMono;

	private DefaultSession(Builder builder) {
		this.id = builder.id;
		this.identity = builder.identity;
		this.capabilities = builder.capabilities;
		this.conflictResolution = builder.conflictResolution;
		this.reconnector = builder.reconnector;
		this.credentialResolver = builder.credentialResolver;
		this.policy = builder.policy;
		this.observer = builder.observer;

		this.backends = new LinkedHashMap<>();
		builder.backends.forEach(b -> this.backends.put(b.id(), b));
		this.connections = new LinkedHashMap<>(builder.connections);
		this.backendSessionIds = new HashMap<>();
		this.connections.forEach((backendId, connection) -> connection.backendSessionId()
			.ifPresent(token -> this.backendSessionIds.put(backendId, token)));
		this.routingTable = builder.capabilities.routingTable().retainBackends(this.connections.keySet());
		this.initiallyConnected = Set.copyOf(this.connections.keySet());

		Set<String> failed = new LinkedHashSet<>(this.backends.keySet());
		failed.removeAll(this.initiallyConnected);
		this.failedBackends = Collections.unmodifiableSet(failed);

		this.closeMono = Mono.defer(this::doClose).cache();
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String id() {
		return this.id;
	}

	@Override
	public Identity identity() {
		return this.identity;
	}

	@Override
	public List<McpSchema.Tool> tools() {
		RoutingTable routes = routingTable();
		return this.capabilities.tools()
			.stream()
			.filter(tool -> routes.lookup(OperationKind.TOOL, tool.name()) != null)
			.toList();
	}

	@Override
	public List<McpSchema.Resource> resources() {
		RoutingTable routes = routingTable();
		return this.capabilities.resources()
			.stream()
			.filter(resource -> routes.lookup(OperationKind.RESOURCE, resource.uri()) != null)
			.toList();
	}

	@Override
	public List<McpSchema.Prompt> prompts() {
		RoutingTable routes = routingTable();
		return this.capabilities.prompts()
			.stream()
			.filter(prompt -> routes.lookup(OperationKind.PROMPT, prompt.name()) != null)
			.toList();
	}

	@Override
	public RoutingTable routingTable() {
		this.lock.readLock().lock();
		try {
			return this.routingTable;
		}
		finally {
			this.lock.readLock().unlock();
		}
	}

	@Override
	public Map<String, String> backendSessionIds() {
		this.lock.readLock().lock();
		try {
			return Map.copyOf(this.backendSessionIds);
		}
		finally {
			this.lock.readLock().unlock();
		}
	}

	@Override
	public Set<String> connectedBackends() {
		this.lock.readLock().lock();
		try {
			return Collections.unmodifiableSet(new LinkedHashSet<>(this.connections.keySet()));
		}
		finally {
			this.lock.readLock().unlock();
		}
	}

	@Override
	public Set<String> failedBackends() {
		return this.failedBackends;
	}

	@Override
	public boolean isClosed() {
		return this.closed.get();
	}

	/**
	 * Number of calls currently executing against a backend.
	 * @return the in-flight count
	 */
	public int inFlightCalls() {
		return this.inFlight.get();
	}

	/**
	 * Number of threads currently holding the session's read lock. Calls never hold it
	 * while waiting for a backend, so this is zero whenever no map is being read.
	 * @return the read lock hold count across all threads
	 */
	public int readLockHolders() {
		return this.lock.getReadLockCount();
	}

	/**
	 * Circuit breaker state for a backend; {@link CircuitBreaker.State#CLOSED} until the
	 * first recreation.
	 * @param backendId the backend
	 * @return the breaker state
	 */
	public CircuitBreaker.State circuitBreakerState(String backendId) {
		CircuitBreaker breaker = this.circuitBreakers.get(backendId);
		return breaker != null ? breaker.state() : CircuitBreaker.State.CLOSED;
	}

	@Override
	public Mono<McpSchema.CallToolResult> callTool(String name, Map<String, Object> arguments) {
		return route(OperationKind.TOOL, name,
				(connection, originalName) -> connection.callTool(new McpSchema.CallToolRequest(originalName,
						arguments != null ? arguments : Map.of())));
	}

	@Override
	public Mono<McpSchema.ReadResourceResult> readResource(String uri) {
		return route(OperationKind.RESOURCE, uri,
				(connection, originalUri) -> connection.readResource(new McpSchema.ReadResourceRequest(originalUri)));
	}

	@Override
	public Mono<McpSchema.GetPromptResult> getPrompt(String name, Map<String, Object> arguments) {
		return route(OperationKind.PROMPT, name,
				(connection, originalName) -> connection.getPrompt(new McpSchema.GetPromptRequest(originalName,
						arguments != null ? arguments : Map.of())));
	}

	private <T> Mono<T> route(OperationKind kind, String exposedName,
			BiFunction<BackendConnection, String, Mono<T>> call) {
		return Mono.defer(() -> {
			RoutingEntry entry;
			BackendConnection connection;
			boolean noBackends;
			this.lock.readLock().lock();
			try {
				if (this.closed.get()) {
					return Mono.error(new SessionClosedException(this.id));
				}
				entry = this.routingTable.lookup(kind, exposedName);
				if (entry == null) {
					// routes of a backend that lost its connection are reconnected on demand
					RoutingEntry detached = this.capabilities.routingTable().lookup(kind, exposedName);
					if (detached != null && !this.connections.containsKey(detached.backendId())) {
						entry = detached;
					}
				}
				connection = entry != null ? this.connections.get(entry.backendId()) : null;
				noBackends = this.connections.isEmpty() && this.initiallyConnected.isEmpty();
				this.inFlight.incrementAndGet();
			}
			finally {
				this.lock.readLock().unlock();
			}

			if (entry == null) {
				leave();
				return Mono.error(routingMiss(kind, exposedName, noBackends));
			}

			RoutingEntry resolved = entry;
			long start = System.nanoTime();
			AtomicReference<Throwable> failure = new AtomicReference<>();
			Mono<BackendConnection> target = connection != null ? Mono.just(connection)
					: missingConnection(resolved.backendId());
			return target.flatMap(c -> invoke(resolved, c, call))
				.doOnError(failure::set)
				.doFinally(signal -> {
					leave();
					this.observer.operationCompleted(this.id, resolved.backendId(), kind, exposedName,
							Duration.ofNanos(System.nanoTime() - start), failure.get());
				});
		});
	}

	private Throwable routingMiss(OperationKind kind, String exposedName, boolean noBackends) {
		if (noBackends) {
			return new NoBackendsAvailableException(this.id);
		}
		Optional<String> owner = this.conflictResolution.owningBackend(exposedName, this.failedBackends);
		if (owner.isPresent()) {
			return new BackendUnavailableException(owner.get(), "backend failed to initialize");
		}
		return new OperationNotFoundException(kind.label(), exposedName);
	}

	private Mono<BackendConnection> missingConnection(String backendId) {
		if (!this.initiallyConnected.contains(backendId)) {
			return Mono.error(new BackendUnavailableException(backendId, "backend failed to initialize"));
		}
		return recreate(backendId, null, REASON_RECONNECT, reconnectAttempt(backendId))
			.onErrorMap(e -> !(e instanceof VmcpException),
					e -> new BackendUnavailableException(backendId, "reconnect failed", e));
	}

	private <T> Mono<T> invoke(RoutingEntry entry, BackendConnection connection,
			BiFunction<BackendConnection, String, Mono<T>> call) {
		String backendId = entry.backendId();
		return call.apply(connection, entry.originalName()).onErrorResume(error -> {
			if (Utils.findCause(error, BackendSessionExpiredException.class) != null) {
				logger.info("Backend {} lost session state for session {}, re-initializing", backendId, this.id);
				return recreate(backendId, connection, REASON_SESSION_EXPIRED, reconnectAttempt(backendId))
					.flatMap(fresh -> call.apply(fresh, entry.originalName()))
					.onErrorMap(e -> translate(backendId, e));
			}
			if (Utils.findCause(error, BackendAuthorizationException.class) != null) {
				logger.info("Backend {} rejected credentials for session {}, re-resolving", backendId, this.id);
				return recoverCredentials(backendId, connection)
					.flatMap(fresh -> call.apply(fresh, entry.originalName()))
					.onErrorMap(e -> e instanceof BackendAuthorizationException,
							e -> new CredentialExpiredException(backendId, "backend rejected refreshed credentials",
									e))
					.onErrorMap(e -> translate(backendId, e));
			}
			return Mono.error(translate(backendId, error));
		});
	}

	private Mono<BackendConnection> recoverCredentials(String backendId, BackendConnection stale) {
		Backend backend = backend(backendId);
		Mono<BackendConnection> attempt = Mono.defer(() -> {
			this.credentialResolver.invalidate(this.identity, backend);
			return this.reconnector.reconnect(backend);
		})
			.retryWhen(Retry.backoff(this.policy.authorizationAttempts() - 1, this.policy.minBackoff())
				.maxBackoff(this.policy.maxBackoff())
				.onRetryExhaustedThrow((spec, signal) -> signal.failure()));
		return recreate(backendId, stale, REASON_AUTHORIZATION, attempt).onErrorMap(
				e -> !(e instanceof CredentialExpiredException) && !(e instanceof SessionClosedException),
				e -> new CredentialExpiredException(backendId, "credential recovery failed", e));
	}

	/**
	 * Replaces the connection of a backend. Concurrent callers asking to replace the
	 * same backend share one attempt. If the connection was already replaced since the
	 * caller observed {@code stale}, the current connection is returned as is.
	 */
	private Mono<BackendConnection> recreate(String backendId, BackendConnection stale, String reason,
			Mono<BackendConnection> attempt) {
		return Mono.defer(() -> {
			BackendConnection current = currentConnection(backendId);
			if (current != null && current != stale) {
				return Mono.just(current);
			}
			CircuitBreaker breaker = this.circuitBreakers.computeIfAbsent(backendId,
					k -> this.policy.newCircuitBreaker());
			Mono<BackendConnection> recreation = this.pendingRecreations.computeIfAbsent(backendId,
					k -> breaker.tryAcquire() ? newRecreation(backendId, stale, reason, attempt, breaker) : null);
			if (recreation == null) {
				return Mono.error(new BackendUnavailableException(backendId, "circuit breaker open"));
			}
			return recreation;
		});
	}

	private Mono<BackendConnection> newRecreation(String backendId, BackendConnection stale, String reason,
			Mono<BackendConnection> attempt, CircuitBreaker breaker) {
		AtomicReference<Mono<BackendConnection>> self = new AtomicReference<>();
		Mono<BackendConnection> recreation = Mono.defer(() -> {
			if (!enter()) {
				return Mono.<BackendConnection>error(new SessionClosedException(this.id));
			}
			return closeQuietly(stale).then(attempt)
				.map(fresh -> install(backendId, stale, fresh))
				.doFinally(signal -> leave());
		})
			.doOnSuccess(fresh -> {
				breaker.recordSuccess();
				this.observer.backendReinitialized(this.id, backendId, reason, null);
			})
			.doOnError(e -> {
				if (!(e instanceof SessionClosedException)) {
					breaker.recordFailure();
				}
				evict(backendId, stale);
				this.observer.backendReinitialized(this.id, backendId, reason, e);
			})
			.doFinally(signal -> this.pendingRecreations.remove(backendId, self.get()))
			.cache();
		self.set(recreation);
		return recreation;
	}

	private BackendConnection install(String backendId, BackendConnection stale, BackendConnection fresh) {
		this.lock.writeLock().lock();
		try {
			if (this.closed.get()) {
				fresh.close();
				throw new SessionClosedException(this.id);
			}
			BackendConnection previous = this.connections.put(backendId, fresh);
			if (previous != null && previous != stale && previous != fresh) {
				previous.close();
			}
			fresh.backendSessionId().ifPresentOrElse(token -> this.backendSessionIds.put(backendId, token),
					() -> this.backendSessionIds.remove(backendId));
			if (previous == null) {
				this.routingTable = this.capabilities.routingTable().retainBackends(this.connections.keySet());
			}
		}
		finally {
			this.lock.writeLock().unlock();
		}
		logger.debug("Installed new connection for backend {} in session {}", backendId, this.id);
		return fresh;
	}

	private void evict(String backendId, BackendConnection stale) {
		this.lock.writeLock().lock();
		try {
			if (stale != null && this.connections.get(backendId) == stale) {
				this.connections.remove(backendId);
				this.backendSessionIds.remove(backendId);
				this.routingTable = this.routingTable.retainBackends(this.connections.keySet());
			}
		}
		finally {
			this.lock.writeLock().unlock();
		}
	}

	private BackendConnection currentConnection(String backendId) {
		this.lock.readLock().lock();
		try {
			return this.connections.get(backendId);
		}
		finally {
			this.lock.readLock().unlock();
		}
	}

	private Mono<BackendConnection> reconnectAttempt(String backendId) {
		return Mono.defer(() -> this.reconnector.reconnect(backend(backendId)));
	}

	private Backend backend(String backendId) {
		Backend backend = this.backends.get(backendId);
		if (backend == null) {
			throw new BackendUnavailableException(backendId, "backend is not part of session " + this.id);
		}
		return backend;
	}

	private Throwable translate(String backendId, Throwable error) {
		if (error instanceof VmcpException || error instanceof McpError) {
			return error;
		}
		McpError mcpError = Utils.findCause(error, McpError.class);
		if (mcpError != null) {
			return mcpError;
		}
		VmcpException vmcpException = Utils.findCause(error, VmcpException.class);
		if (vmcpException != null) {
			return vmcpException;
		}
		return new BackendUnavailableException(backendId,
				error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName(), error);
	}

	private static Mono<Void> closeQuietly(BackendConnection connection) {
		if (connection == null) {
			return Mono.empty();
		}
		return connection.closeGracefully().onErrorResume(e -> {
			logger.debug("Failed to close stale connection to backend {}", connection.backendId(), e);
			return Mono.empty();
		});
	}

	private boolean enter() {
		this.lock.readLock().lock();
		try {
			if (this.closed.get()) {
				return false;
			}
			this.inFlight.incrementAndGet();
			return true;
		}
		finally {
			this.lock.readLock().unlock();
		}
	}

	private void leave() {
		if (this.inFlight.decrementAndGet() == 0 && this.closed.get()) {
			this.drained.tryEmitEmpty();
		}
	}

	@Override
	public Mono<Void> keepAlive() {
		return Mono.defer(() -> {
			Map<String, BackendConnection> snapshot;
			this.lock.readLock().lock();
			try {
				if (this.closed.get()) {
					return Mono.empty();
				}
				snapshot = new LinkedHashMap<>(this.connections);
				this.inFlight.incrementAndGet();
			}
			finally {
				this.lock.readLock().unlock();
			}
			return Flux.fromIterable(snapshot.entrySet())
				.filter(e -> !this.keepAliveUnsupported.contains(e.getKey()))
				.flatMap(e -> ping(e.getKey(), e.getValue()))
				.then()
				.doFinally(signal -> leave());
		});
	}

	private Mono<Void> ping(String backendId, BackendConnection connection) {
		return connection.ping().onErrorResume(error -> {
			if (error instanceof McpError mcpError && mcpError.isMethodNotFound()) {
				logger.info("Backend {} does not support ping, keepalive disabled for it", backendId);
				this.keepAliveUnsupported.add(backendId);
				return Mono.empty();
			}
			if (Utils.findCause(error, BackendSessionExpiredException.class) != null) {
				return recreate(backendId, connection, REASON_KEEPALIVE, reconnectAttempt(backendId))
					.then()
					.onErrorResume(e -> {
						logger.warn("Proactive re-initialization of backend {} failed for session {}: {}", backendId,
								this.id, e.getMessage());
						return Mono.empty();
					});
			}
			logger.debug("Keepalive ping to backend {} failed for session {}: {}", backendId, this.id,
					error.getMessage());
			return Mono.empty();
		});
	}

	@Override
	public Mono<Void> closeGracefully() {
		return this.closeMono;
	}

	@Override
	public void close() {
		closeGracefully().subscribe(null,
				e -> logger.warn("Session {} closed with errors: {}", this.id, e.getMessage()));
	}

	private Mono<Void> doClose() {
		this.lock.writeLock().lock();
		try {
			this.closed.set(true);
		}
		finally {
			this.lock.writeLock().unlock();
		}
		if (this.inFlight.get() == 0) {
			this.drained.tryEmitEmpty();
		}
		return this.drained.asMono().then(Mono.defer(this::closeConnections));
	}

	private Mono<Void> closeConnections() {
		Map<String, BackendConnection> snapshot;
		this.lock.writeLock().lock();
		try {
			snapshot = new LinkedHashMap<>(this.connections);
			this.connections.clear();
			this.backendSessionIds.clear();
			this.routingTable = RoutingTable.empty();
		}
		finally {
			this.lock.writeLock().unlock();
		}
		List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());
		return Flux.fromIterable(snapshot.values())
			.flatMap(connection -> connection.closeGracefully().onErrorResume(e -> {
				logger.warn("Failed to close connection to backend {} of session {}", connection.backendId(), this.id,
						e);
				failures.add(e);
				return Mono.empty();
			}))
			.then(Mono.defer(() -> {
				if (failures.isEmpty()) {
					this.observer.sessionClosed(this.id, null);
					return Mono.<Void>empty();
				}
				SessionCloseException error = new SessionCloseException(this.id, failures.size());
				failures.forEach(error::addSuppressed);
				this.observer.sessionClosed(this.id, error);
				return Mono.<Void>error(error);
			}));
	}

	@Override
	public String toString() {
		return "DefaultSession[id=" + this.id + ", backends=" + connectedBackends() + ", closed=" + isClosed() + "]";
	}

	/**
	 * Builder for {@link DefaultSession}. Sessions are normally built by a
	 * {@link SessionFactory}.
	 */
	public static class Builder {

		private String id;

		private Identity identity = Identity.ANONYMOUS;

		private List<Backend> backends = List.of();

		private Map<String, BackendConnection> connections = Map.of();

		private AggregatedCapabilities capabilities = AggregatedCapabilities.empty();

		private ConflictResolutionStrategy conflictResolution = new PrefixConflictResolution();

		private BackendReconnector reconnector = backend -> Mono
			.error(new BackendUnavailableException(backend.id(), "reconnect not supported"));

		private OutgoingCredentialResolver credentialResolver = (identity, backend) -> Mono.empty();

		private ReinitializationPolicy policy = ReinitializationPolicy.DEFAULT;

		private SessionObserver observer = SessionObserver.NOOP;

		private Builder() {
		}

		public Builder id(String id) {
			Assert.hasText(id, "id must not be empty");
			this.id = id;
			return this;
		}

		public Builder identity(Identity identity) {
			Assert.notNull(identity, "identity must not be null");
			this.identity = identity;
			return this;
		}

		/**
		 * Every backend that was requested for the session, including those that failed
		 * to initialize, in priority order.
		 * @param backends the requested backends
		 * @return this builder
		 */
		public Builder backends(List<Backend> backends) {
			Assert.notNull(backends, "backends must not be null");
			this.backends = List.copyOf(backends);
			return this;
		}

		public Builder connections(Map<String, BackendConnection> connections) {
			Assert.notNull(connections, "connections must not be null");
			this.connections = new LinkedHashMap<>(connections);
			return this;
		}

		public Builder capabilities(AggregatedCapabilities capabilities) {
			Assert.notNull(capabilities, "capabilities must not be null");
			this.capabilities = capabilities;
			return this;
		}

		public Builder conflictResolution(ConflictResolutionStrategy conflictResolution) {
			Assert.notNull(conflictResolution, "conflictResolution must not be null");
			this.conflictResolution = conflictResolution;
			return this;
		}

		public Builder reconnector(BackendReconnector reconnector) {
			Assert.notNull(reconnector, "reconnector must not be null");
			this.reconnector = reconnector;
			return this;
		}

		public Builder credentialResolver(OutgoingCredentialResolver credentialResolver) {
			Assert.notNull(credentialResolver, "credentialResolver must not be null");
			this.credentialResolver = credentialResolver;
			return this;
		}

		public Builder reinitializationPolicy(ReinitializationPolicy policy) {
			Assert.notNull(policy, "policy must not be null");
			this.policy = policy;
			return this;
		}

		public Builder observer(SessionObserver observer) {
			Assert.notNull(observer, "observer must not be null");
			this.observer = observer;
			return this;
		}

		public DefaultSession build() {
			Assert.hasText(this.id, "id must be set");
			for (String backendId : this.connections.keySet()) {
				Assert.isTrue(this.backends.stream().anyMatch(b -> b.id().equals(backendId)),
						"connection for unknown backend " + backendId);
			}
			return new DefaultSession(this);
		}

	}

}
