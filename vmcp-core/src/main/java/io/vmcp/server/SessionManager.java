/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.server;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;
import java.util.function.UnaryOperator;

import io.vmcp.auth.Identity;
import io.vmcp.backend.Backend;
import io.vmcp.backend.BackendRegistry;
import io.vmcp.observability.SessionObserver;
import io.vmcp.session.Session;
import io.vmcp.session.SessionFactory;
import io.vmcp.spec.SessionLimitExceededException;
import io.vmcp.spec.SessionNotFoundException;
import io.vmcp.store.InMemorySessionStore;
import io.vmcp.store.SessionMetadata;
import io.vmcp.store.SessionStore;
import io.vmcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Adapts sessions to a protocol front end that asks for a session identifier before it
 * knows who the caller is.
 *
 * <p>
 * Creation happens in two phases. {@link #generate()} issues an identifier and stores a
 * placeholder; it is the only place the active-session cap is enforced, and a request
 * over the cap is rejected right away. {@link #populate(String, Identity, List)} later
 * builds the session for that identifier and registers its capabilities.
 * </p>
 *
 * <p>
 * Live sessions are held by this instance only; the {@link SessionStore} holds
 * metadata. An identifier the store knows but this instance does not (for example one
 * issued by another instance) is reported as not found.
 * </p>
 */
public class SessionManager {

	private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

	public static final int DEFAULT_MAX_SESSIONS = 1000;

	public static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(5);

	private final SessionFactory sessionFactory;

	private final SessionStore store;

	private final BackendRegistry backendRegistry;

	private final SessionCapabilityRegistry capabilityRegistry;

	private final SessionObserver observer;

	private final UnaryOperator<Session> sessionDecorator;

	private final int maxSessions;

	private final Duration retryAfter;

	private final LongSupplier currentTimeMillisSupplier;

	private final ConcurrentHashMap<String, SessionEntry> sessions = new ConcurrentHashMap<>();

	private final AtomicInteger activeSessions = new AtomicInteger();

	private final Disposable keepAlive;

	private SessionManager(Builder builder) {
		this.sessionFactory = builder.sessionFactory;
		this.store = builder.store;
		this.backendRegistry = builder.backendRegistry;
		this.capabilityRegistry = builder.capabilityRegistry;
		this.observer = builder.observer;
		this.sessionDecorator = builder.sessionDecorator;
		this.maxSessions = builder.maxSessions;
		this.retryAfter = builder.retryAfter;
		this.currentTimeMillisSupplier = builder.currentTimeMillisSupplier;

		this.store.setExpirationListener(metadata -> {
			logger.info("Session {} expired", metadata.id());
			return closeLocal(metadata.id());
		});

		if (builder.keepAliveInterval != null) {
			this.keepAlive = Flux.interval(builder.keepAliveInterval, builder.keepAliveInterval)
				.onBackpressureDrop()
				.concatMap(tick -> keepAliveAll(), 1)
				.subscribe(null, e -> logger.error("Keepalive loop terminated", e));
		}
		else {
			this.keepAlive = null;
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Phase one of session creation: issues a fresh identifier and stores a
	 * placeholder for it.
	 * @return the identifier, or {@link SessionLimitExceededException} if the cap on
	 * active sessions is reached
	 */
	public Mono<String> generate() {
		return Mono.defer(() -> {
			if (!tryReserve()) {
				int active = this.activeSessions.get();
				logger.warn("Rejecting new session, {} of {} sessions active", active, this.maxSessions);
				this.observer.sessionRejected(active);
				return Mono.error(new SessionLimitExceededException(this.retryAfter));
			}
			String id = this.sessionFactory.generateId();
			long now = this.currentTimeMillisSupplier.getAsLong();
			SessionEntry entry = new SessionEntry(now);
			if (this.sessions.putIfAbsent(id, entry) != null) {
				release();
				return Mono.error(new IllegalStateException("Duplicate session id generated: " + id));
			}
			return this.store.add(id, SessionMetadata.placeholder(id, now)).thenReturn(id).onErrorResume(e -> {
				if (this.sessions.remove(id, entry)) {
					release();
				}
				return Mono.error(e);
			});
		});
	}

	/**
	 * Phase two of session creation: builds the session for an identifier issued by
	 * {@link #generate()}, replaces the placeholder and registers the session's
	 * capabilities.
	 * @param id the issued identifier
	 * @param identity the caller
	 * @param backends the backends of the session
	 * @return the session
	 */
	public Mono<Session> populate(String id, Identity identity, List<Backend> backends) {
		return Mono.defer(() -> {
			SessionEntry entry = this.sessions.get(id);
			if (entry == null || entry.terminated.get()) {
				return Mono.error(new SessionNotFoundException(id));
			}
			if (!entry.populating.compareAndSet(false, true)) {
				return Mono.error(new IllegalStateException("Session " + id + " is already populated"));
			}
			return this.sessionFactory.makeSessionWithId(id, identity, backends)
				.map(this.sessionDecorator)
				.flatMap(session -> {
					entry.session.set(session);
					if (entry.terminated.get()) {
						return session.closeGracefully()
							.onErrorResume(e -> Mono.empty())
							.then(Mono.<Session>error(new SessionNotFoundException(id, "terminated during creation")));
					}
					SessionMetadata metadata = new SessionMetadata(id, entry.createdAt,
							this.currentTimeMillisSupplier.getAsLong(), identity.reference());
					return this.store.add(id, metadata).then(Mono.defer(() -> {
						if (!entry.terminated.get()) {
							this.capabilityRegistry.register(id, SessionCapabilities.from(session));
						}
						// terminate sets the flag before unregistering, so a registration it missed is undone here
						if (entry.terminated.get()) {
							this.capabilityRegistry.unregister(id);
							return this.store.delete(id)
								.then(Mono.<Session>error(new SessionNotFoundException(id, "terminated during creation")));
						}
						logger.debug("Session {} populated with backends {}", id, session.connectedBackends());
						return Mono.just(session);
					}));
				});
		});
	}

	/**
	 * Runs both creation phases for a caller, taking the backends from the
	 * {@link BackendRegistry}.
	 * @param identity the caller
	 * @return the new session
	 */
	public Mono<Session> initialize(Identity identity) {
		Assert.notNull(identity, "identity must not be null");
		return generate().flatMap(id -> this.backendRegistry.backendsFor(identity)
			.defaultIfEmpty(List.of())
			.flatMap(backends -> populate(id, identity, backends))
			.onErrorResume(e -> terminate(id).then(Mono.error(e)))
			.doOnCancel(() -> terminate(id).subscribe()));
	}

	/**
	 * Resolves an identifier to its live session and extends the session's TTL.
	 * @param id the identifier the client presented
	 * @return the session, or {@link SessionNotFoundException} if the identifier is
	 * unknown, expired, terminated, still being populated or owned by another instance
	 */
	public Mono<Session> getSession(String id) {
		if (id == null) {
			return Mono.error(new SessionNotFoundException(null, "no session id"));
		}
		return this.store.get(id)
			.switchIfEmpty(Mono.error(() -> new SessionNotFoundException(id, "unknown or expired")))
			.flatMap(metadata -> {
				SessionEntry entry = this.sessions.get(id);
				if (entry == null) {
					return Mono.error(new SessionNotFoundException(id, "not served by this instance"));
				}
				Session session = entry.session.get();
				if (session != null && session.isClosed() && !entry.terminated.get()) {
					// closed without terminate; give back its slot and its record
					logger.debug("Session {} was closed directly, releasing it", id);
					return terminate(id).then(Mono.<Session>error(new SessionNotFoundException(id, "closed")));
				}
				if (entry.terminated.get() || session == null) {
					return Mono.error(new SessionNotFoundException(id,
							session == null ? "initialization pending" : "terminated"));
				}
				return Mono.just(session);
			});
	}

	public Mono<Void> validate(String id) {
		return getSession(id).then();
	}

	/**
	 * Closes a session and deletes its metadata. The connections are closed before the
	 * record is removed. Terminating an unknown or already terminated identifier has no
	 * effect.
	 * @param id the identifier
	 * @return a Mono that completes once the session is gone
	 */
	public Mono<Void> terminate(String id) {
		if (id == null) {
			return Mono.empty();
		}
		return closeLocal(id).then(this.store.delete(id));
	}

	private Mono<Void> closeLocal(String id) {
		return Mono.defer(() -> {
			SessionEntry entry = this.sessions.get(id);
			if (entry == null || !entry.terminated.compareAndSet(false, true)) {
				return Mono.empty();
			}
			this.capabilityRegistry.unregister(id);
			this.sessions.remove(id, entry);
			release();
			Session session = entry.session.get();
			if (session == null) {
				return Mono.empty();
			}
			return session.closeGracefully()
				.onErrorResume(e -> {
					logger.warn("Session {} did not close cleanly: {}", id, e.getMessage());
					return Mono.empty();
				});
		});
	}

	private Mono<Void> keepAliveAll() {
		return Flux.fromIterable(this.sessions.values())
			.map(entry -> entry.session)
			.flatMap(ref -> Mono.justOrEmpty(ref.get()))
			.flatMap(session -> session.keepAlive().onErrorResume(e -> {
				logger.debug("Keepalive failed for session {}", session.id(), e);
				return Mono.empty();
			}))
			.then();
	}

	public int activeSessionCount() {
		return this.activeSessions.get();
	}

	public int maxSessions() {
		return this.maxSessions;
	}

	/**
	 * Terminates every session and stops background work.
	 * @return a Mono that completes once all sessions are closed
	 */
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			if (this.keepAlive != null) {
				this.keepAlive.dispose();
			}
			return Flux.fromIterable(List.copyOf(this.sessions.keySet()))
				.flatMap(this::terminate)
				.then(this.store.closeGracefully());
		});
	}

	private boolean tryReserve() {
		int current;
		do {
			current = this.activeSessions.get();
			if (current >= this.maxSessions) {
				return false;
			}
		}
		while (!this.activeSessions.compareAndSet(current, current + 1));
		return true;
	}

	private void release() {
		this.activeSessions.decrementAndGet();
	}

	private static final class SessionEntry {

		private final long createdAt;

		private final AtomicReference<Session> session = new AtomicReference<>();

		private final AtomicBoolean populating = new AtomicBoolean();

		private final AtomicBoolean terminated = new AtomicBoolean();

		private SessionEntry(long createdAt) {
			this.createdAt = createdAt;
		}

	}

	/**
	 * Builder for {@link SessionManager}.
	 */
	public static class Builder {

		private SessionFactory sessionFactory;

		private SessionStore store;

		private BackendRegistry backendRegistry = identity -> Mono.just(List.of());

		private SessionCapabilityRegistry capabilityRegistry = SessionCapabilityRegistry.NOOP;

		private SessionObserver observer = SessionObserver.NOOP;

		private UnaryOperator<Session> sessionDecorator = UnaryOperator.identity();

		private int maxSessions = DEFAULT_MAX_SESSIONS;

		private Duration retryAfter = DEFAULT_RETRY_AFTER;

		private Duration keepAliveInterval;

		private LongSupplier currentTimeMillisSupplier = System::currentTimeMillis;

		private Builder() {
		}

		public Builder sessionFactory(SessionFactory sessionFactory) {
			Assert.notNull(sessionFactory, "sessionFactory must not be null");
			this.sessionFactory = sessionFactory;
			return this;
		}

		/**
		 * Sets the metadata store. Defaults to an {@link InMemorySessionStore} with its
		 * default TTL.
		 * @param store the store
		 * @return this builder
		 */
		public Builder store(SessionStore store) {
			Assert.notNull(store, "store must not be null");
			this.store = store;
			return this;
		}

		public Builder backendRegistry(BackendRegistry backendRegistry) {
			Assert.notNull(backendRegistry, "backendRegistry must not be null");
			this.backendRegistry = backendRegistry;
			return this;
		}

		public Builder capabilityRegistry(SessionCapabilityRegistry capabilityRegistry) {
			Assert.notNull(capabilityRegistry, "capabilityRegistry must not be null");
			this.capabilityRegistry = capabilityRegistry;
			return this;
		}

		public Builder observer(SessionObserver observer) {
			Assert.notNull(observer, "observer must not be null");
			this.observer = observer;
			return this;
		}

		/**
		 * Wraps every new session, for example in a
		 * {@link io.vmcp.session.ToolSearchSession}.
		 * @param sessionDecorator the decorator
		 * @return this builder
		 */
		public Builder sessionDecorator(UnaryOperator<Session> sessionDecorator) {
			Assert.notNull(sessionDecorator, "sessionDecorator must not be null");
			this.sessionDecorator = sessionDecorator;
			return this;
		}

		public Builder maxSessions(int maxSessions) {
			Assert.isTrue(maxSessions > 0, "maxSessions must be positive");
			this.maxSessions = maxSessions;
			return this;
		}

		public Builder retryAfter(Duration retryAfter) {
			Assert.isPositive(retryAfter, "retryAfter must be positive");
			this.retryAfter = retryAfter;
			return this;
		}

		/**
		 * Enables proactive keepalive of backend connections. Disabled by default.
		 * @param keepAliveInterval the interval between keepalive rounds
		 * @return this builder
		 */
		public Builder keepAliveInterval(Duration keepAliveInterval) {
			Assert.isPositive(keepAliveInterval, "keepAliveInterval must be positive");
			this.keepAliveInterval = keepAliveInterval;
			return this;
		}

		public Builder clock(LongSupplier currentTimeMillisSupplier) {
			Assert.notNull(currentTimeMillisSupplier, "currentTimeMillisSupplier must not be null");
			this.currentTimeMillisSupplier = currentTimeMillisSupplier;
			return this;
		}

		public SessionManager build() {
			Assert.notNull(this.sessionFactory, "sessionFactory must be set");
			if (this.store == null) {
				this.store = InMemorySessionStore.builder().build();
			}
			return new SessionManager(this);
		}

	}

}
