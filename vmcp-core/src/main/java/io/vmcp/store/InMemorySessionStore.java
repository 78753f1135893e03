/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.store;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

import io.vmcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Single-process {@link SessionStore}. A record expires once it has not been read for
 * longer than the TTL. A periodic sweep notifies the expiration listener and removes
 * the record after the listener finished.
 */
public class InMemorySessionStore implements SessionStore {

	private static final Logger logger = LoggerFactory.getLogger(InMemorySessionStore.class);

	public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);

	public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(60);

	private final ConcurrentHashMap<String, SessionMetadata> records = new ConcurrentHashMap<>();

	private final Duration ttl;

	private final LongSupplier currentTimeMillisSupplier;

	private final AtomicBoolean sweeping = new AtomicBoolean();

	private final ScheduledExecutorService sweepExecutor;

	private final ScheduledFuture<?> sweepTask;

	private volatile SessionExpirationListener expirationListener = metadata -> Mono.empty();

	private InMemorySessionStore(Duration ttl, Duration sweepInterval, LongSupplier currentTimeMillisSupplier) {
		this.ttl = ttl;
		this.currentTimeMillisSupplier = currentTimeMillisSupplier;
		if (sweepInterval != null) {
			this.sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
				Thread thread = new Thread(r, "vmcp-session-sweep");
				thread.setDaemon(true);
				return thread;
			});
			this.sweepTask = this.sweepExecutor.scheduleAtFixedRate(this::sweep, sweepInterval.toMillis(),
					sweepInterval.toMillis(), TimeUnit.MILLISECONDS);
		}
		else {
			this.sweepExecutor = null;
			this.sweepTask = null;
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public Mono<Void> add(String id, SessionMetadata metadata) {
		return Mono.fromRunnable(() -> {
			Assert.hasText(id, "id must not be empty");
			Assert.notNull(metadata, "metadata must not be null");
			this.records.put(id, metadata);
		});
	}

	@Override
	public Mono<SessionMetadata> get(String id) {
		return Mono.fromSupplier(() -> {
			if (id == null) {
				return null;
			}
			long now = this.currentTimeMillisSupplier.getAsLong();
			SessionMetadata touched = this.records.computeIfPresent(id,
					(key, metadata) -> isExpired(metadata, now) ? metadata : metadata.touchedAt(now));
			return touched == null || isExpired(touched, now) ? null : touched;
		});
	}

	@Override
	public Mono<Void> delete(String id) {
		return Mono.fromRunnable(() -> {
			if (id != null) {
				this.records.remove(id);
			}
		});
	}

	@Override
	public void setExpirationListener(SessionExpirationListener listener) {
		Assert.notNull(listener, "listener must not be null");
		this.expirationListener = listener;
	}

	public int size() {
		return this.records.size();
	}

	/**
	 * Notifies the listener of every expired record and removes each record once its
	 * own notification finished, so a slow listener only holds back its own record. A
	 * record read in the meantime is kept.
	 * @return the number of records removed
	 */
	public Mono<Integer> evictExpired() {
		return Flux.defer(() -> {
			long now = this.currentTimeMillisSupplier.getAsLong();
			List<SessionMetadata> expired = this.records.values().stream().filter(m -> isExpired(m, now)).toList();
			return Flux.fromIterable(expired);
		}).flatMap(this::expire).reduce(0, (count, removed) -> removed ? count + 1 : count);
	}

	private Mono<Boolean> expire(SessionMetadata metadata) {
		return Mono.defer(() -> {
			SessionMetadata current = this.records.get(metadata.id());
			if (current == null || !isExpired(current, this.currentTimeMillisSupplier.getAsLong())) {
				return Mono.just(false);
			}
			return this.expirationListener.sessionExpired(current)
				.onErrorResume(e -> {
					logger.warn("Expiration listener failed for session {}", current.id(), e);
					return Mono.empty();
				})
				.then(Mono.fromSupplier(() -> this.records.remove(current.id(), current)));
		});
	}

	private void sweep() {
		if (!this.sweeping.compareAndSet(false, true)) {
			return;
		}
		evictExpired().doFinally(signal -> this.sweeping.set(false)).subscribe(count -> {
			if (count > 0) {
				logger.debug("Evicted {} expired session(s)", count);
			}
		}, error -> logger.warn("Session sweep failed", error));
	}

	private boolean isExpired(SessionMetadata metadata, long now) {
		return now - metadata.lastTouchedAt() > this.ttl.toMillis();
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			if (this.sweepTask != null) {
				this.sweepTask.cancel(false);
				this.sweepExecutor.shutdown();
			}
		});
	}

	Map<String, SessionMetadata> records() {
		return Map.copyOf(this.records);
	}

	/**
	 * Builder for {@link InMemorySessionStore}.
	 */
	public static class Builder {

		private Duration ttl = DEFAULT_TTL;

		private Duration sweepInterval = DEFAULT_SWEEP_INTERVAL;

		private LongSupplier currentTimeMillisSupplier = System::currentTimeMillis;

		private Builder() {
		}

		public Builder ttl(Duration ttl) {
			Assert.isPositive(ttl, "ttl must be positive");
			this.ttl = ttl;
			return this;
		}

		/**
		 * Sets how often expired records are swept. {@code null} disables the periodic
		 * sweep, leaving eviction to explicit {@link InMemorySessionStore#evictExpired()}
		 * calls.
		 * @param sweepInterval the interval or {@code null}
		 * @return this builder
		 */
		public Builder sweepInterval(Duration sweepInterval) {
			if (sweepInterval != null) {
				Assert.isPositive(sweepInterval, "sweepInterval must be positive");
			}
			this.sweepInterval = sweepInterval;
			return this;
		}

		public Builder clock(LongSupplier currentTimeMillisSupplier) {
			Assert.notNull(currentTimeMillisSupplier, "currentTimeMillisSupplier must not be null");
			this.currentTimeMillisSupplier = currentTimeMillisSupplier;
			return this;
		}

		public InMemorySessionStore build() {
			return new InMemorySessionStore(this.ttl, this.sweepInterval, this.currentTimeMillisSupplier);
		}

	}

}
