/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.auth;

import java.util.concurrent.ConcurrentHashMap;

import io.vmcp.backend.Backend;
import io.vmcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Memoizes another resolver per (caller, backend) pair until the backend rejects the
 * credential. Failed resolutions are not cached.
 */
public class CachingCredentialResolver implements OutgoingCredentialResolver {

	private static final Logger logger = LoggerFactory.getLogger(CachingCredentialResolver.class);

	private final OutgoingCredentialResolver delegate;

	private final ConcurrentHashMap<Key, Mono<Credential>> cache = new ConcurrentHashMap<>();

	public CachingCredentialResolver(OutgoingCredentialResolver delegate) {
		Assert.notNull(delegate, "delegate must not be null");
		this.delegate = delegate;
	}

	@Override
	public Mono<Credential> resolve(Identity identity, Backend backend) {
		Key key = new Key(identity.reference(), backend.id());
		return this.cache.computeIfAbsent(key, k -> this.delegate.resolve(identity, backend)
			.defaultIfEmpty(Credential.NONE)
			.doOnError(e -> this.cache.remove(k))
			.cache());
	}

	@Override
	public void invalidate(Identity identity, Backend backend) {
		if (this.cache.remove(new Key(identity.reference(), backend.id())) != null) {
			logger.debug("Dropped cached credential of {} for backend {}", identity.reference(), backend.id());
		}
		this.delegate.invalidate(identity, backend);
	}

	private record Key(String subject, String backendId) {
	}

}
