/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.auth;

import java.util.concurrent.atomic.AtomicInteger;

import io.vmcp.backend.Backend;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class CachingCredentialResolverTests {

	private final Backend backend = Backend.of("github", "http://localhost/github");

	private final Identity alice = Identity.of("alice", "token-a");

	@Test
	void resolvesOncePerIdentityAndBackend() {
		AtomicInteger resolutions = new AtomicInteger();
		var resolver = new CachingCredentialResolver(
				(identity, backend) -> Mono.fromSupplier(() -> Credential.bearer("t" + resolutions.incrementAndGet())));

		resolver.resolve(this.alice, this.backend).block();
		Credential second = resolver.resolve(this.alice, this.backend).block();

		assertThat(resolutions).hasValue(1);
		assertThat(second.headers()).containsEntry("Authorization", "Bearer t1");

		resolver.resolve(Identity.of("bob", "token-b"), this.backend).block();
		assertThat(resolutions).hasValue(2);
	}

	@Test
	void invalidateForcesFreshResolution() {
		AtomicInteger resolutions = new AtomicInteger();
		var resolver = new CachingCredentialResolver(
				(identity, backend) -> Mono.fromSupplier(() -> Credential.bearer("t" + resolutions.incrementAndGet())));

		resolver.resolve(this.alice, this.backend).block();
		resolver.invalidate(this.alice, this.backend);

		StepVerifier.create(resolver.resolve(this.alice, this.backend))
			.assertNext(credential -> assertThat(credential.headers()).containsEntry("Authorization", "Bearer t2"))
			.verifyComplete();
	}

	@Test
	void failedResolutionIsNotCached() {
		AtomicInteger attempts = new AtomicInteger();
		var resolver = new CachingCredentialResolver((identity, backend) -> Mono.defer(() -> attempts
			.incrementAndGet() == 1 ? Mono.error(new IllegalStateException("idp down")) : Mono.just(Credential.NONE)));

		StepVerifier.create(resolver.resolve(this.alice, this.backend))
			.expectError(IllegalStateException.class)
			.verify();
		StepVerifier.create(resolver.resolve(this.alice, this.backend)).expectNext(Credential.NONE).verifyComplete();
	}

	@Test
	void passThroughForwardsCallerToken() {
		StepVerifier.create(new PassThroughCredentialResolver().resolve(this.alice, this.backend))
			.assertNext(credential -> assertThat(credential.headers()).containsEntry("Authorization", "Bearer token-a"))
			.verifyComplete();
		StepVerifier.create(new PassThroughCredentialResolver().resolve(Identity.ANONYMOUS, this.backend))
			.expectNext(Credential.NONE)
			.verifyComplete();
	}

	@Test
	void credentialToStringDoesNotLeakHeaderValues() {
		assertThat(Credential.bearer("secret").toString()).doesNotContain("secret");
		assertThat(this.alice.toString()).doesNotContain("token-a");
	}

}
