/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.session;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import io.vmcp.aggregator.DefaultCapabilityAggregator;
import io.vmcp.aggregator.OperationKind;
import io.vmcp.auth.Identity;
import io.vmcp.auth.OutgoingCredentialResolver;
import io.vmcp.backend.Backend;
import io.vmcp.backend.BackendConnection;
import io.vmcp.backend.StubBackendConnection;
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
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class DefaultSessionTests {

	private static final Identity ALICE = Identity.of("alice", "token");

	private static final ReinitializationPolicy FAST_POLICY = new ReinitializationPolicy(2, Duration.ofMillis(1),
			Duration.ofMillis(5), 3, Duration.ofMinutes(1));

	private static BackendSessionExpiredException expired(String backendId) {
		return new BackendSessionExpiredException(backendId, backendId + "-session");
	}

	private static DefaultSession.Builder sessionWith(List<Backend> backends, BackendConnection... connections) {
		Map<String, BackendConnection> map = new LinkedHashMap<>();
		for (BackendConnection connection : connections) {
			map.put(connection.backendId(), connection);
		}
		return DefaultSession.builder()
			.id("session-1")
			.identity(ALICE)
			.backends(backends)
			.connections(map)
			.capabilities(new DefaultCapabilityAggregator().aggregate(map).block())
			.reinitializationPolicy(FAST_POLICY);
	}

	private static List<Backend> backends(String... ids) {
		List<Backend> backends = new ArrayList<>();
		for (String id : ids) {
			backends.add(Backend.of(id, "stub://" + id));
		}
		return backends;
	}

	/**
	 * A reconnector handing out connections from a supplier and counting the attempts.
	 */
	static final class CountingReconnector implements BackendReconnector {

		final AtomicInteger attempts = new AtomicInteger();

		private final Supplier<Mono<BackendConnection>> next;

		CountingReconnector(Supplier<Mono<BackendConnection>> next) {
			this.next = next;
		}

		@Override
		public Mono<BackendConnection> reconnect(Backend backend) {
			return Mono.defer(() -> {
				this.attempts.incrementAndGet();
				return this.next.get();
			});
		}

	}

	// ---------------------------------------
	// Routing
	// ---------------------------------------

	@Test
	void callsReachOwningBackendUnderOriginalName() {
		var fs = new StubBackendConnection("fs").withTools("read_file");
		var db = new StubBackendConnection("db").withTools("read_file", "query");
		DefaultSession session = sessionWith(backends("fs", "db"), fs, db).build();

		StepVerifier.create(session.callTool("db_read_file", Map.of("path", "/tmp")))
			.expectNext(McpSchema.CallToolResult.text("read_file"))
			.verifyComplete();

		assertThat(db.toolCalls()).containsExactly(new McpSchema.CallToolRequest("read_file", Map.of("path", "/tmp")));
		assertThat(fs.toolCalls()).isEmpty();
	}

	@Test
	void resourcesAndPromptsAreRouted() {
		var docs = new StubBackendConnection("docs").withResources("file:///readme").withPrompts("explain");
		DefaultSession session = sessionWith(backends("docs"), docs).build();

		StepVerifier.create(session.readResource("file:///readme"))
			.assertNext(result -> assertThat(result.contents()).hasSize(1))
			.verifyComplete();
		StepVerifier.create(session.getPrompt("docs_explain", null))
			.assertNext(result -> assertThat(result.description()).isEqualTo("docs"))
			.verifyComplete();

		assertThat(docs.resourceReads()).containsExactly("file:///readme");
		assertThat(docs.promptGets()).containsExactly("explain");
	}

	@Test
	void unknownOperationIsReportedAndSessionStaysUsable() {
		var fs = new StubBackendConnection("fs").withTools("read_file");
		DefaultSession session = sessionWith(backends("fs"), fs).build();

		StepVerifier.create(session.callTool("fs_delete_everything", Map.of()))
			.expectError(OperationNotFoundException.class)
			.verify();
		StepVerifier.create(session.readResource("file:///missing"))
			.expectError(OperationNotFoundException.class)
			.verify();
		StepVerifier.create(session.callTool("fs_read_file", Map.of())).expectNextCount(1).verifyComplete();
		assertThat(session.inFlightCalls()).isZero();
	}

	@Test
	void sessionWithoutBackendsReportsNoBackendsAvailable() {
		DefaultSession session = sessionWith(backends("fs", "db")).build();

		assertThat(session.connectedBackends()).isEmpty();
		assertThat(session.failedBackends()).containsExactly("fs", "db");
		StepVerifier.create(session.callTool("fs_read_file", Map.of()))
			.expectError(NoBackendsAvailableException.class)
			.verify();
	}

	@Test
	void operationOfFailedBackendIsReportedAsUnavailable() {
		var fs = new StubBackendConnection("fs").withTools("read_file");
		DefaultSession session = sessionWith(backends("fs", "db"), fs).build();

		StepVerifier.create(session.callTool("db_query", Map.of()))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOf(BackendUnavailableException.class)
				.satisfies(e -> assertThat(((BackendUnavailableException) e).backendId()).isEqualTo("db")))
			.verify();
	}

	@Test
	void backendErrorsArePassedThroughAndTransportErrorsWrapped() {
		var tools = new StubBackendConnection("tools").withTools("strict", "flaky").onCallTool(request -> {
			if (request.name().equals("strict")) {
				return Mono.error(new McpError(new McpSchema.JSONRPCResponse.JSONRPCError(
						McpSchema.ErrorCodes.INVALID_PARAMS, "missing argument", null)));
			}
			return Mono.error(new IOException("connection reset"));
		});
		DefaultSession session = sessionWith(backends("tools"), tools).build();

		StepVerifier.create(session.callTool("tools_strict", Map.of()))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOf(McpError.class)
				.hasMessage("missing argument"))
			.verify();
		StepVerifier.create(session.callTool("tools_flaky", Map.of()))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOf(BackendUnavailableException.class)
				.hasRootCauseInstanceOf(IOException.class))
			.verify();
	}

	@Test
	void gettersReturnImmutableSnapshots() {
		var fs = new StubBackendConnection("fs").withTools("read_file");
		DefaultSession session = sessionWith(backends("fs"), fs).build();

		assertThatThrownBy(() -> session.tools().clear()).isInstanceOf(UnsupportedOperationException.class);
		assertThatThrownBy(() -> session.connectedBackends().clear())
			.isInstanceOf(UnsupportedOperationException.class);
		assertThatThrownBy(() -> session.backendSessionIds().clear())
			.isInstanceOf(UnsupportedOperationException.class);
		assertThat(session.backendSessionIds()).containsEntry("fs", "fs-session");
	}

	@Test
	void readLockIsReleasedWhileBackendCallIsPending() {
		Sinks.One<McpSchema.CallToolResult> reply = Sinks.one();
		var slow = new StubBackendConnection("slow").withTools("wait").onCallTool(request -> reply.asMono());
		DefaultSession session = sessionWith(backends("slow"), slow).build();

		CompletableFuture<McpSchema.CallToolResult> call = session.callTool("slow_wait", Map.of()).toFuture();

		await().atMost(Duration.ofSeconds(2)).until(() -> slow.toolCalls().size() == 1);
		assertThat(session.readLockHolders()).isZero();
		assertThat(session.inFlightCalls()).isEqualTo(1);
		assertThat(session.routingTable().lookup(OperationKind.TOOL, "slow_wait")).isNotNull();

		reply.tryEmitValue(McpSchema.CallToolResult.text("done"));
		assertThat(call.join()).isEqualTo(McpSchema.CallToolResult.text("done"));
	}

	@Test
	void cancelledCallReleasesItsInFlightSlot() {
		var slow = new StubBackendConnection("slow").withTools("wait").onCallTool(request -> Mono.never());
		DefaultSession session = sessionWith(backends("slow"), slow).build();

		Disposable call = session.callTool("slow_wait", Map.of()).subscribe();
		assertThat(session.inFlightCalls()).isEqualTo(1);

		call.dispose();

		assertThat(session.inFlightCalls()).isZero();
		StepVerifier.create(session.closeGracefully()).verifyComplete();
		assertThat(slow.closeCount()).isEqualTo(1);
	}

	// ---------------------------------------
	// Close
	// ---------------------------------------

	@Test
	void closeWaitsForInFlightCallsBeforeClosingConnections() {
		Sinks.One<McpSchema.CallToolResult> reply = Sinks.one();
		AtomicReference<DefaultSession> sessionRef = new AtomicReference<>();
		List<Integer> inFlightAtClose = new ArrayList<>();
		var slow = new StubBackendConnection("slow").withTools("wait")
			.onCallTool(request -> reply.asMono())
			.onClose(Mono.fromRunnable(() -> inFlightAtClose.add(sessionRef.get().inFlightCalls())));
		var fast = new StubBackendConnection("fast").withTools("go")
			.onClose(Mono.fromRunnable(() -> inFlightAtClose.add(sessionRef.get().inFlightCalls())));
		DefaultSession session = sessionWith(backends("slow", "fast"), slow, fast).build();
		sessionRef.set(session);

		CompletableFuture<McpSchema.CallToolResult> call = session.callTool("slow_wait", Map.of()).toFuture();
		CompletableFuture<Void> close = session.closeGracefully().toFuture();

		assertThat(session.isClosed()).isTrue();
		assertThat(close).isNotDone();
		assertThat(slow.closeCount()).isZero();
		assertThat(fast.closeCount()).isZero();
		StepVerifier.create(session.callTool("fast_go", Map.of())).expectError(SessionClosedException.class).verify();

		reply.tryEmitValue(McpSchema.CallToolResult.text("late"));

		assertThat(call.join()).isEqualTo(McpSchema.CallToolResult.text("late"));
		close.join();
		assertThat(slow.closeCount()).isEqualTo(1);
		assertThat(fast.closeCount()).isEqualTo(1);
		assertThat(inFlightAtClose).containsExactly(0, 0);
	}

	@Test
	void closeIsIdempotentAndNeverReopens() {
		var fs = new StubBackendConnection("fs").withTools("read_file");
		DefaultSession session = sessionWith(backends("fs"), fs).build();

		session.closeGracefully().block();
		session.closeGracefully().block();

		assertThat(fs.closeCount()).isEqualTo(1);
		assertThat(session.isClosed()).isTrue();
		assertThat(session.connectedBackends()).isEmpty();
		StepVerifier.create(session.callTool("fs_read_file", Map.of()))
			.expectError(SessionClosedException.class)
			.verify();
	}

	@Test
	void closeCollectsEveryConnectionFailure() {
		var a = new StubBackendConnection("a").onClose(Mono.error(new IOException("a broke")));
		var b = new StubBackendConnection("b");
		var c = new StubBackendConnection("c").onClose(Mono.error(new IOException("c broke")));
		DefaultSession session = sessionWith(backends("a", "b", "c"), a, b, c).build();

		StepVerifier.create(session.closeGracefully()).expectErrorSatisfies(error -> {
			assertThat(error).isInstanceOf(SessionCloseException.class);
			assertThat(error.getSuppressed()).extracting(Throwable::getMessage)
				.containsExactlyInAnyOrder("a broke", "c broke");
		}).verify();
		assertThat(b.closeCount()).isEqualTo(1);
	}

	@Test
	void recreationFinishingAfterCloseDoesNotInstallItsConnection() {
		var stale = new StubBackendConnection("db").withTools("query").onCallTool(request -> Mono.error(expired("db")));
		var fresh = new StubBackendConnection("db", "new").withTools("query");
		Sinks.One<BackendConnection> handshake = Sinks.one();
		var reconnector = new CountingReconnector(handshake::asMono);
		DefaultSession session = sessionWith(backends("db"), stale).reconnector(reconnector).build();

		Disposable call = session.callTool("db_query", Map.of()).subscribe(result -> {
		}, error -> {
		});
		await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> assertThat(reconnector.attempts).hasValue(1));
		call.dispose();

		CompletableFuture<Void> closing = session.closeGracefully().toFuture();
		assertThat(session.isClosed()).isTrue();
		assertThat(closing).isNotDone();

		handshake.tryEmitValue(fresh);
		closing.join();

		assertThat(fresh.closeCount()).isEqualTo(1);
		assertThat(session.connectedBackends()).isEmpty();
		assertThat(stale.closeCount()).isEqualTo(1);
	}

	// ---------------------------------------
	// Re-initialization
	// ---------------------------------------

	@Test
	void expiredBackendSessionIsRecreatedAndCallRetriedOnce() {
		var stale = new StubBackendConnection("db", "old").withTools("query")
			.onCallTool(request -> Mono.error(expired("db")));
		var fresh = new StubBackendConnection("db", "new").withTools("query");
		var reconnector = new CountingReconnector(() -> Mono.just(fresh));
		DefaultSession session = sessionWith(backends("db"), stale).reconnector(reconnector).build();

		StepVerifier.create(session.callTool("db_query", Map.of()))
			.expectNext(McpSchema.CallToolResult.text("query"))
			.verifyComplete();

		assertThat(reconnector.attempts).hasValue(1);
		assertThat(stale.closeCount()).isEqualTo(1);
		assertThat(fresh.toolCalls()).hasSize(1);
		assertThat(session.backendSessionIds()).containsEntry("db", "new");
	}

	@Test
	void persistentlyExpiredBackendIsRecreatedOnlyOncePerCall() {
		AtomicInteger calls = new AtomicInteger();
		var reconnector = new CountingReconnector(() -> Mono.just(new StubBackendConnection("db").withTools("query")
			.onCallTool(request -> Mono.defer(() -> {
				calls.incrementAndGet();
				return Mono.error(expired("db"));
			}))));
		var stale = new StubBackendConnection("db").withTools("query").onCallTool(request -> Mono.defer(() -> {
			calls.incrementAndGet();
			return Mono.error(expired("db"));
		}));
		DefaultSession session = sessionWith(backends("db"), stale).reconnector(reconnector).build();

		StepVerifier.create(session.callTool("db_query", Map.of()))
			.expectError(BackendSessionExpiredException.class)
			.verify(Duration.ofSeconds(5));

		assertThat(reconnector.attempts).hasValue(1);
		assertThat(calls).hasValue(2);
	}

	@Test
	void concurrentRecreationsOfSameBackendAreCoalesced() {
		var stale = new StubBackendConnection("db").withTools("query").onCallTool(request -> Mono.error(expired("db")));
		var fresh = new StubBackendConnection("db", "new").withTools("query");
		var reconnector = new CountingReconnector(
				() -> Mono.delay(Duration.ofMillis(100)).thenReturn((BackendConnection) fresh));
		DefaultSession session = sessionWith(backends("db"), stale).reconnector(reconnector).build();

		List<McpSchema.CallToolResult> results = Flux.range(0, 5)
			.flatMap(i -> session.callTool("db_query", Map.of()))
			.collectList()
			.block(Duration.ofSeconds(5));

		assertThat(results).hasSize(5);
		assertThat(reconnector.attempts).hasValue(1);
		assertThat(stale.closeCount()).isEqualTo(1);
		assertThat(fresh.toolCalls()).hasSize(5);
	}

	@Test
	void concurrentCredentialRecoveriesOfSameBackendAreCoalesced() {
		OutgoingCredentialResolver resolver = mock(OutgoingCredentialResolver.class);
		var stale = new StubBackendConnection("gh").withTools("issues")
			.onCallTool(request -> Mono.error(new BackendAuthorizationException("gh", 401)));
		var fresh = new StubBackendConnection("gh").withTools("issues");
		var reconnector = new CountingReconnector(
				() -> Mono.delay(Duration.ofMillis(100)).thenReturn((BackendConnection) fresh));
		DefaultSession session = sessionWith(backends("gh"), stale).reconnector(reconnector)
			.credentialResolver(resolver)
			.build();

		List<McpSchema.CallToolResult> results = Flux.range(0, 5)
			.flatMap(i -> session.callTool("gh_issues", Map.of()))
			.collectList()
			.block(Duration.ofSeconds(5));

		assertThat(results).hasSize(5);
		assertThat(reconnector.attempts).hasValue(1);
		verify(resolver, times(1)).invalidate(any(Identity.class), any(Backend.class));
		assertThat(stale.closeCount()).isEqualTo(1);
		assertThat(fresh.toolCalls()).hasSize(5);
	}

	@Test
	void rejectedCredentialsAreReResolvedAndCallRetried() {
		OutgoingCredentialResolver resolver = mock(OutgoingCredentialResolver.class);
		var stale = new StubBackendConnection("gh").withTools("issues")
			.onCallTool(request -> Mono.error(new BackendAuthorizationException("gh", 401)));
		var fresh = new StubBackendConnection("gh").withTools("issues");
		var reconnector = new CountingReconnector(() -> Mono.just(fresh));
		DefaultSession session = sessionWith(backends("gh"), stale).reconnector(reconnector)
			.credentialResolver(resolver)
			.build();

		StepVerifier.create(session.callTool("gh_issues", Map.of())).expectNextCount(1).verifyComplete();

		verify(resolver, times(1)).invalidate(any(Identity.class), any(Backend.class));
		assertThat(reconnector.attempts).hasValue(1);
		assertThat(fresh.toolCalls()).hasSize(1);
	}

	@Test
	void credentialRecoveryGivesUpAfterBoundedAttempts() {
		OutgoingCredentialResolver resolver = mock(OutgoingCredentialResolver.class);
		var stale = new StubBackendConnection("gh").withTools("issues")
			.onCallTool(request -> Mono.error(new BackendAuthorizationException("gh", 403)));
		var reconnector = new CountingReconnector(() -> Mono.error(new BackendAuthorizationException("gh", 403)));
		DefaultSession session = sessionWith(backends("gh"), stale).reconnector(reconnector)
			.credentialResolver(resolver)
			.build();

		StepVerifier.create(session.callTool("gh_issues", Map.of()))
			.expectError(CredentialExpiredException.class)
			.verify(Duration.ofSeconds(5));

		assertThat(reconnector.attempts).hasValue(FAST_POLICY.authorizationAttempts());
		verify(resolver, times(FAST_POLICY.authorizationAttempts())).invalidate(any(Identity.class),
				any(Backend.class));
	}

	@Test
	void stillRejectedAfterRecoverySurfacesCredentialExpired() {
		var stale = new StubBackendConnection("gh").withTools("issues")
			.onCallTool(request -> Mono.error(new BackendAuthorizationException("gh", 401)));
		var fresh = new StubBackendConnection("gh").withTools("issues")
			.onCallTool(request -> Mono.error(new BackendAuthorizationException("gh", 401)));
		var reconnector = new CountingReconnector(() -> Mono.just(fresh));
		DefaultSession session = sessionWith(backends("gh"), stale).reconnector(reconnector).build();

		StepVerifier.create(session.callTool("gh_issues", Map.of()))
			.expectError(CredentialExpiredException.class)
			.verify(Duration.ofSeconds(5));
		assertThat(fresh.toolCalls()).hasSize(1);
	}

	@Test
	void circuitBreakerStopsRecreatingPersistentlyFailingBackend() {
		var policy = new ReinitializationPolicy(1, Duration.ofMillis(1), Duration.ofMillis(1), 2,
				Duration.ofMinutes(5));
		var stale = new StubBackendConnection("db").withTools("query").onCallTool(request -> Mono.error(expired("db")));
		var healthy = new StubBackendConnection("fs").withTools("read");
		var reconnector = new CountingReconnector(() -> Mono.error(new IOException("connection refused")));
		DefaultSession session = sessionWith(backends("db", "fs"), stale, healthy).reconnector(reconnector)
			.reinitializationPolicy(policy)
			.build();

		for (int i = 0; i < 4; i++) {
			StepVerifier.create(session.callTool("db_query", Map.of()))
				.expectError(BackendUnavailableException.class)
				.verify(Duration.ofSeconds(5));
		}

		assertThat(reconnector.attempts).hasValue(2);
		assertThat(session.circuitBreakerState("db")).isEqualTo(CircuitBreaker.State.OPEN);
		assertThat(session.connectedBackends()).containsExactly("fs");
		StepVerifier.create(session.callTool("fs_read", Map.of())).expectNextCount(1).verifyComplete();
	}

	@Test
	void backendWhoseRecreationFailedLeavesTheRoutingTable() {
		var stale = new StubBackendConnection("db").withTools("query").onCallTool(request -> Mono.error(expired("db")));
		var fresh = new StubBackendConnection("db", "new").withTools("query");
		var fs = new StubBackendConnection("fs").withTools("read");
		AtomicInteger handshakes = new AtomicInteger();
		var reconnector = new CountingReconnector(() -> handshakes.getAndIncrement() == 0
				? Mono.error(new IOException("connection refused")) : Mono.just(fresh));
		DefaultSession session = sessionWith(backends("db", "fs"), stale, fs).reconnector(reconnector).build();

		StepVerifier.create(session.callTool("db_query", Map.of()))
			.expectError(BackendUnavailableException.class)
			.verify(Duration.ofSeconds(5));

		assertThat(session.connectedBackends()).containsAll(session.routingTable().backendIds());
		assertThat(session.routingTable().backendIds()).containsExactly("fs");
		assertThat(session.tools()).extracting(McpSchema.Tool::name).containsExactly("fs_read");

		StepVerifier.create(session.callTool("db_query", Map.of()))
			.expectNext(McpSchema.CallToolResult.text("query"))
			.verifyComplete();

		assertThat(reconnector.attempts).hasValue(2);
		assertThat(session.routingTable().backendIds()).containsExactlyInAnyOrder("db", "fs");
		assertThat(session.tools()).extracting(McpSchema.Tool::name)
			.containsExactlyInAnyOrder("fs_read", "db_query");
	}

	@Test
	void failedBackendIsNeverReconnected() {
		var fs = new StubBackendConnection("fs").withTools("read");
		var reconnector = new CountingReconnector(() -> Mono.just(new StubBackendConnection("db")));
		DefaultSession session = sessionWith(backends("fs", "db"), fs).reconnector(reconnector).build();

		StepVerifier.create(session.callTool("db_query", Map.of()))
			.expectError(BackendUnavailableException.class)
			.verify();
		assertThat(reconnector.attempts).hasValue(0);
	}

	// ---------------------------------------
	// Keepalive
	// ---------------------------------------

	@Test
	void keepAliveSkipsBackendsWithoutPingSupport() {
		var noPing = new StubBackendConnection("legacy").onPing(Mono.error(new McpError(
				new McpSchema.JSONRPCResponse.JSONRPCError(McpSchema.ErrorCodes.METHOD_NOT_FOUND, "no ping", null))));
		var pinged = new StubBackendConnection("modern");
		DefaultSession session = sessionWith(backends("legacy", "modern"), noPing, pinged).build();

		session.keepAlive().block();
		session.keepAlive().block();

		assertThat(noPing.pingCount()).isEqualTo(1);
		assertThat(pinged.pingCount()).isEqualTo(2);
		assertThat(session.inFlightCalls()).isZero();
	}

	@Test
	void keepAliveReinitializesExpiredBackendProactively() {
		var stale = new StubBackendConnection("db", "old").onPing(Mono.error(expired("db")));
		var fresh = new StubBackendConnection("db", "new");
		var reconnector = new CountingReconnector(() -> Mono.just(fresh));
		DefaultSession session = sessionWith(backends("db"), stale).reconnector(reconnector).build();

		StepVerifier.create(session.keepAlive()).verifyComplete();

		assertThat(reconnector.attempts).hasValue(1);
		assertThat(session.backendSessionIds()).containsEntry("db", "new");
	}

	@Test
	void keepAliveNeverFailsAndIsSkippedOnClosedSession() {
		var broken = new StubBackendConnection("db").onPing(Mono.error(new IOException("down")));
		DefaultSession session = sessionWith(backends("db"), broken).build();

		StepVerifier.create(session.keepAlive()).verifyComplete();
		session.closeGracefully().block();
		StepVerifier.create(session.keepAlive()).verifyComplete();
		assertThat(broken.pingCount()).isEqualTo(1);
	}

	@Test
	void connectionsForUnknownBackendsAreRejected() {
		assertThatThrownBy(() -> sessionWith(backends("fs"), new StubBackendConnection("db")).build())
			.isInstanceOf(IllegalArgumentException.class);
	}

}
