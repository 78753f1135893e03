/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.vmcp.test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import io.vmcp.aggregator.OperationKind;
import io.vmcp.aggregator.RoutingEntry;
import io.vmcp.auth.CachingCredentialResolver;
import io.vmcp.auth.Credential;
import io.vmcp.auth.Identity;
import io.vmcp.backend.Backend;
import io.vmcp.backend.StaticBackendRegistry;
import io.vmcp.server.SessionManager;
import io.vmcp.session.CircuitBreaker;
import io.vmcp.session.DefaultSession;
import io.vmcp.session.DefaultSessionFactory;
import io.vmcp.session.Session;
import io.vmcp.spec.BackendSessionExpiredException;
import io.vmcp.spec.BackendUnavailableException;
import io.vmcp.spec.McpSchema;
import io.vmcp.spec.NoBackendsAvailableException;
import io.vmcp.spec.SessionClosedException;
import io.vmcp.spec.SessionLimitExceededException;
import io.vmcp.spec.SessionNotFoundException;
import io.vmcp.store.InMemorySessionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * End-to-end session behavior against in-memory backends.
 */
@Timeout(30)
class SessionScenarioTests {

	private static final Identity ALICE = Identity.of("alice", "alice-token");

	private static final Identity BOB = Identity.of("bob", "bob-token");

	private final InMemoryBackendConnector connector = new InMemoryBackendConnector();

	private final List<Session> sessions = new CopyOnWriteArrayList<>();

	private SessionManager manager;

	@AfterEach
	void closeEverything() {
		Flux.fromIterable(this.sessions)
			.flatMap(session -> session.closeGracefully().onErrorResume(e -> Mono.empty()))
			.then()
			.block(Duration.ofSeconds(10));
		if (this.manager != null) {
			this.manager.closeGracefully().block(Duration.ofSeconds(10));
		}
	}

	private InMemoryBackendServer backend(String id, String... tools) {
		InMemoryBackendServer.Builder builder = InMemoryBackendServer.builder(id);
		for (String tool : tools) {
			builder.tool(tool, tool + " on " + id);
		}
		InMemoryBackendServer server = builder.build();
		this.connector.register(server);
		return server;
	}

	private DefaultSessionFactory.Builder factoryBuilder() {
		return DefaultSessionFactory.builder().connector(this.connector);
	}

	private DefaultSession create(DefaultSessionFactory factory, Identity identity, String... backendIds) {
		Session session = factory.makeSession(identity, InMemoryBackendConnector.backends(backendIds))
			.block(Duration.ofSeconds(10));
		this.sessions.add(session);
		return (DefaultSession) session;
	}

	@Test
	void concurrentSessionsNeverShareConnections() {
		InMemoryBackendServer fs = backend("fs", "read");
		InMemoryBackendServer db = backend("db", "query");
		DefaultSessionFactory factory = factoryBuilder().build();
		List<Backend> backends = InMemoryBackendConnector.backends("fs", "db");

		List<Session> created = Flux
			.merge(factory.makeSession(ALICE, backends), factory.makeSession(BOB, backends))
			.collectList()
			.block(Duration.ofSeconds(10));
		this.sessions.addAll(created);

		assertThat(created).hasSize(2);
		Set<String> first = new HashSet<>(created.get(0).backendSessionIds().values());
		Set<String> second = new HashSet<>(created.get(1).backendSessionIds().values());
		assertThat(first).hasSize(2).doesNotContainAnyElementsOf(second);
		assertThat(second).hasSize(2);
		assertThat(fs.connections()).hasSize(2).doesNotHaveDuplicates();
		assertThat(db.connections()).hasSize(2).doesNotHaveDuplicates();
		assertThat(fs.presentedCredentials()).containsExactlyInAnyOrder(Credential.bearer("alice-token"),
				Credential.bearer("bob-token"));
	}

	@Test
	void everyExposedNameReachesItsBackendUnderTheOriginalName() {
		InMemoryBackendServer fs = backend("fs", "read", "list");
		InMemoryBackendServer db = backend("db", "read");
		DefaultSession session = create(factoryBuilder().build(), ALICE, "fs", "db");

		Map<String, RoutingEntry> tools = session.routingTable().tools();
		assertThat(tools).containsOnlyKeys("fs_read", "fs_list", "db_read");

		for (RoutingEntry entry : tools.values()) {
			InMemoryBackendServer target = entry.backendId().equals("fs") ? fs : db;
			InMemoryBackendServer other = target == fs ? db : fs;
			int targetCalls = target.calls().size();
			int otherCalls = other.calls().size();

			StepVerifier.create(session.callTool(entry.exposedName(), Map.of()))
				.assertNext(result -> assertThat(((McpSchema.TextContent) result.content().get(0)).text())
					.isEqualTo(entry.backendId() + ":" + entry.originalName()))
				.verifyComplete();

			assertThat(target.calls()).hasSize(targetCalls + 1).last().isEqualTo(entry.originalName());
			assertThat(other.calls()).hasSize(otherCalls);
		}
	}

	@Test
	void readLockIsReleasedWhileABackendCallIsPending() {
		InMemoryBackendServer fs = backend("fs", "read");
		backend("db", "query");
		DefaultSession session = create(factoryBuilder().build(), ALICE, "fs", "db");
		fs.callDelay(Duration.ofMillis(500));

		List<McpSchema.CallToolResult> results = new CopyOnWriteArrayList<>();
		session.callTool("fs_read", Map.of()).subscribe(results::add);
		await().atMost(Duration.ofSeconds(5)).until(() -> fs.calls().contains("read"));

		assertThat(results).isEmpty();
		assertThat(session.inFlightCalls()).isEqualTo(1);
		assertThat(session.readLockHolders()).isZero();
		assertThat(session.routingTable().lookup(OperationKind.TOOL, "db_query")).isNotNull();
		assertThat(session.tools()).hasSize(2);
		StepVerifier.create(session.callTool("db_query", Map.of())).expectNextCount(1).verifyComplete();
		assertThat(results).isEmpty();

		await().atMost(Duration.ofSeconds(5)).until(() -> results.size() == 1);
	}

	@Test
	void connectionsCloseOnlyAfterInFlightCallsReturn() {
		InMemoryBackendServer fs = backend("fs", "read");
		InMemoryBackendServer db = backend("db", "query");
		DefaultSession session = create(factoryBuilder().build(), ALICE, "fs", "db");
		List<Integer> inFlightAtClose = new CopyOnWriteArrayList<>();
		fs.onClose(() -> inFlightAtClose.add(session.inFlightCalls()));
		db.onClose(() -> inFlightAtClose.add(session.inFlightCalls()));
		fs.callDelay(Duration.ofMillis(300));
		db.callDelay(Duration.ofMillis(300));

		List<McpSchema.CallToolResult> results = new CopyOnWriteArrayList<>();
		List<Throwable> errors = new CopyOnWriteArrayList<>();
		for (int i = 0; i < 3; i++) {
			session.callTool("fs_read", Map.of()).subscribe(results::add, errors::add);
			session.callTool("db_query", Map.of()).subscribe(results::add, errors::add);
		}
		await().atMost(Duration.ofSeconds(5)).until(() -> session.inFlightCalls() == 6);

		Mono<Void> closing = session.closeGracefully().cache();
		closing.subscribe(null, errors::add);

		assertThat(session.isClosed()).isTrue();
		assertThat(fs.closeCount()).isZero();
		assertThat(db.closeCount()).isZero();
		StepVerifier.create(session.callTool("fs_read", Map.of())).expectError(SessionClosedException.class).verify();

		StepVerifier.create(closing).verifyComplete();
		assertThat(results).hasSize(6);
		assertThat(errors).isEmpty();
		assertThat(inFlightAtClose).hasSize(2).containsOnly(0);
		assertThat(fs.liveSessions()).isEmpty();
		assertThat(db.liveSessions()).isEmpty();
	}

	@Test
	void twoOfFiveBackendsFailingLeavesThreeConnected() {
		backend("a", "one");
		backend("b", "two").failHandshake(true);
		backend("c", "three");
		backend("d", "four").failHandshake(true);
		backend("e", "five");

		DefaultSession session = create(factoryBuilder().build(), ALICE, "a", "b", "c", "d", "e");

		assertThat(session.connectedBackends()).containsExactlyInAnyOrder("a", "c", "e");
		assertThat(session.failedBackends()).containsExactlyInAnyOrder("b", "d");
		assertThat(session.backendSessionIds()).containsOnlyKeys("a", "c", "e");
		assertThat(session.tools()).extracting(McpSchema.Tool::name)
			.containsExactlyInAnyOrder("a_one", "c_three", "e_five");
		assertThat(session.routingTable().backendIds()).containsExactlyInAnyOrder("a", "c", "e");
	}

	@Test
	void allBackendsFailingYieldsAnEmptyUsableSession() {
		for (String id : List.of("a", "b", "c", "d", "e")) {
			backend(id, "tool").failHandshake(true);
		}

		DefaultSession session = create(factoryBuilder().build(), ALICE, "a", "b", "c", "d", "e");

		assertThat(session).isNotNull();
		assertThat(session.isClosed()).isFalse();
		assertThat(session.connectedBackends()).isEmpty();
		assertThat(session.backendSessionIds()).isEmpty();
		assertThat(session.routingTable().isEmpty()).isTrue();
		assertThat(session.tools()).isEmpty();
		assertThat(session.resources()).isEmpty();
		assertThat(session.prompts()).isEmpty();
		StepVerifier.create(session.callTool("a_tool", Map.of()))
			.expectError(NoBackendsAvailableException.class)
			.verify();
	}

	@Test
	void backendThatAlwaysExpiresIsReinitializedOncePerCall() {
		InMemoryBackendServer fs = backend("fs", "read");
		DefaultSession session = create(factoryBuilder().build(), ALICE, "fs");
		fs.alwaysExpired(true);

		StepVerifier.create(session.callTool("fs_read", Map.of()))
			.expectError(BackendSessionExpiredException.class)
			.verify();

		assertThat(fs.handshakeCount()).isEqualTo(2);
		assertThat(fs.calls()).containsExactly("read", "read");

		StepVerifier.create(session.callTool("fs_read", Map.of()))
			.expectError(BackendSessionExpiredException.class)
			.verify();

		assertThat(fs.handshakeCount()).isEqualTo(3);
		assertThat(fs.calls()).hasSize(4);
		assertThat(session.circuitBreakerState("fs")).isEqualTo(CircuitBreaker.State.CLOSED);
	}

	@Test
	void expiredBackendSessionIsReplacedTransparently() {
		InMemoryBackendServer fs = backend("fs", "read");
		DefaultSession session = create(factoryBuilder().build(), ALICE, "fs");
		String before = session.backendSessionIds().get("fs");
		fs.expireSessions();

		StepVerifier.create(session.callTool("fs_read", Map.of())).expectNextCount(1).verifyComplete();

		assertThat(session.backendSessionIds().get("fs")).isNotEqualTo(before);
		assertThat(fs.handshakeCount()).isEqualTo(2);
	}

	@Test
	void callToFailedBackendIsUnavailableNotATimeout() {
		InMemoryBackendServer.Builder fsBuilder = InMemoryBackendServer.builder("fs").tool("readFile", "Reads a file");
		InMemoryBackendServer fs = fsBuilder.build();
		this.connector.register(fs);
		backend("db", "query").failHandshake(true);
		DefaultSession session = create(factoryBuilder().build(), ALICE, "fs", "db");

		StepVerifier.create(session.callTool("fs_readFile", Map.of("path", "/tmp/a")))
			.assertNext(result -> assertThat(result.isError()).isNotEqualTo(Boolean.TRUE))
			.verifyComplete();
		StepVerifier.create(session.callTool("db_query", Map.of()))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOfSatisfying(BackendUnavailableException.class,
					unavailable -> assertThat(unavailable.backendId()).isEqualTo("db")))
			.verify(Duration.ofSeconds(1));
	}

	@Test
	void closedSessionIdentifierIsNotFound() {
		backend("fs", "read");
		this.manager = SessionManager.builder()
			.sessionFactory(factoryBuilder().idGenerator(() -> "abc-1").build())
			.store(InMemorySessionStore.builder().sweepInterval(null).build())
			.backendRegistry(new StaticBackendRegistry(InMemoryBackendConnector.backends("fs")))
			.build();

		Session session = this.manager.initialize(ALICE).block(Duration.ofSeconds(10));
		assertThat(session.id()).isEqualTo("abc-1");
		StepVerifier.create(this.manager.getSession("abc-1")).expectNext(session).verifyComplete();

		StepVerifier.create(session.closeGracefully()).verifyComplete();

		StepVerifier.create(this.manager.getSession("abc-1")).expectError(SessionNotFoundException.class).verify();
		StepVerifier.create(session.callTool("fs_read", Map.of())).expectError(SessionClosedException.class).verify();

		StepVerifier.create(this.manager.terminate("abc-1")).verifyComplete();
		StepVerifier.create(this.manager.getSession("abc-1")).expectError(SessionNotFoundException.class).verify();
	}

	@Test
	void eleventhSessionOverTheCapIsRejectedWithARetryHint() {
		InMemoryBackendServer fs = backend("fs", "read");
		this.manager = SessionManager.builder()
			.sessionFactory(factoryBuilder().build())
			.store(InMemorySessionStore.builder().sweepInterval(null).build())
			.backendRegistry(new StaticBackendRegistry(InMemoryBackendConnector.backends("fs")))
			.maxSessions(10)
			.retryAfter(Duration.ofSeconds(3))
			.build();

		List<Session> admitted = new ArrayList<>();
		for (int i = 0; i < 10; i++) {
			admitted.add(this.manager.initialize(Identity.of("user-" + i, "token-" + i)).block(Duration.ofSeconds(10)));
		}
		int handshakes = fs.handshakeCount();

		StepVerifier.create(this.manager.initialize(Identity.of("user-10", "token-10")))
			.expectErrorSatisfies(error -> assertThat(error)
				.isInstanceOfSatisfying(SessionLimitExceededException.class,
						limit -> assertThat(limit.retryAfter()).isEqualTo(Duration.ofSeconds(3))))
			.verify(Duration.ofSeconds(1));

		assertThat(fs.handshakeCount()).isEqualTo(handshakes);
		assertThat(this.manager.activeSessionCount()).isEqualTo(10);
		for (Session session : admitted) {
			StepVerifier.create(this.manager.getSession(session.id())).expectNext(session).verifyComplete();
			StepVerifier.create(session.callTool("fs_read", Map.of())).expectNextCount(1).verifyComplete();
		}
	}

	@Test
	void rejectedCredentialIsReplacedByAFreshlyResolvedOne() {
		InMemoryBackendServer fs = backend("fs", "read");
		AtomicInteger generation = new AtomicInteger();
		CachingCredentialResolver resolver = new CachingCredentialResolver(
				(identity, backend) -> Mono.fromSupplier(() -> Credential.bearer("token-" + generation.incrementAndGet())));
		DefaultSession session = create(factoryBuilder().credentialResolver(resolver).build(), ALICE, "fs");
		fs.acceptCredentials(credential -> credential.equals(Credential.bearer("token-2")));

		StepVerifier.create(session.callTool("fs_read", Map.of())).expectNextCount(1).verifyComplete();

		assertThat(fs.presentedCredentials()).containsExactly(Credential.bearer("token-1"),
				Credential.bearer("token-2"));
		assertThat(fs.connections().get(0).isClosed()).isTrue();
		assertThat(fs.connections().get(1).isClosed()).isFalse();
	}

}
