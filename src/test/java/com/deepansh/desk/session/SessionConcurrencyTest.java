package com.deepansh.desk.session;

import com.deepansh.desk.approval.DeferredDecisionProvider;
import com.deepansh.desk.config.DeskProperties;
import com.deepansh.desk.dispatch.DispatcherFactory;
import com.deepansh.desk.dispatch.IntentClassifier;
import com.deepansh.desk.dispatch.TurnErrorHandler;
import com.deepansh.desk.history.TurnRole;
import com.deepansh.desk.support.CapturingRenderer;
import com.deepansh.desk.support.DeskFixtures;
import com.deepansh.desk.support.ScriptedLlmClient;
import com.deepansh.desk.worker.WorkerRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Turns of one session are sequential, different sessions are independent,
 * and concurrent writes to one session record never leave it unreadable.
 */
class SessionConcurrencyTest {

    private static final Instant NOW = Instant.parse("2026-10-19T01:00:00Z");

    @TempDir
    Path tempDir;

    private FileSessionStore store;
    private SessionRegistry registry;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        store = new FileSessionStore(tempDir, DeskFixtures.objectMapper());
        ScriptedLlmClient llm = new ScriptedLlmClient();
        DeskProperties properties = DeskFixtures.properties();
        WorkerRegistry workers = new WorkerRegistry(
                DeskFixtures.services(llm, new CapturingRenderer(), properties));
        DispatcherFactory factory = new DispatcherFactory(workers, new IntentClassifier(llm, workers),
                new DeferredDecisionProvider(), store, new TurnErrorHandler(), properties, DeskFixtures.CLOCK);
        registry = new SessionRegistry(store, factory, new SessionIdGenerator(DeskFixtures.CLOCK));
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void execute_sameSessionFromTwoThreads_turnsNeverOverlap() throws Exception {
        String sessionId = registry.create("Sato", null).getSessionId();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        AtomicInteger turns = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);

        List<Future<?>> workers = new ArrayList<>();
        for (int t = 0; t < 2; t++) {
            workers.add(executor.submit(() -> {
                await(start);
                for (int i = 0; i < 25; i++) {
                    registry.execute(sessionId, rt -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(1));
                        turns.incrementAndGet();
                        inside.decrementAndGet();
                        return null;
                    });
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> worker : workers) {
            worker.get(30, TimeUnit.SECONDS);
        }

        assertThat(turns.get()).isEqualTo(50);
        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void execute_otherSession_proceedsWhileATurnIsInProgress() throws Exception {
        String busy = registry.create("Sato", "busy").getSessionId();
        String other = registry.create("Suzuki", "other").getSessionId();
        CountDownLatch inTurn = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<?> longTurn = executor.submit(() -> registry.execute(busy, rt -> {
            inTurn.countDown();
            await(release);
            return null;
        }));
        assertThat(inTurn.await(5, TimeUnit.SECONDS)).isTrue();

        Future<String> quickTurn = executor.submit(() -> registry.execute(other, SessionRuntime::getSessionId));

        assertThat(quickTurn.get(5, TimeUnit.SECONDS)).isEqualTo(other);
        assertThat(longTurn.isDone()).isFalse();
        release.countDown();
        longTurn.get(5, TimeUnit.SECONDS);
    }

    @Test
    void save_parallelWritersOnOneSession_recordAlwaysLoads() throws Exception {
        String sessionId = "20261019_100000_cafe0001";
        store.save(sessionFrom(sessionId, "writer-initial"));
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean writing = new AtomicBoolean(true);
        Queue<Throwable> failures = new ConcurrentLinkedQueue<>();
        Queue<String> seen = new ConcurrentLinkedQueue<>();

        List<Future<?>> writers = new ArrayList<>();
        for (int w = 0; w < 6; w++) {
            int writer = w;
            writers.add(executor.submit(() -> {
                await(start);
                for (int i = 0; i < 20; i++) {
                    store.save(sessionFrom(sessionId, "writer-" + writer + "-" + i));
                }
                return null;
            }));
        }
        Future<?> reader = executor.submit(() -> {
            await(start);
            while (writing.get()) {
                try {
                    seen.add(store.load(sessionId).orElseThrow().getRequesterId());
                } catch (RuntimeException e) {
                    failures.add(e);
                }
            }
            return null;
        });

        start.countDown();
        for (Future<?> writer : writers) {
            writer.get(30, TimeUnit.SECONDS);
        }
        writing.set(false);
        reader.get(30, TimeUnit.SECONDS);

        assertThat(failures).isEmpty();
        assertThat(seen).allMatch(requester -> requester.startsWith("writer-"));
        assertThat(store.load(sessionId).orElseThrow().getRequesterId()).matches("writer-\\d-\\d+");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .containsExactly("session_" + sessionId + ".json");
        }
    }

    @Test
    void lockFor_sameId_isAlwaysTheSameLock() {
        assertThat(store.lockFor("20261019_100000_cafe0001"))
                .isSameAs(store.lockFor("20261019_100000_cafe0001"));
    }

    private static Session sessionFrom(String sessionId, String requester) {
        Session session = Session.create(sessionId, 30, NOW);
        session.setRequesterId(requester);
        for (int i = 0; i < 20; i++) {
            session.getDispatcherHistory().append(TurnRole.USER, requester + " line " + i + " ".repeat(64));
        }
        return session;
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch timed out");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
