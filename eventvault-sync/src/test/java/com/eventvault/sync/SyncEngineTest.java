package com.eventvault.sync;

import com.eventvault.common.config.EventVaultConfig.RemoteConfig;
import com.eventvault.store.ResourceCatalog;
import com.eventvault.store.ResourceJson;
import com.eventvault.store.ResourceStore;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SyncEngineTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    @TempDir
    Path dataDir;

    private InMemoryConnector mirror;
    private SyncEngine engine;

    @BeforeEach
    void setUp() {
        mirror = new InMemoryConnector();
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    private static RemoteConfig fastConfig() {
        RemoteConfig config = new RemoteConfig();
        config.setMinIntervalMs(0);
        config.setCallTimeoutMs(2_000);
        config.setMaxAttempts(3);
        config.setBackoffInitialMs(5);
        config.setBackoffMaxMs(20);
        config.setBackoffJitter(0);
        config.setBatchThreshold(5);
        config.setBatchSize(2);
        config.setReconnectPollMs(10);
        return config;
    }

    private static JsonNode json(String text) {
        return ResourceJson.parse(text);
    }

    private static SyncTask task(String key, String json) {
        return new SyncTask(key, json(json), Instant.now());
    }

    @Nested
    class Delivery {

        @Test
        void storeSave_isMirrored() {
            ResourceStore store = new ResourceStore(dataDir, ResourceCatalog.standard(), Duration.ofSeconds(5));
            engine = new SyncEngine(mirror, fastConfig());
            store.addListener(engine);
            engine.start();

            assertTrue(store.save(ResourceCatalog.SIGNUP_LOCK, json("true")));

            assertTrue(engine.flush(WAIT));
            assertEquals(Optional.of(json("true")), mirror.get(ResourceCatalog.SIGNUP_LOCK));
            assertEquals(1, engine.stats().pushed());
        }

        @Test
        void suppressedSave_isNotMirrored() {
            ResourceStore store = new ResourceStore(dataDir, ResourceCatalog.standard(), Duration.ofSeconds(5));
            engine = new SyncEngine(mirror, fastConfig());
            store.addListener(engine);
            engine.start();

            store.save(ResourceCatalog.SIGNUP_LOCK, json("true"), false);

            assertTrue(engine.flush(WAIT));
            assertTrue(mirror.getCalls().isEmpty());
        }

        @Test
        void pendingSaves_sameKey_areCoalescedToLatest() {
            engine = new SyncEngine(mirror, fastConfig());
            engine.enqueue(task("events", "{\"main_team\":[\"A1\"]}"));
            engine.enqueue(task("events", "{\"main_team\":[\"A2\"]}"));
            engine.enqueue(task("events", "{\"main_team\":[\"A3\"]}"));

            assertEquals(2, engine.stats().coalesced());
            assertEquals(1, engine.stats().pending());

            engine.start();
            assertTrue(engine.flush(WAIT));

            assertEquals(List.of("push events"), mirror.getCalls());
            assertEquals(json("{\"main_team\":[\"A3\"]}"), mirror.get("events").orElseThrow());
        }

        @Test
        void tasks_areDeliveredInEnqueueOrder() {
            engine = new SyncEngine(mirror, fastConfig());
            engine.enqueue(task("b", "1"));
            engine.enqueue(task("a", "2"));
            engine.enqueue(task("c", "3"));
            engine.enqueue(task("b", "4"));

            engine.start();
            assertTrue(engine.flush(WAIT));

            assertEquals(List.of("push b", "push a", "push c"), mirror.getCalls());
            assertEquals(json("4"), mirror.get("b").orElseThrow());
        }

        @Test
        void fullQueue_rejectsNewKeys() {
            RemoteConfig config = fastConfig();
            config.setQueueCapacity(2);
            engine = new SyncEngine(mirror, config);

            assertTrue(engine.enqueue(task("a", "1")));
            assertTrue(engine.enqueue(task("b", "1")));
            assertFalse(engine.enqueue(task("c", "1")));
            // an already queued key still coalesces
            assertTrue(engine.enqueue(task("a", "2")));

            assertEquals(1, engine.stats().rejected());
            assertEquals(2, engine.stats().pending());
        }

        @Test
        void minimumInterval_separatesCalls() {
            RemoteConfig config = fastConfig();
            config.setMinIntervalMs(60);
            engine = new SyncEngine(mirror, config);
            engine.enqueue(task("a", "1"));
            engine.enqueue(task("b", "1"));
            engine.enqueue(task("c", "1"));

            long start = System.nanoTime();
            engine.start();
            assertTrue(engine.flush(WAIT));

            long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
            assertTrue(elapsedMs >= 120, "elapsed " + elapsedMs + "ms");
            assertEquals(3, engine.stats().pushed());
        }
    }

    @Nested
    class Retries {

        @Test
        void throttled_isRetriedThenDelivered() {
            mirror.throttleNext(2, 0);
            engine = new SyncEngine(mirror, fastConfig());
            engine.enqueue(task("results", "{\"total_wins\":1}"));

            engine.start();
            assertTrue(engine.flush(WAIT));

            SyncStats stats = engine.stats();
            assertEquals(1, stats.pushed());
            assertEquals(2, stats.retried());
            assertEquals(0, stats.dropped());
            assertEquals(3, mirror.getCalls().size());
        }

        @Test
        void exhaustedRetries_dropTaskAndQueueMovesOn() {
            mirror.throttleNext(3, 0);
            engine = new SyncEngine(mirror, fastConfig());
            engine.enqueue(task("a", "1"));
            engine.enqueue(task("b", "2"));

            engine.start();
            assertTrue(engine.flush(WAIT));

            assertEquals(1, engine.stats().dropped());
            assertEquals(1, engine.stats().pushed());
            assertTrue(mirror.get("a").isEmpty());
            assertEquals(json("2"), mirror.get("b").orElseThrow());
        }

        @Test
        void rejected_isDroppedWithoutRetry() {
            AtomicInteger calls = new AtomicInteger();
            RemoteConnector refusing = new FakeConnector() {
                @Override
                public void push(String key, JsonNode document) throws RemoteException {
                    calls.incrementAndGet();
                    throw new RemoteRejectedException("forbidden", 403);
                }
            };
            engine = new SyncEngine(refusing, fastConfig());
            engine.enqueue(task("a", "1"));

            engine.start();
            assertTrue(engine.flush(WAIT));

            assertEquals(1, calls.get());
            assertEquals(1, engine.stats().dropped());
            assertEquals(0, engine.stats().retried());
        }

        @Test
        void slowCall_timesOutAndIsRetried() {
            AtomicInteger calls = new AtomicInteger();
            RemoteConnector slowOnce = new FakeConnector() {
                @Override
                public void push(String key, JsonNode document) {
                    if (calls.incrementAndGet() == 1) {
                        try {
                            Thread.sleep(5_000);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }
                }
            };
            RemoteConfig config = fastConfig();
            config.setCallTimeoutMs(100);
            engine = new SyncEngine(slowOnce, config);
            engine.enqueue(task("a", "1"));

            engine.start();
            assertTrue(engine.flush(WAIT));

            assertEquals(2, calls.get());
            assertEquals(1, engine.stats().retried());
            assertEquals(1, engine.stats().pushed());
        }

        @Test
        void disconnected_pausesWithoutSpendingRetries() throws Exception {
            ResourceStore store = new ResourceStore(dataDir, ResourceCatalog.standard(), Duration.ofSeconds(5));
            engine = new SyncEngine(mirror, fastConfig());
            store.addListener(engine);
            engine.start();
            mirror.setConnected(false);

            assertTrue(store.save(ResourceCatalog.SIGNUP_LOCK, json("true")));
            assertEquals(json("true"), store.load(ResourceCatalog.SIGNUP_LOCK));
            assertFalse(engine.flush(Duration.ofMillis(200)));
            assertTrue(mirror.get(ResourceCatalog.SIGNUP_LOCK).isEmpty());

            mirror.setConnected(true);

            assertTrue(engine.flush(WAIT));
            assertEquals(json("true"), mirror.get(ResourceCatalog.SIGNUP_LOCK).orElseThrow());
            assertEquals(0, engine.stats().retried());
            assertEquals(0, engine.stats().dropped());
        }
    }

    @Nested
    class Batching {

        @Test
        void largeArray_isPushedInBatches() {
            engine = new SyncEngine(mirror, fastConfig());
            JsonNode history = json("[1,2,3,4,5,6,7]");
            engine.enqueue(new SyncTask("events-history", history, Instant.now()));

            engine.start();
            assertTrue(engine.flush(WAIT));

            assertEquals(List.of("batch events-history 0/4", "batch events-history 1/4",
                    "batch events-history 2/4", "batch events-history 3/4"), mirror.getCalls());
            assertEquals(history, mirror.get("events-history").orElseThrow());
        }

        @Test
        void largeObject_isPushedAsKeyValueRecords() {
            engine = new SyncEngine(mirror, fastConfig());
            JsonNode stats = json("{\"1\":{\"wins\":1},\"2\":{\"wins\":2},\"3\":{},\"4\":{},\"5\":{},\"6\":{}}");
            engine.enqueue(new SyncTask("player-stats", stats, Instant.now()));

            engine.start();
            assertTrue(engine.flush(WAIT));

            assertEquals(3, mirror.getCalls().size());
            assertEquals(stats, mirror.get("player-stats").orElseThrow());
        }

        @Test
        void throttledBatch_resumesWithoutResendingEarlierBatches() {
            AtomicInteger calls = new AtomicInteger();
            List<Integer> accepted = new java.util.concurrent.CopyOnWriteArrayList<>();
            RemoteConnector flaky = new FakeConnector() {
                @Override
                public void pushBatch(String key, RecordBatch batch) throws RemoteException {
                    if (calls.incrementAndGet() == 2) {
                        throw new RemoteThrottledException("slow down");
                    }
                    accepted.add(batch.index());
                }
            };
            engine = new SyncEngine(flaky, fastConfig());
            engine.enqueue(task("events-history", "[1,2,3,4,5,6]"));

            engine.start();
            assertTrue(engine.flush(WAIT));

            assertEquals(List.of(0, 1, 2), accepted);
            assertEquals(1, engine.stats().pushed());
        }
    }

    @Test
    void shutdown_stopsWorker() {
        engine = new SyncEngine(mirror, fastConfig());
        engine.start();
        assertTrue(engine.isRunning());

        engine.shutdown(Duration.ofSeconds(1));

        assertFalse(engine.isRunning());
    }

    /** Connected connector that accepts everything; override to misbehave. */
    private static class FakeConnector implements RemoteConnector {
        @Override
        public boolean isConnected() {
            return true;
        }

        @Override
        public void push(String key, JsonNode document) throws RemoteException {
        }

        @Override
        public void pushBatch(String key, RecordBatch batch) throws RemoteException {
        }

        @Override
        public Optional<JsonNode> pull(String key) {
            return Optional.empty();
        }
    }
}
