package com.eventvault.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ResourceStoreTest {

    @TempDir
    Path dataDir;

    private ResourceStore store;

    @BeforeEach
    void setUp() {
        store = new ResourceStore(dataDir, ResourceCatalog.standard(), Duration.ofSeconds(5));
    }

    private static JsonNode json(String text) {
        return ResourceJson.parse(text);
    }

    private List<Path> tempFiles() throws Exception {
        try (Stream<Path> files = Files.list(dataDir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".tmp")).toList();
        }
    }

    @Nested
    class Reads {

        @Test
        void load_absent_returnsDefault() {
            JsonNode events = store.load(ResourceCatalog.EVENTS);

            assertEquals(json("{\"main_team\":[],\"team_2\":[],\"team_3\":[]}"), events);
            assertFalse(store.exists(ResourceCatalog.EVENTS));
        }

        @Test
        void load_absent_returnsPrivateCopyOfDefault() {
            ObjectNode first = (ObjectNode) store.load(ResourceCatalog.BLOCKED_ACTORS);
            first.put("123", "spam");

            assertEquals(json("{}"), store.load(ResourceCatalog.BLOCKED_ACTORS));
        }

        @Test
        void load_withCallerDefault_absent_returnsCallerDefault() {
            assertEquals(json("[1]"), store.load(ResourceCatalog.EVENTS_HISTORY, json("[1]")));
            assertNull(store.load(ResourceCatalog.EVENTS_HISTORY, null));
        }

        @Test
        void read_absent_reportsAbsent() {
            assertEquals(ReadResult.Status.ABSENT, store.read(ResourceCatalog.RESULTS).status());
        }

        @Test
        void read_unknownKey_throws() {
            assertThrows(StoreException.class, () -> store.read("nope"));
            assertThrows(StoreException.class, () -> store.save("nope", json("{}")));
        }

        @Test
        void read_corruptFile_quarantinesAndReportsCorrupt() throws Exception {
            Path file = dataDir.resolve("events.json");
            Files.writeString(file, "{ \"main_team\": [", StandardCharsets.UTF_8);

            ReadResult result = store.read(ResourceCatalog.EVENTS);

            assertEquals(ReadResult.Status.CORRUPT, result.status());
            assertNotNull(result.quarantinedTo());
            assertFalse(Files.exists(file));
            assertTrue(result.quarantinedTo().getFileName().toString().startsWith("events.json."));
            assertTrue(result.quarantinedTo().getFileName().toString().endsWith(ResourceStore.QUARANTINE_SUFFIX));
            assertEquals("{ \"main_team\": [", Files.readString(result.quarantinedTo()));
        }

        @Test
        void load_corruptFile_returnsDefaultAndKeepsOriginalAside() throws Exception {
            Files.writeString(dataDir.resolve("signup_lock.json"), "tru");

            assertEquals(json("false"), store.load(ResourceCatalog.SIGNUP_LOCK));
            try (Stream<Path> files = Files.list(dataDir)) {
                assertEquals(1, files.filter(p -> p.getFileName().toString().startsWith("signup_lock.json."))
                        .count());
            }
        }

        @Test
        void read_emptyFile_isCorrupt() throws Exception {
            Files.writeString(dataDir.resolve("ign_map.json"), "");

            assertEquals(ReadResult.Status.CORRUPT, store.read(ResourceCatalog.ALIAS_MAP).status());
        }

        @Test
        void read_trailingGarbage_isCorrupt() throws Exception {
            Files.writeString(dataDir.resolve("events_history.json"), "[1,2]]garbage");

            ReadResult result = store.read(ResourceCatalog.EVENTS_HISTORY);

            assertEquals(ReadResult.Status.CORRUPT, result.status());
            assertFalse(Files.exists(dataDir.resolve("events_history.json")));
            assertEquals("[1,2]]garbage", Files.readString(result.quarantinedTo()));
        }

        @Test
        void read_trailingWhitespace_isOk() throws Exception {
            Files.writeString(dataDir.resolve("events_history.json"), "[1,2]\n\n  ");

            assertEquals(json("[1,2]"), store.read(ResourceCatalog.EVENTS_HISTORY).value());
        }

        @Test
        void lastModified_tracksSaves() {
            assertTrue(store.lastModified(ResourceCatalog.RESULTS).isEmpty());

            store.save(ResourceCatalog.RESULTS, json("{\"total_wins\":1,\"total_losses\":0,\"history\":[]}"));

            assertTrue(store.lastModified(ResourceCatalog.RESULTS).isPresent());
        }
    }

    @Nested
    class Writes {

        @Test
        void save_thenLoad_returnsSameDocument() {
            JsonNode roster = json("{\"main_team\":[\"Alpha\",\"Bravo\"],\"team_2\":[],\"team_3\":[\"Charlie\"]}");

            assertTrue(store.save(ResourceCatalog.EVENTS, roster));

            assertEquals(roster, store.load(ResourceCatalog.EVENTS));
        }

        @Test
        void save_writesPrettyJsonWithTrailingNewline() throws Exception {
            store.save(ResourceCatalog.ALIAS_MAP, json("{\"1\":\"Alpha\"}"));

            String text = Files.readString(dataDir.resolve("ign_map.json"));
            assertTrue(text.endsWith("\n"));
            assertTrue(text.contains("\"1\" : \"Alpha\""));
        }

        @Test
        void save_existing_keepsPreviousAsBak() throws Exception {
            store.save(ResourceCatalog.ALIAS_MAP, json("{\"1\":\"Alpha\"}"));
            store.save(ResourceCatalog.ALIAS_MAP, json("{\"1\":\"Bravo\"}"));

            Path bak = dataDir.resolve("ign_map.json" + ResourceStore.BACKUP_SUFFIX);
            assertTrue(Files.exists(bak));
            assertEquals(json("{\"1\":\"Alpha\"}"), ResourceJson.parse(Files.readAllBytes(bak)));
            assertEquals(json("{\"1\":\"Bravo\"}"), store.load(ResourceCatalog.ALIAS_MAP));
            assertTrue(tempFiles().isEmpty());
        }

        @Test
        void save_firstWrite_hasNoBak() {
            store.save(ResourceCatalog.ALIAS_MAP, json("{}"));

            assertFalse(Files.exists(dataDir.resolve("ign_map.json.bak")));
        }

        @Test
        void save_createsMissingDataDir() {
            Path nested = dataDir.resolve("deeper/data");
            ResourceStore nestedStore = new ResourceStore(nested, ResourceCatalog.standard(), Duration.ofSeconds(1));

            assertTrue(nestedStore.save(ResourceCatalog.SIGNUP_LOCK, json("true")));
            assertTrue(Files.exists(nested.resolve("signup_lock.json")));
        }

        @Test
        void save_failure_leavesPreviousDocumentAndNoTempFile() throws Exception {
            JsonNode original = json("{\"1\":\"Alpha\"}");
            store.save(ResourceCatalog.ALIAS_MAP, original);
            // A non-empty directory where the .bak file belongs makes the write fail.
            Path bak = dataDir.resolve("ign_map.json.bak");
            Files.delete(bak);
            Files.createDirectories(bak);
            Files.writeString(bak.resolve("blocker"), "x");

            boolean saved = store.save(ResourceCatalog.ALIAS_MAP, json("{\"1\":\"Bravo\"}"));

            assertFalse(saved);
            assertEquals(original, store.load(ResourceCatalog.ALIAS_MAP));
            assertTrue(tempFiles().isEmpty());
        }

        @Test
        void save_copiesValue_laterMutationDoesNotLeak() {
            ObjectNode value = (ObjectNode) json("{\"1\":\"Alpha\"}");
            store.save(ResourceCatalog.ALIAS_MAP, value);
            value.put("2", "Bravo");

            assertEquals(json("{\"1\":\"Alpha\"}"), store.load(ResourceCatalog.ALIAS_MAP));
        }

        @Test
        void update_appliesFunctionAndSaves() {
            var saved = store.update(ResourceCatalog.RESULTS, null, doc -> {
                ((ObjectNode) doc).put("total_wins", doc.get("total_wins").asInt() + 1);
                return doc;
            });

            assertTrue(saved.isPresent());
            assertEquals(1, store.load(ResourceCatalog.RESULTS).get("total_wins").asInt());
        }

        @Test
        void update_nullResult_abortsWithoutWriting() {
            var saved = store.update(ResourceCatalog.RESULTS, null, doc -> null);

            assertTrue(saved.isEmpty());
            assertFalse(store.exists(ResourceCatalog.RESULTS));
        }

        @Test
        void restoreRaw_writesExactBytes() throws Exception {
            byte[] bytes = "{\"1\":   \"Alpha\"}".getBytes(StandardCharsets.UTF_8);

            assertTrue(store.restoreRaw(ResourceCatalog.ALIAS_MAP, bytes));

            assertArrayEquals(bytes, Files.readAllBytes(dataDir.resolve("ign_map.json")));
            assertArrayEquals(bytes, store.readRaw(ResourceCatalog.ALIAS_MAP).orElseThrow());
        }

        @Test
        void restoreRaw_invalidJson_isRejected() {
            store.save(ResourceCatalog.ALIAS_MAP, json("{\"1\":\"Alpha\"}"));

            assertFalse(store.restoreRaw(ResourceCatalog.ALIAS_MAP, "{oops".getBytes(StandardCharsets.UTF_8)));
            assertEquals(json("{\"1\":\"Alpha\"}"), store.load(ResourceCatalog.ALIAS_MAP));
        }

        @Test
        void restoreRaw_trailingContent_isRejected() {
            store.save(ResourceCatalog.EVENTS_HISTORY, json("[\"kept\"]"));

            assertFalse(store.restoreRaw(ResourceCatalog.EVENTS_HISTORY, "[] {oops".getBytes(StandardCharsets.UTF_8)));
            assertEquals(json("[\"kept\"]"), store.load(ResourceCatalog.EVENTS_HISTORY));
        }

        @Test
        void readRaw_absent_isEmpty() {
            assertTrue(store.readRaw(ResourceCatalog.MATCH_STATS).isEmpty());
        }
    }

    @Nested
    class Listeners {

        @Test
        void save_notifiesListenersWithSnapshot() {
            List<String> seen = new CopyOnWriteArrayList<>();
            store.addListener((key, snapshot) -> seen.add(key + "=" + snapshot.toString()));

            store.save(ResourceCatalog.SIGNUP_LOCK, json("true"));

            assertEquals(List.of("signup-lock=true"), seen);
        }

        @Test
        void save_withoutNotify_skipsListeners() {
            AtomicInteger calls = new AtomicInteger();
            store.addListener((key, snapshot) -> calls.incrementAndGet());

            store.save(ResourceCatalog.SIGNUP_LOCK, json("true"), false);

            assertEquals(0, calls.get());
        }

        @Test
        void failingListener_doesNotFailSave() {
            AtomicInteger calls = new AtomicInteger();
            store.addListener((key, snapshot) -> {
                throw new IllegalStateException("boom");
            });
            store.addListener((key, snapshot) -> calls.incrementAndGet());

            assertTrue(store.save(ResourceCatalog.SIGNUP_LOCK, json("true")));
            assertEquals(1, calls.get());
        }

        @Test
        void failedSave_doesNotNotify() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            store.addListener((key, snapshot) -> calls.incrementAndGet());
            // A non-empty directory at the target path cannot be replaced.
            Path target = dataDir.resolve("signup_lock.json");
            Files.createDirectories(target);
            Files.writeString(target.resolve("blocker"), "x");

            assertFalse(store.save(ResourceCatalog.SIGNUP_LOCK, json("true")));
            assertEquals(0, calls.get());
        }

        @Test
        void listeners_sameKey_notifiedInWriteOrder() throws Exception {
            List<JsonNode> seen = new CopyOnWriteArrayList<>();
            CountDownLatch firstInListener = new CountDownLatch(1);
            CountDownLatch releaseFirst = new CountDownLatch(1);
            store.addListener((key, snapshot) -> {
                seen.add(snapshot);
                if (snapshot.equals(json("[\"v1\"]"))) {
                    firstInListener.countDown();
                    try {
                        releaseFirst.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            });

            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                Future<Boolean> first = pool.submit(() -> store.save(ResourceCatalog.EVENTS_HISTORY, json("[\"v1\"]")));
                assertTrue(firstInListener.await(5, TimeUnit.SECONDS));
                Future<Boolean> second = pool.submit(() -> store.save(ResourceCatalog.EVENTS_HISTORY, json("[\"v2\"]")));
                Thread.sleep(100);
                assertFalse(second.isDone());

                releaseFirst.countDown();

                assertTrue(first.get(5, TimeUnit.SECONDS));
                assertTrue(second.get(5, TimeUnit.SECONDS));
            } finally {
                pool.shutdownNow();
            }
            assertEquals(List.of(json("[\"v1\"]"), json("[\"v2\"]")), seen);
            assertEquals(json("[\"v2\"]"), store.load(ResourceCatalog.EVENTS_HISTORY));
        }

        @Test
        void removeListener_stopsNotifications() {
            AtomicInteger calls = new AtomicInteger();
            ResourceChangeListener listener = (key, snapshot) -> calls.incrementAndGet();
            store.addListener(listener);
            store.removeListener(listener);

            store.save(ResourceCatalog.SIGNUP_LOCK, json("true"));

            assertEquals(0, calls.get());
        }
    }

    @Nested
    class Concurrency {

        @Test
        void concurrentUpdates_sameKey_loseNothing() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int t = 0; t < 8; t++) {
                    futures.add(pool.submit(() -> {
                        for (int i = 0; i < 25; i++) {
                            store.update(ResourceCatalog.RESULTS, null, doc -> {
                                ((ObjectNode) doc).put("total_wins", doc.get("total_wins").asInt() + 1);
                                return doc;
                            });
                        }
                    }));
                }
                for (Future<?> f : futures) {
                    f.get(30, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(200, store.load(ResourceCatalog.RESULTS).get("total_wins").asInt());
        }

        @Test
        void concurrentSavesAndReads_neverSeePartialDocument() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(4);
            AtomicInteger badReads = new AtomicInteger();
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int w = 0; w < 2; w++) {
                    int writer = w;
                    futures.add(pool.submit(() -> {
                        for (int i = 0; i < 30; i++) {
                            StringBuilder history = new StringBuilder("[");
                            for (int n = 0; n < 200; n++) {
                                history.append(n == 0 ? "" : ",").append(writer * 1000 + i);
                            }
                            history.append("]");
                            store.save(ResourceCatalog.EVENTS_HISTORY, json(history.toString()));
                        }
                    }));
                }
                for (int r = 0; r < 2; r++) {
                    futures.add(pool.submit(() -> {
                        for (int i = 0; i < 60; i++) {
                            ReadResult result = store.read(ResourceCatalog.EVENTS_HISTORY);
                            if (result.status() == ReadResult.Status.CORRUPT
                                    || (result.isOk() && result.value().size() != 200)) {
                                badReads.incrementAndGet();
                            }
                        }
                    }));
                }
                for (Future<?> f : futures) {
                    f.get(60, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(0, badReads.get());
            assertEquals(200, store.load(ResourceCatalog.EVENTS_HISTORY).size());
        }

        @Test
        void heldKey_doesNotBlockOtherKeys() throws Exception {
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Thread holder = new Thread(() -> store.update(ResourceCatalog.EVENTS, null, doc -> {
                held.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return doc;
            }));
            holder.start();
            try {
                assertTrue(held.await(5, TimeUnit.SECONDS));

                long start = System.nanoTime();
                assertTrue(store.save(ResourceCatalog.RESULTS,
                        json("{\"total_wins\":0,\"total_losses\":0,\"history\":[]}")));
                assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 2000);
            } finally {
                release.countDown();
                holder.join(5000);
            }
        }

        @Test
        void heldKey_otherWriterTimesOut() throws Exception {
            ResourceStore impatient = new ResourceStore(dataDir, ResourceCatalog.standard(), Duration.ofMillis(100));
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Thread holder = new Thread(() -> impatient.update(ResourceCatalog.EVENTS, null, doc -> {
                held.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return doc;
            }));
            holder.start();
            try {
                assertTrue(held.await(5, TimeUnit.SECONDS));

                assertThrows(StoreException.class,
                        () -> impatient.save(ResourceCatalog.EVENTS, json("{}")));
            } finally {
                release.countDown();
                holder.join(5000);
            }
        }
    }
}
