package com.groundgate.core.evidence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EvidenceStoreTest {

    private EvidenceStore store;

    @BeforeEach
    void setUp() {
        store = new EvidenceStore();
    }

    @Nested
    @DisplayName("addChunk")
    class AddChunkTests {

        @Test
        @DisplayName("returns a stable content-derived id")
        void returnsStableId() {
            String first = store.addChunk("paper-1", "section:Methods", "CD73 is expressed on T cells.");
            String second = new EvidenceStore().addChunk("paper-1", "section:Methods", "CD73 is expressed on T cells.");

            assertEquals(first, second);
            assertTrue(first.startsWith("chunk-"));
            assertEquals("chunk-".length() + 16, first.length());
        }

        @Test
        @DisplayName("adding identical input twice keeps one chunk")
        void idempotent() {
            String id = store.addChunk("paper-1", "section:Intro", "text");
            String again = store.addChunk("paper-1", "section:Intro", "text");

            assertEquals(id, again);
            assertEquals(1, store.size());
        }

        @Test
        @DisplayName("source, locator and text all contribute to the id")
        void allFieldsContribute() {
            String base = store.addChunk("a", "section:1", "text");

            assertNotEquals(base, store.idFor("b", "section:1", "text"));
            assertNotEquals(base, store.idFor("a", "section:2", "text"));
            assertNotEquals(base, store.idFor("a", "section:1", "other"));
        }

        @Test
        @DisplayName("first write wins when texts share the hashed prefix")
        void firstWriteWins() {
            var small = new EvidenceStore(4);
            String id = small.addChunk("src", "loc", "abcd-original");
            String same = small.addChunk("src", "loc", "abcd-replacement");

            assertEquals(id, same);
            assertEquals("abcd-original", small.getChunk(id).orElseThrow().text());
        }

        @Test
        @DisplayName("null fields are stored as empty strings")
        void nullFields() {
            String id = store.addChunk(null, null, "text");

            var chunk = store.getChunk(id).orElseThrow();
            assertEquals("", chunk.source());
            assertEquals("", chunk.locator());
            assertEquals(id, store.idFor("", "", "text"));
        }

        @Test
        @DisplayName("rejects a non-positive prefix length")
        void rejectsBadPrefixLength() {
            assertThrows(IllegalArgumentException.class, () -> new EvidenceStore(0));
        }
    }

    @Nested
    @DisplayName("lookup")
    class LookupTests {

        @Test
        @DisplayName("unknown ids are absent")
        void unknownAbsent() {
            assertTrue(store.getChunk("chunk-missing").isEmpty());
            assertFalse(store.hasChunk("chunk-missing"));
            assertTrue(store.isEmpty());
        }

        @Test
        @DisplayName("chunks are listed in insertion order")
        void insertionOrder() {
            String a = store.addChunk("s", "l", "first");
            String b = store.addChunk("s", "l", "second");
            String c = store.addChunk("s", "l", "third");

            assertEquals(List.of(a, b, c), store.chunks().stream().map(ch -> ch.chunkId()).toList());
        }
    }

    @Nested
    @DisplayName("getQuote")
    class GetQuoteTests {

        @Test
        @DisplayName("returns full text when it fits")
        void fullText() {
            String id = store.addChunk("s", "l", "short text");
            assertEquals("short text", store.getQuote(id, 200));
        }

        @Test
        @DisplayName("clips long text and marks the cut")
        void clips() {
            String id = store.addChunk("s", "l", "x".repeat(300));
            String quote = store.getQuote(id, 50);

            assertTrue(quote.length() <= 50);
            assertTrue(quote.endsWith("..."));
        }

        @Test
        @DisplayName("unknown id yields an empty quote")
        void unknownEmpty() {
            assertEquals("", store.getQuote("chunk-missing", 100));
        }
    }

    @Test
    @DisplayName("concurrent writers of the same chunk agree on one id")
    void concurrentWriters() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            var start = new CountDownLatch(1);
            Set<String> ids = ConcurrentHashMap.newKeySet();
            var futures = new ArrayList<Future<?>>();
            for (int i = 0; i < 32; i++) {
                int n = i;
                futures.add(pool.submit(() -> {
                    start.await();
                    ids.add(store.addChunk("shared", "section:1", "same text"));
                    store.addChunk("own", "section:" + n, "text " + n);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }

            assertEquals(1, ids.size());
            assertEquals(33, store.size());
        } finally {
            pool.shutdownNow();
        }
    }
}
