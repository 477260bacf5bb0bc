package io.indextables.segsearch.core;

import io.indextables.segsearch.config.SegSearchConfig;
import io.indextables.segsearch.exception.CapacityException;
import io.indextables.segsearch.exception.ConfigException;
import io.indextables.segsearch.exception.SchemaMismatchException;
import io.indextables.segsearch.exception.StateException;
import io.indextables.segsearch.result.SearchResult;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Document intake, arena accounting and the builder state machine.
 */
public class SegmentBuilderTest {

    private static Schema schema;

    @BeforeAll
    public static void setUp() {
        SegSearch.initialize();
        schema = new SchemaBuilder()
            .addExactField("id", true)
            .addTextField("body", false)
            .build();
    }

    private static Map<String, String> doc(String id, String body) {
        Map<String, String> doc = new HashMap<>();
        doc.put("id", id);
        doc.put("body", body);
        return doc;
    }

    private static String repeat(char c, int count) {
        char[] chars = new char[count];
        Arrays.fill(chars, c);
        return new String(chars);
    }

    @Test
    @DisplayName("Encoded size counts 4 + name + 4 + value bytes per field")
    public void testEncodedSize() {
        assertEquals(30, SegmentBuilder.encodedSize(doc("1", "red fox")));
        assertEquals(0, SegmentBuilder.encodedSize(Collections.emptyMap()));
        // two bytes per character in UTF-8
        assertEquals(4 + 4 + 4 + 4, SegmentBuilder.encodedSize(Collections.singletonMap("body", "éé")));
    }

    @Test
    @DisplayName("Documents get consecutive positions and charge the arena")
    public void testAddDocuments() {
        try (SegmentBuilder builder = new SegmentBuilder(schema, 10_000)) {
            assertEquals(0, builder.addDocument(doc("1", "red fox")));
            assertEquals(1, builder.addDocument(doc("2", "blue fox")));
            assertEquals(2, builder.getDocumentCount());
            assertEquals(30 + 31, builder.getArenaBytesUsed());
            assertEquals(10_000 - 61, builder.getRemainingArenaBytes());
            assertEquals(10_000, builder.getArenaBytes());
            assertFalse(builder.isFinalized());
        }
    }

    @Test
    @DisplayName("A document that does not fit is rejected and consumes nothing")
    public void testCapacity() {
        try (SegmentBuilder builder = new SegmentBuilder(schema, 100)) {
            Map<String, String> first = Collections.singletonMap("body", repeat('a', 50));
            assertEquals(0, builder.addDocument(first));
            assertEquals(62, builder.getArenaBytesUsed());

            CapacityException e = assertThrows(CapacityException.class,
                () -> builder.addDocument(Collections.singletonMap("body", repeat('b', 30))));
            assertEquals(100, e.getArenaBytes());
            assertEquals(62, e.getUsedBytes());
            assertEquals(42, e.getRequestedBytes());
            assertEquals(1, builder.getDocumentCount());
            assertEquals(62, builder.getArenaBytesUsed());
            System.out.println("Rejected as expected: " + e.getMessage());

            // exactly filling the arena is allowed
            assertEquals(1, builder.addDocument(Collections.singletonMap("body", repeat('c', 26))));
            assertEquals(0, builder.getRemainingArenaBytes());

            try (Segment segment = builder.finalizeSegment()) {
                assertEquals(2, segment.getNumDocs());
            }
        }
    }

    @Test
    @DisplayName("Arena budgets outside the configured range are rejected")
    public void testInvalidArena() {
        assertThrows(ConfigException.class, () -> new SegmentBuilder(schema, 0));
        assertThrows(ConfigException.class, () -> new SegmentBuilder(schema, -1));
        assertThrows(ConfigException.class, () -> new SegmentBuilder(schema, SegSearchConfig.getMaxArenaBytes() + 1));
        assertThrows(IllegalArgumentException.class, () -> new SegmentBuilder(null, 1000));
    }

    @Test
    @DisplayName("Undeclared fields and null values are schema mismatches")
    public void testSchemaMismatch() {
        try (SegmentBuilder builder = new SegmentBuilder(schema, 10_000)) {
            Map<String, String> extra = doc("1", "red fox");
            extra.put("color", "red");
            assertThrows(SchemaMismatchException.class, () -> builder.addDocument(extra));

            Map<String, String> nullValue = new HashMap<>();
            nullValue.put("id", null);
            assertThrows(SchemaMismatchException.class, () -> builder.addDocument(nullValue));

            assertEquals(0, builder.getDocumentCount());
            assertEquals(0, builder.getArenaBytesUsed());
        }
    }

    @Test
    @DisplayName("Declared fields may be missing from a document")
    public void testMissingFields() {
        try (SegmentBuilder builder = new SegmentBuilder(schema, 10_000)) {
            builder.addDocument(Collections.singletonMap("id", "k7"));
            builder.addDocument(Collections.singletonMap("body", "body only"));
            builder.addDocument(Collections.emptyMap());
            try (Segment segment = builder.finalizeSegment();
                 SearchIndex index = new SearchIndex()) {
                assertEquals(3, segment.getNumDocs());
                index.registerSegment(segment);
                SearchResult result = index.search("k7");
                assertEquals(1, result.size());
                assertEquals("k7", result.getHits().get(0).get("id"));
                SearchResult bodyOnly = index.search("body");
                assertEquals(1, bodyOnly.size());
                assertTrue(bodyOnly.getHits().get(0).getFields().isEmpty());
            }
        }
    }

    @Test
    @DisplayName("Exact values longer than a single index term are rejected and consume nothing")
    public void testImmenseExactValue() {
        try (SegmentBuilder builder = new SegmentBuilder(schema)) {
            SchemaMismatchException e = assertThrows(SchemaMismatchException.class,
                () -> builder.addDocument(Collections.singletonMap("id", repeat('x', 40_000))));
            System.out.println("Rejected as expected: " + e.getMessage());
            // 16384 two-byte characters exceed the limit by two bytes
            assertThrows(SchemaMismatchException.class,
                () -> builder.addDocument(Collections.singletonMap("id", repeat('\u00e9', 16_384))));
            assertEquals(0, builder.getDocumentCount());
            assertEquals(0, builder.getArenaBytesUsed());

            // the largest allowed term and long text values are fine
            assertEquals(0, builder.addDocument(Collections.singletonMap("id", repeat('y', 32_766))));
            assertEquals(1, builder.addDocument(Collections.singletonMap("body", repeat('z', 40_000))));
            try (Segment segment = builder.finalizeSegment()) {
                assertEquals(2, segment.getNumDocs());
            }
        }
    }

    @Test
    @DisplayName("JSON documents are flat objects of strings")
    public void testAddJson() {
        try (SegmentBuilder builder = new SegmentBuilder(schema, 10_000)) {
            assertEquals(0, builder.addJson("{\"id\": \"7\", \"body\": \"red fox\"}"));
            assertEquals(30, builder.getArenaBytesUsed());
            assertThrows(SchemaMismatchException.class, () -> builder.addJson("{\"id\": 7}"));
            assertThrows(SchemaMismatchException.class, () -> builder.addJson("[\"id\"]"));
            assertThrows(SchemaMismatchException.class, () -> builder.addJson("{broken"));
            assertThrows(SchemaMismatchException.class, () -> builder.addJson("{\"color\": \"red\"}"));
            assertEquals(1, builder.getDocumentCount());
        }
    }

    @Test
    @DisplayName("Removing documents resets the count and the arena")
    public void testRemoveDocuments() {
        try (SegmentBuilder builder = new SegmentBuilder(schema, 10_000)) {
            builder.addDocument(doc("1", "red fox"));
            builder.addDocument(doc("2", "blue fox"));
            builder.removeDocuments();
            assertEquals(0, builder.getDocumentCount());
            assertEquals(0, builder.getArenaBytesUsed());

            assertEquals(0, builder.addDocument(doc("3", "red dog")));
            try (Segment segment = builder.finalizeSegment();
                 SearchIndex index = new SearchIndex()) {
                assertEquals(1, segment.getNumDocs());
                index.registerSegment(segment);
                assertTrue(index.search("fox").isEmpty());
                assertEquals(1, index.search("dog").size());
            }
        }
    }

    @Test
    @DisplayName("A finalized builder rejects every mutation")
    public void testFinalizedState() {
        SegmentBuilder builder = new SegmentBuilder(schema, 10_000);
        builder.addDocument(doc("1", "red fox"));
        try (Segment segment = builder.finalizeSegment()) {
            assertTrue(builder.isFinalized());
            assertThrows(StateException.class, () -> builder.addDocument(doc("2", "blue fox")));
            assertThrows(StateException.class, () -> builder.addJson("{\"id\": \"2\"}"));
            assertThrows(StateException.class, builder::removeDocuments);
            assertThrows(StateException.class, builder::finalizeSegment);

            // closing the builder leaves the segment usable
            builder.close();
            assertFalse(segment.isClosed());
            assertEquals(1, segment.getNumDocs());
            assertTrue(segment.export().length > 0);
        }
    }

    @Test
    @DisplayName("A closed builder rejects mutation and finalization")
    public void testClosedState() {
        SegmentBuilder builder = new SegmentBuilder(schema, 10_000);
        builder.addDocument(doc("1", "red fox"));
        builder.close();
        builder.close();
        assertThrows(StateException.class, () -> builder.addDocument(doc("2", "blue fox")));
        assertThrows(StateException.class, builder::finalizeSegment);
    }

    @Test
    @DisplayName("An empty builder finalizes into an empty segment")
    public void testEmptySegment() {
        try (SegmentBuilder builder = new SegmentBuilder(schema);
             Segment segment = builder.finalizeSegment()) {
            assertEquals(0, segment.getNumDocs());
            assertEquals(SegSearchConfig.getDefaultArenaBytes(), builder.getArenaBytes());
        }
    }

    @Test
    @DisplayName("Bulk add stops at the first failure and keeps earlier documents")
    public void testAddDocumentsStopsOnFailure() {
        try (SegmentBuilder builder = new SegmentBuilder(schema, 10_000)) {
            List<Map<String, String>> docs = new ArrayList<>();
            docs.add(doc("1", "red fox"));
            docs.add(Collections.singletonMap("color", "red"));
            docs.add(doc("3", "red dog"));
            assertThrows(SchemaMismatchException.class, () -> builder.addDocuments(docs));
            assertEquals(1, builder.getDocumentCount());
        }
    }

    @Test
    @DisplayName("Asynchronous bulk add completes with the number of documents added")
    public void testAddDocumentsAsync() throws Exception {
        List<Map<String, String>> docs = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            docs.add(doc(String.valueOf(i), "document number " + i));
        }
        try (SegmentBuilder builder = new SegmentBuilder(schema, 100_000)) {
            CompletableFuture<Integer> future = builder.addDocumentsAsync(docs);
            assertEquals(100, future.get(30, TimeUnit.SECONDS));
            assertEquals(100, builder.getDocumentCount());
        }
    }

    @Test
    @DisplayName("Asynchronous bulk add reports capacity failures")
    public void testAddDocumentsAsyncFailure() throws Exception {
        List<Map<String, String>> docs = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            docs.add(Collections.singletonMap("body", repeat('x', 38)));
        }
        try (SegmentBuilder builder = new SegmentBuilder(schema, 200)) {
            CompletableFuture<Integer> future = builder.addDocumentsAsync(docs);
            ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(30, TimeUnit.SECONDS));
            assertTrue(e.getCause() instanceof CapacityException);
            // 50 bytes each
            assertEquals(4, builder.getDocumentCount());
        }
    }
}
