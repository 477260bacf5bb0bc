package io.indextables.segsearch.core;

import io.indextables.segsearch.exception.DuplicateSegmentException;
import io.indextables.segsearch.exception.InvalidQueryException;
import io.indextables.segsearch.exception.NotRegisteredException;
import io.indextables.segsearch.exception.SchemaMismatchException;
import io.indextables.segsearch.exception.StateException;
import io.indextables.segsearch.query.SearchOptions;
import io.indextables.segsearch.result.SearchResult;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Registration, searching and directory summaries over one or more segments.
 */
public class SearchIndexTest {

    private static Schema schema;

    @BeforeAll
    public static void setUp() {
        SegSearch.initialize();
        schema = Schema.fromJson("{\"id\": {\"exact\": true, \"stored\": true}, \"body\": {\"text\": true}}");
    }

    private static Segment segmentOf(Schema schema, String... bodies) {
        try (SegmentBuilder builder = new SegmentBuilder(schema, 100_000)) {
            for (int i = 0; i < bodies.length; i++) {
                Map<String, String> doc = new HashMap<>();
                doc.put("id", String.valueOf(i));
                doc.put("body", bodies[i]);
                builder.addDocument(doc);
            }
            return builder.finalizeSegment();
        }
    }

    private static Set<String> ids(SearchResult result) {
        Set<String> ids = new HashSet<>();
        for (SearchResult.Hit hit : result) {
            ids.add(hit.get("id"));
        }
        return ids;
    }

    @Test
    @DisplayName("Red fox, blue fox, red dog: 'fox' finds the two foxes")
    public void testEndToEnd() {
        try (Segment segment = segmentOf(schema, "red fox", "blue fox", "red dog");
             SearchIndex index = new SearchIndex()) {
            index.registerSegment(segment);
            SearchResult result = index.search("fox", new SearchOptions().withFields("id").withLimit(10));
            System.out.println("Hits: " + result);
            assertEquals(2, result.size());
            assertEquals(new HashSet<>(Arrays.asList("0", "1")), ids(result));
            for (SearchResult.Hit hit : result) {
                assertEquals(Collections.singleton("id"), hit.getFields().keySet());
                assertTrue(hit.getScore() > 0);
            }
        }
    }

    @Test
    @DisplayName("An empty index returns no hits")
    public void testEmptyIndex() {
        try (SearchIndex index = new SearchIndex()) {
            assertTrue(index.search("anything").isEmpty());
            assertEquals(0, index.getSegmentCount());
            assertEquals(0, index.getNumDocs());
            assertNull(index.getSchema());
            assertEquals(0, index.directorySummary().getSegmentCount());
        }
    }

    @Test
    @DisplayName("Limit 0 returns no hits and the limit caps larger results")
    public void testLimit() {
        try (Segment segment = segmentOf(schema, "fox one", "fox two", "fox three", "fox four");
             SearchIndex index = new SearchIndex()) {
            index.registerSegment(segment);
            assertTrue(index.search("fox", new SearchOptions().withLimit(0)).isEmpty());
            assertEquals(2, index.search("fox", new SearchOptions().withLimit(2)).size());
            assertEquals(4, index.search("fox", new SearchOptions().withLimit(100)).size());
        }
    }

    @Test
    @DisplayName("Repeated searches return identical results")
    public void testIdempotentSearch() {
        try (Segment segment = segmentOf(schema, "red fox", "blue fox", "red dog", "red red fox");
             SearchIndex index = new SearchIndex()) {
            index.registerSegment(segment);
            SearchResult first = index.search("red fox");
            for (int i = 0; i < 5; i++) {
                assertEquals(first, index.search("red fox"));
            }
        }
    }

    @Test
    @DisplayName("Hits from several segments are ranked together")
    public void testMultipleSegments() {
        try (Segment first = segmentOf(schema, "red fox", "blue fox");
             Segment second = segmentOf(schema, "red dog", "grey fox");
             SearchIndex index = new SearchIndex()) {
            index.registerSegment(first);
            index.registerSegment(second);
            assertEquals(2, index.getSegmentCount());
            assertEquals(4, index.getNumDocs());
            assertEquals(3, index.search("fox").size());
            assertEquals(2, index.search("red").size());

            index.removeSegment(first);
            assertFalse(index.isRegistered(first));
            assertTrue(index.isRegistered(second));
            assertEquals(1, index.search("fox").size());
            // removal leaves the segment open
            assertFalse(first.isClosed());
        }
    }

    @Test
    @DisplayName("Registering the same instance twice fails; removing an unknown one fails")
    public void testMembership() {
        try (Segment segment = segmentOf(schema, "red fox");
             Segment other = segmentOf(schema, "blue fox");
             SearchIndex index = new SearchIndex()) {
            index.registerSegment(segment);
            assertThrows(DuplicateSegmentException.class, () -> index.registerSegment(segment));
            assertThrows(NotRegisteredException.class, () -> index.removeSegment(other));
            assertEquals(1, index.getSegmentCount());

            index.removeSegment(segment);
            assertThrows(NotRegisteredException.class, () -> index.removeSegment(segment));
            assertEquals(0, index.getSegmentCount());
            assertNull(index.getSchema());
        }
    }

    @Test
    @DisplayName("Segments with a different schema are rejected")
    public void testSchemaMismatch() {
        Schema otherSchema = new SchemaBuilder()
            .addExactField("id", true)
            .addTextField("body", true)
            .build();
        try (Segment segment = segmentOf(schema, "red fox");
             Segment mismatched = segmentOf(otherSchema, "blue fox");
             SearchIndex index = new SearchIndex()) {
            index.registerSegment(segment);
            assertThrows(SchemaMismatchException.class, () -> index.registerSegment(mismatched));
            assertEquals(1, index.getSegmentCount());
            assertEquals(1, index.search("fox").size());

            // once empty, the index takes any schema
            index.removeSegment(segment);
            index.registerSegment(mismatched);
            assertEquals(otherSchema, index.getSchema());
        }
    }

    @Test
    @DisplayName("Field selection: all stored by default, unknown fields rejected, unstored dropped")
    public void testFieldSelection() {
        try (Segment segment = segmentOf(schema, "red fox");
             SearchIndex index = new SearchIndex()) {
            index.registerSegment(segment);
            assertEquals(Collections.singletonMap("id", "0"), index.search("fox").getHits().get(0).getFields());
            assertTrue(index.search("fox", new SearchOptions().withFields("body")).getHits().get(0)
                .getFields().isEmpty());
            assertThrows(SchemaMismatchException.class,
                () -> index.search("fox", new SearchOptions().withFields("color")));
        }
    }

    @Test
    @DisplayName("Exact fields match whole values only")
    public void testExactField() {
        Schema productSchema = new SchemaBuilder()
            .addExactField("sku", true)
            .addField("category", new FieldCapabilities(true, true, true))
            .build();
        try (SegmentBuilder builder = new SegmentBuilder(productSchema, 10_000)) {
            Map<String, String> first = new HashMap<>();
            first.put("sku", "AB-100");
            first.put("category", "Garden Tools");
            builder.addDocument(first);
            Map<String, String> second = new HashMap<>();
            second.put("sku", "AB-200");
            second.put("category", "Kitchen");
            builder.addDocument(second);

            try (Segment segment = builder.finalizeSegment();
                 SearchIndex index = new SearchIndex()) {
                index.registerSegment(segment);
                SearchResult bySku = index.search("\"AB-100\"");
                assertEquals(1, bySku.size());
                assertEquals("AB-100", bySku.getHits().get(0).get("sku"));
                assertEquals("Garden Tools", bySku.getHits().get(0).get("category"));

                // text on category matches a single word, exact needs the whole value
                assertEquals(1, index.search("garden").size());
                assertEquals(1, index.search("\"Garden Tools\"").size());
                assertTrue(index.search("AB").isEmpty());
            }
        }
    }

    @Test
    @DisplayName("Unparseable queries are rejected")
    public void testInvalidQuery() {
        try (Segment segment = segmentOf(schema, "red fox");
             SearchIndex index = new SearchIndex()) {
            index.registerSegment(segment);
            assertThrows(InvalidQueryException.class, () -> index.search("body:(unbalanced"));
            assertThrows(IllegalArgumentException.class, () -> index.search(null));
            assertTrue(index.search("   ").isEmpty());
        }
    }

    @Test
    @DisplayName("Searching with a closed registered segment fails")
    public void testClosedSegment() {
        Segment segment = segmentOf(schema, "red fox");
        try (SearchIndex index = new SearchIndex()) {
            index.registerSegment(segment);
            segment.close();
            assertThrows(StateException.class, () -> index.search("fox"));
            assertThrows(StateException.class, () -> new SearchIndex().registerSegment(segment));
        }
    }

    @Test
    @DisplayName("Failed registration or removal leaves the registered set unchanged")
    public void testFailedChangeKeepsState() {
        try (Segment kept = segmentOf(schema, "red fox");
             Segment added = segmentOf(schema, "blue fox");
             SearchIndex index = new SearchIndex()) {
            Segment closedLater = segmentOf(schema, "grey fox");
            index.registerSegment(kept);
            index.registerSegment(closedLater);
            closedLater.close();

            // a new view cannot be opened while a registered segment is closed
            assertThrows(StateException.class, () -> index.removeSegment(kept));
            assertTrue(index.isRegistered(kept));
            assertEquals(2, index.getSegmentCount());
            assertEquals(schema, index.getSchema());

            assertThrows(StateException.class, () -> index.registerSegment(added));
            assertFalse(index.isRegistered(added));
            assertEquals(2, index.getSegmentCount());

            // dropping the closed segment restores searching
            index.removeSegment(closedLater);
            assertEquals(1, index.search("fox").size());
            index.registerSegment(added);
            assertEquals(2, index.search("fox").size());
        }
    }

    @Test
    @DisplayName("A closed index rejects use but leaves its segments open")
    public void testCloseIndex() {
        try (Segment segment = segmentOf(schema, "red fox")) {
            SearchIndex index = new SearchIndex();
            index.registerSegment(segment);
            index.close();
            index.close();
            assertThrows(StateException.class, () -> index.search("fox"));
            assertThrows(StateException.class, () -> index.registerSegment(segment));
            assertFalse(segment.isClosed());
            assertEquals(0, index.getSegmentCount());
        }
    }

    @Test
    @DisplayName("One segment can be shared by several indexes")
    public void testSharedSegment() {
        try (Segment segment = segmentOf(schema, "red fox", "blue fox");
             SearchIndex first = new SearchIndex();
             SearchIndex second = new SearchIndex()) {
            first.registerSegment(segment);
            second.registerSegment(segment);
            first.close();
            assertEquals(2, second.search("fox").size());
        }
    }

    @Test
    @DisplayName("Directory summary is identical for the same registered set")
    public void testDirectorySummary() {
        try (Segment first = segmentOf(schema, "red fox", "blue fox");
             Segment second = segmentOf(schema, "red dog");
             SearchIndex a = new SearchIndex();
             SearchIndex b = new SearchIndex()) {
            a.registerSegment(first);
            a.registerSegment(second);
            b.registerSegment(second);
            b.registerSegment(first);

            DirectorySummary summary = a.directorySummary();
            System.out.println(summary);
            assertEquals(summary, b.directorySummary());
            assertEquals(summary.toString(), a.directorySummary().toString());
            assertEquals(2, summary.getSegmentCount());
            assertEquals(3, summary.getNumDocs());
            assertEquals(first.getSizeInBytes() + second.getSizeInBytes(), summary.getTotalBytes());
            for (DirectorySummary.SegmentEntry entry : summary.getSegments()) {
                assertFalse(entry.getFiles().isEmpty());
                for (DirectorySummary.FileEntry file : entry.getFiles()) {
                    assertEquals(40, file.getSha1().length());
                }
            }
        }
    }

    @Test
    @DisplayName("Concurrent searches and registrations do not interfere")
    public void testConcurrentSearch() throws Exception {
        try (Segment base = segmentOf(schema, "red fox", "blue fox");
             SearchIndex index = new SearchIndex()) {
            index.registerSegment(base);
            List<Segment> extra = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                extra.add(segmentOf(schema, "green fox " + i));
            }

            ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                List<Future<Integer>> searches = new ArrayList<>();
                for (int i = 0; i < 50; i++) {
                    searches.add(executor.submit(() -> index.search("fox").size()));
                }
                for (Segment segment : extra) {
                    index.registerSegment(segment);
                }
                for (Future<Integer> search : searches) {
                    int hits = search.get(30, TimeUnit.SECONDS);
                    assertTrue(hits >= 2 && hits <= 7, "Unexpected hit count " + hits);
                }
                assertEquals(7, index.search("fox").size());
            } finally {
                executor.shutdown();
                for (Segment segment : extra) {
                    segment.close();
                }
            }
        }
    }

    @Test
    @DisplayName("Asynchronous search returns the same hits")
    public void testSearchAsync() throws Exception {
        try (Segment segment = segmentOf(schema, "red fox", "blue fox", "red dog");
             SearchIndex index = new SearchIndex()) {
            index.registerSegment(segment);
            CompletableFuture<SearchResult> future = index.searchAsync("fox", new SearchOptions());
            assertEquals(index.search("fox"), future.get(30, TimeUnit.SECONDS));
        }
    }
}
