package io.indextables.segsearch.core;

import io.indextables.segsearch.exception.DuplicateSegmentException;
import io.indextables.segsearch.exception.SchemaMismatchException;
import io.indextables.segsearch.exception.StateException;
import io.indextables.segsearch.query.SearchOptions;
import io.indextables.segsearch.result.SearchResult;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Merging segments into one.
 */
public class SegmentMergerTest {

    private static Schema schema;

    @BeforeAll
    public static void setUp() {
        SegSearch.initialize();
        schema = new SchemaBuilder()
            .addExactField("id", true)
            .addTextField("body", true)
            .build();
    }

    private static Segment segmentOf(String prefix, String... bodies) {
        try (SegmentBuilder builder = new SegmentBuilder(schema, 100_000)) {
            for (int i = 0; i < bodies.length; i++) {
                Map<String, String> doc = new HashMap<>();
                doc.put("id", prefix + i);
                doc.put("body", bodies[i]);
                builder.addDocument(doc);
            }
            return builder.finalizeSegment();
        }
    }

    @Test
    @DisplayName("Merged segment holds every document of its inputs")
    public void testMerge() {
        try (Segment first = segmentOf("a", "red fox", "blue fox");
             Segment second = segmentOf("b", "red dog");
             Segment third = segmentOf("c", "grey fox", "brown bear")) {
            SegmentMerger merger = new SegmentMerger()
                .addSegment(first)
                .addSegment(second)
                .addSegment(third);
            assertEquals(3, merger.getSegmentCount());

            try (Segment merged = merger.merge();
                 SearchIndex index = new SearchIndex()) {
                System.out.println("Merged: " + merged);
                assertEquals(5, merged.getNumDocs());
                assertEquals(schema, merged.getSchema());
                assertNotEquals(first.getSegmentId(), merged.getSegmentId());

                index.registerSegment(merged);
                SearchResult foxes = index.search("fox", new SearchOptions().withLimit(10));
                Set<String> ids = new HashSet<>();
                for (SearchResult.Hit hit : foxes) {
                    ids.add(hit.get("id"));
                }
                assertEquals(Set.of("a0", "a1", "c0"), ids);
            }

            // inputs stay usable
            assertFalse(first.isClosed());
            assertEquals(2, first.getNumDocs());
        }
    }

    @Test
    @DisplayName("Merging a single segment copies it")
    public void testSingleSegment() {
        try (Segment only = segmentOf("a", "red fox", "blue fox")) {
            try (Segment copy = new SegmentMerger().addSegment(only).merge()) {
                assertEquals(2, copy.getNumDocs());
                assertNotSame(only, copy);
                assertArrayEquals(only.export(), copy.export());
                only.close();
                assertFalse(copy.isClosed());
                assertTrue(copy.export().length > 0);
            }
        }
    }

    @Test
    @DisplayName("Merged segment survives export and import")
    public void testMergedRoundTrip() {
        try (Segment first = segmentOf("a", "red fox");
             Segment second = segmentOf("b", "blue fox");
             Segment merged = new SegmentMerger().addSegment(first).addSegment(second).merge();
             Segment imported = Segment.fromBytes(merged.export())) {
            assertEquals(2, imported.getNumDocs());
            assertArrayEquals(merged.export(), imported.export());
        }
    }

    @Test
    @DisplayName("A closed merger rejects further use and leaves its inputs open")
    public void testClose() {
        try (Segment segment = segmentOf("a", "red fox")) {
            SegmentMerger merger = new SegmentMerger().addSegment(segment);
            merger.close();
            merger.close();
            assertEquals(0, merger.getSegmentCount());
            assertThrows(StateException.class, merger::merge);
            assertThrows(StateException.class, () -> merger.addSegment(segment));
            assertFalse(segment.isClosed());
        }
    }

    @Test
    @DisplayName("A merge that fails on a closed input leaves the merger usable")
    public void testFailedMergeKeepsMerger() {
        try (Segment first = segmentOf("a", "red fox");
             Segment second = segmentOf("b", "blue fox");
             SegmentMerger merger = new SegmentMerger()) {
            Segment closedLater = segmentOf("c", "grey fox");
            merger.addSegment(first).addSegment(closedLater);
            closedLater.close();
            assertThrows(StateException.class, merger::merge);

            // the retry fails on the same input, not because the merger was spent
            StateException again = assertThrows(StateException.class, merger::merge);
            assertTrue(again.getMessage().contains(closedLater.getSegmentId()), again.getMessage());
            assertEquals(2, merger.getSegmentCount());
            merger.addSegment(second);
            assertEquals(3, merger.getSegmentCount());
        }
    }

    @Test
    @DisplayName("Invalid merger use is rejected")
    public void testInvalidUse() {
        Schema otherSchema = new SchemaBuilder().addTextField("body", true).build();
        try (Segment segment = segmentOf("a", "red fox");
             SegmentBuilder otherBuilder = new SegmentBuilder(otherSchema, 1000)) {
            otherBuilder.addDocument(Map.of("body", "blue fox"));
            try (Segment other = otherBuilder.finalizeSegment()) {
                assertThrows(StateException.class, () -> new SegmentMerger().merge());

                SegmentMerger merger = new SegmentMerger().addSegment(segment);
                assertThrows(DuplicateSegmentException.class, () -> merger.addSegment(segment));
                assertThrows(SchemaMismatchException.class, () -> merger.addSegment(other));

                try (Segment merged = merger.merge()) {
                    assertEquals(1, merged.getNumDocs());
                }
                assertThrows(StateException.class, merger::merge);
                assertThrows(StateException.class, () -> merger.addSegment(other));
            }
        }
    }
}
