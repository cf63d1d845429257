package com.lookup.matching.lookup;

import com.lookup.matching.cache.CacheConfig;
import com.lookup.matching.cache.CaffeineLookupCache;
import com.lookup.matching.core.model.LookupResult;
import com.lookup.matching.core.model.LookupSuggestion;
import com.lookup.matching.core.model.MatchConfig;
import com.lookup.matching.core.model.MatchType;
import com.lookup.matching.core.model.ReferenceDataset;
import com.lookup.matching.core.model.ReferenceRow;
import com.lookup.matching.metrics.MetricsService;
import com.lookup.matching.store.InMemoryReferenceDatasetStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("LookupMatchingEngine Tests")
class LookupMatchingEngineTest {

    private static final ReferenceDataset DEPARTMENTS = ReferenceDataset.builder()
            .id("departments")
            .columns("name", "code", "manager")
            .row(Map.of("name", "Engineering", "code", "ENG", "manager", "Alice"))
            .row(Map.of("name", "Marketing", "code", "MKT", "manager", "Bob"))
            .row(Map.of("name", "Finance", "code", "FIN", "manager", "Carol"))
            .row(Map.of("name", "Human Resources", "code", "HR"))
            .build();

    private static final MatchConfig BY_NAME = MatchConfig.builder()
            .sourceColumn("name")
            .targetColumn("code")
            .alsoGet("manager", "departmentManager")
            .build();

    private LookupMatchingEngine engine;

    @BeforeEach
    void setUp() {
        engine = new LookupMatchingEngine();
    }

    @Nested
    @DisplayName("Match tiers")
    class Tiers {

        @Test
        @DisplayName("Verbatim input is an exact match with confidence 1")
        void testExact() {
            LookupResult result = engine.performLookup("Engineering", DEPARTMENTS, BY_NAME);

            assertTrue(result.isMatched());
            assertEquals(MatchType.EXACT, result.getMatchType());
            assertEquals(1.0, result.getConfidence());
            assertEquals("ENG", result.getMatchedValue().asText());
            assertEquals("Alice", result.getDerivedValues().get("departmentManager").asText());
        }

        @Test
        @DisplayName("Case, accent and spacing noise is a normalized match at 0.95")
        void testNormalized() {
            LookupResult result = engine.performLookup("  human   RESOURCES ", DEPARTMENTS, BY_NAME);

            assertEquals(MatchType.NORMALIZED, result.getMatchType());
            assertEquals(0.95, result.getConfidence());
            assertEquals("HR", result.getMatchedValue().asText());
        }

        @Test
        @DisplayName("A typo is a fuzzy match with confidence equal to the similarity")
        void testFuzzy() {
            LookupResult result = engine.performLookup("Enginering", DEPARTMENTS, BY_NAME);

            assertEquals(MatchType.FUZZY, result.getMatchType());
            assertEquals("ENG", result.getMatchedValue().asText());
            assertEquals(engine.calculateSimilarity("enginering", "engineering"), result.getConfidence(), 1e-9);
            assertTrue(result.getConfidence() >= BY_NAME.fuzzyThreshold());
        }

        @Test
        @DisplayName("Nothing above threshold is no match")
        void testNoMatch() {
            LookupResult result = engine.performLookup("Zebra", DEPARTMENTS, BY_NAME);

            assertFalse(result.isMatched());
            assertEquals(MatchType.NONE, result.getMatchType());
            assertEquals(0.0, result.getConfidence());
            assertTrue(result.getDerivedValues().isEmpty());
        }

        @Test
        @DisplayName("Exact tier wins over a normalized candidate earlier in the dataset")
        void testExactBeatsNormalized() {
            List<ReferenceRow> rows = List.of(
                    ReferenceRow.of(Map.of("name", "finance", "code", "LOWER")),
                    ReferenceRow.of(Map.of("name", "Finance", "code", "EXACT")));

            LookupResult result = engine.performLookup("Finance", rows, BY_NAME);

            assertEquals(MatchType.EXACT, result.getMatchType());
            assertEquals("EXACT", result.getMatchedValue().asText());
        }

        @Test
        @DisplayName("Numeric source values match their plain text")
        void testNumericSource() {
            List<ReferenceRow> rows = List.of(ReferenceRow.of(Map.of("id", 101, "label", "Sales")));
            MatchConfig byId = MatchConfig.builder().sourceColumn("id").targetColumn("label").build();

            LookupResult result = engine.performLookup("101", rows, byId);

            assertEquals(MatchType.EXACT, result.getMatchType());
            assertEquals("Sales", result.getMatchedValue().asText());
        }

        @Test
        @DisplayName("Fuzzy matching can be disabled")
        void testStrictOptions() {
            LookupMatchingEngine strict = new LookupMatchingEngine(LookupOptions.strict());

            assertEquals(MatchType.NONE, strict.performLookup("Enginering", DEPARTMENTS, BY_NAME).getMatchType());
            assertEquals(MatchType.NORMALIZED, strict.performLookup("ENGINEERING", DEPARTMENTS, BY_NAME).getMatchType());
        }
    }

    @Nested
    @DisplayName("Derived fields")
    class DerivedFields {

        @Test
        @DisplayName("Derived fields come from the matched row only")
        void testDerivedFromWinner() {
            LookupResult result = engine.performLookup("Marketing", DEPARTMENTS, BY_NAME);

            assertEquals(1, result.getDerivedValues().size());
            assertEquals("Bob", result.getDerivedValues().get("departmentManager").asText());
        }

        @Test
        @DisplayName("A derived column missing from the matched row is skipped")
        void testMissingDerivedColumn() {
            LookupResult result = engine.performLookup("Human Resources", DEPARTMENTS, BY_NAME);

            assertTrue(result.isMatched());
            assertFalse(result.getDerivedValues().containsKey("departmentManager"));
        }
    }

    @Nested
    @DisplayName("Degenerate input")
    class Degenerate {

        @Test
        @DisplayName("Null or empty input is no match")
        void testEmptyInput() {
            assertFalse(engine.performLookup(null, DEPARTMENTS, BY_NAME).isMatched());
            assertFalse(engine.performLookup("", DEPARTMENTS, BY_NAME).isMatched());
        }

        @Test
        @DisplayName("Null or empty dataset is no match")
        void testEmptyDataset() {
            assertFalse(engine.performLookup("Finance", (ReferenceDataset) null, BY_NAME).isMatched());
            assertFalse(engine.performLookup("Finance", List.of(), BY_NAME).isMatched());
        }

        @Test
        @DisplayName("Unresolvable columns yield no match without throwing")
        void testUnresolvableColumns() {
            MatchConfig unknownSource = MatchConfig.builder().sourceColumn("title").targetColumn("code").build();
            MatchConfig blankTarget = MatchConfig.builder().sourceColumn("name").targetColumn("").build();

            assertFalse(engine.performLookup("Finance", DEPARTMENTS, unknownSource).isMatched());
            assertFalse(engine.performLookup("Finance", DEPARTMENTS, blankTarget).isMatched());
        }

        @Test
        @DisplayName("Missing match config yields no match without throwing")
        void testNullConfig() {
            InMemoryReferenceDatasetStore store = new InMemoryReferenceDatasetStore();
            store.save(DEPARTMENTS);
            LookupMatchingEngine stored = new LookupMatchingEngine(store);

            LookupResult direct = assertDoesNotThrow(() -> engine.performLookup("Engineering", DEPARTMENTS, null));
            LookupResult viaStore = assertDoesNotThrow(() -> stored.lookup("departments", "Engineering", null));

            assertFalse(direct.isMatched());
            assertEquals(MatchType.NONE, direct.getMatchType());
            assertFalse(viaStore.isMatched());
        }

        @Test
        @DisplayName("Rows lacking the source value or target column are skipped, the scan continues")
        void testIncompleteRowsSkipped() {
            Map<String, Object> nullName = new HashMap<>();
            nullName.put("name", null);
            nullName.put("code", "NULL");
            List<ReferenceRow> rows = List.of(
                    ReferenceRow.of(nullName),
                    ReferenceRow.of(Map.of("name", "Finance")),
                    ReferenceRow.of(Map.of("name", "Finance", "code", "FIN")));

            LookupResult result = engine.performLookup("Finance", rows, BY_NAME);

            assertEquals(MatchType.EXACT, result.getMatchType());
            assertEquals("FIN", result.getMatchedValue().asText());
        }

        @Test
        @DisplayName("Lookups do not modify the rows")
        void testRowsUntouched() {
            List<ReferenceRow> rows = new ArrayList<>(DEPARTMENTS.getRows());

            engine.performLookup("Enginering", rows, BY_NAME);

            assertEquals(DEPARTMENTS.getRows(), rows);
        }
    }

    @Nested
    @DisplayName("Suggestions")
    class Suggestions {

        @Test
        @DisplayName("Unmatched fuzzy results still offer the closest candidates with a reason")
        void testSuggestionsOnNoMatch() {
            MatchConfig strictThreshold = MatchConfig.builder().sourceColumn("name").targetColumn("code")
                    .fuzzyThreshold(0.99).build();

            LookupResult result = engine.performLookup("Financ", DEPARTMENTS, strictThreshold);

            assertFalse(result.isMatched());
            assertFalse(result.getSuggestions().isEmpty());
            LookupSuggestion best = result.getSuggestions().get(0);
            assertEquals("Finance", best.matchedText());
            assertEquals("FIN", best.value().asText());
            assertEquals("Very similar spelling", best.reason());
        }

        @Test
        @DisplayName("The fuzzy winner is not repeated as a suggestion")
        void testWinnerExcluded() {
            LookupResult result = engine.performLookup("Enginering", DEPARTMENTS, BY_NAME);

            assertTrue(result.getSuggestions().stream().noneMatch(s -> s.matchedText().equals("Engineering")));
            assertTrue(result.getSuggestions().size() <= LookupOptions.defaults().getMaxSuggestions());
        }
    }

    @Nested
    @DisplayName("Stored datasets")
    class Stored {

        private InMemoryReferenceDatasetStore store;
        private MetricsService metrics;

        @BeforeEach
        void setUp() {
            store = new InMemoryReferenceDatasetStore();
            store.save(DEPARTMENTS);
            metrics = mock(MetricsService.class);
        }

        @Test
        @DisplayName("Looks up through the store")
        void testLookupThroughStore() {
            LookupMatchingEngine stored = new LookupMatchingEngine(store);

            assertEquals("FIN", stored.lookup("departments", "Finance", BY_NAME).getMatchedValue().asText());
        }

        @Test
        @DisplayName("Missing dataset is no match")
        void testMissingDataset() {
            LookupMatchingEngine stored = new LookupMatchingEngine(store);

            assertFalse(stored.lookup("countries", "Finance", BY_NAME).isMatched());
            assertFalse(engine.lookup("departments", "Finance", BY_NAME).isMatched(), "engine without store");
        }

        @Test
        @DisplayName("Repeated lookups are served from the cache")
        void testCacheHit() {
            CaffeineLookupCache cache = new CaffeineLookupCache(CacheConfig.defaults());
            LookupMatchingEngine cached = new LookupMatchingEngine(store, LookupOptions.defaults(), cache, metrics);

            LookupResult first = cached.lookup("departments", "Enginering", BY_NAME);
            LookupResult second = cached.lookup("departments", "Enginering", BY_NAME);

            assertSame(first, second);
            verify(metrics).recordCacheMiss();
            verify(metrics).recordCacheHit();
            verify(metrics, times(1)).recordLookupDuration(eq(MatchType.FUZZY), any());
        }

        @Test
        @DisplayName("Matched lookups record their confidence")
        void testConfidenceRecorded() {
            LookupMatchingEngine measured = new LookupMatchingEngine(null, LookupOptions.defaults(), null, metrics);

            measured.performLookup("Finance", DEPARTMENTS, BY_NAME);
            measured.performLookup("Zebra", DEPARTMENTS, BY_NAME);

            verify(metrics, times(1)).recordConfidence(anyDouble());
            verify(metrics).recordLookupDuration(eq(MatchType.EXACT), any());
            verify(metrics).recordLookupDuration(eq(MatchType.NONE), any());
        }
    }

    @Nested
    @DisplayName("Batch lookup")
    class Batch {

        @Test
        @DisplayName("Results keep input order and metrics count each tier")
        void testBatchMetrics() {
            List<String> inputs = List.of("Engineering", "marketing", "Financ", "Zebra");

            BatchLookupResult batch = engine.batchLookup(inputs, DEPARTMENTS.getRows(), BY_NAME, null);

            assertEquals(4, batch.results().size());
            assertEquals("Engineering", batch.results().get(0).getInputValue());
            assertEquals("Zebra", batch.results().get(3).getInputValue());
            assertEquals(1, batch.metrics().count(MatchType.EXACT));
            assertEquals(1, batch.metrics().count(MatchType.NORMALIZED));
            assertEquals(1, batch.metrics().count(MatchType.FUZZY));
            assertEquals(1, batch.metrics().count(MatchType.NONE));
            assertEquals(0.75, batch.metrics().matchRate(), 1e-9);
        }

        @Test
        @DisplayName("Progress is reported every batch size inputs and at the end")
        void testProgress() {
            LookupMatchingEngine small = new LookupMatchingEngine(LookupOptions.builder().batchSize(2).build());
            List<long[]> reports = new ArrayList<>();

            small.batchLookup(List.of("a", "b", "c", "d", "e"), DEPARTMENTS.getRows(), BY_NAME,
                    (processed, total) -> reports.add(new long[]{processed, total}));

            assertEquals(3, reports.size());
            assertArrayEquals(new long[]{2, 5}, reports.get(0));
            assertArrayEquals(new long[]{4, 5}, reports.get(1));
            assertArrayEquals(new long[]{5, 5}, reports.get(2));
        }

        @Test
        @DisplayName("An empty batch has zero rates")
        void testEmptyBatch() {
            BatchLookupResult batch = engine.batchLookup(List.of(), DEPARTMENTS.getRows(), BY_NAME, ProgressCallback.NOOP);

            assertTrue(batch.results().isEmpty());
            assertEquals(0.0, batch.metrics().matchRate());
            assertEquals(0, batch.metrics().count(MatchType.EXACT));
        }
    }
}
