package com.lookup.matching.similarity;

import com.lookup.matching.normalization.StringNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class BestMatchFinderTest {

    private static final List<String> DEPARTMENTS = List.of("Engineering", "Marketing", "Finance");

    private final BestMatchFinder finder = new BestMatchFinder();

    @Test
    @DisplayName("Exact candidate is returned first with similarity 1")
    void testExactCandidateFirst() {
        List<CandidateMatch> matches = finder.findBestMatches("Marketing", DEPARTMENTS);

        assertFalse(matches.isEmpty());
        assertEquals("Marketing", matches.get(0).value());
        assertEquals(1.0, matches.get(0).similarity());
        assertEquals(1, matches.get(0).index());
    }

    @Test
    @DisplayName("Typo resolves to the intended candidate")
    void testTypo() {
        List<CandidateMatch> matches = finder.findBestMatches("Enginering", DEPARTMENTS, 0.7, 5);

        assertEquals("Engineering", matches.get(0).value());
        assertTrue(matches.get(0).similarity() > 0.8, "got " + matches.get(0).similarity());
    }

    @Test
    @DisplayName("Normalized equality counts as exact")
    void testNormalizedEquality() {
        List<CandidateMatch> matches = finder.findBestMatches("  marketing ", DEPARTMENTS);

        assertEquals("Marketing", matches.get(0).value());
        assertEquals(1.0, matches.get(0).similarity());
    }

    @Test
    @DisplayName("Results are sorted descending and truncated")
    void testSortedAndTruncated() {
        List<String> candidates = List.of("Finance", "Finanse", "Financial", "Fiance", "Engineering");

        List<CandidateMatch> matches = finder.findBestMatches("Finance", candidates, 0.5, 2);

        assertEquals(2, matches.size());
        assertEquals("Finance", matches.get(0).value());
        assertTrue(matches.get(0).similarity() >= matches.get(1).similarity());
    }

    @Test
    @DisplayName("Non-string, null and empty candidates are skipped")
    void testSkipsInvalidCandidates() {
        List<Object> candidates = Arrays.asList(42, null, "", "Marketing", Boolean.TRUE);

        List<CandidateMatch> matches = finder.findBestMatches("Marketing", candidates);

        assertEquals(1, matches.size());
        assertEquals(3, matches.get(0).index());
    }

    @Test
    @DisplayName("Degenerate inputs yield an empty list")
    void testDegenerateInputs() {
        assertTrue(finder.findBestMatches(null, DEPARTMENTS).isEmpty());
        assertTrue(finder.findBestMatches("Marketing", null).isEmpty());
        assertTrue(finder.findBestMatches("Marketing", List.of()).isEmpty());
        assertTrue(finder.findBestMatches("Marketing", DEPARTMENTS, 0.6, 0).isEmpty());
    }

    @Test
    @DisplayName("Nothing above threshold yields an empty list")
    void testNothingAboveThreshold() {
        assertTrue(finder.findBestMatches("Zebra", DEPARTMENTS, 0.9, 5).isEmpty());
    }

    @Nested
    @DisplayName("Scoring short-circuits")
    @ExtendWith(MockitoExtension.class)
    class ShortCircuits {

        @Mock
        private CompositeSimilarityScorer scorer;

        @Test
        @DisplayName("Exact and length-pruned candidates are never scored")
        void testExactAndPrunedNotScored() {
            when(scorer.compute("marketing", "markting")).thenReturn(0.9);
            BestMatchFinder mocked = new BestMatchFinder(scorer, new StringNormalizer());

            List<CandidateMatch> matches = mocked.findBestMatches("Marketing", List.of("Marketing", "x", "Markting"));

            assertEquals(2, matches.size());
            verify(scorer, times(1)).compute(anyString(), anyString());
            verify(scorer).compute("marketing", "markting");
        }

        @Test
        @DisplayName("Large dataset of obviously mismatched lengths is not scored")
        void testLargeDatasetPruned() {
            List<String> candidates = new ArrayList<>();
            for (int i = 0; i < 10_000; i++) {
                candidates.add("c" + (i % 10));
            }
            BestMatchFinder mocked = new BestMatchFinder(scorer, new StringNormalizer());

            List<CandidateMatch> matches = mocked.findBestMatches("International Business Machines", candidates);

            assertTrue(matches.isEmpty());
            verifyNoInteractions(scorer);
        }
    }
}
