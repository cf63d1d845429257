package com.lookup.matching.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LookupResult Tests")
class LookupResultTest {

    @Test
    @DisplayName("No-match results carry zero confidence and no values")
    void testNoMatch() {
        LookupResult result = LookupResult.noMatch("Zebra");

        assertFalse(result.isMatched());
        assertEquals(MatchType.NONE, result.getMatchType());
        assertEquals(0.0, result.getConfidence());
        assertTrue(result.getMatchedValue().isNull());
        assertTrue(result.getDerivedValues().isEmpty());
        assertNull(result.getMatchedRow());
    }

    @Test
    @DisplayName("No-match results keep their suggestions")
    void testNoMatchSuggestions() {
        LookupSuggestion suggestion = new LookupSuggestion(ReferenceValue.of("ENG"), "Engineering", 0.65, "Partial match");

        LookupResult result = LookupResult.noMatch("Engnr", List.of(suggestion));

        assertEquals(List.of(suggestion), result.getSuggestions());
    }

    @Test
    @DisplayName("Confidence outside [0, 1] is rejected")
    void testConfidenceValidation() {
        assertThrows(IllegalArgumentException.class, () -> LookupResult.builder()
                .matchType(MatchType.FUZZY)
                .confidence(1.2)
                .build());
    }

    @Test
    @DisplayName("Match type is required")
    void testMatchTypeRequired() {
        assertThrows(NullPointerException.class, () -> LookupResult.builder().confidence(0.5).build());
    }

    @Test
    @DisplayName("Derived values are exposed read-only")
    void testDerivedValuesReadOnly() {
        LookupResult result = LookupResult.builder()
                .inputValue("Engineering")
                .matchType(MatchType.EXACT)
                .confidence(1.0)
                .matchedValue(ReferenceValue.of("ENG"))
                .derivedValue("manager", ReferenceValue.of("Alice"))
                .build();

        assertEquals("Alice", result.getDerivedValues().get("manager").asText());
        assertThrows(UnsupportedOperationException.class,
                () -> result.getDerivedValues().put("x", ReferenceValue.NULL));
    }
}
