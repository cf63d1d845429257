package com.lookup.matching.review;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FuzzyMatchForReview Tests")
class FuzzyMatchForReviewTest {

    @Test
    @DisplayName("Loaded match is pending, unselected, with a positional ID")
    void testFrom() {
        FuzzyMatchForReview m = FuzzyMatchForReview.from(
                new FuzzyMatch("row_12", "department", "Enginering", "Engineering", 0.92), 4);

        assertEquals("match_row_12_department_4", m.getId());
        assertEquals(12, m.getRowIndex());
        assertEquals(ReviewStatus.PENDING, m.getStatus());
        assertFalse(m.isSelected());
        assertNull(m.getManualValue());
        assertTrue(m.getSuggestions().isEmpty());
    }

    @ParameterizedTest(name = "{0} at {1} -> {2}")
    @DisplayName("Row index comes from the row ID, else the load position")
    @CsvSource({
            "row_7, 0, 7",
            "row_7_extra, 0, 7",
            "import-3, 5, 5",
            "row_, 2, 2",
            "row_99999999999, 1, 1"
    })
    void testRowIndex(String rowId, int ordinal, int expected) {
        assertEquals(expected, FuzzyMatchForReview.rowIndex(rowId, ordinal));
    }

    @Test
    @DisplayName("Low-confidence matches carry their value as a suggestion")
    void testSuggestions() {
        FuzzyMatchForReview m = FuzzyMatchForReview.from(
                new FuzzyMatch("row_0", "department", "Mrkt", "Marketing", 0.75), 0);

        assertEquals(1, m.getSuggestions().size());
        assertEquals("Marketing", m.getSuggestions().get(0).value());
        assertEquals(0.75, m.getSuggestions().get(0).confidence());
        assertEquals("Fuzzy match suggestion", m.getSuggestions().get(0).reason());
    }

    @Test
    @DisplayName("Fuzzy match validates its inputs")
    void testFuzzyMatchValidation() {
        assertThrows(NullPointerException.class, () -> new FuzzyMatch(null, "f", "a", "b", 0.5));
        assertThrows(IllegalArgumentException.class, () -> new FuzzyMatch("row_0", "f", "a", "b", 1.2));
    }

    @Test
    @DisplayName("Copies leave the original unchanged")
    void testImmutability() {
        FuzzyMatchForReview original = FuzzyMatchForReview.from(
                new FuzzyMatch("row_0", "department", "Finanse", "Finance", 0.85), 0);

        FuzzyMatchForReview accepted = original.accepted(null);

        assertTrue(original.isPending());
        assertEquals("Finance", accepted.getResolvedValue());
        assertEquals(original, accepted.reset());
        assertSame(original, original.reset());
    }
}
