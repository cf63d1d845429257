package com.lookup.matching.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReferenceValue Tests")
class ReferenceValueTest {

    @Test
    @DisplayName("Scalars are converted to their value type")
    void testScalarConversion() {
        assertEquals(ValueType.STRING, ReferenceValue.of("Engineering").getType());
        assertEquals(ValueType.NUMBER, ReferenceValue.of(42).getType());
        assertEquals(ValueType.NUMBER, ReferenceValue.of(3.5).getType());
        assertEquals(ValueType.BOOLEAN, ReferenceValue.of(true).getType());
        assertSame(ReferenceValue.NULL, ReferenceValue.of(null));
        assertTrue(ReferenceValue.of(null).isNull());
    }

    @Test
    @DisplayName("Numbers render in plain notation without trailing zeros")
    void testNumberText() {
        assertEquals("42", ReferenceValue.of(42).asText());
        assertEquals("42", ReferenceValue.of(42.0).asText());
        assertEquals("1000000", ReferenceValue.of(new BigDecimal("1E+6")).asText());
        assertEquals("0.25", ReferenceValue.of(0.25f).asText());
    }

    @Test
    @DisplayName("Booleans render as true/false and NULL has no text")
    void testBooleanAndNullText() {
        assertEquals("true", ReferenceValue.of(Boolean.TRUE).asText());
        assertEquals("false", ReferenceValue.ofBoolean(false).asText());
        assertNull(ReferenceValue.NULL.asText());
    }

    @Test
    @DisplayName("Numerically equal values are equal regardless of scale")
    void testNumericEquality() {
        ReferenceValue a = ReferenceValue.of(new BigDecimal("10.0"));
        ReferenceValue b = ReferenceValue.of(10);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(ReferenceValue.of("10"), b);
    }

    @Test
    @DisplayName("Unsupported types and non-finite numbers are rejected")
    void testRejectsUnsupported() {
        assertThrows(IllegalArgumentException.class, () -> ReferenceValue.of(LocalDate.now()));
        assertThrows(IllegalArgumentException.class, () -> ReferenceValue.of(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> ReferenceValue.of(Double.POSITIVE_INFINITY));
    }
}
