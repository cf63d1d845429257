package com.lookup.matching.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forLookup should set datasetId, sourceColumn and operation in MDC")
    void forLookupSetsMDC() {
        try (LogContext ctx = LogContext.forLookup("departments", "name")) {
            assertEquals("departments", MDC.get("datasetId"));
            assertEquals("name", MDC.get("sourceColumn"));
            assertEquals("lookup", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forBatch should set batchId and operation in MDC")
    void forBatchSetsMDC() {
        try (LogContext ctx = LogContext.forBatch("batch-456")) {
            assertEquals("batch-456", MDC.get("batchId"));
            assertEquals("batch", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forReview should set sessionId, reviewAction and operation in MDC")
    void forReviewSetsMDC() {
        try (LogContext ctx = LogContext.forReview("session-1", "AcceptMatch")) {
            assertEquals("session-1", MDC.get("sessionId"));
            assertEquals("AcceptMatch", MDC.get("reviewAction"));
            assertEquals("review", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close, including extra keys")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forLookup("departments", "name").with("tenant", "acme");
        assertEquals("acme", MDC.get("tenant"));

        ctx.close();

        assertNull(MDC.get("datasetId"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("tenant"));
    }

    @Test
    @DisplayName("Null values are not written to MDC")
    void nullValuesSkipped() {
        try (LogContext ctx = LogContext.forLookup("departments", null)) {
            assertEquals("departments", MDC.get("datasetId"));
            assertNull(MDC.get("sourceColumn"));
        }
    }

    @Test
    @DisplayName("generateCorrelationId should produce unique IDs")
    void generateCorrelationIdUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
