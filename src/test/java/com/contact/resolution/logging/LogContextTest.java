package com.contact.resolution.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Merge context sets and clears MDC entries")
    void testMergeContext() {
        try (LogContext ctx = LogContext.forMerge("corr-1", "p1", "s1")) {
            assertEquals("corr-1", MDC.get(LogContext.CORRELATION_ID));
            assertEquals("p1", MDC.get(LogContext.PRIMARY_CONTACT_ID));
            assertEquals("s1", MDC.get(LogContext.SECONDARY_CONTACT_ID));
            assertEquals("merge", MDC.get(LogContext.OPERATION));
        }
        assertNull(MDC.get(LogContext.CORRELATION_ID));
        assertNull(MDC.get(LogContext.PRIMARY_CONTACT_ID));
        assertNull(MDC.get(LogContext.OPERATION));
    }

    @Test
    @DisplayName("Nested context leaves the outer entries in place")
    void testNestedContexts() {
        try (LogContext batch = LogContext.forBatch("batch-1", "p1")) {
            try (LogContext merge = LogContext.forMerge("corr-1", "p1", "s1")) {
                assertEquals("batch-1", MDC.get(LogContext.BATCH_ID));
                assertEquals("s1", MDC.get(LogContext.SECONDARY_CONTACT_ID));
            }
            assertEquals("batch-1", MDC.get(LogContext.BATCH_ID));
            assertEquals("p1", MDC.get(LogContext.PRIMARY_CONTACT_ID));
            assertNull(MDC.get(LogContext.SECONDARY_CONTACT_ID));
        }
        assertNull(MDC.get(LogContext.BATCH_ID));
        assertNull(MDC.get(LogContext.PRIMARY_CONTACT_ID));
    }

    @Test
    @DisplayName("Custom keys added with with() are cleared on close")
    void testWith() {
        try (LogContext ctx = LogContext.forDuplicateSearch("corr-2").with("excludeId", "c9")) {
            assertEquals("c9", MDC.get("excludeId"));
            assertEquals("findDuplicates", MDC.get(LogContext.OPERATION));
        }
        assertNull(MDC.get("excludeId"));
    }

    @Test
    @DisplayName("Generated correlation ids are unique")
    void testGenerateCorrelationId() {
        assertNotEquals(LogContext.generateCorrelationId(), LogContext.generateCorrelationId());
    }
}
