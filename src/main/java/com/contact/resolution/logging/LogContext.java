package com.contact.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Entries added through a context are removed when it closes.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forMerge(correlationId, primaryId, secondaryId)) {
 *     log.info("merge.completed primaryId={}", primaryId);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String OPERATION = "operation";
    public static final String PRIMARY_CONTACT_ID = "primaryContactId";
    public static final String SECONDARY_CONTACT_ID = "secondaryContactId";
    public static final String BATCH_ID = "batchId";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forDuplicateSearch(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(OPERATION, "findDuplicates");
        return ctx;
    }

    public static LogContext forMerge(String correlationId, String primaryContactId, String secondaryContactId) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(PRIMARY_CONTACT_ID, primaryContactId);
        ctx.put(SECONDARY_CONTACT_ID, secondaryContactId);
        ctx.put(OPERATION, "merge");
        return ctx;
    }

    public static LogContext forBatch(String batchId, String primaryContactId) {
        LogContext ctx = new LogContext();
        ctx.put(BATCH_ID, batchId);
        ctx.put(PRIMARY_CONTACT_ID, primaryContactId);
        ctx.put(OPERATION, "mergeBatch");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        // keys already set by an enclosing context are left for that context to remove
        if (MDC.get(key) == null) {
            keys.add(key);
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
