package com.insider.resolution.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forResolution should set correlationId, query, and operation in MDC")
    void forResolutionSetsMDC() {
        try (LogContext ctx = LogContext.forResolution("corr-123", "gale klappa")) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("gale klappa", MDC.get("query"));
            assertEquals("resolve", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forScan should set entityId and operation in MDC")
    void forScanSetsMDC() {
        try (LogContext ctx = LogContext.forScan("0000783325")) {
            assertEquals("0000783325", MDC.get("entityId"));
            assertEquals("scan", MDC.get("operation"));
        }
        assertNull(MDC.get("entityId"));
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
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forResolution("corr-123", "gale klappa");
        assertNotNull(MDC.get("correlationId"));

        ctx.close();

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("query"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("close should put back values set before the context opened")
    void restoresOuterValues() {
        try (LogContext outer = LogContext.forBatch("batch-1")) {
            try (LogContext inner = LogContext.forBatch("batch-2")) {
                assertEquals("batch-2", MDC.get("batchId"));
            }
            assertEquals("batch-1", MDC.get("batchId"));
            assertEquals("batch", MDC.get("operation"));
        }
        assertNull(MDC.get("batchId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("with() should add additional keys to MDC")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forResolution("corr-123", "gale klappa")
                .with("strategy", "INDEXED_SEARCH")) {
            assertEquals("INDEXED_SEARCH", MDC.get("strategy"));
        }
        assertNull(MDC.get("strategy"));
    }

    @Test
    @DisplayName("generateCorrelationId should produce unique IDs")
    void uniqueCorrelationIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(1000, ids.size());
    }

    @Test
    @DisplayName("propagating() should carry MDC into executor threads")
    void propagatingExecutor() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Executor executor = LogContext.propagating(pool);
            try (LogContext ctx = LogContext.forBatch("batch-789")) {
                String seen = CompletableFuture.supplyAsync(() -> MDC.get("batchId"), executor)
                        .get(5, TimeUnit.SECONDS);
                assertEquals("batch-789", seen);
            }
            String after = CompletableFuture.supplyAsync(() -> MDC.get("batchId"), executor)
                    .get(5, TimeUnit.SECONDS);
            assertNull(after);
        } finally {
            pool.shutdownNow();
        }
    }
}
