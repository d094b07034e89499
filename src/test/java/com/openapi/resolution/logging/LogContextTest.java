package com.openapi.resolution.logging;

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
    @DisplayName("forCatalog should set runId and operation in MDC")
    void forCatalogSetsMDC() {
        try (LogContext ctx = LogContext.forCatalog("run-1")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("catalog", MDC.get("operation"));
        }
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("forSchema should set runId, schema and operation in MDC")
    void forSchemaSetsMDC() {
        try (LogContext ctx = LogContext.forSchema("run-1", "Pet")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("Pet", MDC.get("schema"));
            assertEquals("resolve", MDC.get("operation"));
        }
        assertNull(MDC.get("schema"));
    }

    @Test
    @DisplayName("forBatch should set batchId and operation in MDC")
    void forBatchSetsMDC() {
        try (LogContext ctx = LogContext.forBatch("run-1-0")) {
            assertEquals("run-1-0", MDC.get("batchId"));
            assertEquals("batch", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("Closing a nested context restores the outer values")
    void nestedContexts() {
        try (LogContext outer = LogContext.forCatalog("run-1")) {
            try (LogContext inner = LogContext.forSchema("run-1", "Pet")) {
                assertEquals("resolve", MDC.get("operation"));
            }
            assertEquals("catalog", MDC.get("operation"));
            assertEquals("run-1", MDC.get("runId"));
            assertNull(MDC.get("schema"));
        }
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("with() should add additional keys to MDC")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forCatalog("run-1").with("document", "petstore.yaml")) {
            assertEquals("petstore.yaml", MDC.get("document"));
        }
        assertNull(MDC.get("document"));
    }

    @Test
    @DisplayName("generateRunId should return unique UUIDs")
    void uniqueRunIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateRunId());
        }
        assertEquals(100, ids.size());
    }
}
