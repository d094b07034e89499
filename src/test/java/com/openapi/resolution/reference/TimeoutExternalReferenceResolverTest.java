package com.openapi.resolution.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.openapi.resolution.exception.ErrorCode;
import com.openapi.resolution.exception.ExternalReferenceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TimeoutExternalReferenceResolver Tests")
class TimeoutExternalReferenceResolverTest {

    @Test
    @DisplayName("Should return the delegate's result within the timeout")
    void returnsResult() {
        ExternalReferenceResolver delegate = mock(ExternalReferenceResolver.class);
        JsonNode node = JsonNodeFactory.instance.objectNode().put("type", "string");
        when(delegate.resolveExternal("a.yaml#/X", "/base.yaml")).thenReturn(node);

        try (TimeoutExternalReferenceResolver resolver =
                     new TimeoutExternalReferenceResolver(delegate, Duration.ofSeconds(5))) {
            assertSame(node, resolver.resolveExternal("a.yaml#/X", "/base.yaml"));
        }
    }

    @Test
    @DisplayName("A slow delegate fails with EXTERNAL_FETCH_TIMEOUT")
    void timesOut() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        ExternalReferenceResolver slow = (pointer, base) -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return JsonNodeFactory.instance.objectNode();
        };

        try (TimeoutExternalReferenceResolver resolver =
                     new TimeoutExternalReferenceResolver(slow, Duration.ofMillis(50))) {
            ExternalReferenceException e = assertThrows(ExternalReferenceException.class,
                    () -> resolver.resolveExternal("slow.yaml#/X", ""));

            assertEquals(ErrorCode.EXTERNAL_FETCH_TIMEOUT, e.getErrorCode());
            assertEquals("slow.yaml#/X", e.getPointer());
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("A timed out delegate is interrupted")
    void interruptsOnTimeout() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        ExternalReferenceResolver slow = (pointer, base) -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return JsonNodeFactory.instance.objectNode();
        };

        try (TimeoutExternalReferenceResolver resolver =
                     new TimeoutExternalReferenceResolver(slow, Duration.ofMillis(50))) {
            assertThrows(ExternalReferenceException.class, () -> resolver.resolveExternal("slow.yaml#/X", ""));

            assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("Delegate exceptions propagate unchanged")
    void propagatesDelegateErrors() {
        ExternalReferenceException original = new ExternalReferenceException("nope",
                ErrorCode.EXTERNAL_REFERENCE_NOT_SUPPORTED, "x.yaml#/Y");
        ExternalReferenceResolver delegate = (pointer, base) -> {
            throw original;
        };

        try (TimeoutExternalReferenceResolver resolver =
                     new TimeoutExternalReferenceResolver(delegate, Duration.ofSeconds(5))) {
            ExternalReferenceException e = assertThrows(ExternalReferenceException.class,
                    () -> resolver.resolveExternal("x.yaml#/Y", ""));

            assertSame(original, e);
        }
    }

    @Test
    @DisplayName("Timeout must be positive")
    void rejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> new TimeoutExternalReferenceResolver(UnsupportedExternalReferenceResolver.INSTANCE, Duration.ZERO));
    }
}
