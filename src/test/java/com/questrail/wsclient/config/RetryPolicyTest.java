package com.questrail.wsclient.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RetryPolicyTest
 * -----------------------------------------------------------------------------
 * Validates retry timing configuration and its copy methods.
 */
class RetryPolicyTest {

    @Test
    void defaultsMatchDocumentedValues() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertEquals(Duration.ofSeconds(10), policy.startRetryDelay());
        assertEquals(Duration.ofSeconds(1), policy.queueRetryDelay());
        assertEquals(Duration.ofSeconds(10), policy.connectTimeout());
        assertEquals(Duration.ofSeconds(10), policy.writeTimeout());
        assertEquals(Duration.ofSeconds(30), policy.shutdownTimeout());
    }

    @Test
    void canonicalConstructorAcceptsZeroDurations() {
        RetryPolicy policy = new RetryPolicy(
                Duration.ZERO,
                Duration.ZERO,
                Duration.ZERO,
                Duration.ZERO,
                Duration.ZERO
        );

        assertEquals(Duration.ZERO, policy.startRetryDelay());
        assertEquals(Duration.ZERO, policy.shutdownTimeout());
    }

    @Test
    void canonicalConstructorRejectsNullDelay() {
        assertThrows(NullPointerException.class, () ->
                new RetryPolicy(null, Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO)
        );
    }

    @Test
    void canonicalConstructorRejectsNegativeQueueRetryDelay() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () ->
                new RetryPolicy(Duration.ZERO, Duration.ofMillis(-1), Duration.ZERO, Duration.ZERO, Duration.ZERO)
        );
        assertTrue(e.getMessage().contains("queueRetryDelay"));
    }

    @Test
    void withMethodsReplaceOnlyOneField() {
        RetryPolicy base = RetryPolicy.defaults();

        RetryPolicy changed = base.withStartRetryDelay(Duration.ofMillis(50))
                .withWriteTimeout(Duration.ofMillis(75));

        assertEquals(Duration.ofMillis(50), changed.startRetryDelay());
        assertEquals(Duration.ofMillis(75), changed.writeTimeout());
        assertEquals(base.queueRetryDelay(), changed.queueRetryDelay());
        assertEquals(base.connectTimeout(), changed.connectTimeout());
        assertEquals(base.shutdownTimeout(), changed.shutdownTimeout());
    }
}
