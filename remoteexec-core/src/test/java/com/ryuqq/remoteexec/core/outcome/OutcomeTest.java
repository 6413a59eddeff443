package com.ryuqq.remoteexec.core.outcome;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outcome sealed interface 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OutcomeTest {

    @Test
    void ok_IsOk() {
        // Given
        Outcome<String> outcome = Ok.of("done");

        // Then
        assertTrue(outcome.isOk());
        assertFalse(outcome.isFail());
        assertFalse(outcome.isCancelled());
    }

    @Test
    void ok_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Ok.of(null)
        );
        assertTrue(exception.getMessage().contains("value cannot be null"));
    }

    @Test
    void fail_NullCause_CreatesFail() {
        // When
        Fail<String> fail = Fail.of("COMMAND_FAILED", "boom");

        // Then
        assertTrue(fail.isFail());
        assertNull(fail.cause());
    }

    @Test
    void fail_BlankErrorCode_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Fail.of("   ", "message")
        );
        assertTrue(exception.getMessage().contains("errorCode cannot be null or blank"));
    }

    @Test
    void fail_NullMessage_ThrowsException() {
        // When & Then
        assertThrows(
            IllegalArgumentException.class,
            () -> Fail.of("ERR", null)
        );
    }

    @Test
    void cancelled_IsCancelled() {
        // Given
        Outcome<String> outcome = Cancelled.of("user request");

        // Then
        assertTrue(outcome.isCancelled());
        assertEquals("user request", ((Cancelled<String>) outcome).reason());
    }
}
