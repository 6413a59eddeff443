package com.ryuqq.remoteexec.core.spi;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GatewayException 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class GatewayExceptionTest {

    @Test
    void factories_ClassifyFailure() {
        assertTrue(GatewayException.transientFailure("503").isTransient());
        assertTrue(GatewayException.notFound("gone").isNotFound());
        assertEquals(FailureType.PERMANENT, GatewayException.permanentFailure("403").getFailureType());
    }

    @Test
    void constructor_NullFailureType_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new GatewayException(null, "x"));
    }

    @Test
    void toString_IncludesStatusCode() {
        // Given
        GatewayException exception = new GatewayException(FailureType.TRANSIENT, "busy", 429, null);

        // Then
        assertEquals(429, exception.getStatusCode());
        assertTrue(exception.toString().contains("[429]"));
    }
}
