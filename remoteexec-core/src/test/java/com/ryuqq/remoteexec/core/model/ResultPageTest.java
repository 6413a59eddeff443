package com.ryuqq.remoteexec.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ResultPage 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ResultPageTest {

    @Test
    void constructor_BlankToken_NormalizedToNull() {
        // When
        ResultPage page = new ResultPage(List.of("a"), List.of(List.of("1")), 0, "  ");

        // Then
        assertNull(page.nextPageToken());
        assertFalse(page.hasMore());
    }

    @Test
    void constructor_RowsWithNullCells_Accepted() {
        // Given
        List<List<String>> rows = new ArrayList<>();
        rows.add(Arrays.asList("1", null));

        // When
        ResultPage page = new ResultPage(List.of("id", "name"), rows, 0, "1");

        // Then
        assertEquals(1, page.rowCount());
        assertNull(page.rows().get(0).get(1));
        assertTrue(page.hasMore());
    }

    @Test
    void constructor_CopiesRows() {
        // Given
        List<List<String>> rows = new ArrayList<>();
        rows.add(List.of("1"));
        ResultPage page = new ResultPage(List.of("id"), rows, 0, null);

        // When
        rows.add(List.of("2"));

        // Then
        assertEquals(1, page.rowCount());
        assertThrows(UnsupportedOperationException.class, () -> page.rows().add(List.of("3")));
    }

    @Test
    void constructor_NegativeChunkIndex_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new ResultPage(List.of(), List.of(), -1, null)
        );
        assertTrue(exception.getMessage().contains("chunkIndex must be non-negative"));
    }

    @Test
    void empty_HasNoRows() {
        assertEquals(0, ResultPage.empty().rowCount());
        assertFalse(ResultPage.empty().hasMore());
    }
}
