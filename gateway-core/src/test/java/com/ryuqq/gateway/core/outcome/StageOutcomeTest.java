package com.ryuqq.gateway.core.outcome;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StageOutcome Record 테스트.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class StageOutcomeTest {

    @Test
    void withSubResults_CountsSuccessAndFailure() {
        // Given
        StageOutcome outcome = StageOutcome.failure("00u1", "jane@example.com", "1 application(s) failed")
            .withSubResults(List.of(SubResult.success("app1"), SubResult.failure("app2", "boom")));

        // Then
        assertFalse(outcome.isSuccess());
        assertEquals(1, outcome.successfulSubResults());
        assertEquals(1, outcome.failedSubResults());
        assertEquals("jane@example.com", outcome.displayName());
    }

    @Test
    void constructor_CopiesLists() {
        // Given
        List<String> groups = new ArrayList<>(List.of("G1"));

        // When
        StageOutcome outcome = StageOutcome.success("00u1", null, null).withGroupIds(groups);
        groups.add("G2");

        // Then
        assertEquals(List.of("G1"), outcome.groupIds());
        assertEquals("00u1", outcome.displayName());
        assertThrows(UnsupportedOperationException.class, () -> outcome.groupIds().add("G3"));
    }

    @Test
    void constructor_BlankEntityKey_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> StageOutcome.success(" ", null, null));
    }

    @Test
    void subResult_SuccessDropsReason() {
        // When
        SubResult result = new SubResult("app1", OutcomeStatus.SUCCESS, "ignored");

        // Then
        assertNull(result.reason());
        assertTrue(result.isSuccess());
    }
}
