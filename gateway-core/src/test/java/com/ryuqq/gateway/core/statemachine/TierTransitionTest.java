package com.ryuqq.gateway.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.gateway.core.statemachine.SearchTier.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * TierTransition 테스트.
 *
 * <ul>
 *   <li>강등 (건너뛰기 포함) 허용</li>
 *   <li>같은 tier 재시도, 승격 불가</li>
 * </ul>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class TierTransitionTest {

    @Test
    void demote_FullChain_Succeeds() {
        // Given
        SearchTier tier = NATIVE_FILTER;

        // When
        tier = TierTransition.demote(tier, FREE_TEXT);
        tier = TierTransition.demote(tier, CLIENT_SIDE_SCAN);

        // Then
        assertEquals(CLIENT_SIDE_SCAN, tier);
        assertTrue(tier.isLast());
    }

    @Test
    void validate_SkipFreeText_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> TierTransition.validate(NATIVE_FILTER, CLIENT_SIDE_SCAN));
    }

    @Test
    void validate_SameTier_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> TierTransition.validate(FREE_TEXT, FREE_TEXT)
        );
        assertTrue(exception.getMessage().contains("demotion only"));
    }

    @Test
    void validate_Promotion_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> TierTransition.validate(CLIENT_SIDE_SCAN, NATIVE_FILTER));
        assertThrows(IllegalStateException.class, () -> TierTransition.validate(FREE_TEXT, NATIVE_FILTER));
    }

    @Test
    void validate_NullTier_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> TierTransition.validate(null, FREE_TEXT));
    }

    @Test
    void next_LastTier_ThrowsException() {
        // When & Then
        assertEquals(FREE_TEXT, NATIVE_FILTER.next());
        assertThrows(IllegalStateException.class, CLIENT_SIDE_SCAN::next);
    }

    @Test
    void trustsAttributeMatch_OnlyNativeFilter() {
        assertTrue(NATIVE_FILTER.trustsAttributeMatch());
        assertFalse(FREE_TEXT.trustsAttributeMatch());
        assertFalse(CLIENT_SIDE_SCAN.trustsAttributeMatch());
    }
}
