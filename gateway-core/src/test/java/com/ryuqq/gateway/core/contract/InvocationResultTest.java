package com.ryuqq.gateway.core.contract;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InvocationRequest / InvocationResult 테스트.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class InvocationResultTest {

    @Test
    void error_CreatesSingleTextBlock() {
        // When
        InvocationResult result = InvocationResult.error("Unknown command: nope");

        // Then
        assertTrue(result.error());
        assertEquals(1, result.content().size());
        assertEquals(ContentKind.TEXT, result.content().get(0).kind());
        assertEquals("text", result.content().get(0).kind().wireName());
        assertEquals("Unknown command: nope", result.joinedText());
    }

    @Test
    void constructor_EmptyContent_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new InvocationResult(List.of(), false));
    }

    @Test
    void joinedText_JoinsBlocksWithNewline() {
        // When
        InvocationResult result = new InvocationResult(
            List.of(ContentBlock.text("a"), ContentBlock.text("b")), false
        );

        // Then
        assertEquals("a\nb", result.joinedText());
    }

    @Test
    void request_NullArgumentsBecomeEmpty() {
        // When
        InvocationRequest request = InvocationRequest.of("get_user", null);

        // Then
        assertTrue(request.rawArguments().isEmpty());
    }

    @Test
    void request_KeepsNullValues() {
        // Given
        Map<String, Object> raw = new HashMap<>();
        raw.put("userId", null);

        // When
        InvocationRequest request = InvocationRequest.of("get_user", raw);

        // Then
        assertTrue(request.rawArguments().containsKey("userId"));
        assertNull(request.rawArguments().get("userId"));
    }
}
