package com.ryuqq.gateway.core.contract;

/**
 * 응답 콘텐츠 블록.
 *
 * @param kind 블록 종류
 * @param text 블록 본문 (빈 문자열 허용)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record ContentBlock(
    ContentKind kind,
    String text
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind 또는 text가 null인 경우
     */
    public ContentBlock {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
    }

    /**
     * 텍스트 블록 생성.
     *
     * @param text 본문
     * @return ContentBlock 인스턴스
     * @throws IllegalArgumentException text가 null인 경우
     */
    public static ContentBlock text(String text) {
        return new ContentBlock(ContentKind.TEXT, text);
    }
}
