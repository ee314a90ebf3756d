package com.ryuqq.gateway.core.contract;

/**
 * 응답 콘텐츠 블록의 종류.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public enum ContentKind {

    /**
     * 일반 텍스트.
     */
    TEXT("text");

    private final String wireName;

    ContentKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 경계 프로토콜에서 사용하는 이름.
     *
     * @return wire 이름 (예: "text")
     */
    public String wireName() {
        return wireName;
    }
}
