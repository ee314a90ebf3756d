package com.ryuqq.gateway.core.model;

/**
 * 디렉터리가 관리하는 엔티티 종류.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public enum EntityKind {

    /**
     * 사용자.
     */
    USER("User"),

    /**
     * 그룹.
     */
    GROUP("Group");

    private final String displayName;

    EntityKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * 사람이 읽는 이름.
     *
     * @return 표시 이름 (예: "User")
     */
    public String displayName() {
        return displayName;
    }
}
