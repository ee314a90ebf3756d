package com.ryuqq.gateway.testkit.scripted;

/**
 * {@link com.ryuqq.gateway.core.spi.DirectoryClient} 호출 종류.
 *
 * <p>{@link ScriptedDirectoryClient}가 호출을 기록하고 실패를 주입하는 단위입니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public enum DirectoryOperation {

    GET,
    LIST,
    LIST_FILTERED,
    LIST_FREE_TEXT,
    LIST_ALL,
    CREATE,
    SET_ACTIVATION,
    SUSPEND,
    UNSUSPEND,
    DEACTIVATE,
    DELETE,
    ASSIGN_TO_GROUP,
    REMOVE_FROM_GROUP,
    LIST_GROUP_MEMBERS,
    GRANT_APPLICATION,
    LIST_SYSTEM_EVENTS
}
