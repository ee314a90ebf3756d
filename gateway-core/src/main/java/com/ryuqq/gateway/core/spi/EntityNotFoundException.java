package com.ryuqq.gateway.core.spi;

import com.ryuqq.gateway.core.model.EntityKind;

/**
 * 대상 엔티티가 디렉터리에 존재하지 않음.
 *
 * <p>조회 성격의 Command는 이 실패를 안내 메시지로 변환하고,
 * 변경 대상이 없는 경우에는 오류로 전파합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class EntityNotFoundException extends DirectoryException {

    private static final long serialVersionUID = 1L;

    private final String kindName;
    private final String entityKey;

    /**
     * 생성자.
     *
     * @param kind 엔티티 종류 (null이면 "Entity")
     * @param entityKey 조회한 키
     */
    public EntityNotFoundException(EntityKind kind, String entityKey) {
        this(kind == null ? "Entity" : kind.displayName(), entityKey);
    }

    /**
     * 생성자 (애플리케이션 등 EntityKind 밖의 대상).
     *
     * @param kindName 대상 종류 이름 (예: "Application")
     * @param entityKey 조회한 키
     */
    public EntityNotFoundException(String kindName, String entityKey) {
        super(kindName + " not found: " + entityKey);
        this.kindName = kindName;
        this.entityKey = entityKey;
    }

    public String getKindName() {
        return kindName;
    }

    public String getEntityKey() {
        return entityKey;
    }
}
