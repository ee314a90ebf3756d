package com.ryuqq.gateway.core.model;

import java.time.Instant;

/**
 * 디렉터리 시스템 로그 이벤트.
 *
 * <p>마지막 로그인 위치 조회에 사용됩니다. 위치/클라이언트 정보는 모두 선택 값입니다.</p>
 *
 * @param published 발생 시각
 * @param eventType 이벤트 유형 (예: user.session.start)
 * @param targetId 대상 엔티티 키 (null 가능)
 * @param ipAddress 클라이언트 IP (null 가능)
 * @param city 도시 (null 가능)
 * @param state 주/도 (null 가능)
 * @param country 국가 (null 가능)
 * @param device 디바이스 (null 가능)
 * @param userAgent User-Agent (null 가능)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record SystemEvent(
    Instant published,
    String eventType,
    String targetId,
    String ipAddress,
    String city,
    String state,
    String country,
    String device,
    String userAgent
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException published 또는 eventType이 null인 경우
     */
    public SystemEvent {
        if (published == null) {
            throw new IllegalArgumentException("published cannot be null");
        }
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType cannot be null or blank");
        }
    }
}
