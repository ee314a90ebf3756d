package com.ryuqq.gateway.adapter.runner;

/**
 * 온보딩 오케스트레이터 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>stopAtFirstGroupFailure: 그룹 할당 중 첫 실패에서 해당 엔티티의 나머지 그룹을 건너뛸지 (기본 true)</li>
 *   <li>lookupBeforeProvisioning: 권한 부여 전에 엔티티를 조회해 존재를 확인할지 (기본 true)</li>
 * </ul>
 *
 * <p>어느 설정이든 이미 성공한 할당이나 권한 부여는 되돌리지 않습니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 * @param stopAtFirstGroupFailure 첫 그룹 할당 실패 시 중단 여부
 * @param lookupBeforeProvisioning 권한 부여 전 엔티티 조회 여부
 */
public record OnboardingConfig(boolean stopAtFirstGroupFailure, boolean lookupBeforeProvisioning) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: stopAtFirstGroupFailure=true, lookupBeforeProvisioning=true</p>
     */
    public OnboardingConfig() {
        this(true, true);
    }

    /**
     * stopAtFirstGroupFailure만 변경한 새 인스턴스 생성.
     *
     * @param stopAtFirstGroupFailure 새 값
     * @return 새 OnboardingConfig 인스턴스
     */
    public OnboardingConfig withStopAtFirstGroupFailure(boolean stopAtFirstGroupFailure) {
        return new OnboardingConfig(stopAtFirstGroupFailure, this.lookupBeforeProvisioning);
    }

    /**
     * lookupBeforeProvisioning만 변경한 새 인스턴스 생성.
     *
     * @param lookupBeforeProvisioning 새 값
     * @return 새 OnboardingConfig 인스턴스
     */
    public OnboardingConfig withLookupBeforeProvisioning(boolean lookupBeforeProvisioning) {
        return new OnboardingConfig(this.stopAtFirstGroupFailure, lookupBeforeProvisioning);
    }
}
