package com.ryuqq.gateway.application.onboarding;

import com.ryuqq.gateway.core.outcome.StageOutcome;
import com.ryuqq.gateway.core.statemachine.OnboardingStage;

import java.util.ArrayList;
import java.util.List;

/**
 * 한 단계의 결과 보고.
 *
 * <p>successes와 failures는 각각 입력 순서를 유지합니다.
 * 단계가 생략되면 두 목록은 비어있고 skipReason이 채워집니다.</p>
 *
 * @param stage 단계
 * @param successes 성공한 엔티티 결과
 * @param failures 실패한 엔티티 결과
 * @param skipped 단계 생략 여부
 * @param skipReason 생략 사유 (생략되지 않았으면 null)
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record StageReport(
    OnboardingStage stage,
    List<StageOutcome> successes,
    List<StageOutcome> failures,
    boolean skipped,
    String skipReason
) {

    /**
     * Stage 1 성공이 없을 때의 생략 사유.
     */
    public static final String NO_ENTITIES = "no entities available for further processing";

    /**
     * 매핑 테이블 / 애플리케이션 목록이 비어있을 때의 생략 사유.
     */
    public static final String NOT_CONFIGURED = "not configured";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException stage가 null이거나 생략 사유가 모순되는 경우
     */
    public StageReport {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        if (skipped && (skipReason == null || skipReason.isBlank())) {
            throw new IllegalArgumentException("skipReason is required for a skipped stage");
        }
        successes = successes == null ? List.of() : List.copyOf(successes);
        failures = failures == null ? List.of() : List.copyOf(failures);
        skipReason = skipped ? skipReason : null;
    }

    /**
     * 입력 순서의 결과 목록으로 완료된 단계 보고 생성.
     *
     * @param stage 단계
     * @param outcomes 엔티티별 결과 (입력 순서)
     * @return StageReport
     */
    public static StageReport completed(OnboardingStage stage, List<StageOutcome> outcomes) {
        List<StageOutcome> successes = new ArrayList<>();
        List<StageOutcome> failures = new ArrayList<>();
        for (StageOutcome outcome : outcomes) {
            if (outcome.isSuccess()) {
                successes.add(outcome);
            } else {
                failures.add(outcome);
            }
        }
        return new StageReport(stage, successes, failures, false, null);
    }

    public static StageReport skipped(OnboardingStage stage, String reason) {
        return new StageReport(stage, List.of(), List.of(), true, reason);
    }

    /**
     * 성공한 엔티티 키 (입력 순서).
     *
     * @return 엔티티 키 목록
     */
    public List<String> successKeys() {
        return successes.stream().map(StageOutcome::entityKey).toList();
    }

    public int processed() {
        return successes.size() + failures.size();
    }
}
