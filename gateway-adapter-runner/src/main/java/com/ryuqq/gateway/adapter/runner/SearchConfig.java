package com.ryuqq.gateway.adapter.runner;

/**
 * 검색 전략 선택기 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanCap: CLIENT_SIDE_SCAN이 필터 없이 조회하는 최대 엔티티 수 (기본 200)</li>
 * </ul>
 *
 * <p>scanCap은 대규모 디렉터리에서 최악의 경우 비용을 제한합니다.
 * 상한을 넘는 엔티티는 검색 대상이 되지 않으며, 결과에 그 사실이 경고로 표시됩니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 * @param scanCap 클라이언트 측 스캔 상한 (1 이상)
 */
public record SearchConfig(int scanCap) {

    /**
     * 기본 스캔 상한.
     */
    public static final int DEFAULT_SCAN_CAP = 200;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanCap=200</p>
     */
    public SearchConfig() {
        this(DEFAULT_SCAN_CAP);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException scanCap이 양수가 아닌 경우
     */
    public SearchConfig {
        if (scanCap <= 0) {
            throw new IllegalArgumentException(
                "scanCap must be positive (current: " + scanCap + ")"
            );
        }
    }

    /**
     * scanCap만 변경한 새 인스턴스 생성.
     *
     * @param scanCap 새 스캔 상한
     * @return 새 SearchConfig 인스턴스
     */
    public SearchConfig withScanCap(int scanCap) {
        return new SearchConfig(scanCap);
    }
}
