package com.ryuqq.gateway.core.statemachine;

/**
 * 검색 전략 tier.
 *
 * <p>정확도 보장이 높은 순(비용이 낮은 순)으로 정렬되어 있습니다.</p>
 *
 * <p><strong>전이 규칙:</strong></p>
 * <ul>
 *   <li>NATIVE_FILTER → FREE_TEXT → CLIENT_SIDE_SCAN</li>
 *   <li>강등(demotion)만 허용, 승격 불가</li>
 *   <li>한 번의 검색에서 각 tier는 최대 한 번 시도</li>
 * </ul>
 *
 * <pre>
 * NATIVE_FILTER
 *    │ (unsupported operator / failure)
 *    ▼
 * FREE_TEXT
 *    │ (failure, or operator=present)
 *    ▼
 * CLIENT_SIDE_SCAN (cap 200)
 * </pre>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public enum SearchTier {

    /**
     * 디렉터리 서버 측 필터. 결과의 속성 일치는 신뢰.
     */
    NATIVE_FILTER("native filter", true),

    /**
     * 속성 무관 자유 텍스트 매칭. 후보마다 검증 필요.
     */
    FREE_TEXT("free-text search", false),

    /**
     * 필터 없이 고정 상한만큼 조회 후 클라이언트 측 검증.
     */
    CLIENT_SIDE_SCAN("client-side scan", false);

    private final String label;
    private final boolean trustsAttributeMatch;

    SearchTier(String label, boolean trustsAttributeMatch) {
        this.label = label;
        this.trustsAttributeMatch = trustsAttributeMatch;
    }

    public String label() {
        return label;
    }

    /**
     * 이 tier의 결과를 속성/연산자 관점에서 신뢰할 수 있는지.
     *
     * @return 서버가 이미 필터링했으면 true
     */
    public boolean trustsAttributeMatch() {
        return trustsAttributeMatch;
    }

    /**
     * 마지막 tier인지 확인.
     *
     * @return CLIENT_SIDE_SCAN이면 true
     */
    public boolean isLast() {
        return this == CLIENT_SIDE_SCAN;
    }

    /**
     * 바로 다음 tier.
     *
     * @return 다음 tier
     * @throws IllegalStateException 마지막 tier인 경우
     */
    public SearchTier next() {
        if (isLast()) {
            throw new IllegalStateException("No tier below " + this);
        }
        return values()[ordinal() + 1];
    }
}
