package com.ryuqq.gateway.application.onboarding;

import java.util.List;

/**
 * 표 형식 텍스트(헤더 행 + 데이터 행)를 {@link OnboardingRow}로 변환.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public interface TabularRowParser {

    /**
     * 파싱.
     *
     * @param data 표 형식 텍스트
     * @return 데이터 행 (빈 행 제외, 입력 순서)
     * @throws TabularDataException 형식이 잘못된 경우
     */
    List<OnboardingRow> parse(String data);
}
