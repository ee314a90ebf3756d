package com.ryuqq.gateway.adapter.http;

import java.time.Duration;
import java.util.Map;

/**
 * 원격 디렉터리 연결 설정.
 *
 * <p>프로세스 시작 시 환경 변수에서 한 번 읽습니다. 값이 없으면 {@link IllegalStateException}으로
 * 시작을 중단하며, 요청 처리 중에는 다시 읽지 않습니다.</p>
 *
 * <p><strong>환경 변수:</strong></p>
 * <ul>
 *   <li><strong>OKTA_ORG_URL:</strong> 디렉터리 조직 URL (예: https://acme.okta.com)</li>
 *   <li><strong>OKTA_API_TOKEN:</strong> API 토큰</li>
 * </ul>
 *
 * @param orgUrl 조직 URL (scheme 포함, 끝의 '/' 제거)
 * @param apiToken API 토큰
 * @param requestTimeout 요청 타임아웃
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record DirectoryConnectionConfig(String orgUrl, String apiToken, Duration requestTimeout) {

    public static final String ORG_URL_VARIABLE = "OKTA_ORG_URL";
    public static final String API_TOKEN_VARIABLE = "OKTA_API_TOKEN";

    /**
     * 기본 요청 타임아웃.
     */
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Compact constructor (유효성 검증 및 정규화).
     *
     * @throws IllegalArgumentException 값이 비어있거나 타임아웃이 양수가 아닌 경우
     */
    public DirectoryConnectionConfig {
        if (orgUrl == null || orgUrl.isBlank()) {
            throw new IllegalArgumentException("orgUrl cannot be null or blank");
        }
        if (apiToken == null || apiToken.isBlank()) {
            throw new IllegalArgumentException("apiToken cannot be null or blank");
        }
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        orgUrl = normalize(orgUrl);
        apiToken = apiToken.trim();
    }

    /**
     * 기본 타임아웃 생성자.
     *
     * @param orgUrl 조직 URL
     * @param apiToken API 토큰
     */
    public DirectoryConnectionConfig(String orgUrl, String apiToken) {
        this(orgUrl, apiToken, DEFAULT_REQUEST_TIMEOUT);
    }

    /**
     * 프로세스 환경 변수에서 설정 로드.
     *
     * @return DirectoryConnectionConfig
     * @throws IllegalStateException 필요한 환경 변수가 없는 경우
     */
    public static DirectoryConnectionConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * 주어진 환경 맵에서 설정 로드.
     *
     * @param environment 환경 변수 맵
     * @return DirectoryConnectionConfig
     * @throws IllegalStateException 필요한 환경 변수가 없는 경우
     */
    public static DirectoryConnectionConfig fromEnvironment(Map<String, String> environment) {
        String orgUrl = environment.get(ORG_URL_VARIABLE);
        if (orgUrl == null || orgUrl.isBlank()) {
            throw new IllegalStateException(
                ORG_URL_VARIABLE + " environment variable is not set. Please set it to your Okta domain."
            );
        }
        String apiToken = environment.get(API_TOKEN_VARIABLE);
        if (apiToken == null || apiToken.isBlank()) {
            throw new IllegalStateException(
                API_TOKEN_VARIABLE + " environment variable is not set. "
                    + "Please generate an API token in the Okta Admin Console."
            );
        }
        return new DirectoryConnectionConfig(orgUrl, apiToken);
    }

    /**
     * requestTimeout만 변경한 새 인스턴스 생성.
     *
     * @param requestTimeout 새 타임아웃
     * @return 새 DirectoryConnectionConfig 인스턴스
     */
    public DirectoryConnectionConfig withRequestTimeout(Duration requestTimeout) {
        return new DirectoryConnectionConfig(orgUrl, apiToken, requestTimeout);
    }

    /**
     * REST API 기본 경로.
     *
     * @return {@code <orgUrl>/api/v1}
     */
    public String apiBase() {
        return orgUrl + "/api/v1";
    }

    /**
     * Authorization 헤더 값.
     *
     * @return {@code SSWS <token>}
     */
    public String authorizationHeader() {
        return "SSWS " + apiToken;
    }

    @Override
    public String toString() {
        return "DirectoryConnectionConfig[orgUrl=" + orgUrl + ", apiToken=****, requestTimeout=" + requestTimeout + "]";
    }

    private static String normalize(String url) {
        String trimmed = url.trim();
        if (!trimmed.startsWith("http://") && !trimmed.startsWith("https://")) {
            trimmed = "https://" + trimmed;
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
