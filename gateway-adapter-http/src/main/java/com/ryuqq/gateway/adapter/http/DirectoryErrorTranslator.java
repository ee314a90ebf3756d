package com.ryuqq.gateway.adapter.http;

import com.ryuqq.gateway.core.spi.CapabilityUnsupportedException;
import com.ryuqq.gateway.core.spi.DirectoryException;
import com.ryuqq.gateway.core.spi.DirectoryTransportException;
import com.ryuqq.gateway.core.spi.EntityNotFoundException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 디렉터리 오류 응답을 {@link DirectoryException} 계열로 변환.
 *
 * <p><strong>변환 규칙:</strong></p>
 * <ul>
 *   <li>404 → {@link EntityNotFoundException} (요청 대상의 종류와 키)</li>
 *   <li>검색 표현식을 보낸 요청의 400 중 검색 조건 오류 → {@link CapabilityUnsupportedException}</li>
 *   <li>그 외 → {@link DirectoryTransportException} (상태 코드 포함)</li>
 * </ul>
 *
 * <p>백엔드 오류 문구를 해석하는 곳은 이 클래스뿐입니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
final class DirectoryErrorTranslator {

    /**
     * 검색 조건이 잘못되었을 때의 디렉터리 오류 코드.
     */
    static final String INVALID_SEARCH_CRITERIA = "E0000031";

    private static final Pattern OPERATOR_TOKEN =
        Pattern.compile("\\s(eq|ne|sw|ew|co|pr|gt|ge|lt|le)(?=\\s|$)", Pattern.CASE_INSENSITIVE);

    private final DirectoryJsonMapper jsonMapper;

    DirectoryErrorTranslator(DirectoryJsonMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
    }

    /**
     * 오류 응답 변환.
     *
     * @param status HTTP 상태 코드
     * @param body 응답 본문
     * @param target 요청 대상
     * @return 던질 예외
     */
    DirectoryException translate(int status, String body, RequestTarget target) {
        String summary = jsonMapper.errorSummary(body);
        String message = summary == null || summary.isBlank()
            ? "Directory request failed with status " + status
            : summary;

        if (status == 404 && target.kindName() != null) {
            return new EntityNotFoundException(target.kindName(), target.key());
        }
        if (status == 400 && target.searchExpression() != null && isSearchCriteriaError(body, summary)) {
            return new CapabilityUnsupportedException(operatorOf(target.searchExpression()), message);
        }
        return new DirectoryTransportException(status, message, null);
    }

    private boolean isSearchCriteriaError(String body, String summary) {
        if (INVALID_SEARCH_CRITERIA.equals(jsonMapper.errorCode(body))) {
            return true;
        }
        if (summary == null) {
            return false;
        }
        String lower = summary.toLowerCase(Locale.ROOT);
        return lower.contains("invalid search")
            || (lower.contains("operator") && (lower.contains("not supported") || lower.contains("unsupported")));
    }

    static String operatorOf(String expression) {
        Matcher matcher = OPERATOR_TOKEN.matcher(expression);
        return matcher.find() ? matcher.group(1).toLowerCase(Locale.ROOT) : null;
    }

    /**
     * 오류 변환에 필요한 요청 대상 정보.
     *
     * @param kindName 404일 때 보고할 대상 종류 (예: "User", null이면 404도 전송 오류)
     * @param key 대상 키
     * @param searchExpression 요청에 포함된 검색 표현식 (null 가능)
     */
    record RequestTarget(String kindName, String key, String searchExpression) {

        static RequestTarget of(String kindName, String key) {
            return new RequestTarget(kindName, key, null);
        }

        static RequestTarget search(String expression) {
            return new RequestTarget(null, null, expression);
        }

        static RequestTarget none() {
            return new RequestTarget(null, null, null);
        }
    }
}
