package com.ryuqq.gateway.core.contract;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Command 호출 결과.
 *
 * <p>경계 프로토콜에는 전송 오류와 업무 오류를 구분하는 별도 채널이 없으므로,
 * 모든 호출은 예외 대신 항상 잘 구성된 InvocationResult로 끝납니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>content:</strong> 순서가 있는 콘텐츠 블록 목록 (1개 이상)</li>
 *   <li><strong>error:</strong> 오류 결과 여부</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * InvocationResult ok = InvocationResult.text("User 00u1 has been suspended.");
 * InvocationResult failed = InvocationResult.error("Unknown command: foo");
 * </pre>
 *
 * @param content 콘텐츠 블록 목록
 * @param error 오류 여부
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record InvocationResult(
    List<ContentBlock> content,
    boolean error
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException content가 null이거나 비어있는 경우
     */
    public InvocationResult {
        if (content == null || content.isEmpty()) {
            throw new IllegalArgumentException("content cannot be null or empty");
        }
        content = List.copyOf(content);
    }

    /**
     * 단일 텍스트 블록의 성공 결과 생성.
     *
     * @param text 본문
     * @return 성공 InvocationResult
     */
    public static InvocationResult text(String text) {
        return new InvocationResult(List.of(ContentBlock.text(text)), false);
    }

    /**
     * 단일 텍스트 블록의 오류 결과 생성.
     *
     * @param message 오류 메시지
     * @return 오류 InvocationResult
     */
    public static InvocationResult error(String message) {
        return new InvocationResult(List.of(ContentBlock.text(message)), true);
    }

    /**
     * 모든 블록의 본문을 줄바꿈으로 이어붙인 텍스트.
     *
     * @return 결합된 본문
     */
    public String joinedText() {
        return content.stream()
            .map(ContentBlock::text)
            .collect(Collectors.joining("\n"));
    }
}
