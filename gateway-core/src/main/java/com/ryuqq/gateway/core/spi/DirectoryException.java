package com.ryuqq.gateway.core.spi;

/**
 * 디렉터리 호출 실패.
 *
 * <p>Sealed class로 정의되어 실패 유형이 세 가지로 고정됩니다:</p>
 * <ul>
 *   <li>{@link EntityNotFoundException}: 대상 엔티티 없음</li>
 *   <li>{@link CapabilityUnsupportedException}: 요청한 필터 연산자를 디렉터리가 지원하지 않음</li>
 *   <li>{@link DirectoryTransportException}: 그 외 원격 호출 실패</li>
 * </ul>
 *
 * <p>호출자는 메시지 문자열이 아니라 타입으로 분기해야 합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public abstract sealed class DirectoryException extends RuntimeException
    permits EntityNotFoundException, CapabilityUnsupportedException, DirectoryTransportException {

    private static final long serialVersionUID = 1L;

    protected DirectoryException(String message) {
        super(message);
    }

    protected DirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
