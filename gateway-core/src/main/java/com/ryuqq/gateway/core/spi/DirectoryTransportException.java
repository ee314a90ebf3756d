package com.ryuqq.gateway.core.spi;

/**
 * 일반 원격 호출 실패 (네트워크 오류, 4xx/5xx 응답 등).
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public final class DirectoryTransportException extends DirectoryException {

    private static final long serialVersionUID = 1L;

    /**
     * HTTP 상태가 없는 실패 (예: I/O 오류).
     */
    public static final int NO_STATUS = -1;

    private final int status;

    public DirectoryTransportException(String message) {
        this(NO_STATUS, message, null);
    }

    public DirectoryTransportException(String message, Throwable cause) {
        this(NO_STATUS, message, cause);
    }

    /**
     * 생성자.
     *
     * @param status 응답 상태 코드 (없으면 {@link #NO_STATUS})
     * @param message 실패 메시지
     * @param cause 원인 (null 가능)
     */
    public DirectoryTransportException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
