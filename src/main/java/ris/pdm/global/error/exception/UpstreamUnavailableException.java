package ris.pdm.global.error.exception;

import ris.pdm.global.error.CommonErrorCode;
import ris.pdm.global.error.exception.base.ServerBaseException;

/**
 * 업스트림 트래커 API 호출 실패 (네트워크 오류, 타임아웃, non-2xx 응답)
 *
 * <p>RateLimitedClient 경계에서 모든 전송 계층 예외가 이 예외로 통일됩니다.
 * 원본 메시지는 예외 메시지에, 원본 예외는 cause로 보존됩니다.
 */
public class UpstreamUnavailableException extends ServerBaseException {

    private final String operation;

    public UpstreamUnavailableException(String operation, Throwable cause) {
        super(CommonErrorCode.EXTERNAL_API_ERROR, cause, operation, describe(cause));
        this.operation = operation;
    }

    public UpstreamUnavailableException(String operation, String reason) {
        super(CommonErrorCode.EXTERNAL_API_ERROR, operation, reason);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
