package ris.pdm.global.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
    // === Client Errors (4xx) ===
    INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST),
    UNKNOWN_CACHE_NAMESPACE("C002", "존재하지 않는 캐시 네임스페이스입니다 (namespace: %s)", HttpStatus.NOT_FOUND),

    // === Server Errors (5xx) ===
    INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다.", HttpStatus.INTERNAL_SERVER_ERROR),
    DATA_PROCESSING_ERROR("S004", "데이터 처리 중 오류 발생 (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
    EXTERNAL_API_ERROR("S005", "외부 API 호출 실패 (%s): %s", HttpStatus.SERVICE_UNAVAILABLE),
    BATCH_EXECUTION_FAILED("S006", "배치 실행 실패 (batch %s/%s, size=%s): %s", HttpStatus.SERVICE_UNAVAILABLE);


    private final String code;
    private final String message;
    private final HttpStatus status;
}
