package ris.pdm.global.error.dto;

import java.time.LocalDateTime;
import lombok.Builder;
import ris.pdm.global.error.ErrorCode;
import ris.pdm.global.error.exception.base.BaseException;
import org.springframework.http.ResponseEntity;

public record ErrorResponse(int status, String code, String message, LocalDateTime timestamp) {

    @Builder
    public ErrorResponse {}

    /**
     * BaseException을 받는 경우 (비즈니스/업스트림 예외)
     * e.getMessage()를 통해 동적으로 가공된 메시지(예: 어떤 업스트림 작업이 실패했는지)를 전달합니다.
     */
    public static ResponseEntity<ErrorResponse> toResponseEntity(BaseException e) {
        return ResponseEntity
                .status(e.getErrorCode().getStatus())
                .body(ErrorResponse.builder()
                        .status(e.getErrorCode().getStatus().value())
                        .code(e.getErrorCode().getCode())
                        .message(e.getMessage())
                        .timestamp(LocalDateTime.now())
                        .build());
    }

    /**
     * ErrorCode를 직접 받는 경우 (예상치 못한 서버 예외)
     * Enum에 정의된 기본 메시지를 사용하며, 상세한 에러 내용은 숨깁니다.
     */
    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ErrorResponse.builder()
                        .status(errorCode.getStatus().value())
                        .code(errorCode.getCode())
                        .message(errorCode.getMessage())
                        .timestamp(LocalDateTime.now())
                        .build());
    }
}
