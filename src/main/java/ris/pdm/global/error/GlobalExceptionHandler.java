package ris.pdm.global.error;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import ris.pdm.global.error.dto.ErrorResponse;
import ris.pdm.global.error.exception.InvalidInputException;
import ris.pdm.global.error.exception.base.BaseException;
import ris.pdm.global.error.exception.base.ServerBaseException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 프로젝트 예외 처리 (동적 메시지 포함)
     * 서버 예외는 원인까지 로그에 남기고, 클라이언트 예외는 WARN 한 줄만 남깁니다.
     */
    @ExceptionHandler(BaseException.class)
    protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
        if (e instanceof ServerBaseException) {
            log.error("Server Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage(), e);
        } else {
            log.warn("Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
        }
        return ErrorResponse.toResponseEntity(e);
    }

    /**
     * 요청 파라미터 검증 실패 (@Validated 컨트롤러)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    protected ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException e) {
        return handleBaseException(new InvalidInputException(e.getMessage()));
    }

    /**
     * 예측하지 못한 시스템 예외 처리
     * 500 에러는 상세 메시지를 숨기고 규격화된 공통 코드를 넘깁니다.
     */
    @ExceptionHandler(Exception.class)
    protected ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected System Failure: ", e);
        return ErrorResponse.toResponseEntity(CommonErrorCode.INTERNAL_SERVER_ERROR);
    }
}
