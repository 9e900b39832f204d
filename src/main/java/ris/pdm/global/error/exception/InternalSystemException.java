package ris.pdm.global.error.exception;

import ris.pdm.global.error.CommonErrorCode;
import ris.pdm.global.error.exception.base.ServerBaseException;

/**
 * LogicExecutor 전용 시스템 예외
 *
 * <p>LogicExecutor에서 처리하지 못한 관리되지 않은 예외를 프로젝트 규격에 맞게 래핑합니다.
 * taskName으로 에러 발생 지점을 추적하고, 응답에는 {@code S001} 공통 메시지만 노출합니다.
 */
public class InternalSystemException extends ServerBaseException {

    /**
     * @param taskName 작업 이름 (예: "CacheStore:set:ris:cache:metrics:...")
     * @param cause 원본 예외
     */
    public InternalSystemException(String taskName, Throwable cause) {
        super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause, taskName);
    }

    public InternalSystemException(String taskName) {
        super(CommonErrorCode.INTERNAL_SERVER_ERROR, taskName);
    }
}
