package ris.pdm.global.error.exception;

import lombok.Getter;
import ris.pdm.global.error.CommonErrorCode;
import ris.pdm.global.error.exception.base.ServerBaseException;

/**
 * 배치 실행 중 단일 배치 실패로 전체 작업이 중단됨
 *
 * <p>진단을 위해 실패한 배치의 순번(0-base), 전체 배치 수, 배치 크기를 보존합니다.
 */
@Getter
public class BatchExecutionException extends ServerBaseException {

    private final int batchIndex;
    private final int batchCount;
    private final int batchSize;

    public BatchExecutionException(int batchIndex, int batchCount, int batchSize, Throwable cause) {
        super(CommonErrorCode.BATCH_EXECUTION_FAILED, cause,
                batchIndex + 1, batchCount, batchSize, cause.getMessage());
        this.batchIndex = batchIndex;
        this.batchCount = batchCount;
        this.batchSize = batchSize;
    }
}
