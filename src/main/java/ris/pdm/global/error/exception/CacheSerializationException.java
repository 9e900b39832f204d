package ris.pdm.global.error.exception;

import ris.pdm.global.error.CommonErrorCode;
import ris.pdm.global.error.exception.base.ServerBaseException;

/** 캐시 값 JSON 직렬화/역직렬화 실패 */
public class CacheSerializationException extends ServerBaseException {

    public CacheSerializationException(String key, Throwable cause) {
        super(CommonErrorCode.DATA_PROCESSING_ERROR, cause, "cache-json:" + key);
    }
}
