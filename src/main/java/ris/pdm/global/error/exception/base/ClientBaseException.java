package ris.pdm.global.error.exception.base;

import ris.pdm.global.error.ErrorCode;

/**
 * ClientBaseException: 호출자의 입력이 잘못되었을 때 발생하는 '비즈니스 예외'
 * 4xx 계열의 에러를 처리하며, 호출자에게 구체적인 실패 원인을 전달하는 것이 목적입니다.
 */
public abstract class ClientBaseException extends BaseException {

    public ClientBaseException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ClientBaseException(ErrorCode errorCode, Object... args) {
        super(errorCode, args);
    }
}
