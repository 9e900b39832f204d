package ris.pdm.global.error.exception;

import ris.pdm.global.error.CommonErrorCode;
import ris.pdm.global.error.exception.base.ClientBaseException;

public class InvalidInputException extends ClientBaseException {

    public InvalidInputException(String detail) {
        super(CommonErrorCode.INVALID_INPUT_VALUE, detail);
    }
}
