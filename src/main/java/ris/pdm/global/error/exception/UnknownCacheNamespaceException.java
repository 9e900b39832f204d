package ris.pdm.global.error.exception;

import ris.pdm.global.error.CommonErrorCode;
import ris.pdm.global.error.exception.base.ClientBaseException;

public class UnknownCacheNamespaceException extends ClientBaseException {

    public UnknownCacheNamespaceException(String namespace) {
        super(CommonErrorCode.UNKNOWN_CACHE_NAMESPACE, namespace);
    }
}
