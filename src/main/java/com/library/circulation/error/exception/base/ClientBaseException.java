package com.library.circulation.error.exception.base;

import com.library.circulation.error.ErrorCode;

/**
 * Business-rule rejection (4xx). Always leaves state unchanged and is never retried.
 */
public abstract class ClientBaseException extends BaseException {

    public ClientBaseException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ClientBaseException(ErrorCode errorCode, Object... args) {
        super(errorCode, args);
    }
}
