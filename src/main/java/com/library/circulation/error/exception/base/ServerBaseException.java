package com.library.circulation.error.exception.base;

import com.library.circulation.error.ErrorCode;

/**
 * Internal failure (5xx): a consistency bug or an unexpected system fault.
 * Logged with full detail for post-mortem analysis.
 */
public abstract class ServerBaseException extends BaseException {

    public ServerBaseException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ServerBaseException(ErrorCode errorCode, Object... args) {
        super(errorCode, args);
    }
}
