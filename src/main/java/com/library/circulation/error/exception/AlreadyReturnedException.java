package com.library.circulation.error.exception;

import com.library.circulation.error.CirculationErrorCode;
import com.library.circulation.error.exception.base.ClientBaseException;

public class AlreadyReturnedException extends ClientBaseException {
    public AlreadyReturnedException(Long loanId, Object status) {
        super(CirculationErrorCode.ALREADY_RETURNED, loanId, status);
    }
}
