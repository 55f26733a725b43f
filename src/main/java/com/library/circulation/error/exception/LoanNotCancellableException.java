package com.library.circulation.error.exception;

import com.library.circulation.error.CirculationErrorCode;
import com.library.circulation.error.exception.base.ClientBaseException;

public class LoanNotCancellableException extends ClientBaseException {
    public LoanNotCancellableException(Long loanId, Object status, int renewalCount) {
        super(CirculationErrorCode.NOT_CANCELLABLE, loanId, status, renewalCount);
    }
}
