package com.library.circulation.error.exception;

import com.library.circulation.error.CirculationErrorCode;
import com.library.circulation.error.exception.base.ClientBaseException;

public class NoFeeOwedException extends ClientBaseException {
    public NoFeeOwedException(Long loanId) {
        super(CirculationErrorCode.NO_FEE_OWED, loanId);
    }
}
