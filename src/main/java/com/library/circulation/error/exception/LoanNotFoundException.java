package com.library.circulation.error.exception;

import com.library.circulation.error.CirculationErrorCode;
import com.library.circulation.error.exception.base.ClientBaseException;

public class LoanNotFoundException extends ClientBaseException {
    public LoanNotFoundException(Long loanId) {
        super(CirculationErrorCode.LOAN_NOT_FOUND, loanId);
    }
}
