package com.library.circulation.error.exception;

import com.library.circulation.error.CirculationErrorCode;
import com.library.circulation.error.exception.base.ClientBaseException;

public class CopiesOnLoanException extends ClientBaseException {
    public CopiesOnLoanException(Long bookId, long copiesOutstanding) {
        super(CirculationErrorCode.COPIES_ON_LOAN, bookId, copiesOutstanding);
    }
}
