package com.library.circulation.error.exception;

import com.library.circulation.error.CirculationErrorCode;
import com.library.circulation.error.exception.base.ClientBaseException;

public class RenewalLimitExceededException extends ClientBaseException {
    public RenewalLimitExceededException(Long loanId, int maxRenewals) {
        super(CirculationErrorCode.RENEWAL_LIMIT_EXCEEDED, loanId, maxRenewals);
    }
}
