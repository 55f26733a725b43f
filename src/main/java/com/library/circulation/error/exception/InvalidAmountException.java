package com.library.circulation.error.exception;

import com.library.circulation.error.CirculationErrorCode;
import com.library.circulation.error.exception.base.ClientBaseException;

import java.math.BigDecimal;

public class InvalidAmountException extends ClientBaseException {
    public InvalidAmountException(Long loanId, BigDecimal offered, BigDecimal owed) {
        super(CirculationErrorCode.INVALID_AMOUNT, offered, owed, loanId);
    }
}
