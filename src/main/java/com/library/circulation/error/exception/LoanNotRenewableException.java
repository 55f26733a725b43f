package com.library.circulation.error.exception;

import com.library.circulation.error.CirculationErrorCode;
import com.library.circulation.error.exception.base.ClientBaseException;
import com.library.circulation.policy.RenewalDenial;
import lombok.Getter;

@Getter
public class LoanNotRenewableException extends ClientBaseException {

    private final RenewalDenial denial;

    public LoanNotRenewableException(Long loanId, RenewalDenial denial) {
        super(CirculationErrorCode.NOT_RENEWABLE, loanId, denial.getDescription());
        this.denial = denial;
    }
}
