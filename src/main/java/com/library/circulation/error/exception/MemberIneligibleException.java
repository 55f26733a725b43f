package com.library.circulation.error.exception;

import com.library.circulation.error.CirculationErrorCode;
import com.library.circulation.error.exception.base.ClientBaseException;
import com.library.circulation.policy.IneligibilityReason;
import lombok.Getter;

@Getter
public class MemberIneligibleException extends ClientBaseException {

    private final IneligibilityReason reason;

    public MemberIneligibleException(Long memberId, IneligibilityReason reason) {
        super(CirculationErrorCode.MEMBER_INELIGIBLE, memberId, reason.getDescription());
        this.reason = reason;
    }
}
