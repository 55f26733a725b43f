package com.library.circulation.error.exception;

import com.library.circulation.error.CirculationErrorCode;
import com.library.circulation.error.exception.base.ClientBaseException;

public class MemberNotFoundException extends ClientBaseException {
    public MemberNotFoundException(Long memberId) {
        super(CirculationErrorCode.MEMBER_NOT_FOUND, memberId);
    }
}
