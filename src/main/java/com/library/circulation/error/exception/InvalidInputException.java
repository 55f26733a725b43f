package com.library.circulation.error.exception;

import com.library.circulation.error.CirculationErrorCode;
import com.library.circulation.error.exception.base.ClientBaseException;

public class InvalidInputException extends ClientBaseException {
    public InvalidInputException(String detail) {
        super(CirculationErrorCode.INVALID_INPUT_VALUE, detail);
    }
}
