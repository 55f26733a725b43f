package com.library.circulation.error.exception;

import com.library.circulation.error.CirculationErrorCode;
import com.library.circulation.error.exception.base.ClientBaseException;

public class OutOfStockException extends ClientBaseException {
    public OutOfStockException(String bookLabel) {
        super(CirculationErrorCode.OUT_OF_STOCK, bookLabel);
    }
}
