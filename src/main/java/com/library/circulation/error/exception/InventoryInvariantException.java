package com.library.circulation.error.exception;

import com.library.circulation.error.CirculationErrorCode;
import com.library.circulation.error.exception.base.ServerBaseException;

public class InventoryInvariantException extends ServerBaseException {
    public InventoryInvariantException(Long bookId, String detail) {
        super(CirculationErrorCode.INVENTORY_INVARIANT_VIOLATION, bookId, detail);
    }
}
