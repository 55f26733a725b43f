package com.library.circulation.error.exception;

import com.library.circulation.error.CirculationErrorCode;
import com.library.circulation.error.exception.base.ClientBaseException;

public class BookNotFoundException extends ClientBaseException {
    public BookNotFoundException(Long bookId) {
        super(CirculationErrorCode.BOOK_NOT_FOUND, bookId);
    }
}
