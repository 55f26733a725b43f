package com.library.circulation.repository;

public interface LoanParties {
    Long getMemberId();
    Long getBookId();
}
