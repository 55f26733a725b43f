package com.library.circulation.policy;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum IneligibilityReason {
    MEMBER_INACTIVE("membership is not active"),
    MEMBERSHIP_EXPIRED("membership has expired"),
    OUTSTANDING_FEES("outstanding fees exceed the borrowing threshold"),
    BORROW_LIMIT_REACHED("maximum number of borrowed books reached");

    private final String description;
}
