package com.library.circulation.policy;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum RenewalDenial {
    RENEWAL_LIMIT_REACHED("renewal limit reached"),
    NOT_ON_LOAN("loan is no longer active"),
    OVERDUE("loan is overdue and must be returned"),
    OUTSTANDING_FEES("loan is overdue and outstanding fees exceed the threshold");

    private final String description;
}
