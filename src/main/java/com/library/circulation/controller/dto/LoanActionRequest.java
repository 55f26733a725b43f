package com.library.circulation.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * {@code {"type": "borrow", "memberId": .., "bookId": .., "requestKey": ..}} or
 * {@code {"type": "return", "loanId": ..}}.
 */
public record LoanActionRequest(
        @NotBlank String type,
        Long memberId,
        Long bookId,
        Long loanId,
        @Size(max = 64) String requestKey
) {
}
