package com.library.circulation.controller.dto;

import com.library.circulation.model.Loan;
import com.library.circulation.policy.LateFeeCalculator;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record LoanResponse(
        Long id,
        Long memberId,
        Long bookId,
        LocalDateTime borrowedAt,
        LocalDateTime dueDate,
        LocalDateTime returnedAt,
        Loan.LoanStatus status,
        BigDecimal lateFee,
        boolean feePaid,
        int renewalCount,
        int maxRenewalsAllowed,
        String notes,
        boolean overdue,
        long daysOverdue
) {

    public static LoanResponse from(Loan loan, LocalDateTime now, LateFeeCalculator calculator) {
        return new LoanResponse(
                loan.getId(),
                loan.getMemberId(),
                loan.getBookId(),
                loan.getBorrowedAt(),
                loan.getDueDate(),
                loan.getReturnedAt(),
                loan.getStatus(),
                loan.getLateFee(),
                loan.isFeePaid(),
                loan.getRenewalCount(),
                loan.getMaxRenewalsAllowed(),
                loan.getNotes(),
                calculator.isOverdue(loan, now),
                calculator.daysOverdue(loan, now));
    }
}
