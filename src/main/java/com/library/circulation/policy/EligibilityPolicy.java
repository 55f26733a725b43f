package com.library.circulation.policy;

import com.library.circulation.config.CirculationProperties;
import com.library.circulation.error.exception.LoanNotRenewableException;
import com.library.circulation.error.exception.MemberIneligibleException;
import com.library.circulation.error.exception.RenewalLimitExceededException;
import com.library.circulation.model.Loan;
import com.library.circulation.model.Member;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Borrow and renew eligibility, evaluated against a snapshot the caller already holds.
 * Nothing here reads storage or the clock.
 */
@Component
public class EligibilityPolicy {

    private final BigDecimal feeThreshold;
    private final boolean allowRenewalWhileOverdue;

    public EligibilityPolicy(CirculationProperties properties) {
        this.feeThreshold = properties.getFeeThreshold();
        this.allowRenewalWhileOverdue = properties.isAllowRenewalWhileOverdue();
    }

    /**
     * First rule the member fails, or empty when they may borrow. The fee threshold is
     * inclusive: a member owing exactly the threshold still borrows.
     */
    public Optional<IneligibilityReason> evaluateBorrow(Member member, long activeLoanCount, LocalDateTime now) {
        if (!member.isActive()) {
            return Optional.of(IneligibilityReason.MEMBER_INACTIVE);
        }
        if (member.isMembershipExpired(now)) {
            return Optional.of(IneligibilityReason.MEMBERSHIP_EXPIRED);
        }
        if (member.getOutstandingFees().compareTo(feeThreshold) > 0) {
            return Optional.of(IneligibilityReason.OUTSTANDING_FEES);
        }
        if (activeLoanCount >= member.getMaxBooksAllowed()) {
            return Optional.of(IneligibilityReason.BORROW_LIMIT_REACHED);
        }
        return Optional.empty();
    }

    public boolean canBorrowBooks(Member member, long activeLoanCount, LocalDateTime now) {
        return evaluateBorrow(member, activeLoanCount, now).isEmpty();
    }

    public void checkBorrow(Member member, long activeLoanCount, LocalDateTime now) {
        evaluateBorrow(member, activeLoanCount, now).ifPresent(reason -> {
            throw new MemberIneligibleException(member.getId(), reason);
        });
    }

    public Optional<RenewalDenial> evaluateRenewal(Loan loan, Member member, LocalDateTime now) {
        if (loan.getRenewalCount() >= loan.getMaxRenewalsAllowed()) {
            return Optional.of(RenewalDenial.RENEWAL_LIMIT_REACHED);
        }
        if (!loan.isOnLoan()) {
            return Optional.of(RenewalDenial.NOT_ON_LOAN);
        }
        if (loan.isOverdue(now)) {
            if (!allowRenewalWhileOverdue) {
                return Optional.of(RenewalDenial.OVERDUE);
            }
            if (member.getOutstandingFees().compareTo(feeThreshold) > 0) {
                return Optional.of(RenewalDenial.OUTSTANDING_FEES);
            }
        }
        return Optional.empty();
    }

    public boolean canRenew(Loan loan, Member member, LocalDateTime now) {
        return evaluateRenewal(loan, member, now).isEmpty();
    }

    public void checkRenewal(Loan loan, Member member, LocalDateTime now) {
        Optional<RenewalDenial> denial = evaluateRenewal(loan, member, now);
        if (denial.isEmpty()) {
            return;
        }
        if (denial.get() == RenewalDenial.RENEWAL_LIMIT_REACHED) {
            throw new RenewalLimitExceededException(loan.getId(), loan.getMaxRenewalsAllowed());
        }
        throw new LoanNotRenewableException(loan.getId(), denial.get());
    }
}
