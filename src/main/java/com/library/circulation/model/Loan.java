package com.library.circulation.model;

import com.library.circulation.error.exception.AlreadyReturnedException;
import com.library.circulation.error.exception.InvalidAmountException;
import com.library.circulation.error.exception.InvalidInputException;
import com.library.circulation.error.exception.LoanNotCancellableException;
import com.library.circulation.error.exception.LoanNotRenewableException;
import com.library.circulation.error.exception.NoFeeOwedException;
import com.library.circulation.error.exception.RenewalLimitExceededException;
import com.library.circulation.policy.LateFeeCalculator;
import com.library.circulation.policy.RenewalDenial;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * One borrowing of one copy. The member and book references are fixed at creation and the
 * record is never deleted.
 *
 * <p>Overdue is derived from {@code now} by {@link #isOverdue(LocalDateTime)}; the stored
 * {@link LoanStatus#OVERDUE} only appears after an explicit sweep.
 */
@Entity
@Table(name = "loans", indexes = {
        @Index(name = "ix_loans_member_status", columnList = "memberId, status"),
        @Index(name = "ix_loans_book_status", columnList = "bookId, status"),
        @Index(name = "ix_loans_status_due", columnList = "status, dueDate")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@ToString
public class Loan {

    public static final Set<LoanStatus> ON_LOAN = EnumSet.of(LoanStatus.ACTIVE, LoanStatus.OVERDUE);

    public static final int MAX_NOTES_LENGTH = 500;
    public static final int MAX_REQUEST_KEY_LENGTH = 64;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long memberId;

    @Column(nullable = false, updatable = false)
    private Long bookId;

    @Column(nullable = false, updatable = false)
    private LocalDateTime borrowedAt;

    @Column(nullable = false)
    private LocalDateTime dueDate;

    private LocalDateTime returnedAt; // Null until returned

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private LoanStatus status;

    @Column(precision = 10, scale = 2)
    private BigDecimal lateFee; // Null until a fee has been assessed

    @Column(nullable = false)
    private boolean feePaid;

    @Column(nullable = false)
    private int renewalCount;

    @Column(nullable = false)
    private int maxRenewalsAllowed;

    @Column(length = MAX_NOTES_LENGTH)
    private String notes;

    @Column(unique = true, length = MAX_REQUEST_KEY_LENGTH, updatable = false)
    private String requestKey;

    private LocalDateTime updatedAt;

    public enum LoanStatus {
        ACTIVE, RETURNED, OVERDUE, RETURNED_LATE, LOST, DAMAGED, CANCELLED
    }

    public static Loan open(Long memberId, Long bookId, LocalDateTime borrowedAt,
                            int loanPeriodDays, int maxRenewalsAllowed, String requestKey) {
        if (loanPeriodDays <= 0) {
            throw new InvalidInputException("loan period must be positive");
        }
        Loan loan = new Loan();
        loan.memberId = memberId;
        loan.bookId = bookId;
        loan.borrowedAt = borrowedAt;
        loan.dueDate = borrowedAt.plusDays(loanPeriodDays);
        loan.status = LoanStatus.ACTIVE;
        loan.renewalCount = 0;
        loan.maxRenewalsAllowed = maxRenewalsAllowed;
        loan.feePaid = false;
        loan.requestKey = requestKey;
        loan.updatedAt = borrowedAt;
        return loan;
    }

    public boolean isOnLoan() {
        return returnedAt == null && ON_LOAN.contains(status);
    }

    public boolean isOverdue(LocalDateTime now) {
        return isOnLoan() && now.isAfter(dueDate);
    }

    public boolean canBeRenewed(LocalDateTime now, boolean allowWhileOverdue) {
        return isOnLoan()
                && renewalCount < maxRenewalsAllowed
                && (!isOverdue(now) || allowWhileOverdue);
    }

    public boolean hasUnpaidFee() {
        return lateFee != null && lateFee.signum() > 0 && !feePaid;
    }

    /**
     * Pushes the due date out by one loan period. Policy checks (overdue, member fees) are
     * the caller's; this only guards the loan's own limits.
     */
    public void renew(int extensionDays, LocalDateTime now) {
        if (renewalCount >= maxRenewalsAllowed) {
            throw new RenewalLimitExceededException(id, maxRenewalsAllowed);
        }
        if (!isOnLoan()) {
            throw new LoanNotRenewableException(id, RenewalDenial.NOT_ON_LOAN);
        }
        if (extensionDays <= 0) {
            throw new InvalidInputException("renewal period must be positive");
        }
        dueDate = dueDate.plusDays(extensionDays);
        renewalCount++;
        status = LoanStatus.ACTIVE;
        updatedAt = now;
    }

    /**
     * Closes the loan. A late return freezes the fee owed at this moment; an on-time return
     * records a zero fee.
     */
    public void markReturned(LocalDateTime now, LateFeeCalculator calculator) {
        ensureOpen();
        boolean wasOverdue = isOverdue(now);
        returnedAt = now;
        if (wasOverdue) {
            status = LoanStatus.RETURNED_LATE;
            lateFee = calculator.calculateLateFee(dueDate, now);
        } else {
            status = LoanStatus.RETURNED;
            lateFee = BigDecimal.ZERO.setScale(2);
        }
        updatedAt = now;
    }

    public void markLost(LocalDateTime now, BigDecimal fee) {
        ensureOpen();
        status = LoanStatus.LOST;
        lateFee = fee;
        updatedAt = now;
    }

    public void markDamaged(LocalDateTime now, BigDecimal fee, String damageNotes) {
        ensureOpen();
        status = LoanStatus.DAMAGED;
        lateFee = fee;
        notes = damageNotes;
        updatedAt = now;
    }

    public void markOverdue(LocalDateTime now) {
        if (status == LoanStatus.ACTIVE && isOverdue(now)) {
            status = LoanStatus.OVERDUE;
            updatedAt = now;
        }
    }

    /**
     * Administrative undo of a checkout that was never renewed.
     */
    public void cancel(LocalDateTime now) {
        if (status != LoanStatus.ACTIVE || returnedAt != null || renewalCount > 0) {
            throw new LoanNotCancellableException(id, status, renewalCount);
        }
        status = LoanStatus.CANCELLED;
        updatedAt = now;
    }

    /**
     * Only the exact fee is accepted; partial payments are not supported.
     */
    public void payLateFee(BigDecimal amount, LocalDateTime now) {
        if (!hasUnpaidFee()) {
            throw new NoFeeOwedException(id);
        }
        if (amount == null || amount.compareTo(lateFee) != 0) {
            throw new InvalidAmountException(id, amount, lateFee);
        }
        feePaid = true;
        updatedAt = now;
    }

    private void ensureOpen() {
        if (!isOnLoan()) {
            throw new AlreadyReturnedException(id, status);
        }
    }
}
