package com.library.circulation.model;

import com.library.circulation.config.CirculationProperties;
import com.library.circulation.error.exception.AlreadyReturnedException;
import com.library.circulation.error.exception.InvalidAmountException;
import com.library.circulation.error.exception.LoanNotCancellableException;
import com.library.circulation.error.exception.NoFeeOwedException;
import com.library.circulation.error.exception.RenewalLimitExceededException;
import com.library.circulation.policy.LateFeeCalculator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoanTest {

    private static final LocalDateTime DAY_0 = LocalDateTime.of(2024, 3, 1, 10, 0);

    private final LateFeeCalculator calculator = new LateFeeCalculator(new CirculationProperties());

    private Loan newLoan() {
        return Loan.open(1L, 2L, DAY_0, 14, 2, null);
    }

    @Test
    void openLoanIsActiveAndDueAfterLoanPeriod() {
        Loan loan = newLoan();

        assertThat(loan.getStatus()).isEqualTo(Loan.LoanStatus.ACTIVE);
        assertThat(loan.getDueDate()).isEqualTo(DAY_0.plusDays(14));
        assertThat(loan.getReturnedAt()).isNull();
        assertThat(loan.getLateFee()).isNull();
        assertThat(loan.isOnLoan()).isTrue();
    }

    @Test
    @DisplayName("Borrowed day 0, due day 14, returned day 20: returned late with a 3.00 fee")
    void lateReturnFreezesFee() {
        Loan loan = newLoan();

        loan.markReturned(DAY_0.plusDays(20), calculator);

        assertThat(loan.getStatus()).isEqualTo(Loan.LoanStatus.RETURNED_LATE);
        assertThat(loan.getLateFee()).isEqualByComparingTo("3.00");
        assertThat(loan.getReturnedAt()).isEqualTo(DAY_0.plusDays(20));
        assertThat(loan.isOverdue(DAY_0.plusDays(40))).isFalse();
    }

    @Test
    void returnOnDueDateIsOnTime() {
        Loan loan = newLoan();

        loan.markReturned(DAY_0.plusDays(14), calculator);

        assertThat(loan.getStatus()).isEqualTo(Loan.LoanStatus.RETURNED);
        assertThat(loan.getLateFee()).isEqualByComparingTo("0.00");
        assertThat(loan.hasUnpaidFee()).isFalse();
    }

    @Test
    void returnHoursAfterDueIsLateButFree() {
        Loan loan = newLoan();

        loan.markReturned(DAY_0.plusDays(14).plusHours(2), calculator);

        assertThat(loan.getStatus()).isEqualTo(Loan.LoanStatus.RETURNED_LATE);
        assertThat(loan.getLateFee()).isEqualByComparingTo("0.00");
    }

    @Test
    void secondReturnFails() {
        Loan loan = newLoan();
        loan.markReturned(DAY_0.plusDays(3), calculator);

        assertThatThrownBy(() -> loan.markReturned(DAY_0.plusDays(4), calculator))
                .isInstanceOf(AlreadyReturnedException.class);
        assertThat(loan.getReturnedAt()).isEqualTo(DAY_0.plusDays(3));
    }

    @Test
    void renewExtendsDueDate() {
        Loan loan = newLoan();

        loan.renew(14, DAY_0.plusDays(10));

        assertThat(loan.getRenewalCount()).isEqualTo(1);
        assertThat(loan.getDueDate()).isEqualTo(DAY_0.plusDays(28));
    }

    @Test
    void renewBeyondLimitFails() {
        Loan loan = newLoan();
        loan.renew(14, DAY_0.plusDays(1));
        loan.renew(14, DAY_0.plusDays(2));

        assertThatThrownBy(() -> loan.renew(14, DAY_0.plusDays(3)))
                .isInstanceOf(RenewalLimitExceededException.class);
        assertThat(loan.getRenewalCount()).isEqualTo(2);
        assertThat(loan.getDueDate()).isEqualTo(DAY_0.plusDays(42));
    }

    @Test
    void overdueIsDerivedFromNow() {
        Loan loan = newLoan();

        assertThat(loan.isOverdue(DAY_0.plusDays(14))).isFalse();
        assertThat(loan.isOverdue(DAY_0.plusDays(14).plusSeconds(1))).isTrue();
        assertThat(loan.getStatus()).isEqualTo(Loan.LoanStatus.ACTIVE);
        assertThat(loan.canBeRenewed(DAY_0.plusDays(15), false)).isFalse();
        assertThat(loan.canBeRenewed(DAY_0.plusDays(15), true)).isTrue();
    }

    @Test
    void sweptOverdueLoanCanStillBeReturnedOrRenewed() {
        Loan returned = newLoan();
        returned.markOverdue(DAY_0.plusDays(16));
        assertThat(returned.getStatus()).isEqualTo(Loan.LoanStatus.OVERDUE);

        returned.markReturned(DAY_0.plusDays(18), calculator);
        assertThat(returned.getStatus()).isEqualTo(Loan.LoanStatus.RETURNED_LATE);
        assertThat(returned.getLateFee()).isEqualByComparingTo("2.00");

        Loan renewed = newLoan();
        renewed.markOverdue(DAY_0.plusDays(16));
        renewed.renew(14, DAY_0.plusDays(16));
        assertThat(renewed.getStatus()).isEqualTo(Loan.LoanStatus.ACTIVE);
    }

    @Test
    void markOverdueIgnoresLoansNotPastDue() {
        Loan loan = newLoan();

        loan.markOverdue(DAY_0.plusDays(5));

        assertThat(loan.getStatus()).isEqualTo(Loan.LoanStatus.ACTIVE);
    }

    @Test
    void lostAndDamagedAssessFeeAndAreTerminal() {
        Loan lost = newLoan();
        lost.markLost(DAY_0.plusDays(5), new BigDecimal("25.00"));

        assertThat(lost.getStatus()).isEqualTo(Loan.LoanStatus.LOST);
        assertThat(lost.getLateFee()).isEqualByComparingTo("25.00");
        assertThat(lost.isOnLoan()).isFalse();
        assertThat(lost.isOverdue(DAY_0.plusDays(30))).isFalse();
        assertThatThrownBy(() -> lost.markReturned(DAY_0.plusDays(6), calculator))
                .isInstanceOf(AlreadyReturnedException.class);

        Loan damaged = newLoan();
        damaged.markDamaged(DAY_0.plusDays(5), new BigDecimal("10.00"), "water damage");

        assertThat(damaged.getStatus()).isEqualTo(Loan.LoanStatus.DAMAGED);
        assertThat(damaged.getNotes()).isEqualTo("water damage");
        assertThatThrownBy(() -> damaged.markLost(DAY_0.plusDays(6), BigDecimal.ONE))
                .isInstanceOf(AlreadyReturnedException.class);
    }

    @Test
    void cancelOnlyUntouchedActiveLoan() {
        Loan untouched = newLoan();
        untouched.cancel(DAY_0.plusHours(1));
        assertThat(untouched.getStatus()).isEqualTo(Loan.LoanStatus.CANCELLED);

        Loan renewed = newLoan();
        renewed.renew(14, DAY_0.plusDays(1));
        assertThatThrownBy(() -> renewed.cancel(DAY_0.plusDays(2)))
                .isInstanceOf(LoanNotCancellableException.class);
    }

    @Test
    void payLateFeeRequiresExactAmount() {
        Loan loan = newLoan();
        loan.markReturned(DAY_0.plusDays(20), calculator);

        assertThatThrownBy(() -> loan.payLateFee(new BigDecimal("2.50"), DAY_0.plusDays(21)))
                .isInstanceOf(InvalidAmountException.class);
        assertThat(loan.isFeePaid()).isFalse();

        loan.payLateFee(new BigDecimal("3.0"), DAY_0.plusDays(21));

        assertThat(loan.isFeePaid()).isTrue();
        assertThatThrownBy(() -> loan.payLateFee(new BigDecimal("3.00"), DAY_0.plusDays(22)))
                .isInstanceOf(NoFeeOwedException.class);
    }

    @Test
    void payLateFeeWithoutFeeFails() {
        Loan active = newLoan();
        assertThatThrownBy(() -> active.payLateFee(BigDecimal.ONE, DAY_0))
                .isInstanceOf(NoFeeOwedException.class);

        Loan onTime = newLoan();
        onTime.markReturned(DAY_0.plusDays(2), calculator);
        assertThatThrownBy(() -> onTime.payLateFee(BigDecimal.ONE, DAY_0.plusDays(2)))
                .isInstanceOf(NoFeeOwedException.class);
    }
}
