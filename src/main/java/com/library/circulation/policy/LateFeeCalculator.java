package com.library.circulation.policy;

import com.library.circulation.config.CirculationProperties;
import com.library.circulation.model.Loan;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Overdue-day and late-fee arithmetic. Stateless apart from the daily rate; every method takes
 * the point in time explicitly.
 */
@Component
public class LateFeeCalculator {

    private final BigDecimal lateFeePerDay;

    public LateFeeCalculator(CirculationProperties properties) {
        this.lateFeePerDay = properties.getLateFeePerDay();
    }

    public boolean isOverdue(Loan loan, LocalDateTime now) {
        return loan.isOverdue(now);
    }

    /**
     * Days past due rounded up, so one hour late counts as one day.
     */
    public long daysOverdue(Loan loan, LocalDateTime now) {
        if (!loan.isOverdue(now)) {
            return 0;
        }
        Duration late = Duration.between(loan.getDueDate(), now);
        long days = late.toDays();
        return late.minusDays(days).isZero() ? days : days + 1;
    }

    public BigDecimal calculateLateFee(Loan loan, LocalDateTime returnTime) {
        return calculateLateFee(loan.getDueDate(), returnTime);
    }

    /**
     * Whole days late times the daily rate. A partial day is not charged.
     */
    public BigDecimal calculateLateFee(LocalDateTime dueDate, LocalDateTime returnTime) {
        long daysLate = Duration.between(dueDate, returnTime).toDays();
        if (daysLate <= 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        return lateFeePerDay.multiply(BigDecimal.valueOf(daysLate)).setScale(2, RoundingMode.HALF_UP);
    }
}
