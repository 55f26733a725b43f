package com.library.circulation.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Circulation rules bound from {@code library.circulation.*}.
 *
 * <p>Defaults reproduce the desk rules: 14-day loans, two renewals, 0.50 per late day and a
 * 10.00 outstanding-fee ceiling (inclusive) for borrowing.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "library.circulation")
public class CirculationProperties {

    @Min(1)
    private int loanPeriodDays = 14;

    @Min(0)
    private int maxRenewals = 2;

    @NotNull
    @DecimalMin("0.00")
    private BigDecimal lateFeePerDay = new BigDecimal("0.50");

    @NotNull
    @DecimalMin("0.00")
    private BigDecimal feeThreshold = new BigDecimal("10.00");

    /** When false, an overdue loan must be returned; it can never be renewed. */
    private boolean allowRenewalWhileOverdue = false;

    @NotNull
    @DecimalMin("0.00")
    private BigDecimal lostFee = new BigDecimal("25.00");

    @NotNull
    @DecimalMin("0.00")
    private BigDecimal damagedFee = new BigDecimal("10.00");

    /**
     * Lost and damaged copies never come back; when enabled the copy is also removed from
     * {@code totalCopies} in the same transaction.
     */
    private boolean writeOffUnreturnedCopies = true;

    @NotNull
    @Valid
    private Retry retry = new Retry();

    @NotNull
    @Valid
    private OverdueSweep overdueSweep = new OverdueSweep();

    @Getter
    @Setter
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;

        @Min(1)
        private long initialBackoffMillis = 100;

        @DecimalMin("1.0")
        private double multiplier = 2.0;
    }

    @Getter
    @Setter
    public static class OverdueSweep {
        private boolean enabled = false;

        @NotBlank
        private String cron = "0 0 1 * * *";
    }
}
