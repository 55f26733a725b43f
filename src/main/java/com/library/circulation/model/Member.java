package com.library.circulation.model;

import com.library.circulation.error.exception.InvalidInputException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * Borrower record. Circulation reads it for eligibility and only touches
 * {@code outstandingFees} when a loan fee is assessed or paid.
 */
@Entity
@Table(name = "members")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@ToString
public class Member {

    public static final int DEFAULT_MAX_BOOKS = 5;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String fullName;

    @Column(nullable = false)
    private LocalDateTime membershipExpiresAt;

    @Column(nullable = false)
    private int maxBooksAllowed;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal outstandingFees;

    @Column(nullable = false)
    private boolean active;

    private LocalDateTime updatedAt;

    public Member(String fullName, LocalDateTime membershipExpiresAt) {
        this(fullName, membershipExpiresAt, DEFAULT_MAX_BOOKS);
    }

    public Member(String fullName, LocalDateTime membershipExpiresAt, int maxBooksAllowed) {
        if (maxBooksAllowed <= 0) {
            throw new InvalidInputException("max books allowed must be positive");
        }
        this.fullName = fullName;
        this.membershipExpiresAt = membershipExpiresAt;
        this.maxBooksAllowed = maxBooksAllowed;
        this.outstandingFees = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        this.active = true;
    }

    /**
     * Expiry is exclusive: a membership ending at {@code now} has already lapsed.
     */
    public boolean isMembershipExpired(LocalDateTime now) {
        return !membershipExpiresAt.isAfter(now);
    }

    public void addFee(BigDecimal amount, LocalDateTime now) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidInputException("fee amount must be positive");
        }
        outstandingFees = outstandingFees.add(amount).setScale(2, RoundingMode.HALF_UP);
        updatedAt = now;
    }

    /**
     * Settles a paid loan fee. Fees may already have been cleared at the front desk, so the
     * balance stops at zero.
     */
    public void settleFee(BigDecimal amount, LocalDateTime now) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidInputException("payment amount must be positive");
        }
        BigDecimal remaining = outstandingFees.subtract(amount);
        outstandingFees = remaining.signum() < 0
                ? BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP)
                : remaining.setScale(2, RoundingMode.HALF_UP);
        updatedAt = now;
    }

    public void deactivate(LocalDateTime now) {
        active = false;
        updatedAt = now;
    }
}
