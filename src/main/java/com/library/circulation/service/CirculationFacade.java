package com.library.circulation.service;

import com.library.circulation.error.exception.InvalidInputException;
import com.library.circulation.model.Book;
import com.library.circulation.model.Loan;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Supplier;

/**
 * Entry point for callers. Validates input before any transaction opens and re-runs an
 * operation whose transaction failed on lock contention. Each attempt is a fresh transaction,
 * so a rolled-back attempt leaves nothing behind.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CirculationFacade {

    private final CirculationService circulationService;
    private final InventoryService inventoryService;
    private final Retry circulationRetry;

    public Loan createLoan(Long memberId, Long bookId) {
        return createLoan(memberId, bookId, null);
    }

    public Loan createLoan(Long memberId, Long bookId, String requestKey) {
        requireId(memberId, "memberId");
        requireId(bookId, "bookId");
        if (requestKey != null && (requestKey.isBlank() || requestKey.length() > Loan.MAX_REQUEST_KEY_LENGTH)) {
            throw new InvalidInputException("requestKey must be 1-" + Loan.MAX_REQUEST_KEY_LENGTH + " characters");
        }
        try {
            return withRetry(() -> circulationService.createLoan(memberId, bookId, requestKey));
        } catch (DataIntegrityViolationException e) {
            if (requestKey == null) {
                throw e;
            }
            // Another member's loan with the same key committed while this one was in flight.
            log.info("Request key {} collided on insert, resolving against the committed loan", requestKey);
            return circulationService.findReplay(memberId, bookId, requestKey).orElseThrow(() -> e);
        }
    }

    public Loan returnLoan(Long loanId) {
        requireId(loanId, "loanId");
        return withRetry(() -> circulationService.returnLoan(loanId));
    }

    public Loan renewLoan(Long loanId) {
        requireId(loanId, "loanId");
        return withRetry(() -> circulationService.renewLoan(loanId));
    }

    public Loan reportLost(Long loanId) {
        requireId(loanId, "loanId");
        return withRetry(() -> circulationService.reportLost(loanId));
    }

    public Loan reportDamaged(Long loanId, String notes) {
        requireId(loanId, "loanId");
        if (notes != null && notes.length() > Loan.MAX_NOTES_LENGTH) {
            throw new InvalidInputException("damage notes must be at most " + Loan.MAX_NOTES_LENGTH + " characters");
        }
        return withRetry(() -> circulationService.reportDamaged(loanId, notes));
    }

    public Loan cancelLoan(Long loanId) {
        requireId(loanId, "loanId");
        return withRetry(() -> circulationService.cancelLoan(loanId));
    }

    public Loan payLateFee(Long loanId, BigDecimal amount) {
        requireId(loanId, "loanId");
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidInputException("payment amount must be positive");
        }
        return withRetry(() -> circulationService.payLateFee(loanId, amount));
    }

    public int markOverdueLoans() {
        return withRetry(circulationService::markOverdueLoans);
    }

    public Book addCopies(Long bookId, int count) {
        requireId(bookId, "bookId");
        if (count <= 0) {
            throw new InvalidInputException("copies to add must be positive, was " + count);
        }
        return withRetry(() -> inventoryService.addCopies(bookId, count));
    }

    public Book retireBook(Long bookId) {
        requireId(bookId, "bookId");
        return withRetry(() -> inventoryService.retireBook(bookId));
    }

    public Book getBook(Long bookId) {
        requireId(bookId, "bookId");
        return inventoryService.getBook(bookId);
    }

    public Loan getLoan(Long loanId) {
        requireId(loanId, "loanId");
        return circulationService.getLoan(loanId);
    }

    public List<Loan> findLoansOnLoanByMember(Long memberId) {
        requireId(memberId, "memberId");
        return circulationService.findLoansOnLoanByMember(memberId);
    }

    public List<Loan> findOverdueLoans() {
        return circulationService.findOverdueLoans();
    }

    private <T> T withRetry(Supplier<T> call) {
        return Retry.decorateSupplier(circulationRetry, call).get();
    }

    private static void requireId(Long id, String name) {
        if (id == null || id <= 0) {
            throw new InvalidInputException(name + " must be a positive id");
        }
    }
}
