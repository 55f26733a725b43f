package com.library.circulation.service;

import com.library.circulation.config.CirculationProperties;
import com.library.circulation.error.exception.BookNotFoundException;
import com.library.circulation.error.exception.InvalidInputException;
import com.library.circulation.error.exception.LoanNotFoundException;
import com.library.circulation.error.exception.MemberNotFoundException;
import com.library.circulation.model.Book;
import com.library.circulation.model.Loan;
import com.library.circulation.model.Member;
import com.library.circulation.policy.EligibilityPolicy;
import com.library.circulation.policy.LateFeeCalculator;
import com.library.circulation.repository.BookRepository;
import com.library.circulation.repository.LoanParties;
import com.library.circulation.repository.LoanRepository;
import com.library.circulation.repository.MemberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Coordinates the book ledger and the loan lifecycle. Each public operation is one
 * transaction: either every row it touched commits, or none does.
 *
 * <p>Rows are locked {@code FOR UPDATE} in member, book, loan order across all operations.
 * Business failures are thrown as {@link com.library.circulation.error.exception.base.ClientBaseException}
 * subclasses, which roll the transaction back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CirculationService {

    private final BookRepository bookRepository;
    private final MemberRepository memberRepository;
    private final LoanRepository loanRepository;
    private final EligibilityPolicy eligibilityPolicy;
    private final LateFeeCalculator lateFeeCalculator;
    private final CirculationProperties properties;
    private final Clock clock;

    @Transactional
    public Loan createLoan(Long memberId, Long bookId) {
        return createLoan(memberId, bookId, null);
    }

    /**
     * Checks out one copy. A non-null {@code requestKey} makes the call replayable: a second
     * call with the same key returns the loan the first one committed.
     */
    @Transactional
    public Loan createLoan(Long memberId, Long bookId, String requestKey) {
        LocalDateTime now = now();
        Member member = lockMember(memberId);

        if (requestKey != null) {
            Optional<Loan> previous = loanRepository.findByRequestKey(requestKey);
            if (previous.isPresent()) {
                return replay(previous.get(), memberId, bookId, requestKey);
            }
        }

        long loansOut = loanRepository.countByMemberIdAndStatusIn(memberId, Loan.ON_LOAN);
        eligibilityPolicy.checkBorrow(member, loansOut, now);

        Book book = bookRepository.findByIdForUpdate(bookId)
                .filter(found -> !found.isDeleted())
                .orElseThrow(() -> new BookNotFoundException(bookId));
        book.reserveCopy(now);
        bookRepository.save(book);

        Loan loan = loanRepository.save(Loan.open(memberId, bookId, now,
                properties.getLoanPeriodDays(), properties.getMaxRenewals(), requestKey));

        log.info("Loan {} created: book {} to member {}, due {} ({} copies left)",
                loan.getId(), bookId, memberId, loan.getDueDate(), book.getAvailableCopies());
        return loan;
    }

    /**
     * Looks up a committed loan by request key in a fresh transaction. Used after a concurrent
     * create lost the race on the unique key.
     */
    @Transactional(readOnly = true)
    public Optional<Loan> findReplay(Long memberId, Long bookId, String requestKey) {
        return loanRepository.findByRequestKey(requestKey)
                .map(previous -> replay(previous, memberId, bookId, requestKey));
    }

    @Transactional
    public Loan returnLoan(Long loanId) {
        LocalDateTime now = now();
        LoanParties parties = findParties(loanId);
        Optional<Member> member = memberRepository.findByIdForUpdate(parties.getMemberId());
        Book book = lockBook(parties.getBookId());
        Loan loan = lockLoan(loanId);

        loan.markReturned(now, lateFeeCalculator);
        book.releaseCopy(now);
        chargeMember(member, loan, now);

        log.info("Loan {} returned with status {} (fee {})", loanId, loan.getStatus(), loan.getLateFee());
        return loan;
    }

    /**
     * Extends the due date. The loan row lock serialises concurrent renewals so the renewal
     * limit cannot be overshot.
     */
    @Transactional
    public Loan renewLoan(Long loanId) {
        LocalDateTime now = now();
        Loan loan = lockLoan(loanId);
        Member member = memberRepository.findById(loan.getMemberId())
                .orElseThrow(() -> new MemberNotFoundException(loan.getMemberId()));

        eligibilityPolicy.checkRenewal(loan, member, now);
        loan.renew(properties.getLoanPeriodDays(), now);

        log.info("Loan {} renewed ({}/{}), now due {}",
                loanId, loan.getRenewalCount(), loan.getMaxRenewalsAllowed(), loan.getDueDate());
        return loan;
    }

    /**
     * The copy stays out of {@code availableCopies} for good.
     */
    @Transactional
    public Loan reportLost(Long loanId) {
        LocalDateTime now = now();
        LoanParties parties = findParties(loanId);
        Optional<Member> member = memberRepository.findByIdForUpdate(parties.getMemberId());
        Optional<Book> book = lockBookForWriteOff(parties.getBookId());
        Loan loan = lockLoan(loanId);

        loan.markLost(now, properties.getLostFee());
        book.ifPresent(found -> found.writeOffCopy(now));
        chargeMember(member, loan, now);

        log.info("Loan {} reported lost (fee {})", loanId, loan.getLateFee());
        return loan;
    }

    @Transactional
    public Loan reportDamaged(Long loanId, String notes) {
        LocalDateTime now = now();
        LoanParties parties = findParties(loanId);
        Optional<Member> member = memberRepository.findByIdForUpdate(parties.getMemberId());
        Optional<Book> book = lockBookForWriteOff(parties.getBookId());
        Loan loan = lockLoan(loanId);

        loan.markDamaged(now, properties.getDamagedFee(), notes);
        book.ifPresent(found -> found.writeOffCopy(now));
        chargeMember(member, loan, now);

        log.info("Loan {} reported damaged (fee {})", loanId, loan.getLateFee());
        return loan;
    }

    @Transactional
    public Loan cancelLoan(Long loanId) {
        LocalDateTime now = now();
        LoanParties parties = findParties(loanId);
        Book book = lockBook(parties.getBookId());
        Loan loan = lockLoan(loanId);

        loan.cancel(now);
        book.releaseCopy(now);

        log.info("Loan {} cancelled, copy of book {} back on the shelf", loanId, book.getId());
        return loan;
    }

    @Transactional
    public Loan payLateFee(Long loanId, BigDecimal amount) {
        LocalDateTime now = now();
        LoanParties parties = findParties(loanId);
        Optional<Member> member = memberRepository.findByIdForUpdate(parties.getMemberId());
        Loan loan = lockLoan(loanId);

        loan.payLateFee(amount, now);
        member.ifPresent(found -> found.settleFee(amount, now));

        log.info("Fee {} paid on loan {}", amount, loanId);
        return loan;
    }

    /**
     * Persists {@code OVERDUE} on every active loan past its due date. Overdue is otherwise
     * only computed on read; callers opt into this sweep.
     */
    @Transactional
    public int markOverdueLoans() {
        LocalDateTime now = now();
        List<Loan> pastDue = loanRepository.findPastDueForUpdate(Loan.LoanStatus.ACTIVE, now);
        pastDue.forEach(loan -> loan.markOverdue(now));
        if (!pastDue.isEmpty()) {
            log.info("Marked {} loans overdue as of {}", pastDue.size(), now);
        }
        return pastDue.size();
    }

    @Transactional(readOnly = true)
    public Loan getLoan(Long loanId) {
        return loanRepository.findById(loanId).orElseThrow(() -> new LoanNotFoundException(loanId));
    }

    @Transactional(readOnly = true)
    public List<Loan> findLoansOnLoanByMember(Long memberId) {
        return loanRepository.findByMemberIdAndStatusInOrderByDueDateAsc(memberId, Loan.ON_LOAN);
    }

    @Transactional(readOnly = true)
    public List<Loan> findOverdueLoans() {
        return loanRepository.findOverdue(Loan.ON_LOAN, now());
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private Loan replay(Loan previous, Long memberId, Long bookId, String requestKey) {
        if (!previous.getMemberId().equals(memberId) || !previous.getBookId().equals(bookId)) {
            throw new InvalidInputException("request key " + requestKey + " was already used for another loan");
        }
        log.info("Replaying loan {} for request key {}", previous.getId(), requestKey);
        return previous;
    }

    private void chargeMember(Optional<Member> member, Loan loan, LocalDateTime now) {
        if (!loan.hasUnpaidFee()) {
            return;
        }
        if (member.isEmpty()) {
            log.warn("Fee {} on loan {} not added: member {} no longer exists",
                    loan.getLateFee(), loan.getId(), loan.getMemberId());
            return;
        }
        member.get().addFee(loan.getLateFee(), now);
    }

    private Optional<Book> lockBookForWriteOff(Long bookId) {
        if (!properties.isWriteOffUnreturnedCopies()) {
            return Optional.empty();
        }
        return Optional.of(lockBook(bookId));
    }

    private LoanParties findParties(Long loanId) {
        return loanRepository.findPartiesById(loanId).orElseThrow(() -> new LoanNotFoundException(loanId));
    }

    private Member lockMember(Long memberId) {
        return memberRepository.findByIdForUpdate(memberId).orElseThrow(() -> new MemberNotFoundException(memberId));
    }

    private Book lockBook(Long bookId) {
        return bookRepository.findByIdForUpdate(bookId).orElseThrow(() -> new BookNotFoundException(bookId));
    }

    private Loan lockLoan(Long loanId) {
        return loanRepository.findByIdForUpdate(loanId).orElseThrow(() -> new LoanNotFoundException(loanId));
    }
}
