package com.library.circulation.service;

import com.library.circulation.error.exception.BookNotFoundException;
import com.library.circulation.model.Book;
import com.library.circulation.model.Loan;
import com.library.circulation.repository.BookRepository;
import com.library.circulation.repository.LoanRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Ledger operations that do not involve a loan transition.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryService {

    private final BookRepository bookRepository;
    private final LoanRepository loanRepository;
    private final Clock clock;

    @Transactional
    public Book addCopies(Long bookId, int count) {
        Book book = lockBook(bookId);
        book.addCopies(count, LocalDateTime.now(clock));
        log.info("Added {} copies to book {} (total {}, available {})",
                count, bookId, book.getTotalCopies(), book.getAvailableCopies());
        return book;
    }

    /**
     * Soft-deletes the book. Refused while any of its loans is still on loan; past loans
     * stay as history.
     */
    @Transactional
    public Book retireBook(Long bookId) {
        Book book = lockBook(bookId);
        long outstanding = loanRepository.countByBookIdAndStatusIn(bookId, Loan.ON_LOAN);
        book.markDeleted(outstanding, LocalDateTime.now(clock));
        log.info("Book {} retired from circulation", bookId);
        return book;
    }

    @Transactional(readOnly = true)
    public Book getBook(Long bookId) {
        return bookRepository.findById(bookId).orElseThrow(() -> new BookNotFoundException(bookId));
    }

    private Book lockBook(Long bookId) {
        return bookRepository.findByIdForUpdate(bookId).orElseThrow(() -> new BookNotFoundException(bookId));
    }
}
