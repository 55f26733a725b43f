package com.library.circulation.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CirculationErrorCode implements ErrorCode {
    // === Client Errors (4xx) ===
    INVALID_INPUT_VALUE("C001", "Invalid input: %s", HttpStatus.BAD_REQUEST),
    MEMBER_NOT_FOUND("C002", "Member not found (id: %s)", HttpStatus.NOT_FOUND),
    BOOK_NOT_FOUND("C003", "Book not found (id: %s)", HttpStatus.NOT_FOUND),
    LOAN_NOT_FOUND("C004", "Loan record not found (id: %s)", HttpStatus.NOT_FOUND),
    OUT_OF_STOCK("C005", "Book %s is not available. All copies are currently on loan.", HttpStatus.CONFLICT),
    MEMBER_INELIGIBLE("C006", "Member %s cannot borrow books: %s", HttpStatus.UNPROCESSABLE_ENTITY),
    RENEWAL_LIMIT_EXCEEDED("C007", "Loan %s has reached the maximum number of renewals (%s)", HttpStatus.CONFLICT),
    NOT_RENEWABLE("C008", "Loan %s cannot be renewed: %s", HttpStatus.CONFLICT),
    ALREADY_RETURNED("C009", "Loan %s is already closed (status: %s)", HttpStatus.CONFLICT),
    NOT_CANCELLABLE("C010", "Loan %s cannot be cancelled (status: %s, renewals: %s)", HttpStatus.CONFLICT),
    INVALID_AMOUNT("C011", "Payment of %s does not match the fee of %s owed on loan %s", HttpStatus.BAD_REQUEST),
    NO_FEE_OWED("C012", "No fee is owed on loan %s", HttpStatus.CONFLICT),
    COPIES_ON_LOAN("C013", "Book %s cannot be retired while %s copies are on loan", HttpStatus.CONFLICT),

    // === Server Errors (5xx) ===
    INTERNAL_SERVER_ERROR("S001", "Internal server error.", HttpStatus.INTERNAL_SERVER_ERROR),
    INVENTORY_INVARIANT_VIOLATION("S002", "Inventory invariant violated for book %s: %s", HttpStatus.INTERNAL_SERVER_ERROR),
    CIRCULATION_BUSY("S003", "The circulation desk is busy, please retry shortly.", HttpStatus.SERVICE_UNAVAILABLE);

    private final String code;
    private final String message;
    private final HttpStatus status;
}
