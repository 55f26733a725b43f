package com.library.circulation.controller;

import com.library.circulation.controller.dto.DamageReportRequest;
import com.library.circulation.controller.dto.FeePaymentRequest;
import com.library.circulation.controller.dto.LoanActionRequest;
import com.library.circulation.controller.dto.LoanResponse;
import com.library.circulation.error.exception.InvalidInputException;
import com.library.circulation.model.Loan;
import com.library.circulation.policy.LateFeeCalculator;
import com.library.circulation.service.CirculationFacade;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/loans")
@CrossOrigin(origins = "*") // Allow all origins for simplicity in demo, restrict in production
@RequiredArgsConstructor
public class LoanController {

    private final CirculationFacade circulationFacade;
    private final LateFeeCalculator lateFeeCalculator;
    private final Clock clock;

    @GetMapping
    public List<LoanResponse> getLoansOnLoan(@RequestParam Long memberId) {
        return toResponses(circulationFacade.findLoansOnLoanByMember(memberId));
    }

    @GetMapping("/overdue")
    public List<LoanResponse> getOverdueLoans() {
        return toResponses(circulationFacade.findOverdueLoans());
    }

    @GetMapping("/{id}")
    public LoanResponse getLoanById(@PathVariable Long id) {
        return toResponse(circulationFacade.getLoan(id));
    }

    @PostMapping
    public ResponseEntity<LoanResponse> handleLoanAction(@Valid @RequestBody LoanActionRequest request) {
        if ("borrow".equals(request.type())) {
            Loan loan = circulationFacade.createLoan(request.memberId(), request.bookId(), request.requestKey());
            return new ResponseEntity<>(toResponse(loan), HttpStatus.CREATED);
        } else if ("return".equals(request.type())) {
            return ResponseEntity.ok(toResponse(circulationFacade.returnLoan(request.loanId())));
        } else {
            throw new InvalidInputException("invalid loan action type '" + request.type() + "'");
        }
    }

    @PostMapping("/{id}/renewal")
    public LoanResponse renewLoan(@PathVariable Long id) {
        return toResponse(circulationFacade.renewLoan(id));
    }

    @PostMapping("/{id}/lost")
    public LoanResponse reportLost(@PathVariable Long id) {
        return toResponse(circulationFacade.reportLost(id));
    }

    @PostMapping("/{id}/damaged")
    public LoanResponse reportDamaged(@PathVariable Long id,
                                      @Valid @RequestBody(required = false) DamageReportRequest request) {
        String notes = request == null ? null : request.notes();
        return toResponse(circulationFacade.reportDamaged(id, notes));
    }

    @PostMapping("/{id}/cancellation")
    public LoanResponse cancelLoan(@PathVariable Long id) {
        return toResponse(circulationFacade.cancelLoan(id));
    }

    @PostMapping("/{id}/fee-payment")
    public LoanResponse payLateFee(@PathVariable Long id, @Valid @RequestBody FeePaymentRequest request) {
        return toResponse(circulationFacade.payLateFee(id, request.amount()));
    }

    // Basic health check endpoint
    @GetMapping("/health")
    public ResponseEntity<String> healthCheck() {
        return ResponseEntity.ok("OK");
    }

    private LoanResponse toResponse(Loan loan) {
        return LoanResponse.from(loan, LocalDateTime.now(clock), lateFeeCalculator);
    }

    private List<LoanResponse> toResponses(List<Loan> loans) {
        LocalDateTime now = LocalDateTime.now(clock);
        return loans.stream().map(loan -> LoanResponse.from(loan, now, lateFeeCalculator)).toList();
    }
}
