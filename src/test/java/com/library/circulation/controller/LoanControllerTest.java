package com.library.circulation.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.library.circulation.config.CirculationProperties;
import com.library.circulation.error.exception.AlreadyReturnedException;
import com.library.circulation.error.exception.InvalidAmountException;
import com.library.circulation.error.exception.LoanNotFoundException;
import com.library.circulation.error.exception.LoanNotRenewableException;
import com.library.circulation.error.exception.MemberIneligibleException;
import com.library.circulation.error.exception.OutOfStockException;
import com.library.circulation.error.exception.RenewalLimitExceededException;
import com.library.circulation.model.Loan;
import com.library.circulation.policy.IneligibilityReason;
import com.library.circulation.policy.LateFeeCalculator;
import com.library.circulation.policy.RenewalDenial;
import com.library.circulation.service.CirculationFacade;
import com.library.circulation.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(LoanController.class)
@Import(LoanControllerTest.WebTestConfig.class)
public class LoanControllerTest {

    private static final LocalDateTime DAY_0 = LocalDateTime.of(2024, 3, 1, 10, 0);

    @TestConfiguration
    static class WebTestConfig {
        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(DAY_0.plusDays(20));
        }

        @Bean
        LateFeeCalculator lateFeeCalculator() {
            return new LateFeeCalculator(new CirculationProperties());
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CirculationFacade circulationFacade;

    @Autowired
    private ObjectMapper objectMapper;

    private Loan loan1;
    private Loan loan2;

    @BeforeEach
    void setUp() {
        loan1 = Loan.open(201L, 101L, DAY_0, 14, 2, null);
        loan2 = Loan.open(202L, 102L, DAY_0.plusDays(15), 14, 2, null);
    }

    @Test
    void testGetLoansOnLoanForMember() throws Exception {
        when(circulationFacade.findLoansOnLoanByMember(201L)).thenReturn(Arrays.asList(loan1, loan2));

        mockMvc.perform(get("/api/loans").param("memberId", "201"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$[0].bookId").value(101L))
                .andExpect(jsonPath("$[0].overdue").value(true))
                .andExpect(jsonPath("$[0].daysOverdue").value(6))
                .andExpect(jsonPath("$[1].memberId").value(202L))
                .andExpect(jsonPath("$[1].overdue").value(false));
    }

    @Test
    void testGetLoanByIdFound() throws Exception {
        when(circulationFacade.getLoan(1L)).thenReturn(loan1);

        mockMvc.perform(get("/api/loans/1"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.bookId").value(101L))
                .andExpect(jsonPath("$.status").value("ACTIVE"));
    }

    @Test
    void testGetLoanByIdNotFound() throws Exception {
        when(circulationFacade.getLoan(99L)).thenThrow(new LoanNotFoundException(99L));

        mockMvc.perform(get("/api/loans/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("C004"));
    }

    @Test
    void testBorrowBookSuccess() throws Exception {
        when(circulationFacade.createLoan(201L, 101L, null)).thenReturn(loan1);

        Map<String, Object> payload = new HashMap<>();
        payload.put("type", "borrow");
        payload.put("bookId", 101L);
        payload.put("memberId", 201L);

        mockMvc.perform(post("/api/loans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(payload)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.bookId").value(101L))
                .andExpect(jsonPath("$.memberId").value(201L))
                .andExpect(jsonPath("$.status").value("ACTIVE"));

        verify(circulationFacade, times(1)).createLoan(201L, 101L, null);
    }

    @Test
    void testBorrowBookNotAvailable() throws Exception {
        when(circulationFacade.createLoan(anyLong(), anyLong(), any()))
                .thenThrow(new OutOfStockException("'Dune' (id: 101)"));

        Map<String, Object> payload = new HashMap<>();
        payload.put("type", "borrow");
        payload.put("bookId", 101L);
        payload.put("memberId", 201L);

        mockMvc.perform(post("/api/loans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(payload)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("C005"))
                .andExpect(jsonPath("$.message").value("Book 'Dune' (id: 101) is not available. All copies are currently on loan."));
    }

    @Test
    void testBorrowBookMemberIneligible() throws Exception {
        when(circulationFacade.createLoan(anyLong(), anyLong(), any()))
                .thenThrow(new MemberIneligibleException(201L, IneligibilityReason.OUTSTANDING_FEES));

        Map<String, Object> payload = new HashMap<>();
        payload.put("type", "borrow");
        payload.put("bookId", 101L);
        payload.put("memberId", 201L);

        mockMvc.perform(post("/api/loans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(payload)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("C006"))
                .andExpect(jsonPath("$.reason").value("OUTSTANDING_FEES"))
                .andExpect(jsonPath("$.message").value(
                        "Member 201 cannot borrow books: outstanding fees exceed the borrowing threshold"));
    }

    @Test
    void testReturnBookSuccess() throws Exception {
        LateFeeCalculator calculator = new LateFeeCalculator(new CirculationProperties());
        loan1.markReturned(DAY_0.plusDays(20), calculator);
        when(circulationFacade.returnLoan(1L)).thenReturn(loan1);

        Map<String, Object> payload = new HashMap<>();
        payload.put("type", "return");
        payload.put("loanId", 1L);

        mockMvc.perform(post("/api/loans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(payload)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RETURNED_LATE"))
                .andExpect(jsonPath("$.lateFee").value(3.0))
                .andExpect(jsonPath("$.overdue").value(false));
    }

    @Test
    void testReturnBookNotFound() throws Exception {
        when(circulationFacade.returnLoan(99L)).thenThrow(new LoanNotFoundException(99L));

        Map<String, Object> payload = new HashMap<>();
        payload.put("type", "return");
        payload.put("loanId", 99L);

        mockMvc.perform(post("/api/loans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(payload)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Loan record not found (id: 99)"));
    }

    @Test
    void testReturnBookAlreadyReturned() throws Exception {
        when(circulationFacade.returnLoan(2L)).thenThrow(new AlreadyReturnedException(2L, Loan.LoanStatus.RETURNED));

        Map<String, Object> payload = new HashMap<>();
        payload.put("type", "return");
        payload.put("loanId", 2L);

        mockMvc.perform(post("/api/loans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(payload)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("C009"));
    }

    @Test
    void testInvalidActionType() throws Exception {
        Map<String, Object> payload = new HashMap<>();
        payload.put("type", "steal");
        payload.put("loanId", 1L);

        mockMvc.perform(post("/api/loans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(payload)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));

        verifyNoInteractions(circulationFacade);
    }

    @Test
    void testRenewalLimitExceeded() throws Exception {
        when(circulationFacade.renewLoan(1L)).thenThrow(new RenewalLimitExceededException(1L, 2));

        mockMvc.perform(post("/api/loans/1/renewal"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("C007"))
                .andExpect(jsonPath("$.reason").doesNotExist());
    }

    @Test
    void testRenewOverdueLoanDenied() throws Exception {
        when(circulationFacade.renewLoan(1L)).thenThrow(new LoanNotRenewableException(1L, RenewalDenial.OVERDUE));

        mockMvc.perform(post("/api/loans/1/renewal"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("C008"))
                .andExpect(jsonPath("$.reason").value("OVERDUE"));
    }

    @Test
    void testReportDamagedPassesNotes() throws Exception {
        loan1.markDamaged(DAY_0.plusDays(3), new BigDecimal("10.00"), "torn cover");
        when(circulationFacade.reportDamaged(1L, "torn cover")).thenReturn(loan1);

        mockMvc.perform(post("/api/loans/1/damaged")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"notes\": \"torn cover\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DAMAGED"))
                .andExpect(jsonPath("$.notes").value("torn cover"));
    }

    @Test
    void testFeePaymentWrongAmount() throws Exception {
        when(circulationFacade.payLateFee(eq(1L), any(BigDecimal.class)))
                .thenThrow(new InvalidAmountException(1L, new BigDecimal("1.00"), new BigDecimal("3.00")));

        mockMvc.perform(post("/api/loans/1/fee-payment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 1.00}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C011"));
    }

    @Test
    void testFeePaymentRejectsNonPositiveAmount() throws Exception {
        mockMvc.perform(post("/api/loans/1/fee-payment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));

        verifyNoInteractions(circulationFacade);
    }

    @Test
    void testLockContentionSurfacesAsServiceUnavailable() throws Exception {
        when(circulationFacade.cancelLoan(1L)).thenThrow(new CannotAcquireLockException("lock wait timeout"));

        mockMvc.perform(post("/api/loans/1/cancellation"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("S003"));
    }

    @Test
    void testHealthCheck() throws Exception {
        mockMvc.perform(get("/api/loans/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("OK"));
    }
}
