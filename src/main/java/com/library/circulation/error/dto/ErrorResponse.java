package com.library.circulation.error.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.library.circulation.error.ErrorCode;
import com.library.circulation.error.exception.LoanNotRenewableException;
import com.library.circulation.error.exception.MemberIneligibleException;
import com.library.circulation.error.exception.base.BaseException;
import lombok.Builder;
import org.springframework.http.ResponseEntity;

import java.time.LocalDateTime;

/**
 * Error body for every rejected circulation call. {@code reason} names the policy rule that
 * failed (for example {@code OUTSTANDING_FEES}) so desk clients can branch on it without
 * parsing the message; it is omitted for errors that carry no rule.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(int status, String code, String message, String reason, LocalDateTime timestamp) {

    @Builder
    public ErrorResponse {}

    public static ResponseEntity<ErrorResponse> toResponseEntity(BaseException e) {
        return ResponseEntity
                .status(e.getErrorCode().getStatus())
                .body(ErrorResponse.builder()
                        .status(e.getErrorCode().getStatus().value())
                        .code(e.getErrorCode().getCode())
                        .message(e.getMessage())
                        .reason(reasonOf(e))
                        .timestamp(LocalDateTime.now())
                        .build());
    }

    // Unexpected failures expose only the fixed message of the code.
    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ErrorResponse.builder()
                        .status(errorCode.getStatus().value())
                        .code(errorCode.getCode())
                        .message(errorCode.getMessage())
                        .timestamp(LocalDateTime.now())
                        .build());
    }

    private static String reasonOf(BaseException e) {
        if (e instanceof MemberIneligibleException ineligible) {
            return ineligible.getReason().name();
        }
        if (e instanceof LoanNotRenewableException notRenewable) {
            return notRenewable.getDenial().name();
        }
        return null;
    }
}
