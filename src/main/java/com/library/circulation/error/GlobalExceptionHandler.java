package com.library.circulation.error;

import com.library.circulation.error.dto.ErrorResponse;
import com.library.circulation.error.exception.InvalidInputException;
import com.library.circulation.error.exception.base.ClientBaseException;
import com.library.circulation.error.exception.base.ServerBaseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ClientBaseException.class)
    protected ResponseEntity<ErrorResponse> handleClientException(ClientBaseException e) {
        log.warn("Circulation rejected: {} | {}", e.getErrorCode().getCode(), e.getMessage());
        return ErrorResponse.toResponseEntity(e);
    }

    @ExceptionHandler(ServerBaseException.class)
    protected ResponseEntity<ErrorResponse> handleServerException(ServerBaseException e) {
        log.error("Circulation consistency failure: {}", e.getMessage(), e);
        return ErrorResponse.toResponseEntity(e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    protected ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .findFirst()
                .orElse("request body");
        return ErrorResponse.toResponseEntity(new InvalidInputException(detail));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    protected ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ErrorResponse.toResponseEntity(new InvalidInputException("malformed request body"));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    protected ResponseEntity<ErrorResponse> handleBadParameter(Exception e) {
        return ErrorResponse.toResponseEntity(new InvalidInputException(e.getMessage()));
    }

    /**
     * Lock timeouts that outlived the retry budget.
     */
    @ExceptionHandler(TransientDataAccessException.class)
    protected ResponseEntity<ErrorResponse> handleTransient(TransientDataAccessException e) {
        log.warn("Circulation storage contention, retries exhausted: {}", e.getMessage());
        return ErrorResponse.toResponseEntity(CirculationErrorCode.CIRCULATION_BUSY);
    }

    @ExceptionHandler(Exception.class)
    protected ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected System Failure: ", e);
        return ErrorResponse.toResponseEntity(CirculationErrorCode.INTERNAL_SERVER_ERROR);
    }
}
