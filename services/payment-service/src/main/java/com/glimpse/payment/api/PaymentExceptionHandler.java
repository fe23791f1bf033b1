package com.glimpse.payment.api;

import com.glimpse.payment.api.dto.ErrorResponse;
import com.glimpse.payment.api.dto.PaymentResponse;
import com.glimpse.payment.retry.exception.CircuitOpenException;
import com.glimpse.payment.retry.exception.PaymentClientException;
import com.glimpse.payment.retry.exception.RetryExhaustedException;
import com.glimpse.payment.retry.exception.RetryInProgressException;
import com.glimpse.payment.retry.exception.RetryScheduledException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;

@RestControllerAdvice
public class PaymentExceptionHandler {

    private final Clock clock;

    public PaymentExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(RetryScheduledException.class)
    public ResponseEntity<PaymentResponse> retryScheduled(RetryScheduledException e) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new PaymentResponse(
                e.getOperationId(), "RETRY_SCHEDULED", null, null, e.getNextRetryAt(), e.getMessage()));
    }

    @ExceptionHandler(PaymentClientException.class)
    public ResponseEntity<ErrorResponse> clientError(PaymentClientException e) {
        return error(HttpStatus.BAD_REQUEST, "PAYMENT_REJECTED", e.getMessage());
    }

    @ExceptionHandler(RetryExhaustedException.class)
    public ResponseEntity<ErrorResponse> exhausted(RetryExhaustedException e) {
        return error(HttpStatus.BAD_REQUEST, "PAYMENT_RETRIES_EXHAUSTED", e.getMessage());
    }

    @ExceptionHandler(RetryInProgressException.class)
    public ResponseEntity<ErrorResponse> inProgress(RetryInProgressException e) {
        return error(HttpStatus.CONFLICT, "PAYMENT_IN_PROGRESS", e.getMessage());
    }

    @ExceptionHandler(CircuitOpenException.class)
    public ResponseEntity<ErrorResponse> circuitOpen(CircuitOpenException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "PROVIDER_UNAVAILABLE", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", message);
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, clock.instant()));
    }
}
