package com.nosota.unipay.exception;

import com.nosota.unipay.api.model.LedgerErrorCode;
import com.nosota.unipay.api.response.LedgerErrorResponse;
import com.nosota.unipay.error.LedgerOperationException;
import com.nosota.unipay.error.StoreUnavailableException;
import com.nosota.unipay.filter.CorrelationIdFilter;
import com.nosota.unipay.ledger.LedgerFailure;
import jakarta.persistence.EntityNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String RETRY_AFTER_SECONDS = "1";

    @ExceptionHandler(LedgerOperationException.class)
    public ResponseEntity<LedgerErrorResponse> handleLedgerOperation(
            LedgerOperationException ex, HttpServletRequest request) {
        String correlationId = correlationId();
        LedgerFailure failure = ex.getFailure();
        HttpStatus status = statusOf(failure.code());
        log.warn("Ledger operation rejected [correlationId={}]: code={}, message={}",
                correlationId, failure.code(), failure.message());

        LedgerErrorResponse error = new LedgerErrorResponse(
                LocalDateTime.now(),
                status.value(),
                failure.code(),
                failure.message(),
                failure.accountId(),
                failure.requested(),
                failure.available(),
                failure.shortfall(),
                request.getRequestURI(),
                correlationId
        );
        ResponseEntity.BodyBuilder response = ResponseEntity.status(status);
        if (failure.code() == LedgerErrorCode.LOCK_TIMEOUT) {
            response.header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
        }
        return response.body(error);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<LedgerErrorResponse> handleStoreUnavailable(
            StoreUnavailableException ex, HttpServletRequest request) {
        String correlationId = correlationId();
        log.error("Store unavailable [correlationId={}]: {}", correlationId, ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                of(HttpStatus.SERVICE_UNAVAILABLE, LedgerErrorCode.STORE_UNAVAILABLE,
                        "Ledger store is unavailable, try again later", request, correlationId));
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<LedgerErrorResponse> handleEntityNotFound(
            EntityNotFoundException ex, HttpServletRequest request) {
        String correlationId = correlationId();
        log.warn("Entity not found [correlationId={}]: {}", correlationId, ex.getMessage());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                of(HttpStatus.NOT_FOUND, LedgerErrorCode.ACCOUNT_NOT_FOUND, ex.getMessage(), request, correlationId));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<LedgerErrorResponse> handleInvalidBody(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        String correlationId = correlationId();
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.warn("Invalid request body [correlationId={}]: {}", correlationId, message);

        return badRequest(message, request, correlationId);
    }

    @ExceptionHandler({
            ConstraintViolationException.class,
            HandlerMethodValidationException.class,
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class,
            HttpMediaTypeNotSupportedException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<LedgerErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        String correlationId = correlationId();
        log.warn("Bad request [correlationId={}]: {}", correlationId, ex.getMessage());

        return badRequest(ex.getMessage(), request, correlationId);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<LedgerErrorResponse> handleIllegalState(
            IllegalStateException ex, HttpServletRequest request) {
        String correlationId = correlationId();
        log.error("Illegal state [correlationId={}]: {}", correlationId, ex.getMessage());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(
                of(HttpStatus.CONFLICT, LedgerErrorCode.INVALID_STATE_TRANSITION, ex.getMessage(), request, correlationId));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<LedgerErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        String correlationId = correlationId();
        log.error("Unexpected error [correlationId={}]", correlationId, ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                of(HttpStatus.INTERNAL_SERVER_ERROR, null,
                        "An unexpected error occurred. Please contact support with correlation ID: " + correlationId,
                        request, correlationId));
    }

    static HttpStatus statusOf(LedgerErrorCode code) {
        return switch (code) {
            case INSUFFICIENT_FUNDS, LIMIT_EXCEEDED, ACCOUNT_FROZEN, LISTING_UNAVAILABLE, INVALID_REQUEST ->
                    HttpStatus.UNPROCESSABLE_ENTITY;
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case ACCOUNT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_STATE_TRANSITION, LOCK_TIMEOUT -> HttpStatus.CONFLICT;
            case STORE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case DUPLICATE_OPERATION -> HttpStatus.OK;
        };
    }

    private static ResponseEntity<LedgerErrorResponse> badRequest(String message, HttpServletRequest request,
                                                                  String correlationId) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
                of(HttpStatus.BAD_REQUEST, LedgerErrorCode.INVALID_REQUEST, message, request, correlationId));
    }

    private static LedgerErrorResponse of(HttpStatus status, LedgerErrorCode code, String message,
                                          HttpServletRequest request, String correlationId) {
        return new LedgerErrorResponse(LocalDateTime.now(), status.value(), code, message,
                null, null, null, null, request.getRequestURI(), correlationId);
    }

    private static String correlationId() {
        return MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY);
    }
}
