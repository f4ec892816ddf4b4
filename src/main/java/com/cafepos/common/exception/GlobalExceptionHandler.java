package com.cafepos.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * Renders every failure as an RFC 7807 {@link ProblemDetail}.
 *
 * <p>The {@code type} URI is derived from the error code, and {@code code} / {@code kind}
 * are added as extension members so clients can branch without parsing the message:</p>
 * <pre>
 *   {
 *     "type": "https://cafepos.dev/errors/invalid_order_status",
 *     "status": 409,
 *     "detail": "Order is CANCELLED",
 *     "code": "INVALID_ORDER_STATUS",
 *     "kind": "INVALID_STATE"
 *   }
 * </pre>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String TYPE_BASE = "https://cafepos.dev/errors/";

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        log.debug("Business exception: code={}, message={}", e.getErrorCode(), e.getMessage());
        return toResponse(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(this::describe)
                .collect(Collectors.joining(", "));
        return toResponse(ErrorCode.INVALID_INPUT, detail.isEmpty() ? ErrorCode.INVALID_INPUT.getMessage() : detail);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ProblemDetail> handleUnreadable(Exception e) {
        return toResponse(ErrorCode.INVALID_INPUT, "Malformed request");
    }

    // Retries exhausted or a collision outside the retried path
    @ExceptionHandler({DataIntegrityViolationException.class, OptimisticLockingFailureException.class})
    public ResponseEntity<ProblemDetail> handleConflict(RuntimeException e) {
        log.warn("Data conflict: {}", e.getMessage());
        return toResponse(ErrorCode.DATA_CONFLICT, ErrorCode.DATA_CONFLICT.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return toResponse(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.getMessage());
    }

    private ResponseEntity<ProblemDetail> toResponse(ErrorCode errorCode, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(errorCode.getStatus(), detail);
        problem.setType(URI.create(TYPE_BASE + errorCode.name().toLowerCase()));
        problem.setProperty("code", errorCode.name());
        problem.setProperty("kind", errorCode.getKind().name());
        return ResponseEntity.status(errorCode.getStatus()).body(problem);
    }

    private String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
