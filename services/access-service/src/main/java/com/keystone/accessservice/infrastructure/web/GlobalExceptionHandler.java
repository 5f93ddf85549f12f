package com.keystone.accessservice.infrastructure.web;

import com.keystone.security.ErrorCode;
import com.keystone.security.KeystoneException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses (see {@link ProblemDetails}).
 *
 * <p>{@link KeystoneException}s carry their own {@link ErrorCode}; its status affinity becomes the
 * response status. Unexpected exceptions are logged with their stack trace and answered with a
 * generic 500 that reveals nothing about the failure.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(KeystoneException.class)
    public ProblemDetail handleKeystone(KeystoneException ex) {
        if (ex.errorCode().httpStatus() >= 500) {
            log.error("Request failed: code={}, message={}", ex.errorCode().code(), ex.getMessage(), ex);
        } else {
            log.info("Request rejected: code={}, message={}", ex.errorCode().code(), ex.getMessage());
        }
        return ProblemDetails.of(ex);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        return ProblemDetails.of(ErrorCode.VALIDATION_ERROR, detail);
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    public ProblemDetail handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ProblemDetails.of(ErrorCode.VALIDATION_ERROR, ex.getMessage());
    }

    /** Spring MVC exceptions that already know their status (unknown route, wrong method, ...). */
    @ExceptionHandler({
        HandlerMethodValidationException.class,
        MissingServletRequestParameterException.class,
        HttpRequestMethodNotSupportedException.class,
        NoResourceFoundException.class
    })
    public ProblemDetail handleFramework(Exception ex) {
        ProblemDetail problem = ((ErrorResponse) ex).getBody();
        log.info("Request rejected by MVC: status={}, detail={}", problem.getStatus(), problem.getDetail());
        return ProblemDetails.enrich(problem);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return ProblemDetails.of(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred");
    }
}
