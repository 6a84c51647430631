package com.scout.api;

import com.scout.orchestration.registry.CapabilityNotFoundException;
import com.scout.run.DuplicateRunException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps orchestration failures to RFC 7807 problem responses.
 */
@Slf4j
@RestControllerAdvice
public class ScoutApiExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleInvalidRequest(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        log.warn("HTTP_ERROR path={}, errorType={}, errorMessage={}", request.getRequestURI(),
                ex.getClass().getSimpleName(), detail);
        return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleBadRequest(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={}, errorType={}, errorMessage={}", request.getRequestURI(),
                ex.getClass().getSimpleName(), ex.getMessage());
        return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(DuplicateRunException.class)
    public ProblemDetail handleDuplicateRun(DuplicateRunException ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={}, errorType={}, errorMessage={}", request.getRequestURI(),
                ex.getClass().getSimpleName(), ex.getMessage());
        return ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(CapabilityNotFoundException.class)
    public ProblemDetail handleCapabilityNotFound(CapabilityNotFoundException ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, errorType={}, intent={}: plan validation let an unregistered intent through.",
                request.getRequestURI(), ex.getClass().getSimpleName(), ex.getIntent(), ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
        problem.setProperty("intent", ex.getIntent());
        return problem;
    }
}
