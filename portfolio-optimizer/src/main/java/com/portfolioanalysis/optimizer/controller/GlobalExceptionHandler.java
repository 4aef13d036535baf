package com.portfolioanalysis.optimizer.controller;

import com.portfolioanalysis.optimizer.controller.dto.ErrorResponse;
import com.portfolioanalysis.optimizer.domain.exception.DegenerateRiskException;
import com.portfolioanalysis.optimizer.domain.exception.EmptyPopulationException;
import com.portfolioanalysis.optimizer.domain.exception.IndexOutOfRangeException;
import com.portfolioanalysis.optimizer.domain.exception.InsufficientDataException;
import com.portfolioanalysis.optimizer.domain.exception.InvalidWeightsException;
import com.portfolioanalysis.optimizer.domain.exception.PortfolioEngineException;
import com.portfolioanalysis.optimizer.domain.exception.SimulationNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

/**
 * Global exception handler for the optimizer API.
 * Maps every engine failure to a typed error body instead of a default value.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({SimulationNotFoundException.class, IndexOutOfRangeException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(PortfolioEngineException ex, HttpServletRequest request) {
        log.warn("Not found: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage(), request, null);
    }

    @ExceptionHandler({InsufficientDataException.class, DegenerateRiskException.class})
    public ResponseEntity<ErrorResponse> handleUnprocessable(PortfolioEngineException ex, HttpServletRequest request) {
        log.warn("Cannot compute result: {}", ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getErrorCode(), ex.getMessage(), request, null);
    }

    @ExceptionHandler(InvalidWeightsException.class)
    public ResponseEntity<ErrorResponse> handleInvalidWeights(InvalidWeightsException ex, HttpServletRequest request) {
        log.warn("Invalid weights: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), request, null);
    }

    @ExceptionHandler(EmptyPopulationException.class)
    public ResponseEntity<ErrorResponse> handleEmptyPopulation(EmptyPopulationException ex, HttpServletRequest request) {
        log.warn("Empty population: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage(), request, null);
    }

    @ExceptionHandler(PortfolioEngineException.class)
    public ResponseEntity<ErrorResponse> handleEngineException(PortfolioEngineException ex, HttpServletRequest request) {
        log.error("Portfolio engine failure: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage(), request, null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex,
                                                          HttpServletRequest request) {
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> ErrorResponse.FieldError.builder()
                        .field(error.getField())
                        .rejectedValue(String.valueOf(error.getRejectedValue()))
                        .message(error.getDefaultMessage())
                        .build())
                .toList();

        log.warn("Validation failed for {}: {}", request.getRequestURI(), fieldErrors);
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request validation failed", request, fieldErrors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex,
                                                                   HttpServletRequest request) {
        List<ErrorResponse.FieldError> fieldErrors = ex.getConstraintViolations().stream()
                .map(violation -> ErrorResponse.FieldError.builder()
                        .field(violation.getPropertyPath().toString())
                        .rejectedValue(String.valueOf(violation.getInvalidValue()))
                        .message(violation.getMessage())
                        .build())
                .toList();

        log.warn("Constraint violation for {}: {}", request.getRequestURI(), fieldErrors);
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request validation failed", request, fieldErrors);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request to {}: {}", request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), request, null);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String errorCode, String message,
                                                       HttpServletRequest request,
                                                       List<ErrorResponse.FieldError> fieldErrors) {
        ErrorResponse error = ErrorResponse.builder()
                .errorCode(errorCode)
                .message(message)
                .status(status.value())
                .path(request.getRequestURI())
                .fieldErrors(fieldErrors)
                .build();

        return ResponseEntity.status(status).body(error);
    }
}
