package com.example.parkmaster.Exceptions;

import com.example.parkmaster.DTOs.ApiResponse;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String VALIDATION_FAILED = "Validation failed";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        List<String> errors = new ArrayList<>();

        ex.getBindingResult().getFieldErrors().forEach(error ->
                errors.add(error.getDefaultMessage())
        );

        ex.getBindingResult().getGlobalErrors().forEach(error ->
                errors.add(error.getDefaultMessage())
        );

        return failure(HttpStatus.BAD_REQUEST, VALIDATION_FAILED, errors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConstraintViolation(ConstraintViolationException ex) {
        List<String> errors = new ArrayList<>();
        ex.getConstraintViolations().forEach(violation ->
                errors.add(violation.getMessage()));

        return failure(HttpStatus.BAD_REQUEST, VALIDATION_FAILED, errors);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingParams(MissingServletRequestParameterException ex) {
        return failure(HttpStatus.BAD_REQUEST, VALIDATION_FAILED,
                Collections.singletonList(ex.getParameterName() + " parameter is required"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String requiredType = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "the expected type";
        return failure(HttpStatus.BAD_REQUEST, VALIDATION_FAILED,
                Collections.singletonList(ex.getName() + " should be of type " + requiredType));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleResourceNotFoundException(ResourceNotFoundException ex) {
        return failure(HttpStatus.NOT_FOUND, "Resource not found", Collections.singletonList(ex.getMessage()));
    }

    @ExceptionHandler(InvalidDataException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidDataException(InvalidDataException ex) {
        return failure(HttpStatus.UNPROCESSABLE_ENTITY, VALIDATION_FAILED, Collections.singletonList(ex.getMessage()));
    }

    @ExceptionHandler(InconsistentStateException.class)
    public ResponseEntity<ApiResponse<Void>> handleInconsistentStateException(InconsistentStateException ex) {
        logger.error("Aborted request on inconsistent parking lot state: {}", ex.getMessage());
        return failure(HttpStatus.INTERNAL_SERVER_ERROR, "Inconsistent parking lot state",
                Collections.singletonList(ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgumentException(IllegalArgumentException ex) {
        return failure(HttpStatus.BAD_REQUEST, VALIDATION_FAILED, Collections.singletonList(ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        // Enum @JsonCreator methods throw InvalidDataException, which Jackson wraps
        Throwable cause = ex.getMostSpecificCause();
        String error = cause instanceof InvalidDataException
                ? cause.getMessage()
                : "Invalid request format";
        return failure(HttpStatus.BAD_REQUEST, VALIDATION_FAILED, Collections.singletonList(error));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleAllExceptions(Exception ex) {
        logger.error("Unexpected error while handling request: {}", ex.getMessage(), ex);
        return failure(HttpStatus.INTERNAL_SERVER_ERROR, "Server error",
                Collections.singletonList("An unexpected error occurred: " + ex.getMessage()));
    }

    private ResponseEntity<ApiResponse<Void>> failure(HttpStatus status, String message, List<String> errors) {
        ApiResponse<Void> response = new ApiResponse<>(false, status.value(), message, errors);
        return ResponseEntity.status(status).body(response);
    }
}
