package com.cred.freestyle.deadpool.api.exception;

import com.cred.freestyle.deadpool.api.dto.ErrorResponse;
import com.cred.freestyle.deadpool.exception.AlreadyDraftedException;
import com.cred.freestyle.deadpool.exception.CapacityExceededException;
import com.cred.freestyle.deadpool.exception.DraftConflictException;
import com.cred.freestyle.deadpool.exception.ResourceNotFoundException;
import com.cred.freestyle.deadpool.exception.TransientStoreException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the Deadpool API.
 * Converts exceptions thrown by controllers into standardized error responses.
 *
 * @author Deadpool Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle AlreadyDraftedException.
     * Returns 409 CONFLICT when the candidate is already held this season.
     */
    @ExceptionHandler(AlreadyDraftedException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyDraftedException(
            AlreadyDraftedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Already drafted: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.CONFLICT.value(),
                "Already Drafted",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("reason", ex.getReason());
        error.addDetail("candidateId", ex.getCandidateId());
        error.addDetail("candidateName", ex.getCandidateName());
        error.addDetail("year", ex.getYear());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle CapacityExceededException.
     * Returns 409 CONFLICT when the player has no open slots.
     */
    @ExceptionHandler(CapacityExceededException.class)
    public ResponseEntity<ErrorResponse> handleCapacityExceededException(
            CapacityExceededException ex,
            HttpServletRequest request
    ) {
        logger.warn("Capacity exceeded: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.CONFLICT.value(),
                "Draft Capacity Exceeded",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("reason", ex.getReason());
        error.addDetail("playerId", ex.getPlayerId());
        error.addDetail("year", ex.getYear());
        error.addDetail("activePicks", ex.getActivePicks());
        error.addDetail("maxPicks", ex.getMaxPicks());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle remaining draft conflicts (existing draft order, lost conditional writes).
     */
    @ExceptionHandler(DraftConflictException.class)
    public ResponseEntity<ErrorResponse> handleDraftConflictException(
            DraftConflictException ex,
            HttpServletRequest request
    ) {
        logger.warn("Draft conflict: {} - {}", ex.getReason(), ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.CONFLICT.value(),
                "Conflict",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("reason", ex.getReason());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle ResourceNotFoundException.
     * Returns 404 NOT FOUND when any resource doesn't exist.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.NOT_FOUND.value(),
                "Resource Not Found",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("resourceType", ex.getResourceType());
        error.addDetail("resourceId", ex.getResourceId());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    /**
     * Handle TransientStoreException.
     * Returns 503 SERVICE UNAVAILABLE once store retries are exhausted; the client may retry.
     */
    @ExceptionHandler(TransientStoreException.class)
    public ResponseEntity<ErrorResponse> handleTransientStoreException(
            TransientStoreException ex,
            HttpServletRequest request
    ) {
        logger.error("Store unavailable: {}", ex.getMessage(), ex);

        ErrorResponse error = new ErrorResponse(
                HttpStatus.SERVICE_UNAVAILABLE.value(),
                "Service Unavailable",
                "The store is temporarily unavailable. Please retry.",
                request.getRequestURI()
        );
        error.addDetail("retryable", true);

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    /**
     * Handle IllegalArgumentException.
     * Returns 400 BAD REQUEST for invalid arguments.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request
    ) {
        logger.warn("Illegal argument: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Invalid Argument",
                ex.getMessage(),
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.warn("Malformed request: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Malformed Request",
                "Request could not be parsed.",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle validation errors from @Valid annotation.
     * Returns 400 BAD REQUEST with field-level validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {} field errors", ex.getBindingResult().getFieldErrorCount());

        Map<String, String> fieldErrors = new HashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.put(error.getField(), error.getDefaultMessage());
        }

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Validation Failed",
                "Request validation failed. Please check the field errors.",
                request.getRequestURI()
        );
        error.addDetail("fieldErrors", fieldErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle all other uncaught exceptions.
     * Returns 500 INTERNAL SERVER ERROR.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);

        ErrorResponse error = new ErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "An unexpected error occurred. Please try again later.",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
