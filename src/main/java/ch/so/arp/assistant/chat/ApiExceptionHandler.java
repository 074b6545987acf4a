package ch.so.arp.assistant.chat;

import java.time.Instant;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Maps domain and validation exceptions to {@link ApiError} responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ApiError> handleSessionNotFound(SessionNotFoundException ex, HttpServletRequest request) {
        LOGGER.warn("Session not found: {}", ex.getSessionId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ApiError(ApiError.SESSION_NOT_FOUND, "Session not found", request.getRequestURI(),
                        Instant.now()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex,
            HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        LOGGER.debug("Rejected request to {}: {}", request.getRequestURI(), message);
        return ResponseEntity.badRequest()
                .body(new ApiError(ApiError.VALIDATION_ERROR, message, request.getRequestURI(), Instant.now()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        LOGGER.debug("Rejected request to {}: {}", request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest()
                .body(new ApiError(ApiError.VALIDATION_ERROR, ex.getMessage(), request.getRequestURI(),
                        Instant.now()));
    }
}
