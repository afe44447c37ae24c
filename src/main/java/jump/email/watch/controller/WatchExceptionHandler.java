package jump.email.watch.controller;

import jakarta.servlet.http.HttpServletRequest;
import jump.email.watch.exception.CredentialException;
import jump.email.watch.exception.InvalidWatchTransitionException;
import jump.email.watch.exception.NotificationDecodeException;
import jump.email.watch.exception.WatchAlreadyActiveException;
import jump.email.watch.exception.WatchLockTimeoutException;
import jump.email.watch.exception.WatchNotFoundException;
import jump.email.watch.exception.WatchOperationException;
import jump.email.watch.model.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class WatchExceptionHandler {

    @ExceptionHandler({NotificationDecodeException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleDecode(RuntimeException ex, HttpServletRequest request) {
        log.warn("Rejected malformed request to {}: {}", request.getRequestURI(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(CredentialException.class)
    public ResponseEntity<ErrorResponse> handleCredential(CredentialException ex, HttpServletRequest request) {
        log.warn("Credential problem for {}: {}", ex.getPrincipalId(), ex.getMessage());
        return error(HttpStatus.UNAUTHORIZED, ex.getMessage(), request);
    }

    @ExceptionHandler(WatchNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(WatchNotFoundException ex, HttpServletRequest request) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler({WatchAlreadyActiveException.class, InvalidWatchTransitionException.class, WatchLockTimeoutException.class})
    public ResponseEntity<ErrorResponse> handleConflict(RuntimeException ex, HttpServletRequest request) {
        log.info("Conflict on {}: {}", request.getRequestURI(), ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getMessage(), request);
    }

    @ExceptionHandler(WatchOperationException.class)
    public ResponseEntity<ErrorResponse> handleOperation(WatchOperationException ex, HttpServletRequest request) {
        log.error("Watch operation failed at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), request);
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, String message, HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(Instant.now(), status.value(), status.getReasonPhrase(), message, request.getRequestURI());
        return new ResponseEntity<>(body, status);
    }
}
