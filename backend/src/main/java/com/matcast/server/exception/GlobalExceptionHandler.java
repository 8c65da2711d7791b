package com.matcast.server.exception;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.matcast.server.util.HubLogger;

/**
 * REST error mapping. WebSocket frames never get here; the protocol handler
 * turns its own failures into ERROR frames.
 *
 * Unknown exceptions return 500 with a generic message.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    public static class ErrorResponse {
        public String timestamp;
        public int status;
        public String error;
        public String message;
        public String path;
        public Map<String, Object> details = new HashMap<>();

        public ErrorResponse(int status, String error, String message, String path) {
            this.timestamp = Instant.now().toString();
            this.status = status;
            this.error = error;
            this.message = message;
            this.path = path;
        }

        public ErrorResponse addDetail(String key, Object value) {
            if (value != null) {
                details.put(key, value);
            }
            return this;
        }
    }

    // ==================== MATCH EXCEPTIONS ====================

    @ExceptionHandler(MatchNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleMatchNotFound(MatchNotFoundException ex, WebRequest request) {
        log.debug("[REST] {} on {}", ex.getMessage(), request.getDescription(false));

        ErrorResponse response = new ErrorResponse(
                HttpStatus.NOT_FOUND.value(),
                "Match Not Found",
                ex.getMessage(),
                request.getDescription(false)
        ).addDetail("matchId", ex.getMatchId());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    // Unknown event type filter, non-numeric limit and the like
    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadArgument(RuntimeException ex, WebRequest request) {
        log.debug("[REST] Bad argument on {}: {}", request.getDescription(false), ex.getMessage());

        ErrorResponse response = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Bad Request",
                ex.getMessage(),
                request.getDescription(false)
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    // ==================== CATCH-ALL ====================

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, WebRequest request) {
        HubLogger.logError(log, "rest", null, request.getDescription(false), ex);

        ErrorResponse response = new ErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "An internal error occurred. Please try again.",
                request.getDescription(false)
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
}
