package quest.gekko.churnguard.web.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import quest.gekko.churnguard.exception.PipelineBusyException;

import jakarta.servlet.http.HttpServletRequest;
import java.time.DateTimeException;
import java.util.Map;

@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(PipelineBusyException.class)
    public ResponseEntity<Map<String, Object>> handleBusy(PipelineBusyException ex, HttpServletRequest request) {
        log.warn("Rejected {}: {}", request.getRequestURL(), ex.getMessage());
        return body(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler({ IllegalArgumentException.class, DateTimeException.class,
            MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return body(HttpStatus.BAD_REQUEST, "Invalid request: " + ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneralException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error for URL: {}", request.getRequestURL(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred: " + ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error) {
        return ResponseEntity.status(status).body(Map.of("error", error, "status", status.value()));
    }
}
