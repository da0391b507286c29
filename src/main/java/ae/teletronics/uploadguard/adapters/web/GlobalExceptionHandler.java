package ae.teletronics.uploadguard.adapters.web;

import ae.teletronics.uploadguard.adapters.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Maps request-level failures to {@link ErrorResponse} bodies. A scan verdict is never an error: unsafe
 * files come back as 200 with {@code safe=false}; only problems with the request or the staging area
 * end up here.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // ---- 400: blank filename and similar argument errors from the service ----
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadArgument(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), "Bad request");
    }

    // ---- 413: upload larger than the multipart limits ----
    @ExceptionHandler(DataBufferLimitException.class)
    public ResponseEntity<ErrorResponse> handleTooLarge(DataBufferLimitException ex) {
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "PAYLOAD_TOO_LARGE", null, "Request body too large");
    }

    // ---- 4xx from WebFlux itself: missing part (400), not multipart (415), wrong verb (405) ----
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = (ex.getStatusCode() instanceof HttpStatus hs) ? hs : HttpStatus.valueOf(ex.getStatusCode().value());
        return error(status, status.name(), ex.getReason(), status.getReasonPhrase());
    }

    // ---- 503: the staging directory could not be written or cleaned ----
    @ExceptionHandler({IOException.class, UncheckedIOException.class})
    public ResponseEntity<ErrorResponse> handleStaging(Exception ex) {
        log.error("Staging failed, upload was not scanned", ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "STAGING_UNAVAILABLE", null, "Upload could not be staged for scanning");
    }

    // ---- 500: catch-all ----
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleOther(Exception ex) {
        log.error("Unhandled error while serving a scan request", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", ex.getMessage(), "Unexpected error");
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message, String fallback) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message != null ? message : fallback));
    }
}
