package com.bastion.api;

import com.bastion.ingestion.RawContentNotAvailableException;
import com.bastion.ingestion.UploadNotFoundException;
import com.bastion.storage.blob.RawContentStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.format.DateTimeParseException;

/**
 * Maps exceptions raised by the API controllers to HTTP status codes.
 *
 * <pre>
 * IllegalArgumentException, malformed body/params -> 400
 * UploadNotFoundException                           -> 404
 * RawContentNotAvailableException                   -> 404 (blob missing) / 409 (not retained)
 * MaxUploadSizeExceededException                    -> 413
 * RawContentStoreException                          -> 502
 * anything else                                     -> 500
 * </pre>
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({
        IllegalArgumentException.class,
        DateTimeParseException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.debug("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("Invalid request", e.getMessage()));
    }

    @ExceptionHandler(UploadNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleUploadNotFound(UploadNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse("File not found", e.getMessage()));
    }

    @ExceptionHandler(RawContentNotAvailableException.class)
    public ResponseEntity<ErrorResponse> handleRawContentNotAvailable(RawContentNotAvailableException e) {
        HttpStatus status = e.getReason() == RawContentNotAvailableException.Reason.MISSING
            ? HttpStatus.NOT_FOUND
            : HttpStatus.CONFLICT;
        log.warn("Raw content unavailable for upload {}: {}", e.getFileId(), e.getReason());
        return ResponseEntity.status(status)
            .body(new ErrorResponse("Raw file not available", e.getMessage()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleRequestTooLarge(MaxUploadSizeExceededException e) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
            .body(new ErrorResponse("Request too large", e.getMessage()));
    }

    @ExceptionHandler(RawContentStoreException.class)
    public ResponseEntity<ErrorResponse> handleBlobStoreFailure(RawContentStoreException e) {
        log.error("Blob store failure for key {}", e.getKey(), e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(new ErrorResponse("Blob store failure", e.getMessage()));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(RuntimeException e) {
        log.error("Request failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("Request failed", e.getMessage()));
    }
}
