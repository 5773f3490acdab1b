package com.rodoc.ocr.controller;

import com.rodoc.ocr.exception.DocumentProcessingException;
import com.rodoc.ocr.exception.InvalidDocumentException;
import com.rodoc.ocr.exception.OcrEngineUnavailableException;
import com.rodoc.ocr.exception.UnreadableDocumentException;
import com.rodoc.ocr.model.ProcessingFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * Turns engine failures into {@link ProcessingFailure} bodies.
 */
@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(InvalidDocumentException.class)
    public ResponseEntity<ProcessingFailure> handleInvalidDocument(InvalidDocumentException ex) {
        log.warn("Rejected document: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, new ProcessingFailure(ex.errorCode(), ex.getMessage()));
    }

    @ExceptionHandler(UnreadableDocumentException.class)
    public ResponseEntity<ProcessingFailure> handleUnreadable(UnreadableDocumentException ex) {
        log.warn("Document unreadable: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY,
                new ProcessingFailure(ex.errorCode(), ex.getMessage(), ex.qualityScore()));
    }

    @ExceptionHandler(OcrEngineUnavailableException.class)
    public ResponseEntity<ProcessingFailure> handleEngineUnavailable(OcrEngineUnavailableException ex) {
        log.error("Recognition engine unavailable", ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, new ProcessingFailure(ex.errorCode(), ex.getMessage()));
    }

    @ExceptionHandler(DocumentProcessingException.class)
    public ResponseEntity<ProcessingFailure> handleProcessing(DocumentProcessingException ex) {
        log.error("Document processing failed", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, new ProcessingFailure(ex.errorCode(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProcessingFailure> handleInvalidRequest(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        return respond(HttpStatus.BAD_REQUEST, new ProcessingFailure("INPUT_ERROR", message));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProcessingFailure> handleStatus(ResponseStatusException ex) {
        HttpStatusCode status = ex.getStatusCode();
        String code = status.is4xxClientError() ? "INPUT_ERROR" : "INTERNAL_ERROR";
        return respond(status, new ProcessingFailure(code, ex.getReason()));
    }

    /**
     * Request input is rejected earlier, by bean validation or a {@link ResponseStatusException}; an
     * argument or state check failing this deep is a server fault.
     */
    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ProcessingFailure> handleInternal(RuntimeException ex) {
        log.error("Unexpected failure while processing document", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                new ProcessingFailure("INTERNAL_ERROR", "Document processing failed"));
    }

    private static ResponseEntity<ProcessingFailure> respond(HttpStatusCode status, ProcessingFailure body) {
        return ResponseEntity.status(status).body(body);
    }
}
