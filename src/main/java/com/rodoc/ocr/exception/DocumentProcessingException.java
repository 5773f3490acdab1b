package com.rodoc.ocr.exception;

/**
 * Base type of every failure raised while processing a document. Call-level failures escape the
 * processing façade; region-level ones are caught and recorded against the failing field.
 */
public abstract class DocumentProcessingException extends RuntimeException {

    protected DocumentProcessingException(String message) {
        super(message);
    }

    protected DocumentProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return stable machine-readable code reported to callers
     */
    public abstract String errorCode();
}
