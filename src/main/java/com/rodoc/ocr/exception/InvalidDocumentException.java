package com.rodoc.ocr.exception;

/**
 * The supplied bytes are empty, unreadable or not a supported image.
 */
public class InvalidDocumentException extends DocumentProcessingException {

    public InvalidDocumentException(String message) {
        super(message);
    }

    public InvalidDocumentException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "INPUT_ERROR";
    }
}
