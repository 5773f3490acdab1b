package com.rodoc.ocr.exception;

/**
 * The recognition engine could not be invoked or did not answer within the caller's time budget.
 */
public class OcrEngineUnavailableException extends DocumentProcessingException {

    public OcrEngineUnavailableException(String message) {
        super(message);
    }

    public OcrEngineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "OCR_ENGINE_UNAVAILABLE";
    }
}
