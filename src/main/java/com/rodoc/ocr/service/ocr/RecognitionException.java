package com.rodoc.ocr.service.ocr;

/**
 * The recognition engine ran but could not produce text for one image.
 */
public class RecognitionException extends Exception {

    public RecognitionException(String message) {
        super(message);
    }

    public RecognitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
