package com.rodoc.ocr.exception;

/**
 * Every recognition strategy failed, or the best text scored below the quality floor.
 */
public class UnreadableDocumentException extends DocumentProcessingException {

    private final int qualityScore;

    public UnreadableDocumentException(String message, int qualityScore) {
        super(message);
        this.qualityScore = qualityScore;
    }

    public int qualityScore() {
        return qualityScore;
    }

    @Override
    public String errorCode() {
        return "LOW_QUALITY_RESULT";
    }
}
