package com.rodoc.ocr.exception;

public class RegionExtractionException extends DocumentProcessingException {

    private final String fieldName;

    public RegionExtractionException(String fieldName, String message) {
        super(message);
        this.fieldName = fieldName;
    }

    public RegionExtractionException(String fieldName, String message, Throwable cause) {
        super(message, cause);
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }

    @Override
    public String errorCode() {
        return "REGION_EXTRACTION_ERROR";
    }
}
