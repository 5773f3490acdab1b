package com.rodoc.ocr.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Outcome of validating one extracted field")
public record FieldValidation(
        @Schema(description = "Whether the value passed its validator") boolean valid,
        @Schema(description = "Validator message when the value was rejected") String error,
        @Schema(description = "Canonical form of the value when it was accepted") String normalized) {

    public FieldValidation {
        if (valid && error != null) {
            throw new IllegalArgumentException("A valid field cannot carry a validation error");
        }
    }

    public static FieldValidation accepted(String normalized) {
        return new FieldValidation(true, null, normalized);
    }

    public static FieldValidation rejected(String error) {
        return new FieldValidation(false, error, null);
    }
}
