package com.rodoc.ocr.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "One field read from the document together with its confidence and validation outcome")
public record ExtractedField(
        @Schema(description = "Field name", example = "cnp") String name,
        @Schema(description = "Text as recognized, before normalization", example = "1800101221144")
        @JsonProperty("raw_text") String rawText,
        @Schema(description = "Per-field confidence on a 0-100 scale", example = "87.5") double confidence,
        @Schema(description = "Validation outcome") FieldValidation validation) {

    public ExtractedField {
        rawText = rawText == null ? "" : rawText;
        confidence = Math.max(0.0, Math.min(100.0, confidence));
    }

    /**
     * A field whose region or recognition failed: empty value, zero confidence, error recorded.
     */
    public static ExtractedField failed(String name, String error) {
        return new ExtractedField(name, "", 0.0, FieldValidation.rejected(error));
    }

    public boolean valid() {
        return validation != null && validation.valid();
    }

    /**
     * @return the normalized value when valid, otherwise {@code null}
     */
    public String value() {
        return valid() ? validation.normalized() : null;
    }
}
