package com.rodoc.ocr.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Typed failure returned when a document could not be processed")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessingFailure(
        @Schema(description = "Stable error code", example = "LOW_QUALITY_RESULT")
        @JsonProperty("error_code") String errorCode,
        @Schema(description = "Human readable explanation")
        String message,
        @Schema(description = "Best text quality score reached, for low quality results", nullable = true)
        @JsonProperty("quality_score") Integer qualityScore) {

    public ProcessingFailure(String errorCode, String message) {
        this(errorCode, message, null);
    }
}
