package com.rodoc.ocr.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

@Schema(description = "Read-only view of one registry template")
public record TemplateSummary(
        @Schema(example = "ro_identity_card") String id,
        @Schema(example = "romanian_id") @JsonProperty("document_type") String documentType,
        @Schema(example = "romanian") String language,
        @Schema(example = "70") @JsonProperty("confidence_threshold") int confidenceThreshold,
        @JsonProperty("identification_patterns") List<String> identificationPatterns,
        List<String> fields) {
}
