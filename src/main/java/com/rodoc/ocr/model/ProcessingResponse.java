package com.rodoc.ocr.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;
import java.util.Map;

@Schema(description = "Classification and extraction result for one document")
public record ProcessingResponse(
        @Schema(description = "Recognized full text; empty for identity cards read region by region")
        @JsonProperty("raw_text") String rawText,
        @Schema(description = "Id of the matched template", example = "ro_lab_results", nullable = true)
        @JsonProperty("matched_template_id") String matchedTemplateId,
        @Schema(description = "Document type tag", example = "lab_result")
        @JsonProperty("document_type") String documentType,
        @Schema(description = "Overall confidence on a 0-100 scale", example = "72")
        @JsonProperty("overall_confidence") int overallConfidence,
        @Schema(description = "Extracted values keyed by field name")
        @JsonProperty("structured_data") Map<String, Object> structuredData,
        @Schema(description = "Per-field extraction records")
        List<ExtractedField> fields,
        @Schema(description = "Diagnostics describing how the result was produced")
        @JsonProperty("processing_metadata") Map<String, Object> processingMetadata) {

    public static ProcessingResponse from(ProcessingResult result) {
        return new ProcessingResponse(
                result.rawText(),
                result.matchedTemplateId(),
                result.documentType(),
                result.overallConfidence(),
                result.structuredData(),
                result.fields(),
                result.processingMetadata());
    }
}
