package com.rodoc.ocr.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "Document image supplied inline")
public record ProcessRequest(
        @Schema(description = "Base64 encoded image bytes (JPEG, PNG, BMP or GIF)", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank String imageBase64,
        @Schema(description = "Optional document type hint, e.g. carte_identitate, lab_result, reteta", example = "lab_result")
        String typeHint) {
}
