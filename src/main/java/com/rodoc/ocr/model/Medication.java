package com.rodoc.ocr.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Medication(
        @JsonProperty("medication_name") String medicationName,
        @JsonProperty("normalized_name") String normalizedName,
        String dosage,
        String quantity,
        boolean recognized) {
}
