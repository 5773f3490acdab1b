package com.rodoc.ocr.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

public record LabTestResult(
        @JsonProperty("test_name") String testName,
        @JsonProperty("normalized_name") String normalizedName,
        String value,
        String unit,
        @JsonProperty("reference_min") String referenceMin,
        @JsonProperty("reference_max") String referenceMax,
        Status status) {

    public enum Status {
        LOW("low"),
        NORMAL("normal"),
        HIGH("high"),
        UNKNOWN("unknown");

        private final String label;

        Status(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }
    }
}
