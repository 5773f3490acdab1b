package com.rodoc.ocr.service.ocr;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Text returned by the engine together with its per-token confidences (0-100, negative when the
 * engine had no estimate).
 */
public record OcrOutput(String text, List<Float> confidences) {

    public OcrOutput {
        text = text == null ? "" : text;
        confidences = confidences == null ? List.of() : List.copyOf(confidences);
    }

    public static OcrOutput textOnly(String text) {
        return new OcrOutput(text, List.of());
    }

    /**
     * @return the average of the non-negative confidences, or 0 when none were reported
     */
    public double meanConfidence() {
        OptionalDouble average = confidences.stream()
                .mapToDouble(Float::doubleValue)
                .filter(value -> value >= 0 && Double.isFinite(value))
                .average();
        if (average.isEmpty()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, average.getAsDouble()));
    }
}
