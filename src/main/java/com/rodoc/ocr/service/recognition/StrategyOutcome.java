package com.rodoc.ocr.service.recognition;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one recognition strategy: either cleaned text with its scores, or the reason it failed.
 */
public record StrategyOutcome(
        RecognitionStrategy strategy,
        String text,
        int quality,
        double engineConfidence,
        String failure) {

    public StrategyOutcome {
        Objects.requireNonNull(strategy, "strategy");
    }

    static StrategyOutcome succeeded(RecognitionStrategy strategy, String text, int quality, double engineConfidence) {
        return new StrategyOutcome(strategy, text, quality, engineConfidence, null);
    }

    static StrategyOutcome failed(RecognitionStrategy strategy, String failure) {
        return new StrategyOutcome(strategy, "", 0, 0.0, failure);
    }

    public boolean successful() {
        return failure == null;
    }

    /**
     * Whether this outcome beats {@code other}: higher quality first, then longer text.
     */
    boolean betterThan(StrategyOutcome other) {
        if (other == null || !other.successful()) {
            return successful();
        }
        if (!successful()) {
            return false;
        }
        if (quality != other.quality) {
            return quality > other.quality;
        }
        return text.length() > other.text.length();
    }

    Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("strategy", strategy.label());
        if (successful()) {
            summary.put("quality", quality);
            summary.put("length", text.length());
        } else {
            summary.put("error", failure);
        }
        return summary;
    }
}
