package com.rodoc.ocr.service.recognition;

import java.util.List;

/**
 * Winning full-page reading plus every attempt made to get it.
 */
public record RecognizedText(String text, int quality, double engineConfidence, RecognitionStrategy strategy,
                             List<StrategyOutcome> attempts) {

    public RecognizedText {
        attempts = List.copyOf(attempts);
    }
}
