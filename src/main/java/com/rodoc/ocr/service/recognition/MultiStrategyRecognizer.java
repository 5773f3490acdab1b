package com.rodoc.ocr.service.recognition;

import com.rodoc.ocr.config.RodocProperties;
import com.rodoc.ocr.config.RodocProperties.OcrProperties;
import com.rodoc.ocr.config.RodocProperties.RecognitionProperties;
import com.rodoc.ocr.exception.UnreadableDocumentException;
import com.rodoc.ocr.service.image.RawImage;
import com.rodoc.ocr.service.ocr.Deadline;
import com.rodoc.ocr.service.ocr.OcrEngine;
import com.rodoc.ocr.service.ocr.OcrOutput;
import com.rodoc.ocr.service.ocr.RecognitionException;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads a whole page with every {@link RecognitionStrategy} in order and keeps the best reading. A
 * strategy that fails is recorded and the next one is tried; an engine outage aborts the call.
 */
@Component
public class MultiStrategyRecognizer {

    private static final Logger log = LoggerFactory.getLogger(MultiStrategyRecognizer.class);

    private final OcrEngine ocrEngine;
    private final OcrTextCleaner cleaner;
    private final TextQualityEstimator qualityEstimator;
    private final OcrProperties ocrProperties;
    private final RecognitionProperties limits;

    public MultiStrategyRecognizer(OcrEngine ocrEngine, OcrTextCleaner cleaner, TextQualityEstimator qualityEstimator,
                                   RodocProperties properties) {
        this.ocrEngine = ocrEngine;
        this.cleaner = cleaner;
        this.qualityEstimator = qualityEstimator;
        this.ocrProperties = properties.ocr();
        this.limits = properties.recognition();
    }

    /**
     * @throws UnreadableDocumentException when no strategy produced text above the quality floor
     */
    public RecognizedText recognize(RawImage image, Deadline deadline) {
        List<StrategyOutcome> attempts = new ArrayList<>();
        StrategyOutcome best = null;
        for (RecognitionStrategy strategy : RecognitionStrategy.values()) {
            StrategyOutcome outcome = attempt(strategy, image, deadline);
            attempts.add(outcome);
            if (outcome.betterThan(best)) {
                best = outcome;
            }
        }

        if (best == null || !best.successful()) {
            log.warn("Every recognition strategy failed");
            throw new UnreadableDocumentException("No recognition strategy could read the document", 0);
        }
        if (best.quality() < limits.minQualityScore() || best.text().length() < limits.minTextLength()) {
            log.warn("Best reading ({}) scored {} with {} characters; below the quality floor",
                    best.strategy().label(), best.quality(), best.text().length());
            throw new UnreadableDocumentException(String.format(
                    "Recognized text is too poor to process (quality %d, %d characters)",
                    best.quality(), best.text().length()), best.quality());
        }
        log.debug("Selected strategy {} with quality {}", best.strategy().label(), best.quality());
        return new RecognizedText(best.text(), best.quality(), best.engineConfidence(), best.strategy(), attempts);
    }

    private StrategyOutcome attempt(RecognitionStrategy strategy, RawImage image, Deadline deadline) {
        BufferedImage prepared;
        try {
            prepared = strategy.preprocess(image.copy());
        } catch (RuntimeException ex) {
            log.warn("Preprocessing for strategy {} failed: {}", strategy.label(), ex.toString());
            return StrategyOutcome.failed(strategy, "preprocessing failed: " + ex.getMessage());
        }
        try {
            OcrOutput output = ocrEngine.recognize(prepared, strategy.request(ocrProperties), deadline);
            String text = cleaner.clean(output.text().strip());
            int quality = qualityEstimator.estimate(text);
            log.debug("Strategy {} extracted {} characters, quality {}", strategy.label(), text.length(), quality);
            return StrategyOutcome.succeeded(strategy, text, quality, output.meanConfidence());
        } catch (RecognitionException ex) {
            log.warn("Strategy {} failed: {}", strategy.label(), ex.getMessage());
            return StrategyOutcome.failed(strategy, ex.getMessage());
        }
    }
}
