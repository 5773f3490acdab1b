package com.rodoc.ocr.service.confidence;

import java.util.Collection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Combines per-stage scores into the bounded overall confidence:
 * <pre>
 * ocr + min(template * 0.3, 20) + min(fields * 2, 15) + min(terms * 3, 10)
 * </pre>
 * clamped to [0, 100] and truncated. Negative inputs and NaN count as zero; positive infinity saturates
 * like any other large value, so the result stays monotonic non-decreasing in every input.
 */
@Component
public class ConfidenceAggregator {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceAggregator.class);

    static final double TEMPLATE_WEIGHT = 0.3;
    static final double TEMPLATE_CAP = 20.0;
    static final int FIELD_WEIGHT = 2;
    static final double FIELD_CAP = 15.0;
    static final int TERM_WEIGHT = 3;
    static final double TERM_CAP = 10.0;

    public int aggregate(double ocrConfidence, double templateConfidence, int extractedFieldCount,
                         int recognizedTermCount) {
        double base = nonNegative(ocrConfidence);
        double templateBonus = Math.min(nonNegative(templateConfidence) * TEMPLATE_WEIGHT, TEMPLATE_CAP);
        double fieldBonus = Math.min((double) Math.max(0, extractedFieldCount) * FIELD_WEIGHT, FIELD_CAP);
        double termBonus = Math.min((double) Math.max(0, recognizedTermCount) * TERM_WEIGHT, TERM_CAP);
        int result = clamp(base + templateBonus + fieldBonus + termBonus);
        log.debug("Confidence {} = ocr {} + template {} + fields {} + terms {}",
                result, base, templateBonus, fieldBonus, termBonus);
        return result;
    }

    /**
     * Mean of per-field confidences, bounded like {@link #aggregate}; 0 when there are no fields.
     */
    public int meanOf(Collection<Double> fieldConfidences) {
        if (fieldConfidences == null || fieldConfidences.isEmpty()) {
            return 0;
        }
        double sum = 0.0;
        for (Double confidence : fieldConfidences) {
            sum += confidence == null ? 0.0 : nonNegative(confidence);
        }
        return clamp(sum / fieldConfidences.size());
    }

    private static double nonNegative(double value) {
        return Double.isNaN(value) ? 0.0 : Math.max(0.0, value);
    }

    private static int clamp(double value) {
        return (int) Math.max(0.0, Math.min(100.0, value));
    }
}
