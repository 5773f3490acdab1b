package com.rodoc.ocr.service.recognition;

import com.rodoc.ocr.model.ProcessingResult;
import com.rodoc.ocr.service.confidence.ConfidenceAggregator;
import com.rodoc.ocr.service.image.RawImage;
import com.rodoc.ocr.service.ocr.Deadline;
import com.rodoc.ocr.service.registry.DocumentTemplate;
import com.rodoc.ocr.service.registry.MedicalTerms;
import com.rodoc.ocr.service.registry.PostProcessingRule;
import com.rodoc.ocr.service.registry.TemplateRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Text path for pages that are not identity cards: multi-strategy recognition, template matching,
 * regex field extraction, post-processing and the lab/prescription extractors.
 */
@Component
public class FullDocumentRecognizer {

    private static final Logger log = LoggerFactory.getLogger(FullDocumentRecognizer.class);

    public static final String EXTRACTION_METHOD = "full_document";

    private final MultiStrategyRecognizer recognizer;
    private final TemplateMatcher matcher;
    private final FieldExtractor fieldExtractor;
    private final PostProcessor postProcessor;
    private final LabResultExtractor labResultExtractor;
    private final MedicationExtractor medicationExtractor;
    private final ConfidenceAggregator aggregator;
    private final MedicalTerms medicalTerms;

    public FullDocumentRecognizer(MultiStrategyRecognizer recognizer, TemplateMatcher matcher,
                                  FieldExtractor fieldExtractor, PostProcessor postProcessor,
                                  LabResultExtractor labResultExtractor, MedicationExtractor medicationExtractor,
                                  ConfidenceAggregator aggregator, TemplateRegistry registry) {
        this.recognizer = recognizer;
        this.matcher = matcher;
        this.fieldExtractor = fieldExtractor;
        this.postProcessor = postProcessor;
        this.labResultExtractor = labResultExtractor;
        this.medicationExtractor = medicationExtractor;
        this.aggregator = aggregator;
        this.medicalTerms = registry.medicalTerms();
    }

    public ProcessingResult process(RawImage image, String hintedType, Deadline deadline) {
        return interpret(recognizer.recognize(image, deadline), hintedType);
    }

    /**
     * Builds the result for an already recognized page.
     */
    public ProcessingResult interpret(RecognizedText reading, String hintedType) {
        String text = reading.text();
        List<String> terms = List.copyOf(medicalTerms.findTerms(text));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("extraction_method", EXTRACTION_METHOD);
        metadata.put("ocr_strategy", reading.strategy().label());
        metadata.put("ocr_quality", reading.quality());
        metadata.put("engine_confidence", Math.round(reading.engineConfidence() * 10.0) / 10.0);
        List<Map<String, Object>> attempts = new ArrayList<>();
        for (StrategyOutcome outcome : reading.attempts()) {
            attempts.add(outcome.summary());
        }
        metadata.put("strategy_attempts", attempts);
        metadata.put("medical_terms_found", terms.size());

        Optional<TemplateMatch> match = matcher.match(text, hintedType);
        if (match.isEmpty()) {
            log.info("No template cleared its threshold; returning raw text only");
            metadata.put("template_confidence", 0.0);
            metadata.put("issues", List.of("template_no_match"));
            int confidence = aggregator.aggregate(reading.quality(), 0.0, 0, 0);
            return new ProcessingResult(text, null, ProcessingResult.UNKNOWN_TYPE, confidence,
                    Map.of(), List.of(), metadata);
        }

        TemplateMatch best = match.get();
        DocumentTemplate template = best.template();
        metadata.put("template_confidence", best.score());
        metadata.put("matched_patterns", best.matchedPatterns());

        FieldExtraction extraction = fieldExtractor.extract(text, template, reading.engineConfidence());
        Map<String, Object> data = extraction.structuredData();
        if (template.hasRule(PostProcessingRule.EXTRACT_TEST_RESULTS)) {
            data.put("test_results", List.copyOf(labResultExtractor.extract(text)));
        }
        if (template.hasRule(PostProcessingRule.EXTRACT_MEDICATIONS)) {
            data.put("medications", List.copyOf(medicationExtractor.extract(text)));
        }
        postProcessor.apply(template, extraction);

        int termCount = 0;
        if (template.hasRule(PostProcessingRule.MEDICAL_TERM_ENRICHMENT)) {
            data.put("recognized_medical_terms", terms);
            data.put("contains_lab_tests", terms.stream().anyMatch(medicalTerms::isTest));
            data.put("contains_medications", terms.stream().anyMatch(medicalTerms::isMedication));
            metadata.put("units_found", medicalTerms.findUnits(text));
            metadata.put("reference_qualifiers", medicalTerms.findReferenceQualifiers(text));
            termCount = terms.size();
        }

        int confidence = aggregator.aggregate(reading.quality(), best.score(), data.size(), termCount);
        metadata.put("issues", List.copyOf(extraction.issues()));
        log.info("Matched template {} with score {}; {} structured entries, confidence {}",
                template.id(), best.score(), data.size(), confidence);
        return new ProcessingResult(text, template.id(), template.documentType(), confidence, data,
                extraction.fields(), metadata);
    }
}
