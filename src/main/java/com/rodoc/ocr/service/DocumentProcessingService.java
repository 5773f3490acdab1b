package com.rodoc.ocr.service;

import com.rodoc.ocr.config.RodocProperties;
import com.rodoc.ocr.model.ProcessingResult;
import com.rodoc.ocr.service.image.ImageNormalizer;
import com.rodoc.ocr.service.image.RawImage;
import com.rodoc.ocr.service.layout.DocumentLayout;
import com.rodoc.ocr.service.layout.LayoutClassifier;
import com.rodoc.ocr.service.layout.LayoutDecision;
import com.rodoc.ocr.service.ocr.Deadline;
import com.rodoc.ocr.service.recognition.FullDocumentRecognizer;
import com.rodoc.ocr.service.region.RegionExtractor;
import com.rodoc.ocr.service.registry.IdCardSubtype;
import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single entry point of the engine. Normalizes the input, classifies its layout and routes identity
 * cards to region-based extraction and every other page to full-document recognition.
 *
 * <p>Calls share no mutable state and may run concurrently. Call-level failures escape as
 * {@link com.rodoc.ocr.exception.DocumentProcessingException} subtypes; field-level ones are recorded
 * in the result.
 */
@Service
public class DocumentProcessingService {

    private static final Logger log = LoggerFactory.getLogger(DocumentProcessingService.class);

    private final ImageNormalizer normalizer;
    private final LayoutClassifier layoutClassifier;
    private final RegionExtractor regionExtractor;
    private final FullDocumentRecognizer fullDocumentRecognizer;
    private final Duration defaultTimeout;

    public DocumentProcessingService(ImageNormalizer normalizer, LayoutClassifier layoutClassifier,
                                     RegionExtractor regionExtractor, FullDocumentRecognizer fullDocumentRecognizer,
                                     RodocProperties properties) {
        this.normalizer = normalizer;
        this.layoutClassifier = layoutClassifier;
        this.regionExtractor = regionExtractor;
        this.fullDocumentRecognizer = fullDocumentRecognizer;
        this.defaultTimeout = properties.ocr().timeout();
    }

    public ProcessingResult process(byte[] content, String typeHint) {
        return process(content, typeHint, defaultTimeout);
    }

    public ProcessingResult process(byte[] content, String typeHint, Duration timeout) {
        long start = System.nanoTime();
        Deadline deadline = Deadline.after(timeout);
        return run(normalizer.load(content), TypeHint.resolve(typeHint), deadline, start);
    }

    public ProcessingResult process(BufferedImage image, String typeHint, Duration timeout) {
        long start = System.nanoTime();
        Deadline deadline = Deadline.after(timeout);
        return run(normalizer.normalize(image), TypeHint.resolve(typeHint), deadline, start);
    }

    private ProcessingResult run(RawImage image, TypeHint hint, Deadline deadline, long start) {
        LayoutDecision decision = layoutClassifier.classify(image);
        log.debug("Processing {}x{} page, layout {}, hint {}", image.width(), image.height(),
                decision.layout().label(), hint.documentType());

        ProcessingResult result;
        if (decision.layout() == DocumentLayout.IDENTITY_CARD || hint.identityCard()) {
            Optional<IdCardSubtype> subtype = hint.subtype().isPresent() ? hint.subtype() : decision.subtype();
            result = regionExtractor.extract(image, subtype, deadline);
        } else {
            result = fullDocumentRecognizer.process(image, hint.documentType(), deadline);
        }

        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("layout", decision.layout().label());
        extra.put("layout_subtype", decision.subtype().map(IdCardSubtype::code).orElse(null));
        extra.put("layout_evidence", decision.evidence().asMap());
        extra.put("type_hint", hint.documentType());
        extra.put("processing_time_ms", elapsedMs);
        log.info("Processed document as {} (template {}) with confidence {} in {} ms",
                result.documentType(), result.matchedTemplateId(), result.overallConfidence(), elapsedMs);
        return result.withMetadata(extra);
    }
}
