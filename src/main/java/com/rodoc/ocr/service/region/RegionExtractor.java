package com.rodoc.ocr.service.region;

import com.rodoc.ocr.config.RodocProperties;
import com.rodoc.ocr.config.RodocProperties.RegionProperties;
import com.rodoc.ocr.exception.RegionExtractionException;
import com.rodoc.ocr.model.ExtractedField;
import com.rodoc.ocr.model.FieldValidation;
import com.rodoc.ocr.model.ProcessingResult;
import com.rodoc.ocr.service.confidence.ConfidenceAggregator;
import com.rodoc.ocr.service.image.ImageEnhancer;
import com.rodoc.ocr.service.image.RawImage;
import com.rodoc.ocr.service.ocr.Deadline;
import com.rodoc.ocr.service.ocr.OcrEngine;
import com.rodoc.ocr.service.ocr.OcrOutput;
import com.rodoc.ocr.service.ocr.RecognitionException;
import com.rodoc.ocr.service.registry.FieldRegion;
import com.rodoc.ocr.service.registry.FieldValidator;
import com.rodoc.ocr.service.registry.IdCardSubtype;
import com.rodoc.ocr.service.registry.RegionMap;
import com.rodoc.ocr.service.registry.TemplateRegistry;
import com.rodoc.ocr.util.CnpValidator;
import com.rodoc.ocr.util.CnpValidator.CnpValidation;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads identity-card fields from fixed card regions. Each field is cropped, enhanced and recognized on
 * its own; a field that cannot be read is recorded with an empty value, zero confidence and the error,
 * and never aborts the card.
 */
@Component
public class RegionExtractor {

    private static final Logger log = LoggerFactory.getLogger(RegionExtractor.class);

    public static final String EXTRACTION_METHOD = "region_based";
    static final String AUTO_DETECTED_SUFFIX = "_auto_detected";

    private final OcrEngine ocrEngine;
    private final TemplateRegistry registry;
    private final ConfidenceAggregator aggregator;
    private final RegionProperties limits;
    private final String language;

    public RegionExtractor(OcrEngine ocrEngine, TemplateRegistry registry, ConfidenceAggregator aggregator,
                           RodocProperties properties) {
        this.ocrEngine = ocrEngine;
        this.registry = registry;
        this.aggregator = aggregator;
        this.limits = properties.region();
        this.language = properties.ocr().primaryLanguage();
    }

    /**
     * Reads the card with the given subtype's layout, or with every layout when the subtype is unknown,
     * keeping the reading with the highest mean confidence.
     */
    public ProcessingResult extract(RawImage image, Optional<IdCardSubtype> subtype, Deadline deadline) {
        if (subtype.isPresent()) {
            CardReading reading = readCard(image, registry.regionMap(subtype.get()), deadline);
            return toResult(reading, subtype.get().code());
        }

        CardReading best = null;
        for (RegionMap map : registry.regionMaps()) {
            CardReading reading = readCard(image, map, deadline);
            log.debug("Layout {} read with mean confidence {}", map.subtype().code(), reading.meanConfidence());
            if (best == null || reading.meanConfidence() > best.meanConfidence()) {
                best = reading;
            }
        }
        if (best.meanConfidence() <= 0.0) {
            log.info("No identity-card layout produced a confident reading");
            return toResult(best, "unknown");
        }
        return toResult(best, best.subtype().code() + AUTO_DETECTED_SUFFIX);
    }

    CardReading readCard(RawImage image, RegionMap map, Deadline deadline) {
        List<ExtractedField> fields = new ArrayList<>(map.fields().size());
        for (FieldRegion region : map.fields()) {
            try {
                fields.add(readField(image, region, map.subtype(), deadline));
            } catch (RegionExtractionException ex) {
                log.warn("Extraction failed for {} on {}: {}", ex.fieldName(), map.subtype().code(), ex.getMessage());
                fields.add(ExtractedField.failed(region.field(), ex.getMessage()));
            }
        }
        return new CardReading(map.subtype(), fields);
    }

    ExtractedField readField(RawImage image, FieldRegion region, IdCardSubtype subtype, Deadline deadline) {
        Rectangle pixels = region.area().toPixels(image.width(), image.height());
        if (pixels.width < limits.minWidth() || pixels.height < limits.minHeight()) {
            throw new RegionExtractionException(region.field(),
                    "Region too small for OCR: " + pixels.width + "x" + pixels.height);
        }
        BufferedImage enhanced = enhance(image.crop(pixels));
        OcrOutput output;
        try {
            output = ocrEngine.recognize(enhanced, region.ocr().toRequest(language), deadline);
        } catch (RecognitionException ex) {
            throw new RegionExtractionException(region.field(), "Recognition failed: " + ex.getMessage(), ex);
        }
        String text = output.text().strip();
        double confidence = output.meanConfidence();
        log.debug("Field {} read with confidence {}", region.field(), confidence);
        return new ExtractedField(region.field(), text, confidence, validate(region, text, subtype));
    }

    /**
     * Grayscale, fixed contrast boost, then an integer upscale of at least 3x that brings the smaller
     * side to the target dimension.
     */
    BufferedImage enhance(BufferedImage crop) {
        BufferedImage boosted = ImageEnhancer.contrast(ImageEnhancer.toGrayscale(crop), limits.contrast());
        int smaller = Math.min(crop.getWidth(), crop.getHeight());
        int scale = Math.max(3, limits.targetMinDimension() / smaller);
        return ImageEnhancer.resize(boosted, crop.getWidth() * scale, crop.getHeight() * scale);
    }

    private static FieldValidation validate(FieldRegion region, String text, IdCardSubtype subtype) {
        FieldValidator validator = region.validator();
        if (validator == null || (validator == FieldValidator.CNP && !subtype.carriesCnp())) {
            return FieldValidation.accepted(text);
        }
        return validator.validate(text);
    }

    private ProcessingResult toResult(CardReading reading, String cardType) {
        Map<String, Object> data = new LinkedHashMap<>();
        Map<String, Object> fieldConfidences = new LinkedHashMap<>();
        List<String> issues = new ArrayList<>();
        List<Double> confidences = new ArrayList<>();
        for (ExtractedField field : reading.fields()) {
            confidences.add(field.confidence());
            fieldConfidences.put(field.name(), Math.round(field.confidence() * 10.0) / 10.0);
            if (field.valid()) {
                data.put(field.name(), field.value());
                data.put(field.name() + "_valid", true);
            } else {
                data.put(field.name() + "_error", field.validation().error());
                data.put(field.name() + "_valid", false);
                issues.add("field_error:" + field.name());
            }
        }
        Object cnp = data.get("cnp");
        if (cnp instanceof String) {
            CnpValidation validation = CnpValidator.validate((String) cnp);
            if (validation.valid()) {
                data.put("data_nasterii", validation.birthDate().toString());
                data.put("gender", validation.gender().name());
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("extraction_method", EXTRACTION_METHOD);
        metadata.put("card_type", cardType);
        metadata.put("field_confidences", fieldConfidences);
        metadata.put("issues", issues);
        int confidence = aggregator.meanOf(confidences);
        log.info("Identity card read as {}: {} fields, confidence {}", cardType, reading.fields().size(), confidence);
        return new ProcessingResult("", "ro_identity_card", TemplateRegistry.IDENTITY_CARD_TYPE, confidence,
                data, reading.fields(), metadata);
    }
}
