package com.rodoc.ocr.service.layout;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pixel statistics behind a {@link LayoutDecision}, reported in the processing metadata.
 */
public record LayoutEvidence(
        double aspectRatio,
        double darkFraction,
        double edgeFraction,
        int structuredRows,
        boolean cardShape,
        boolean hasPhoto,
        boolean hasStructuredText,
        double photoRatio) {

    public static LayoutEvidence none() {
        return new LayoutEvidence(0.0, 0.0, 0.0, 0, false, false, false, 0.0);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("aspect_ratio", round(aspectRatio));
        map.put("dark_fraction", round(darkFraction));
        map.put("edge_fraction", round(edgeFraction));
        map.put("structured_rows", structuredRows);
        map.put("card_shape", cardShape);
        map.put("has_photo", hasPhoto);
        map.put("has_structured_text", hasStructuredText);
        map.put("photo_ratio", round(photoRatio));
        return map;
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
