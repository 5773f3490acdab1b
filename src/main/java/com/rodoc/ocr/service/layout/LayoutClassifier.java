package com.rodoc.ocr.service.layout;

import com.rodoc.ocr.config.RodocProperties;
import com.rodoc.ocr.config.RodocProperties.LayoutProperties;
import com.rodoc.ocr.service.image.RawImage;
import com.rodoc.ocr.service.registry.IdCardSubtype;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides the document category from geometry and pixel statistics alone:
 * <ul>
 *     <li>photo: dark or strong-edge pixels in the left 30% of the page;</li>
 *     <li>structured text: more than {@code minStructuredRows} rows whose strong-edge density exceeds the
 *     configured row density;</li>
 *     <li>card shape: aspect ratio strictly between the configured bounds.</li>
 * </ul>
 * All three make an identity card, whose subtype follows from the size of the dark region in the left
 * 60% relative to the whole card. The classifier never throws; any failure yields {@code unknown}.
 */
@Component
public class LayoutClassifier {

    private static final Logger log = LoggerFactory.getLogger(LayoutClassifier.class);

    private static final double PHOTO_STRIP = 0.30;
    private static final double SUBTYPE_STRIP = 0.60;

    private final LayoutProperties thresholds;
    private final LabHeaderDetector labHeaderDetector;

    public LayoutClassifier(RodocProperties properties, LabHeaderDetector labHeaderDetector) {
        this.thresholds = properties.layout();
        this.labHeaderDetector = Objects.requireNonNull(labHeaderDetector, "labHeaderDetector");
    }

    public LayoutDecision classify(RawImage image) {
        try {
            LayoutDecision decision = decide(image);
            log.debug("Layout {} subtype {} evidence {}", decision.layout().label(),
                    decision.subtype().map(IdCardSubtype::code).orElse("-"), decision.evidence());
            return decision;
        } catch (RuntimeException ex) {
            log.warn("Layout classification failed, treating page as unknown: {}", ex.toString());
            return LayoutDecision.unknown(LayoutEvidence.none());
        }
    }

    private LayoutDecision decide(RawImage image) {
        int width = image.width();
        int height = image.height();
        double aspect = (double) width / height;
        int[] luma = image.luminance();
        double[] magnitude = gradientMagnitude(luma, width, height);

        int photoColumns = Math.max(1, (int) (width * PHOTO_STRIP));
        double darkFraction = darkFraction(luma, width, height, photoColumns);
        double edgeFraction = edgeFraction(magnitude, width, height, photoColumns);
        boolean hasPhoto = darkFraction > thresholds.darkFraction() || edgeFraction > thresholds.edgeFraction();

        int structuredRows = structuredRows(magnitude, width, height);
        boolean hasStructuredText = structuredRows > thresholds.minStructuredRows();

        boolean cardShape = aspect > thresholds.minCardAspect() && aspect < thresholds.maxCardAspect();

        if (cardShape && hasPhoto && hasStructuredText) {
            double photoRatio = photoRatio(luma, width, height);
            LayoutEvidence evidence = new LayoutEvidence(aspect, darkFraction, edgeFraction, structuredRows,
                    true, true, true, photoRatio);
            return new LayoutDecision(DocumentLayout.IDENTITY_CARD, subtypeFor(photoRatio), evidence);
        }

        LayoutEvidence evidence = new LayoutEvidence(aspect, darkFraction, edgeFraction, structuredRows,
                cardShape, hasPhoto, hasStructuredText, 0.0);
        if (labHeaderDetector.looksLikeLabHeader(image)) {
            return new LayoutDecision(DocumentLayout.LAB_RESULT, Optional.empty(), evidence);
        }
        return LayoutDecision.unknown(evidence);
    }

    Optional<IdCardSubtype> subtypeFor(double photoRatio) {
        if (photoRatio > thresholds.electronicPhotoRatio()) {
            return Optional.of(IdCardSubtype.ELECTRONIC);
        }
        if (photoRatio > thresholds.standardPhotoRatio()) {
            return Optional.of(IdCardSubtype.STANDARD);
        }
        return Optional.empty();
    }

    private double darkFraction(int[] luma, int width, int height, int columns) {
        long dark = 0;
        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int x = 0; x < columns; x++) {
                if (luma[row + x] < thresholds.darkLuminance()) {
                    dark++;
                }
            }
        }
        return (double) dark / ((long) columns * height);
    }

    private double edgeFraction(double[] magnitude, int width, int height, int columns) {
        long strong = 0;
        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int x = 0; x < columns; x++) {
                if (magnitude[row + x] > thresholds.strongEdgeMagnitude()) {
                    strong++;
                }
            }
        }
        return (double) strong / ((long) columns * height);
    }

    private int structuredRows(double[] magnitude, int width, int height) {
        int rows = 0;
        for (int y = 0; y < height; y++) {
            int row = y * width;
            int strong = 0;
            for (int x = 0; x < width; x++) {
                if (magnitude[row + x] > thresholds.strongEdgeMagnitude()) {
                    strong++;
                }
            }
            if ((double) strong / width > thresholds.rowEdgeDensity()) {
                rows++;
            }
        }
        return rows;
    }

    /**
     * Area of the bounding box of dark pixels in the left 60% of the card, over the card area.
     */
    private double photoRatio(int[] luma, int width, int height) {
        int columns = Math.max(1, (int) (width * SUBTYPE_STRIP));
        int minX = Integer.MAX_VALUE;
        int minY = Integer.MAX_VALUE;
        int maxX = -1;
        int maxY = -1;
        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int x = 0; x < columns; x++) {
                if (luma[row + x] < thresholds.darkLuminance()) {
                    minX = Math.min(minX, x);
                    maxX = Math.max(maxX, x);
                    minY = Math.min(minY, y);
                    maxY = Math.max(maxY, y);
                }
            }
        }
        if (maxX < 0) {
            return 0.0;
        }
        double photoArea = (double) (maxX - minX + 1) * (maxY - minY + 1);
        return photoArea / ((double) width * height);
    }

    /**
     * Gradient magnitude with central differences inside the image and one-sided differences on its
     * border; a one-pixel axis has zero gradient along it.
     */
    static double[] gradientMagnitude(int[] luma, int width, int height) {
        double[] magnitude = new double[luma.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double gx = derivative(luma, y * width, x, width, 1);
                double gy = derivative(luma, x, y, height, width);
                magnitude[y * width + x] = Math.sqrt(gx * gx + gy * gy);
            }
        }
        return magnitude;
    }

    private static double derivative(int[] values, int base, int position, int length, int stride) {
        if (length < 2) {
            return 0.0;
        }
        if (position == 0) {
            return values[base + stride] - values[base];
        }
        if (position == length - 1) {
            return values[base + position * stride] - values[base + (position - 1) * stride];
        }
        return (values[base + (position + 1) * stride] - values[base + (position - 1) * stride]) / 2.0;
    }
}
