package com.rodoc.ocr.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "rodoc")
public record RodocProperties(
        OcrProperties ocr,
        LayoutProperties layout,
        RegionProperties region,
        RecognitionProperties recognition) {

    public RodocProperties {
        ocr = ocr != null ? ocr : OcrProperties.defaults();
        layout = layout != null ? layout : LayoutProperties.defaults();
        region = region != null ? region : RegionProperties.defaults();
        recognition = recognition != null ? recognition : RecognitionProperties.defaults();
    }

    public static RodocProperties defaults() {
        return new RodocProperties(null, null, null, null);
    }

    /**
     * @param workerThreads size of the recognition worker pool; recognitions beyond it queue and
     *                      count against their caller's deadline while waiting
     */
    public record OcrProperties(
            String datapath,
            String languages,
            String fallbackLanguage,
            Duration timeout,
            Integer workerThreads) {

        public OcrProperties {
            languages = languages == null || languages.isBlank() ? "ron+eng" : languages;
            fallbackLanguage = fallbackLanguage == null || fallbackLanguage.isBlank() ? "eng" : fallbackLanguage;
            timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
            workerThreads = workerThreads == null || workerThreads < 1
                    ? Math.max(2, Runtime.getRuntime().availableProcessors())
                    : workerThreads;
        }

        static OcrProperties defaults() {
            return new OcrProperties(null, null, null, null, null);
        }

        /**
         * First language of the combined selector, used to locate the traineddata file.
         */
        public String primaryLanguage() {
            int plus = languages.indexOf('+');
            return plus > 0 ? languages.substring(0, plus) : languages;
        }
    }

    /**
     * Thresholds of the pixel-statistics layout heuristics. Luminance values are on the 0-255 scale,
     * fractions and densities on 0-1. Keys left out of the configuration keep their defaults.
     */
    public record LayoutProperties(
            Integer darkLuminance,
            Double darkFraction,
            Double strongEdgeMagnitude,
            Double edgeFraction,
            Double rowEdgeDensity,
            Integer minStructuredRows,
            Double minCardAspect,
            Double maxCardAspect,
            Double electronicPhotoRatio,
            Double standardPhotoRatio) {

        public LayoutProperties {
            darkLuminance = darkLuminance != null ? darkLuminance : 100;
            darkFraction = darkFraction != null ? darkFraction : 0.15;
            strongEdgeMagnitude = strongEdgeMagnitude != null ? strongEdgeMagnitude : 50.0;
            edgeFraction = edgeFraction != null ? edgeFraction : 0.03;
            rowEdgeDensity = rowEdgeDensity != null ? rowEdgeDensity : 0.10;
            minStructuredRows = minStructuredRows != null ? minStructuredRows : 3;
            minCardAspect = minCardAspect != null ? minCardAspect : 1.3;
            maxCardAspect = maxCardAspect != null ? maxCardAspect : 1.9;
            electronicPhotoRatio = electronicPhotoRatio != null ? electronicPhotoRatio : 0.235;
            standardPhotoRatio = standardPhotoRatio != null ? standardPhotoRatio : 0.15;
        }

        static LayoutProperties defaults() {
            return new LayoutProperties(null, null, null, null, null, null, null, null, null, null);
        }
    }

    public record RegionProperties(
            Integer minWidth,
            Integer minHeight,
            Integer targetMinDimension,
            Float contrast) {

        public RegionProperties {
            minWidth = minWidth != null ? minWidth : 50;
            minHeight = minHeight != null ? minHeight : 20;
            targetMinDimension = targetMinDimension != null ? targetMinDimension : 100;
            contrast = contrast != null ? contrast : 2.0f;
        }

        static RegionProperties defaults() {
            return new RegionProperties(null, null, null, null);
        }
    }

    public record RecognitionProperties(
            Integer minQualityScore,
            Integer minTextLength) {

        public RecognitionProperties {
            minQualityScore = minQualityScore != null ? minQualityScore : 20;
            minTextLength = minTextLength != null ? minTextLength : 10;
        }

        static RecognitionProperties defaults() {
            return new RecognitionProperties(null, null);
        }
    }
}
