package com.rodoc.ocr.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class RodocPropertiesTest {

    private static RodocProperties bind(Map<String, String> values) {
        return new Binder(new MapConfigurationPropertySource(values))
                .bind("rodoc", RodocProperties.class)
                .get();
    }

    @Test
    void partialGroupsKeepDefaultsForOmittedKeys() {
        RodocProperties properties = bind(Map.of(
                "rodoc.region.min-width", "80",
                "rodoc.layout.dark-luminance", "90",
                "rodoc.ocr.timeout", "45s"));

        assertThat(properties.region().minWidth()).isEqualTo(80);
        assertThat(properties.region().minHeight()).isEqualTo(20);
        assertThat(properties.region().targetMinDimension()).isEqualTo(100);
        assertThat(properties.region().contrast()).isEqualTo(2.0f);

        assertThat(properties.layout().darkLuminance()).isEqualTo(90);
        assertThat(properties.layout().darkFraction()).isEqualTo(0.15);
        assertThat(properties.layout().minStructuredRows()).isEqualTo(3);
        assertThat(properties.layout().minCardAspect()).isEqualTo(1.3);
        assertThat(properties.layout().maxCardAspect()).isEqualTo(1.9);
        assertThat(properties.layout().electronicPhotoRatio()).isEqualTo(0.235);

        assertThat(properties.ocr().timeout()).isEqualTo(Duration.ofSeconds(45));
        assertThat(properties.ocr().languages()).isEqualTo("ron+eng");
        assertThat(properties.ocr().workerThreads()).isGreaterThanOrEqualTo(2);

        assertThat(properties.recognition().minQualityScore()).isEqualTo(20);
        assertThat(properties.recognition().minTextLength()).isEqualTo(10);
    }

    @Test
    void configuredWorkerThreadsAreKept() {
        RodocProperties properties = bind(Map.of("rodoc.ocr.worker-threads", "3"));

        assertThat(properties.ocr().workerThreads()).isEqualTo(3);
    }

    @Test
    void nonPositiveWorkerThreadsFallBackToProcessorCount() {
        RodocProperties properties = bind(Map.of("rodoc.ocr.worker-threads", "0"));

        assertThat(properties.ocr().workerThreads())
                .isEqualTo(Math.max(2, Runtime.getRuntime().availableProcessors()));
    }

    @Test
    void defaultsMatchAnEmptyConfiguration() {
        RodocProperties defaults = RodocProperties.defaults();

        assertThat(defaults.layout()).isEqualTo(RodocProperties.LayoutProperties.defaults());
        assertThat(defaults.region()).isEqualTo(RodocProperties.RegionProperties.defaults());
        assertThat(defaults.ocr().fallbackLanguage()).isEqualTo("eng");
        assertThat(defaults.ocr().primaryLanguage()).isEqualTo("ron");
    }
}
