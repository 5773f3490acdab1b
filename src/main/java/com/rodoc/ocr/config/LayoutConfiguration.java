package com.rodoc.ocr.config;

import com.rodoc.ocr.service.layout.LabHeaderDetector;
import com.rodoc.ocr.service.layout.NoOpLabHeaderDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides a default {@link LabHeaderDetector}. Deployments with a header-aware detector replace this
 * bean with their own configuration.
 */
@Configuration
public class LayoutConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LayoutConfiguration.class);

    @Bean
    public LabHeaderDetector labHeaderDetector() {
        log.info("Using no-op lab header detector; non-card pages are classified from their text.");
        return new NoOpLabHeaderDetector();
    }
}
