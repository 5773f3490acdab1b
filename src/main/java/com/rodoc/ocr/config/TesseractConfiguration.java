package com.rodoc.ocr.config;

import com.rodoc.ocr.service.ocr.TesseractOcrEngine;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TesseractConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TesseractConfiguration.class);

    @Bean
    public TesseractOcrEngine tesseractOcrEngine(RodocProperties properties) {
        RodocProperties.OcrProperties ocr = properties.ocr();
        String language = ocr.primaryLanguage();
        Path dataPath = resolveDataPath(ocr.datapath(), language);
        if (dataPath == null) {
            String message = String.format(Locale.ROOT,
                    "Unable to locate Tesseract language data for '%s'. "
                            + "Provide it via the rodoc.ocr.datapath property or the TESSDATA_PREFIX environment variable.",
                    language);
            log.error(message);
            throw new IllegalStateException(message);
        }
        for (String configured : (ocr.languages() + "+" + ocr.fallbackLanguage()).split("\\+")) {
            if (!Files.isRegularFile(dataPath.resolve(configured + ".traineddata"))) {
                log.warn("Language '{}' is missing from {}; recognition will report the engine unavailable",
                        configured, dataPath);
            }
        }
        log.info("Configuring Tesseract data path: {} (languages {})", dataPath, ocr.languages());
        return new TesseractOcrEngine(dataPath, ocr.workerThreads());
    }

    static Path resolveDataPath(String configured, String language) {
        List<String> candidates = new ArrayList<>();
        if (configured != null && !configured.isBlank()) {
            candidates.add(configured.trim());
        }
        String envCandidate = System.getenv("TESSDATA_PREFIX");
        if (envCandidate != null && !envCandidate.isBlank()) {
            candidates.add(envCandidate);
        }
        String systemPropertyCandidate = System.getProperty("TESSDATA_PREFIX");
        if (systemPropertyCandidate != null && !systemPropertyCandidate.isBlank()) {
            candidates.add(systemPropertyCandidate);
        }

        candidates.add("/usr/share/tesseract-ocr/5/tessdata");
        candidates.add("/usr/share/tesseract-ocr/4.00/tessdata");
        candidates.add("/usr/local/share/tessdata");
        candidates.add("C:/Program Files/Tesseract-OCR/tessdata");

        for (String candidate : candidates) {
            Path validPath = validateCandidate(candidate, language);
            if (validPath != null) {
                return validPath;
            }
        }
        return null;
    }

    private static Path validateCandidate(String candidate, String language) {
        Path basePath;
        try {
            basePath = Paths.get(candidate).normalize();
        } catch (InvalidPathException ex) {
            log.warn("Ignoring invalid Tesseract data path candidate '{}': {}", candidate, ex.getMessage());
            return null;
        }
        if (!Files.isDirectory(basePath)) {
            return null;
        }

        if (Files.isRegularFile(basePath.resolve(language + ".traineddata"))) {
            return basePath;
        }

        Path tessdataDirectory = basePath.resolve("tessdata");
        if (Files.isRegularFile(tessdataDirectory.resolve(language + ".traineddata"))) {
            return tessdataDirectory;
        }

        log.debug("Tesseract data path candidate '{}' does not contain {}.traineddata", candidate, language);
        return null;
    }
}
