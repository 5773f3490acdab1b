package com.rodoc.ocr.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TesseractConfigurationTest {

    @TempDir
    Path tempDir;

    @Test
    void acceptsDirectoryHoldingTrainedData() throws Exception {
        Files.createFile(tempDir.resolve("ron.traineddata"));

        Path resolved = TesseractConfiguration.resolveDataPath(tempDir.toString(), "ron");

        assertEquals(tempDir.normalize(), resolved);
    }

    @Test
    void descendsIntoTessdataSubdirectory() throws Exception {
        Path tessdata = Files.createDirectory(tempDir.resolve("tessdata"));
        Files.createFile(tessdata.resolve("ron.traineddata"));

        Path resolved = TesseractConfiguration.resolveDataPath(tempDir.toString(), "ron");

        assertEquals(tessdata.normalize(), resolved);
    }

    @Test
    void skipsConfiguredDirectoryWithoutLanguageData() {
        Path resolved = TesseractConfiguration.resolveDataPath(tempDir.toString(), "ron");

        assertNotEquals(tempDir.normalize(), resolved);
    }
}
