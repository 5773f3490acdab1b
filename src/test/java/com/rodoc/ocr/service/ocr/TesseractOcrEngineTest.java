package com.rodoc.ocr.service.ocr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.rodoc.ocr.exception.OcrEngineUnavailableException;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Word;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;

class TesseractOcrEngineTest {

    private final BufferedImage image = new BufferedImage(40, 20, BufferedImage.TYPE_BYTE_GRAY);

    private ITesseract tess;
    private TesseractOcrEngine engine;

    @BeforeEach
    void setUp() {
        tess = Mockito.mock(ITesseract.class);
        engine = new TesseractOcrEngine(() -> tess, Executors.newSingleThreadExecutor(), language -> true);
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private static Word word(String text, float confidence, int x, int y, int width, int height) {
        return new Word(text, confidence, new Rectangle(x, y, width, height));
    }

    @Test
    void buildsTextAndConfidencesFromOneWordPass() throws Exception {
        Mockito.when(tess.getWords(ArgumentMatchers.any(BufferedImage.class), ArgumentMatchers.anyInt()))
                .thenReturn(List.of(
                        word("NUME", 80f, 0, 0, 60, 20),
                        word("POPESCU", 90f, 70, 0, 90, 20)));

        OcrOutput output = engine.recognize(image, OcrRequest.of("ron+eng", OcrRequest.PSM_SINGLE_BLOCK),
                Deadline.after(Duration.ofSeconds(5)));

        assertEquals("NUME POPESCU", output.text());
        assertEquals(85.0, output.meanConfidence(), 1e-6);
        Mockito.verify(tess).setLanguage("ron+eng");
        Mockito.verify(tess).setPageSegMode(OcrRequest.PSM_SINGLE_BLOCK);
        Mockito.verify(tess, Mockito.times(1)).getWords(image, ITessAPI.TessPageIteratorLevel.RIL_WORD);
        Mockito.verify(tess, Mockito.never()).doOCR(ArgumentMatchers.any(BufferedImage.class));
    }

    @Test
    void appliesWhitelistAndSymbolGranularity() throws Exception {
        Mockito.when(tess.getWords(ArgumentMatchers.any(BufferedImage.class), ArgumentMatchers.anyInt()))
                .thenReturn(List.of(word("1", 95f, 0, 0, 10, 20), word("8", 93f, 11, 0, 10, 20)));
        OcrRequest request = new OcrRequest("ron+eng", OcrRequest.PSM_SINGLE_WORD, "0123456789",
                OcrRequest.Granularity.SYMBOL);

        OcrOutput output = engine.recognize(image, request, Deadline.after(Duration.ofSeconds(5)));

        assertEquals("18", output.text());
        Mockito.verify(tess).setVariable("tessedit_char_whitelist", "0123456789");
        Mockito.verify(tess).getWords(image, ITessAPI.TessPageIteratorLevel.RIL_SYMBOL);
    }

    @Test
    void emptyWordListYieldsEmptyTextAndZeroMean() throws Exception {
        Mockito.when(tess.getWords(ArgumentMatchers.any(BufferedImage.class), ArgumentMatchers.anyInt()))
                .thenReturn(List.of());

        OcrOutput output = engine.recognize(image, OcrRequest.of("eng", OcrRequest.PSM_SINGLE_BLOCK),
                Deadline.after(Duration.ofSeconds(5)));

        assertEquals("", output.text());
        assertEquals(0.0, output.meanConfidence(), 1e-6);
    }

    @Nested
    @DisplayName("text assembly")
    class TextAssembly {

        @Test
        void wordsBelowThePreviousLineStartANewLine() {
            String text = TesseractOcrEngine.assembleText(List.of(
                    word("CARTE", 90f, 0, 0, 50, 20),
                    word("DE", 90f, 60, 0, 20, 20),
                    word("IDENTITATE", 90f, 0, 30, 100, 20)), OcrRequest.Granularity.WORD);

            assertEquals("CARTE DE\nIDENTITATE", text);
        }

        @Test
        void wordLeftOfThePreviousOneStartsANewLine() {
            String text = TesseractOcrEngine.assembleText(List.of(
                    word("SERIA", 90f, 100, 0, 50, 20),
                    word("RX", 90f, 0, 5, 20, 20)), OcrRequest.Granularity.WORD);

            assertEquals("SERIA\nRX", text);
        }

        @Test
        void symbolsJoinUnlessTheGapIsWide() {
            String text = TesseractOcrEngine.assembleText(List.of(
                    word("R", 90f, 0, 0, 10, 20),
                    word("X", 90f, 11, 0, 10, 20),
                    word("1", 90f, 40, 0, 10, 20)), OcrRequest.Granularity.SYMBOL);

            assertEquals("RX 1", text);
        }

        @Test
        void blankElementsAreSkipped() {
            String text = TesseractOcrEngine.assembleText(List.of(
                    word(" ", 10f, 0, 0, 5, 20),
                    word("CNP", 90f, 10, 0, 30, 20)), OcrRequest.Granularity.WORD);

            assertEquals("CNP", text);
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        void missingLanguageDataMeansEngineUnavailable() {
            engine.shutdown();
            engine = new TesseractOcrEngine(() -> tess, Executors.newSingleThreadExecutor(),
                    language -> !language.equals("ron"));

            OcrEngineUnavailableException ex = assertThrows(OcrEngineUnavailableException.class,
                    () -> engine.recognize(image, OcrRequest.of("ron+eng", OcrRequest.PSM_SINGLE_BLOCK),
                            Deadline.after(Duration.ofSeconds(5))));
            assertTrue(ex.getMessage().contains("'ron'"));
            Mockito.verifyNoInteractions(tess);
        }

        @Test
        void failedEngineInitMeansEngineUnavailable() {
            Mockito.when(tess.getWords(ArgumentMatchers.any(BufferedImage.class), ArgumentMatchers.anyInt()))
                    .thenThrow(new IllegalStateException("Failed loading language 'ron'"));

            OcrEngineUnavailableException ex = assertThrows(OcrEngineUnavailableException.class,
                    () -> engine.recognize(image, OcrRequest.of("ron", OcrRequest.PSM_SINGLE_BLOCK),
                            Deadline.after(Duration.ofSeconds(5))));
            assertTrue(ex.getMessage().contains("Failed loading language"));
        }

        @Test
        void nativeLibraryErrorMeansEngineUnavailable() {
            Mockito.when(tess.getWords(ArgumentMatchers.any(BufferedImage.class), ArgumentMatchers.anyInt()))
                    .thenThrow(new UnsatisfiedLinkError("libtesseract"));

            assertThrows(OcrEngineUnavailableException.class, () -> engine.recognize(image,
                    OcrRequest.of("eng", OcrRequest.PSM_SINGLE_BLOCK), Deadline.after(Duration.ofSeconds(5))));
        }

        @Test
        void slowRecognitionExceedsDeadline() {
            Mockito.when(tess.getWords(ArgumentMatchers.any(BufferedImage.class), ArgumentMatchers.anyInt()))
                    .thenAnswer(invocation -> {
                        Thread.sleep(5_000);
                        return List.of();
                    });

            OcrEngineUnavailableException ex = assertThrows(OcrEngineUnavailableException.class,
                    () -> engine.recognize(image, OcrRequest.of("eng", OcrRequest.PSM_SINGLE_BLOCK),
                            Deadline.after(Duration.ofMillis(50))));
            assertTrue(ex.getMessage().contains("time budget"));
        }

        @Test
        void exhaustedDeadlineSkipsTheEngine() {
            assertThrows(OcrEngineUnavailableException.class, () -> engine.recognize(image,
                    OcrRequest.of("eng", OcrRequest.PSM_SINGLE_BLOCK), Deadline.after(Duration.ZERO)));
            Mockito.verifyNoInteractions(tess);
        }

        @Test
        void overrunningCallHoldsItsWorkerSoTheNextCallQueues() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            Mockito.when(tess.getWords(ArgumentMatchers.any(BufferedImage.class), ArgumentMatchers.anyInt()))
                    .thenAnswer(invocation -> {
                        awaitIgnoringInterrupts(release);
                        return List.of();
                    });
            OcrRequest request = OcrRequest.of("eng", OcrRequest.PSM_SINGLE_BLOCK);

            try {
                assertThrows(OcrEngineUnavailableException.class,
                        () -> engine.recognize(image, request, Deadline.after(Duration.ofMillis(50))));
                assertThrows(OcrEngineUnavailableException.class,
                        () -> engine.recognize(image, request, Deadline.after(Duration.ofMillis(100))));

                Mockito.verify(tess, Mockito.times(1))
                        .getWords(ArgumentMatchers.any(BufferedImage.class), ArgumentMatchers.anyInt());
            } finally {
                release.countDown();
            }
        }
    }

    // stands in for a native call that ignores thread interruption
    private static void awaitIgnoringInterrupts(CountDownLatch latch) {
        boolean interrupted = false;
        while (true) {
            try {
                if (latch.await(10, TimeUnit.SECONDS)) {
                    break;
                }
            } catch (InterruptedException ex) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
