package com.rodoc.ocr.service.ocr;

import com.rodoc.ocr.exception.OcrEngineUnavailableException;
import jakarta.annotation.PreDestroy;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link OcrEngine} backed by Tess4J. A {@link Tesseract} handle is not thread-safe, so every
 * invocation gets its own instance. Invocations run on a fixed pool of worker threads so the caller
 * can stop waiting once its deadline passes; a recognition that overruns keeps its worker until the
 * native call returns, which bounds the damage to the pool size.
 *
 * <p>Text and confidences come from a single {@code getWords} pass at the requested granularity.
 */
public class TesseractOcrEngine implements OcrEngine {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final Supplier<ITesseract> tesseractFactory;
    private final ExecutorService executor;
    private final Predicate<String> languageInstalled;

    public TesseractOcrEngine(Path datapath, int workerThreads) {
        this(() -> create(datapath),
                Executors.newFixedThreadPool(workerThreads, new WorkerThreadFactory()),
                language -> Files.isRegularFile(datapath.resolve(language + ".traineddata")));
        log.info("Tesseract engine ready with {} worker threads", workerThreads);
    }

    TesseractOcrEngine(Supplier<ITesseract> tesseractFactory, ExecutorService executor,
                       Predicate<String> languageInstalled) {
        this.tesseractFactory = Objects.requireNonNull(tesseractFactory, "tesseractFactory");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.languageInstalled = Objects.requireNonNull(languageInstalled, "languageInstalled");
    }

    private static ITesseract create(Path datapath) {
        Tesseract instance = new Tesseract();
        instance.setDatapath(datapath.toString());
        instance.setOcrEngineMode(1); // LSTM only
        instance.setVariable("user_defined_dpi", "300");
        instance.setVariable("preserve_interword_spaces", "1");
        return instance;
    }

    @Override
    public OcrOutput recognize(BufferedImage image, OcrRequest request, Deadline deadline)
            throws RecognitionException {
        Objects.requireNonNull(image, "image");
        requireLanguageData(request);
        if (deadline.exhausted()) {
            throw new OcrEngineUnavailableException("Time budget exhausted before recognition " + request.describe());
        }
        Future<OcrOutput> pending;
        try {
            pending = executor.submit(() -> run(image, request));
        } catch (RejectedExecutionException ex) {
            throw new OcrEngineUnavailableException("Recognition engine is shutting down", ex);
        }
        try {
            return pending.get(deadline.remaining().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            pending.cancel(true);
            throw new OcrEngineUnavailableException(
                    "Recognition " + request.describe() + " did not finish within the time budget", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            pending.cancel(true);
            throw new OcrEngineUnavailableException("Interrupted while waiting for recognition", ex);
        } catch (ExecutionException ex) {
            throw translate(ex.getCause(), request);
        }
    }

    private void requireLanguageData(OcrRequest request) {
        for (String language : request.language().split("\\+")) {
            if (!language.isBlank() && !languageInstalled.test(language.trim())) {
                throw new OcrEngineUnavailableException(
                        "Tesseract language data '" + language.trim() + "' is not installed");
            }
        }
    }

    private OcrOutput run(BufferedImage image, OcrRequest request) {
        ITesseract tesseract = tesseractFactory.get();
        tesseract.setLanguage(request.language());
        tesseract.setPageSegMode(request.pageSegMode());
        if (request.whitelist() != null) {
            tesseract.setVariable("tessedit_char_whitelist", request.whitelist());
        }
        int level = request.granularity() == OcrRequest.Granularity.SYMBOL
                ? ITessAPI.TessPageIteratorLevel.RIL_SYMBOL
                : ITessAPI.TessPageIteratorLevel.RIL_WORD;
        List<Word> words = tesseract.getWords(image, level);
        if (words == null) {
            words = List.of();
        }
        List<Float> confidences = new ArrayList<>(words.size());
        for (Word word : words) {
            confidences.add(word.getConfidence());
        }
        String text = assembleText(words, request.granularity());
        log.debug("Recognized {} characters with {} ({} confidence samples)",
                text.length(), request.describe(), confidences.size());
        return new OcrOutput(text, confidences);
    }

    /**
     * Rebuilds page text from iterator elements in reading order. An element starting below the middle
     * of the previous one, or to its left, opens a new line. Words on a line are separated by a space;
     * symbols only when the horizontal gap exceeds a third of the previous symbol's height.
     */
    static String assembleText(List<Word> words, OcrRequest.Granularity granularity) {
        StringBuilder text = new StringBuilder();
        Rectangle previous = null;
        for (Word word : words) {
            String token = word.getText() == null ? "" : word.getText().strip();
            if (token.isEmpty()) {
                continue;
            }
            Rectangle box = word.getBoundingBox() == null ? new Rectangle() : word.getBoundingBox();
            if (previous != null) {
                boolean newLine = box.y > previous.y + previous.height / 2 || box.x < previous.x;
                if (newLine) {
                    text.append('\n');
                } else if (granularity == OcrRequest.Granularity.WORD
                        || box.x - (previous.x + previous.width) > previous.height / 3) {
                    text.append(' ');
                }
            }
            text.append(token);
            previous = box;
        }
        return text.toString();
    }

    private static OcrEngineUnavailableException translate(Throwable cause, OcrRequest request) {
        // getWords reports image problems as an empty result, so anything thrown here is an engine fault:
        // missing native library, unreadable traineddata or a failed init
        return new OcrEngineUnavailableException(
                "Tesseract failed to run " + request.describe() + ": " + cause, cause);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "tesseract-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
