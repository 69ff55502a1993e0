package com.receiptscan.core.scan;

import com.receiptscan.app.Config;
import com.receiptscan.core.category.Categorizer;
import com.receiptscan.core.category.Category;
import com.receiptscan.core.confidence.ConfidenceScorer;
import com.receiptscan.core.confidence.ScoringInput;
import com.receiptscan.core.extract.ExtractedFields;
import com.receiptscan.core.extract.FieldExtractor;
import com.receiptscan.core.extract.VendorRules;
import com.receiptscan.core.image.ImagePreprocessor;
import com.receiptscan.core.image.ProcessedImage;
import com.receiptscan.core.image.QualityAssessor;
import com.receiptscan.core.image.QualityReport;
import com.receiptscan.core.ocr.RecognizedText;
import com.receiptscan.core.ocr.TextRecognizer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Один синхронный проход: загрузка → предобработка → OCR → поля → категория → оценка.
 * Ошибки наружу не летят: любой исход упаковывается в {@link ScanResult}. Повторов нет.
 * Экземпляр не хранит состояния между вызовами, кроме неизменяемых таблиц.
 */
public final class ScanOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ScanOrchestrator.class);

    private final ImagePreprocessor preprocessor;
    private final QualityAssessor quality;
    private final TextRecognizer recognizer;
    private final FieldExtractor extractor;
    private final Categorizer categorizer;
    private final ConfidenceScorer scorer;
    private final ReceiptValidator validator = new ReceiptValidator();
    private final double warnBelow;
    private final Clock clock;

    public ScanOrchestrator(ImagePreprocessor preprocessor, QualityAssessor quality, TextRecognizer recognizer,
                            FieldExtractor extractor, Categorizer categorizer, ConfidenceScorer scorer,
                            double warnBelow, Clock clock) {
        this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor");
        this.quality = Objects.requireNonNull(quality, "quality");
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.categorizer = Objects.requireNonNull(categorizer, "categorizer");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.warnBelow = warnBelow;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Сборка из конфига; распознаватель передаётся снаружи (Tesseract или фейк в тестах). */
    public static ScanOrchestrator fromConfig(Config cfg, TextRecognizer recognizer) {
        QualityAssessor qa = new QualityAssessor();
        return new ScanOrchestrator(
                new ImagePreprocessor(cfg.preprocess(), qa),
                qa,
                recognizer,
                new FieldExtractor(VendorRules.defaults(), cfg.extract()),
                new Categorizer(),
                ConfidenceScorer.forName(cfg.scoring().strategy()),
                cfg.quality().warnBelow(),
                Clock.systemUTC());
    }

    public ScanResult scan(Path image) {
        long t0 = System.nanoTime();
        ScanStage stage = ScanStage.START;
        double qualityScore = 0.0;
        Mat raw = null;
        try {
            raw = preprocessor.load(image);
            stage = ScanStage.LOADED;

            QualityReport before = quality.assess(raw);
            qualityScore = before.score();
            if (before.score() < warnBelow) {
                log.warn("low image quality {} for {} (sharpness={}, contrast={}, brightness={})",
                        fmt(before.score()), image, fmt(before.sharpness()), fmt(before.contrast()),
                        fmt(before.brightness()));
            }

            ProcessedImage processed = preprocessor.process(raw);
            raw.release();
            raw = null;
            qualityScore = processed.quality().score();
            stage = ScanStage.PREPROCESSED;
            if (processed.degraded()) {
                log.info("preprocessing degraded for {}: skipped {}", image, processed.degradedStages());
            }

            RecognizedText recognized = recognizer.recognizeDetailed(processed.image());
            if (recognized == null || recognized.blank()) {
                throw new NoTextExtractedException();
            }
            String text = recognized.text();
            stage = ScanStage.RECOGNIZED;

            ExtractedFields fields = extractor.extract(text);
            stage = ScanStage.EXTRACTED;

            Category category = categorizer.categorize(fields.vendorName(), text);
            stage = ScanStage.CATEGORIZED;

            double confidence = ConfidenceScorer.clamp01(
                    scorer.score(ScoringInput.of(text, fields, recognized.reliability())));
            stage = ScanStage.SCORED;

            ReceiptRecord record = new ReceiptRecord(
                    fields.vendorName(), fields.totalAmount(), fields.taxAmount(), fields.transactionDate(),
                    fields.items(), category.wireName(), confidence, text, clock.instant());
            stage = ScanStage.DONE;

            Duration took = elapsed(t0);
            log.info("scanned {}: vendor='{}' total={} category={} confidence={} in {} ms",
                    image, record.vendorName(), record.totalAmount(), record.category(),
                    fmt(confidence), took.toMillis());
            return ScanResult.success(record, took, qualityScore);
        } catch (ReceiptScanException e) {
            log.warn("scan failed for {} at {}: {}", image, stage, e.getMessage());
            return ScanResult.failure(e.failure(), e.getMessage(), elapsed(t0), qualityScore);
        } catch (RuntimeException | LinkageError e) {
            // LinkageError: Tess4J/JavaCPP грузят нативные библиотеки лениво, прямо внутри вызова
            log.error("scan failed unexpectedly for {} at {}", image, stage, e);
            return ScanResult.failure(ScanFailure.INTERNAL_ERROR, "Scanning failed: " + e.getMessage(),
                    elapsed(t0), qualityScore);
        } finally {
            if (raw != null) raw.release();
        }
    }

    public List<String> validate(ReceiptRecord record) {
        return validator.validate(record);
    }

    private static Duration elapsed(long t0) {
        return Duration.ofNanos(System.nanoTime() - t0);
    }

    private static String fmt(double v) {
        return String.format("%.2f", v);
    }
}
