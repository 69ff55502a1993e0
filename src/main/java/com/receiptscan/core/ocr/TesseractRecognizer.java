package com.receiptscan.core.ocr;

import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import net.sourceforge.tess4j.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * OCR чека через Tess4J.
 * Инициализация через datapath (каталог tessdata) и languages ("eng" или "eng+spa").
 * Экземпляр Tesseract не потокобезопасен, поэтому публичные методы synchronized.
 */
public final class TesseractRecognizer implements TextRecognizer {
    private static final Logger log = LoggerFactory.getLogger(TesseractRecognizer.class);

    private final Tesseract tess;

    public static final class Config {
        public final boolean enabled;
        public final String datapath;   // путь к каталогу с *.traineddata
        public final String languages;  // "eng", "eng+spa"
        public final int psm;           // Page Segmentation Mode, 6 = единый блок текста
        public final int oem;           // OCR Engine Mode
        public final String whitelist;  // пусто = без ограничений

        public Config(boolean enabled, String datapath, String languages, int psm, int oem, String whitelist) {
            this.enabled = enabled;
            this.datapath = Objects.requireNonNull(datapath, "datapath");
            this.languages = Objects.requireNonNull(languages, "languages");
            this.psm = psm;
            this.oem = oem;
            this.whitelist = whitelist == null ? "" : whitelist;
        }

        public static Config from(com.receiptscan.app.Config.OcrConf c) {
            return new Config(c.enabled(), c.datapath(), c.languages(), c.psm(), c.oem(), c.whitelist());
        }
    }

    public TesseractRecognizer(Config cfg) {
        if (!cfg.enabled) {
            this.tess = null;
            log.info("OCR: disabled in config");
            return;
        }
        // Путь к tessdata: -Drs.ocr.tessdataDir → cfg.datapath → ENV TESSDATA_PREFIX
        String overrideDir = System.getProperty("rs.ocr.tessdataDir");
        String dir = (overrideDir != null && !overrideDir.isBlank()) ? overrideDir : cfg.datapath;
        if (dir == null || dir.isBlank()) dir = System.getenv("TESSDATA_PREFIX");
        Path dp = Path.of(Objects.requireNonNull(dir, "tessdataDir is required"))
                .toAbsolutePath().normalize();
        if (!Files.isDirectory(dp)) {
            throw new IllegalStateException("tessdataDir not found: " + dp);
        }
        String languages = System.getProperty("rs.ocr.lang", cfg.languages);
        int psm = Integer.getInteger("rs.ocr.psm", cfg.psm);
        int oem = Integer.getInteger("rs.ocr.oem", cfg.oem);
        String whitelist = System.getProperty("rs.ocr.whitelist", cfg.whitelist);

        Tesseract t = new Tesseract();
        t.setDatapath(dp.toString());
        t.setLanguage(languages);
        t.setPageSegMode(psm);
        t.setOcrEngineMode(oem);
        if (whitelist != null && !whitelist.isBlank()) {
            t.setVariable("tessedit_char_whitelist", whitelist);
        }
        // чеки печатаются моноширинно, интервалы между колонками важны для позиций
        t.setVariable("preserve_interword_spaces", "1");
        t.setVariable("user_defined_dpi", "300");

        this.tess = t;
        log.info("OCR: init datapath={} languages={} psm={} oem={}", dp, languages, psm, oem);
    }

    public boolean enabled() {
        return tess != null;
    }

    @Override
    public synchronized String recognize(BufferedImage image) {
        if (tess == null || image == null) return "";
        try {
            String raw = tess.doOCR(image);
            return raw == null ? "" : normalize(raw);
        } catch (TesseractException e) {
            log.warn("OCR: doOCR failed: {}", e.getMessage());
            return "";
        }
    }

    /**
     * Один проход Tesseract по строкам: текст собирается из строк, надёжность
     * считается как средняя уверенность строк (Tesseract отдаёт 0..100).
     */
    @Override
    public synchronized RecognizedText recognizeDetailed(BufferedImage image) {
        if (tess == null || image == null) return new RecognizedText("", null);
        List<Word> lines = tess.getWords(image, ITessAPI.TessPageIteratorLevel.RIL_TEXTLINE);
        String text = joinLines(lines);
        if (text.isEmpty()) return new RecognizedText("", null);
        return new RecognizedText(text, meanConfidence(lines));
    }

    static String joinLines(List<Word> lines) {
        if (lines == null || lines.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        for (Word w : lines) {
            String t = w.getText();
            if (t == null) continue;
            sb.append(t);
            if (!t.endsWith("\n")) sb.append('\n');
        }
        return normalize(sb.toString());
    }

    static Double meanConfidence(List<Word> words) {
        if (words == null || words.isEmpty()) return null;
        double sum = 0;
        int n = 0;
        for (Word w : words) {
            if (w.getText() == null || w.getText().isBlank()) continue;
            sum += w.getConfidence();
            n++;
        }
        return n == 0 ? null : (sum / n) / 100.0;
    }

    /** CRLF → LF, хвостовые пробелы по строкам, trim всего текста. Порядок строк сохраняется. */
    static String normalize(String raw) {
        String[] lines = raw.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1);
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            sb.append(lines[i].stripTrailing());
        }
        return sb.toString().strip();
    }
}
