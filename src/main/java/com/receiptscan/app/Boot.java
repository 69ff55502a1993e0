package com.receiptscan.app;

import com.receiptscan.core.export.DeductionTotals;
import com.receiptscan.core.export.ReceiptCsvExporter;
import com.receiptscan.core.export.ReceiptJson;
import com.receiptscan.core.importer.ReceiptImageCollector;
import com.receiptscan.core.ocr.TesseractRecognizer;
import com.receiptscan.core.queue.ScanQueueService;
import com.receiptscan.core.queue.ScanTask;
import com.receiptscan.core.scan.ReceiptRecord;
import com.receiptscan.core.scan.ScanOrchestrator;
import com.receiptscan.core.scan.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * Командная строка:
 * <pre>
 *   --image=receipt.jpg            один чек
 *   --dir=inbox/                   все изображения в папке (маски из batch.patterns)
 *   --format=json|csv              по умолчанию json
 *   --out=receipts.json            иначе stdout
 *   --totals                       сводка по категориям в лог
 * </pre>
 * Код выхода: 0 если все сканы успешны, 1 если были неуспешные, 2 при неверных аргументах.
 */
public final class Boot {
    private static final Logger log = LoggerFactory.getLogger(Boot.class);

    private Boot() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream stdout) {
        Map<String, String> a = parseArgs(args);
        String format = a.getOrDefault("format", "json");
        if (!format.equals("json") && !format.equals("csv")) {
            log.error("--format must be json|csv, got '{}'", format);
            return 2;
        }
        if (a.containsKey("image") == a.containsKey("dir")) {
            log.error("exactly one of --image=<file> or --dir=<folder> is required");
            return 2;
        }

        Config cfg = Config.load();
        TesseractRecognizer recognizer = new TesseractRecognizer(TesseractRecognizer.Config.from(cfg.ocr()));
        ScanOrchestrator orchestrator = ScanOrchestrator.fromConfig(cfg, recognizer);

        List<ScanResult> results = a.containsKey("image")
                ? List.of(orchestrator.scan(Path.of(a.get("image"))))
                : scanFolder(orchestrator, Path.of(a.get("dir")), cfg.batch().patterns());

        List<ReceiptRecord> records = new ArrayList<>();
        int failed = 0;
        for (ScanResult r : results) {
            if (r.success()) {
                records.add(r.record());
                List<String> problems = orchestrator.validate(r.record());
                if (!problems.isEmpty()) {
                    log.warn("receipt '{}' needs review: {}", r.record().vendorName(), problems);
                }
            } else {
                failed++;
            }
        }

        try {
            write(records, format, a.get("out"), stdout);
        } catch (IOException e) {
            log.error("cannot write output: {}", e.toString());
            return 1;
        }
        if (a.containsKey("totals")) {
            DeductionTotals totals = DeductionTotals.of(records);
            totals.asMap().forEach((c, b) ->
                    log.info("{}: {} receipt(s), total {}", c.wireName(), b.receipts(), b.total()));
            log.info("grand total: {}", totals.grandTotal());
        }
        log.info("Done. scanned={} failed={}", records.size(), failed);
        return failed == 0 ? 0 : 1;
    }

    static List<ScanResult> scanFolder(ScanOrchestrator orchestrator, Path dir, List<String> patterns) {
        List<Path> images = new ReceiptImageCollector(patterns).collect(dir);
        if (images.isEmpty()) return List.of();

        CountDownLatch left = new CountDownLatch(images.size());
        try (ScanQueueService queue = new ScanQueueService()) {
            queue.addListener(t -> {
                if (t.finished()) {
                    log.info("{} {}: {}", t.status, t.image.getFileName(), t.message);
                    left.countDown();
                }
            });
            List<ScanTask> tasks = queue.enqueueAll(images);
            queue.start(orchestrator::scan);
            left.await();
            List<ScanResult> out = new ArrayList<>(tasks.size());
            for (ScanTask t : tasks) {
                if (t.result != null) out.add(t.result);
            }
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while scanning " + dir, e);
        }
    }

    private static void write(List<ReceiptRecord> records, String format, String out, PrintStream stdout)
            throws IOException {
        if (out == null || out.isBlank()) {
            Writer w = new OutputStreamWriter(stdout, StandardCharsets.UTF_8);
            emit(records, format, w);
            w.flush();
            return;
        }
        Path p = Path.of(out);
        if (p.getParent() != null) Files.createDirectories(p.getParent());
        try (Writer w = Files.newBufferedWriter(p, StandardCharsets.UTF_8)) {
            emit(records, format, w);
        }
        log.info("wrote {} receipt(s) to {}", records.size(), p.toAbsolutePath());
    }

    private static void emit(List<ReceiptRecord> records, String format, Writer w) {
        if (format.equals("csv")) {
            new ReceiptCsvExporter().write(records, w);
        } else {
            ReceiptJson.writeAll(records, w);
        }
    }

    /** --key=value и голые флаги --key (значение "true"). */
    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new HashMap<>();
        for (String s : args) {
            if (!s.startsWith("--")) continue;
            int i = s.indexOf('=');
            if (i > 0) m.put(s.substring(2, i), s.substring(i + 1));
            else m.put(s.substring(2), "true");
        }
        return m;
    }
}
