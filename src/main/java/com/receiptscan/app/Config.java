package com.receiptscan.app;

import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.List;
import java.util.Map;


public record Config(OcrConf ocr, PreprocessConf preprocess, QualityConf quality,
                     ExtractConf extract, ScoringConf scoring, BatchConf batch) {
    public record OcrConf(boolean enabled, String datapath, String languages, int psm, int oem, String whitelist) {}
    public record PreprocessConf(boolean cropEnabled, double cropMinArea, double cropMinAspect,
                                 double cropMaxAspect, int cropPadding, int targetHeight,
                                 int bilateralD, double sigmaColor, double sigmaSpace, int medianKernel,
                                 double claheClip, int claheTile, double contrastAlpha, double contrastBeta,
                                 double deskewMinAngle, int adaptiveBlock, int adaptiveC,
                                 boolean morphEnabled, int morphW, int morphH) {
        /** Значения по умолчанию, совпадающие с application.yaml. */
        public static PreprocessConf defaults() {
            return new PreprocessConf(true, 10_000, 1.2, 5.0, 10, 1000,
                    9, 75, 75, 3, 2.0, 8, 1.2, 10, 5.0, 11, 2, true, 2, 2);
        }
    }
    public record QualityConf(double warnBelow) {}
    public record ExtractConf(int minYear, int maxYear, boolean deduplicateItems) {
        public static ExtractConf defaults() {
            return new ExtractConf(2020, 2030, false);
        }
    }
    public record ScoringConf(String strategy) {}
    public record BatchConf(List<String> patterns) {}

    public static Config load() {
        return load("/application.yaml");
    }

    @SuppressWarnings("unchecked")
    static Config load(String resource) {
        try (InputStream in = Config.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException(resource + " not found on classpath");
            }
            Yaml yaml = new Yaml();
            Map<String, Object> root = yaml.load(in);
            if (root == null) root = Map.of();

            Map<String, Object> ocr = section(root, "ocr");
            Map<String, Object> pre = section(root, "preprocess");
            Map<String, Object> cr  = section(pre, "crop");
            Map<String, Object> bil = section(pre, "bilateral");
            Map<String, Object> cl  = section(pre, "clahe");
            Map<String, Object> ct  = section(pre, "contrast");
            Map<String, Object> ad  = section(pre, "adaptive");
            Map<String, Object> mk  = section(pre, "morphology");
            Map<String, Object> q   = section(root, "quality");
            Map<String, Object> ex  = section(root, "extract");
            Map<String, Object> sc  = section(root, "scoring");
            Map<String, Object> b   = section(root, "batch");

            var d = PreprocessConf.defaults();
            var e = ExtractConf.defaults();
            return new Config(
                    new OcrConf(
                            bool(ocr, "enabled", true),
                            str(ocr, "datapath", "./tessdata"),
                            str(ocr, "languages", "eng"),
                            num(ocr, "psm", 6).intValue(),
                            num(ocr, "oem", 3).intValue(),
                            str(ocr, "whitelist", "")),
                    new PreprocessConf(
                            bool(cr, "enabled", d.cropEnabled()),
                            num(cr, "minArea", d.cropMinArea()).doubleValue(),
                            num(cr, "minAspect", d.cropMinAspect()).doubleValue(),
                            num(cr, "maxAspect", d.cropMaxAspect()).doubleValue(),
                            num(cr, "padding", d.cropPadding()).intValue(),
                            num(pre, "targetHeight", d.targetHeight()).intValue(),
                            num(bil, "d", d.bilateralD()).intValue(),
                            num(bil, "sigmaColor", d.sigmaColor()).doubleValue(),
                            num(bil, "sigmaSpace", d.sigmaSpace()).doubleValue(),
                            num(pre, "medianKernel", d.medianKernel()).intValue(),
                            num(cl, "clipLimit", d.claheClip()).doubleValue(),
                            num(cl, "tile", d.claheTile()).intValue(),
                            num(ct, "alpha", d.contrastAlpha()).doubleValue(),
                            num(ct, "beta", d.contrastBeta()).doubleValue(),
                            num(pre, "deskewMinAngle", d.deskewMinAngle()).doubleValue(),
                            num(ad, "block", d.adaptiveBlock()).intValue(),
                            num(ad, "c", d.adaptiveC()).intValue(),
                            bool(mk, "enabled", d.morphEnabled()),
                            num(mk, "w", d.morphW()).intValue(),
                            num(mk, "h", d.morphH()).intValue()),
                    new QualityConf(num(q, "warnBelow", 0.35).doubleValue()),
                    new ExtractConf(
                            num(ex, "minYear", e.minYear()).intValue(),
                            num(ex, "maxYear", e.maxYear()).intValue(),
                            bool(ex, "deduplicateItems", e.deduplicateItems())),
                    new ScoringConf(str(sc, "strategy", "heuristic-text")),
                    new BatchConf((List<String>) b.getOrDefault("patterns", List.of()))
            );
        } catch (IllegalStateException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new RuntimeException("Failed to load " + resource, ex);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> parent, String key) {
        Object v = parent.get(key);
        return v instanceof Map ? (Map<String, Object>) v : Map.of();
    }

    private static Number num(Map<String, Object> m, String key, Number def) {
        Object v = m.get(key);
        return v instanceof Number n ? n : def;
    }

    private static String str(Map<String, Object> m, String key, String def) {
        Object v = m.get(key);
        return v != null ? v.toString() : def;
    }

    private static boolean bool(Map<String, Object> m, String key, boolean def) {
        Object v = m.get(key);
        return v instanceof Boolean bv ? bv : def;
    }
}
