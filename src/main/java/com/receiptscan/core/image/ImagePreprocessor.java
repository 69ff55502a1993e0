package com.receiptscan.core.image;

import com.receiptscan.app.Config;
import com.receiptscan.core.scan.ImageLoadException;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Point2f;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.RotatedRect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_imgproc.CLAHE;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Нормализация фото чека перед OCR:
 * серый → обрезка по контуру чека → масштаб по высоте → шумоподавление → CLAHE → контраст
 * → выравнивание наклона → адаптивный порог → морфология.
 *
 * Каждый этап: чистое преобразование Mat → Mat. Если этап падает внутри,
 * он пропускается (PreprocessingDegraded), а дальше идёт последний удачный кадр.
 * Жёстко прерывает работу только load(): нет файла или он не декодируется.
 */
public final class ImagePreprocessor {
    private static final Logger log = LoggerFactory.getLogger(ImagePreprocessor.class);

    /** Один шаг конвейера. Возвращает новый Mat, вход не трогает. */
    @FunctionalInterface
    interface Stage {
        Mat apply(Mat src, Trace trace);
    }

    record NamedStage(String name, Stage stage) {
        /** Этап, которому не нужно ничего сообщать наружу. */
        static NamedStage pure(String name, UnaryOperator<Mat> f) {
            return new NamedStage(name, (src, trace) -> f.apply(src));
        }
    }

    /** Побочные результаты этапов в рамках одного вызова process(). */
    static final class Trace {
        double skewAngle;
    }

    private final Config.PreprocessConf cfg;
    private final QualityAssessor quality;
    private final List<NamedStage> stages;

    public ImagePreprocessor(Config.PreprocessConf cfg, QualityAssessor quality) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.quality = Objects.requireNonNull(quality, "quality");
        List<NamedStage> s = new ArrayList<>();
        s.add(NamedStage.pure("grayscale", this::toGray));
        if (cfg.cropEnabled()) {
            s.add(NamedStage.pure("crop", this::cropToReceipt));
        }
        if (cfg.targetHeight() > 0) {
            s.add(NamedStage.pure("resize", this::resizeForOcr));
        }
        s.add(NamedStage.pure("denoise", this::denoise));
        s.add(NamedStage.pure("clahe", this::equalize));
        s.add(NamedStage.pure("contrast", this::boostContrast));
        s.add(new NamedStage("deskew", this::deskew));
        s.add(NamedStage.pure("binarize", this::binarize));
        if (cfg.morphEnabled()) {
            s.add(NamedStage.pure("morphology", this::cleanSpeckle));
        }
        this.stages = List.copyOf(s);
    }

    /** Для тестов: произвольный набор этапов. */
    ImagePreprocessor(Config.PreprocessConf cfg, QualityAssessor quality, List<NamedStage> stages) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.quality = Objects.requireNonNull(quality, "quality");
        this.stages = List.copyOf(stages);
    }

    /** Читает файл в BGR Mat. Единственная жёсткая ошибка предобработки. */
    public Mat load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            log.warn("image not found: {}", path);
            throw ImageLoadException.notFound(path);
        }
        Mat m;
        try {
            m = opencv_imgcodecs.imread(path.toString(), opencv_imgcodecs.IMREAD_COLOR);
        } catch (RuntimeException e) {
            throw new ImageLoadException("Could not load image: " + path, e);
        }
        if (m == null || m.empty()) {
            log.warn("image not decodable: {}", path);
            throw ImageLoadException.unreadable(path);
        }
        log.debug("loaded {} ({}x{}, ch={})", path, m.cols(), m.rows(), m.channels());
        return m;
    }

    /** Прогоняет все этапы. Вход не освобождается: им владеет вызывающий. */
    public ProcessedImage process(Mat raw) {
        Objects.requireNonNull(raw, "raw");
        Trace trace = new Trace();
        List<String> degraded = new ArrayList<>();
        Mat current = raw;
        for (NamedStage st : stages) {
            try {
                Mat next = st.stage().apply(current, trace);
                if (next == null || next.empty()) {
                    if (next != null && next != current) next.release();
                    throw new IllegalStateException("stage produced empty image");
                }
                if (current != raw && next != current) Mats.release(current);
                current = next;
            } catch (RuntimeException e) {
                // PreprocessingDegraded: этап пропускаем, работаем с тем, что есть
                degraded.add(st.name());
                log.warn("PreprocessingDegraded: stage '{}' failed, continuing with previous image: {}",
                        st.name(), e.toString());
            }
        }
        try {
            QualityReport q = quality.assess(current);
            return new ProcessedImage(Mats.toBufferedImage(current), q, degraded, trace.skewAngle);
        } finally {
            if (current != raw) Mats.release(current);
        }
    }

    // ---- этапы ----

    Mat toGray(Mat src) {
        Mat gray = new Mat();
        switch (src.channels()) {
            case 1 -> src.copyTo(gray);
            case 3 -> opencv_imgproc.cvtColor(src, gray, opencv_imgproc.COLOR_BGR2GRAY);
            case 4 -> opencv_imgproc.cvtColor(src, gray, opencv_imgproc.COLOR_BGRA2GRAY);
            default -> {
                gray.release();
                throw new IllegalArgumentException("unsupported channel count: " + src.channels());
            }
        }
        return gray;
    }

    /** Вырезает чек из фона (стол, ладонь) с небольшим запасом; не нашли контур: копия как есть. */
    Mat cropToReceipt(Mat src) {
        Mat out = new Mat();
        Optional<Rect> region = detectReceiptRegion(src);
        if (region.isEmpty()) {
            src.copyTo(out);
            return out;
        }
        Rect r = region.get();
        int pad = Math.max(0, cfg.cropPadding());
        int x = Math.max(0, r.x() - pad);
        int y = Math.max(0, r.y() - pad);
        int w = Math.min(src.cols() - x, r.width() + 2 * pad);
        int h = Math.min(src.rows() - y, r.height() + 2 * pad);
        Rect padded = new Rect(x, y, w, h);
        Mat roi = new Mat(src, padded);
        try {
            roi.copyTo(out);
        } finally {
            roi.release();
            padded.close();
            r.close();
        }
        log.debug("crop: {}x{} -> {}x{} at ({},{})", src.cols(), src.rows(), w, h, x, y);
        return out;
    }

    /**
     * Рамка самого крупного внешнего контура по Canny, похожего на чек:
     * площадь не меньше cropMinArea, высота/ширина в (cropMinAspect, cropMaxAspect).
     */
    Optional<Rect> detectReceiptRegion(Mat gray) {
        Mat edges = new Mat();
        Mat hierarchy = new Mat();
        MatVector contours = new MatVector();
        try {
            opencv_imgproc.Canny(gray, edges, 50, 150);
            opencv_imgproc.findContours(edges, contours, hierarchy,
                    opencv_imgproc.RETR_EXTERNAL, opencv_imgproc.CHAIN_APPROX_SIMPLE);
            Rect best = null;
            double bestArea = 0;
            for (long i = 0; i < contours.size(); i++) {
                Mat c = contours.get(i);
                double area = opencv_imgproc.contourArea(c);
                if (area < cfg.cropMinArea() || area <= bestArea) continue;
                Rect box = opencv_imgproc.boundingRect(c);
                double aspect = box.width() > 0 ? (double) box.height() / box.width() : 0;
                if (aspect > cfg.cropMinAspect() && aspect < cfg.cropMaxAspect()) {
                    if (best != null) best.close();
                    best = box;
                    bestArea = area;
                } else {
                    box.close();
                }
            }
            return Optional.ofNullable(best);
        } finally {
            edges.release();
            hierarchy.release();
            contours.close();
        }
    }

    /** Высота к targetHeight с сохранением пропорций; мелкие фото Tesseract читает плохо. */
    Mat resizeForOcr(Mat src) {
        Mat out = new Mat();
        int h = cfg.targetHeight();
        if (src.rows() == h) {
            src.copyTo(out);
            return out;
        }
        int w = Math.max(1, (int) Math.round((double) src.cols() * h / src.rows()));
        int interp = h > src.rows() ? opencv_imgproc.INTER_CUBIC : opencv_imgproc.INTER_AREA;
        opencv_imgproc.resize(src, out, new Size(w, h), 0, 0, interp);
        return out;
    }

    /** Билатеральный фильтр сохраняет края символов, медиана убирает точечный шум. */
    Mat denoise(Mat src) {
        Mat bil = new Mat();
        Mat out = new Mat();
        try {
            opencv_imgproc.bilateralFilter(src, bil, cfg.bilateralD(), cfg.sigmaColor(), cfg.sigmaSpace());
            opencv_imgproc.medianBlur(bil, out, odd(cfg.medianKernel()));
            return out;
        } catch (RuntimeException e) {
            out.release();
            throw e;
        } finally {
            bil.release();
        }
    }

    /** Локальное выравнивание гистограммы по тайлам (неравномерный свет на одном чеке). */
    Mat equalize(Mat src) {
        CLAHE clahe = opencv_imgproc.createCLAHE(cfg.claheClip(), new Size(cfg.claheTile(), cfg.claheTile()));
        Mat out = new Mat();
        try {
            clahe.apply(src, out);
            return out;
        } finally {
            clahe.close();
        }
    }

    /** Линейное усиление после CLAHE: out = alpha * src + beta с насыщением. */
    Mat boostContrast(Mat src) {
        Mat out = new Mat();
        opencv_core.convertScaleAbs(src, out, cfg.contrastAlpha(), cfg.contrastBeta());
        return out;
    }

    /** Поворот только при |угол| > deskewMinAngle, иначе возвращаем копию. */
    Mat deskew(Mat src, Trace trace) {
        double angle = estimateSkewAngle(src);
        trace.skewAngle = angle;
        Mat out = new Mat();
        if (Math.abs(angle) <= cfg.deskewMinAngle()) {
            src.copyTo(out);
            return out;
        }
        Point2f center = new Point2f(src.cols() / 2f, src.rows() / 2f);
        Mat rot = opencv_imgproc.getRotationMatrix2D(center, angle, 1.0);
        try {
            opencv_imgproc.warpAffine(src, out, rot, src.size(),
                    opencv_imgproc.INTER_CUBIC, opencv_core.BORDER_REPLICATE, new Scalar());
            log.debug("deskew: rotated by {} deg", String.format("%.2f", angle));
            return out;
        } finally {
            rot.release();
        }
    }

    /**
     * Угол наклона по minAreaRect самого большого контура (обычно это сам чек).
     * Нормируем в (-45, 45]: OpenCV отдаёт угол прямоугольника в разных диапазонах по версиям.
     */
    static double estimateSkewAngle(Mat gray) {
        Mat bin = new Mat();
        Mat hierarchy = new Mat();
        MatVector contours = new MatVector();
        try {
            opencv_imgproc.threshold(gray, bin, 0, 255, opencv_imgproc.THRESH_BINARY + opencv_imgproc.THRESH_OTSU);
            opencv_imgproc.findContours(bin, contours, hierarchy,
                    opencv_imgproc.RETR_EXTERNAL, opencv_imgproc.CHAIN_APPROX_SIMPLE);
            if (contours.size() == 0) return 0.0;

            long best = -1;
            double bestArea = 0;
            for (long i = 0; i < contours.size(); i++) {
                double area = opencv_imgproc.contourArea(contours.get(i));
                if (area > bestArea) {
                    bestArea = area;
                    best = i;
                }
            }
            if (best < 0) return 0.0;
            RotatedRect rect = opencv_imgproc.minAreaRect(contours.get(best));
            return normalizeAngle(rect.angle());
        } finally {
            bin.release();
            hierarchy.release();
            contours.close();
        }
    }

    static double normalizeAngle(double angle) {
        double a = angle % 90.0;
        if (a > 45.0) a -= 90.0;
        else if (a <= -45.0) a += 90.0;
        return a;
    }

    /** Локальный (адаптивный) порог: и бледные, и жирные участки бинаризуются корректно. */
    Mat binarize(Mat src) {
        Mat blur = new Mat();
        Mat bin = new Mat();
        try {
            opencv_imgproc.GaussianBlur(src, blur, new Size(5, 5), 0);
            opencv_imgproc.adaptiveThreshold(blur, bin, 255,
                    opencv_imgproc.ADAPTIVE_THRESH_GAUSSIAN_C,
                    opencv_imgproc.THRESH_BINARY, odd(Math.max(3, cfg.adaptiveBlock())), cfg.adaptiveC());
            return bin;
        } catch (RuntimeException e) {
            bin.release();
            throw e;
        } finally {
            blur.release();
        }
    }

    /** close → open: убираем крапинки и заращиваем разрывы тонких штрихов. */
    Mat cleanSpeckle(Mat src) {
        Mat k = opencv_imgproc.getStructuringElement(opencv_imgproc.MORPH_RECT,
                new Size(Math.max(1, cfg.morphW()), Math.max(1, cfg.morphH())));
        Mat closed = new Mat();
        Mat out = new Mat();
        try {
            opencv_imgproc.morphologyEx(src, closed, opencv_imgproc.MORPH_CLOSE, k);
            opencv_imgproc.morphologyEx(closed, out, opencv_imgproc.MORPH_OPEN, k);
            return out;
        } catch (RuntimeException e) {
            out.release();
            throw e;
        } finally {
            Mats.release(k, closed);
        }
    }

    // blockSize/ksize должны быть нечётными
    private static int odd(int v) {
        return (v & 1) == 0 ? v + 1 : v;
    }
}
