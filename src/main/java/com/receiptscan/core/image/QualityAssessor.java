package com.receiptscan.core.image;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Оценка качества кадра: резкость (лапласиан), контраст (σ), яркость (близость к серому).
 * Вызывается дважды за скан: на сыром изображении и на обработанном.
 */
public final class QualityAssessor {
    private static final Logger log = LoggerFactory.getLogger(QualityAssessor.class);

    // эмпирические шкалы нормировки
    static final double SHARPNESS_SCALE = 500.0;
    static final double CONTRAST_SCALE = 64.0;
    static final double IDEAL_BRIGHTNESS = 128.0;

    static final double W_SHARPNESS = 0.4;
    static final double W_BRIGHTNESS = 0.3;
    static final double W_CONTRAST = 0.3;

    public QualityReport assess(Mat image) {
        if (image == null || image.empty()) return QualityReport.NEUTRAL;
        Mat gray = null, lap = new Mat(), lapMean = new Mat(), lapStd = new Mat(),
                mean = new Mat(), std = new Mat();
        try {
            gray = image.channels() == 1 ? image : new Mat();
            if (image.channels() != 1) {
                opencv_imgproc.cvtColor(image, gray, image.channels() == 4
                        ? opencv_imgproc.COLOR_BGRA2GRAY : opencv_imgproc.COLOR_BGR2GRAY);
            }
            opencv_imgproc.Laplacian(gray, lap, opencv_core.CV_64F);
            opencv_core.meanStdDev(lap, lapMean, lapStd);
            double lapSigma = lapStd.createIndexer().getDouble(0);
            opencv_core.meanStdDev(gray, mean, std);
            double mu = mean.createIndexer().getDouble(0);
            double sigma = std.createIndexer().getDouble(0);

            QualityReport r = combine(lapSigma * lapSigma, sigma, mu);
            if (log.isDebugEnabled()) {
                log.debug("quality: lapVar={} sigma={} mean={} -> score={}",
                        String.format("%.1f", lapSigma * lapSigma), String.format("%.1f", sigma),
                        String.format("%.1f", mu), String.format("%.3f", r.score()));
            }
            return r;
        } catch (RuntimeException e) {
            log.warn("quality assessment failed, using neutral score: {}", e.toString());
            return QualityReport.NEUTRAL;
        } finally {
            if (gray != image) Mats.release(gray);
            Mats.release(lap, lapMean, lapStd, mean, std);
        }
    }

    /** Чистая арифметика оценки: удобно проверять без нативных Mat. */
    static QualityReport combine(double laplacianVariance, double stdDev, double meanIntensity) {
        double sharpness = clamp01(laplacianVariance / SHARPNESS_SCALE);
        double contrast = clamp01(stdDev / CONTRAST_SCALE);
        double brightness = clamp01(1.0 - Math.abs(meanIntensity - IDEAL_BRIGHTNESS) / IDEAL_BRIGHTNESS);
        double score = clamp01(W_SHARPNESS * sharpness + W_BRIGHTNESS * brightness + W_CONTRAST * contrast);
        return new QualityReport(sharpness, contrast, brightness, score);
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
