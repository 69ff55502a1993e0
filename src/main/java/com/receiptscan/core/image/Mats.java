package com.receiptscan.core.image;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/** Мелкие утилиты для нативных Mat. */
final class Mats {

    private Mats() {
        // no-op
    }

    /** Mat → BufferedImage через PNG-кодек (без прямого доступа к буферам). */
    static BufferedImage toBufferedImage(Mat m) {
        BytePointer buf = new BytePointer();
        try {
            if (!opencv_imgcodecs.imencode(".png", m, buf)) {
                throw new IllegalStateException("imencode failed for " + m.cols() + "x" + m.rows());
            }
            byte[] bytes = new byte[(int) buf.limit()];
            buf.get(bytes);
            BufferedImage bi = ImageIO.read(new ByteArrayInputStream(bytes));
            if (bi == null) {
                throw new IllegalStateException("ImageIO could not decode encoded PNG");
            }
            return bi;
        } catch (IOException e) {
            throw new IllegalStateException("PNG decode failed", e);
        } finally {
            buf.deallocate();
        }
    }

    static void release(Mat... mats) {
        for (Mat m : mats) if (m != null && !m.isNull()) m.release();
    }
}
