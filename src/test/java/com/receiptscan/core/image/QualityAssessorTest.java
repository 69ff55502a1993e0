package com.receiptscan.core.image;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QualityAssessorTest {
    private final QualityAssessor qa = new QualityAssessor();

    @Test
    void combine_weights_and_scales() {
        QualityReport r = QualityAssessor.combine(250, 32, 128);
        assertEquals(0.5, r.sharpness(), 1e-9);
        assertEquals(0.5, r.contrast(), 1e-9);
        assertEquals(1.0, r.brightness(), 1e-9);
        assertEquals(0.4 * 0.5 + 0.3 * 1.0 + 0.3 * 0.5, r.score(), 1e-9);
    }

    @Test
    void combine_clamps_to_unit_range() {
        QualityReport r = QualityAssessor.combine(1e6, 1e3, 128);
        assertEquals(1.0, r.score(), 1e-9);
        QualityReport dark = QualityAssessor.combine(0, 0, 0);
        assertEquals(0.0, dark.score(), 1e-9);
    }

    @Test
    void uniform_mid_gray_scores_only_on_brightness() {
        Mat m = new Mat(100, 100, opencv_core.CV_8UC1, new Scalar(128));
        try {
            QualityReport r = qa.assess(m);
            assertEquals(0.0, r.sharpness(), 1e-6);
            assertEquals(0.0, r.contrast(), 1e-6);
            assertEquals(0.3, r.score(), 1e-6);
        } finally {
            m.release();
        }
    }

    @Test
    void color_input_is_converted() {
        Mat m = new Mat(64, 64, opencv_core.CV_8UC3, new Scalar(0, 0, 0, 0));
        try {
            assertEquals(0.0, qa.assess(m).score(), 1e-6);
        } finally {
            m.release();
        }
    }

    @Test
    void empty_mat_is_neutral() {
        assertEquals(QualityReport.NEUTRAL, qa.assess(new Mat()));
        assertEquals(QualityReport.NEUTRAL, qa.assess(null));
    }
}
