package com.receiptscan.core.image;

/**
 * Оценка пригодности изображения для распознавания.
 * Все компоненты и итог лежат в [0,1].
 */
public record QualityReport(
        double sharpness,   // дисперсия лапласиана / 500
        double contrast,    // σ яркости / 64
        double brightness,  // близость среднего к 128
        double score        // 0.4·sharpness + 0.3·brightness + 0.3·contrast
) {
    /** Нейтральная оценка, если посчитать не удалось. */
    public static final QualityReport NEUTRAL = new QualityReport(0.5, 0.5, 0.5, 0.5);
}
