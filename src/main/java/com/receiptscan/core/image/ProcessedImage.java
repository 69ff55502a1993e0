package com.receiptscan.core.image;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;

/**
 * Результат предобработки. Живёт только в пределах одного скана и нигде не сохраняется.
 */
public record ProcessedImage(
        BufferedImage image,
        QualityReport quality,
        List<String> degradedStages,  // этапы, упавшие внутри и пропущенные
        double skewAngle              // оценка наклона, градусы (0, если не считали)
) {
    public ProcessedImage {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(quality, "quality");
        degradedStages = degradedStages == null ? List.of() : List.copyOf(degradedStages);
    }

    public boolean degraded() {
        return !degradedStages.isEmpty();
    }
}
