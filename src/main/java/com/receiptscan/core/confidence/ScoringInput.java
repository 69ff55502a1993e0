package com.receiptscan.core.confidence;

import com.receiptscan.core.extract.ExtractedFields;
import com.receiptscan.core.extract.FieldExtractor;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Всё, что нужно любой стратегии оценки.
 * reliability: уверенность распознавателя в [0,1] или null, если он её не сообщает.
 */
public record ScoringInput(
        String rawText,
        String vendorName,
        BigDecimal totalAmount,
        boolean dateFound,
        boolean itemsFound,
        Double reliability
) {
    public ScoringInput {
        rawText = rawText == null ? "" : rawText;
        vendorName = vendorName == null ? FieldExtractor.UNKNOWN_VENDOR : vendorName;
        totalAmount = Objects.requireNonNullElse(totalAmount, BigDecimal.ZERO);
    }

    public static ScoringInput of(String rawText, ExtractedFields f, Double reliability) {
        return new ScoringInput(rawText, f.vendorName(), f.totalAmount(),
                f.transactionDate() != null, !f.items().isEmpty(), reliability);
    }

    public boolean vendorFound() {
        return !vendorName.isBlank() && !FieldExtractor.UNKNOWN_VENDOR.equals(vendorName);
    }

    public boolean amountFound() {
        return totalAmount.signum() > 0;
    }
}
