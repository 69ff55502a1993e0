package com.receiptscan.core.scan;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Ровно один на вызов scan(). При неуспехе record всегда отсутствует.
 */
public record ScanResult(
        boolean success,
        ReceiptRecord record,
        String errorMessage,
        ScanFailure failure,
        Duration processingTime,
        double imageQualityScore
) {
    public ScanResult {
        Objects.requireNonNull(processingTime, "processingTime");
        if (success && record == null) {
            throw new IllegalArgumentException("successful result requires a record");
        }
        if (!success && record != null) {
            throw new IllegalArgumentException("failed result must not carry a record");
        }
        if (!success && (errorMessage == null || errorMessage.isBlank())) {
            throw new IllegalArgumentException("failed result requires an error message");
        }
        if (success && failure != null) {
            throw new IllegalArgumentException("successful result must not carry a failure kind");
        }
        imageQualityScore = Double.isNaN(imageQualityScore) ? 0.0 : Math.max(0.0, Math.min(1.0, imageQualityScore));
    }

    public static ScanResult success(ReceiptRecord record, Duration took, double quality) {
        return new ScanResult(true, Objects.requireNonNull(record, "record"), null, null, took, quality);
    }

    public static ScanResult failure(ScanFailure kind, String message, Duration took, double quality) {
        return new ScanResult(false, null, message, Objects.requireNonNull(kind, "kind"), took, quality);
    }

    public Optional<ReceiptRecord> recordIfPresent() {
        return Optional.ofNullable(record);
    }
}
