package com.receiptscan.core.scan;

import java.util.Objects;

/**
 * Терминальная ошибка конвейера. Наружу не пробрасывается:
 * ScanOrchestrator превращает её в ScanResult с success=false.
 */
public class ReceiptScanException extends RuntimeException {
    private final ScanFailure failure;

    public ReceiptScanException(ScanFailure failure, String message) {
        this(failure, message, null);
    }

    public ReceiptScanException(ScanFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public ScanFailure failure() {
        return failure;
    }
}
