package com.receiptscan.core.scan;

public class NoTextExtractedException extends ReceiptScanException {

    public NoTextExtractedException() {
        super(ScanFailure.NO_TEXT_EXTRACTED, "No text could be extracted from the image");
    }
}
