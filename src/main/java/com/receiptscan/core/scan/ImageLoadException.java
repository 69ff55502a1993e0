package com.receiptscan.core.scan;

import java.nio.file.Path;

public class ImageLoadException extends ReceiptScanException {

    public ImageLoadException(String message) {
        super(ScanFailure.IMAGE_LOAD_ERROR, message);
    }

    public ImageLoadException(String message, Throwable cause) {
        super(ScanFailure.IMAGE_LOAD_ERROR, message, cause);
    }

    public static ImageLoadException notFound(Path path) {
        return new ImageLoadException("Image file not found: " + path);
    }

    public static ImageLoadException unreadable(Path path) {
        return new ImageLoadException("Could not load image: " + path);
    }
}
