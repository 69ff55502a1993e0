package com.receiptscan.core.ocr;

/**
 * @param text        распознанный текст, никогда не null
 * @param reliability средняя уверенность по словам в [0,1] или null, если неизвестна
 */
public record RecognizedText(String text, Double reliability) {
    public RecognizedText {
        text = text == null ? "" : text;
        if (reliability != null) {
            reliability = Math.max(0.0, Math.min(1.0, reliability));
        }
    }

    public boolean blank() {
        return text.isBlank();
    }
}
