package com.receiptscan.core.ocr;

import java.awt.image.BufferedImage;

/**
 * Распознавание текста на подготовленном изображении чека.
 * Пустая строка означает «ничего не распознано», это не ошибка.
 */
public interface TextRecognizer {

    /** Весь текст страницы, строки разделены '\n'. */
    String recognize(BufferedImage image);

    /** То же плюс средняя уверенность движка в [0,1], если движок её отдаёт. */
    default RecognizedText recognizeDetailed(BufferedImage image) {
        return new RecognizedText(recognize(image), null);
    }
}
