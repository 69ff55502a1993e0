package com.receiptscan.core.scan;

/** Вид терминальной ошибки сканирования. */
public enum ScanFailure {
    /** Файл отсутствует, повреждён или не читается. */
    IMAGE_LOAD_ERROR,
    /** Распознавание вернуло пустой текст. */
    NO_TEXT_EXTRACTED,
    /** Непредвиденный сбой внутри конвейера. */
    INTERNAL_ERROR
}
