package com.receiptscan.core.scan;

/** Состояния одного скана, в порядке прохождения. */
public enum ScanStage {
    START,
    LOADED,
    PREPROCESSED,
    RECOGNIZED,
    EXTRACTED,
    CATEGORIZED,
    SCORED,
    DONE
}
