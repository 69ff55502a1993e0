package com.receiptscan.core.queue;

import com.receiptscan.core.scan.ScanResult;

import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/** Одна задача пакетного скана. Поля пишет только рабочий поток очереди. */
public final class ScanTask {
    public enum Status { PENDING, RUNNING, DONE, FAILED, CANCELED }

    private static final AtomicInteger SEQ = new AtomicInteger(1);

    public final int id = SEQ.getAndIncrement();
    public final Path image;
    public volatile Status status = Status.PENDING;
    public volatile String message = "";
    public volatile ScanResult result;
    public volatile Instant startedAt;
    public volatile Instant finishedAt;

    public ScanTask(Path image) {
        this.image = image;
    }

    public boolean finished() {
        Status s = status;
        return s == Status.DONE || s == Status.FAILED || s == Status.CANCELED;
    }

    @Override
    public String toString() {
        return "ScanTask#" + id + "[" + status + " " + image + "]";
    }
}
