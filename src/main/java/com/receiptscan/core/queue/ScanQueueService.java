package com.receiptscan.core.queue;

import com.receiptscan.core.scan.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Пакетная обработка: N независимых сканов на одном фоновом потоке.
 * Порядок между задачами не важен, но сохраняется (FIFO).
 */
public final class ScanQueueService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScanQueueService.class);

    /** Обрабатывает один файл. Обычно это ScanOrchestrator::scan. */
    @FunctionalInterface
    public interface Processor {
        ScanResult process(Path image);
    }

    /** Слушатель событий задач (CLI/UI может подписаться). */
    @FunctionalInterface
    public interface Listener {
        void onUpdate(ScanTask task);
    }

    private final BlockingQueue<ScanTask> queue = new LinkedBlockingQueue<>();
    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService exec = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "rs-scan-worker");
        t.setDaemon(true);
        return t;
    });

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Future<?> workerFuture;

    public void addListener(Listener l) {
        if (l != null) listeners.add(l);
    }

    public void removeListener(Listener l) {
        listeners.remove(l);
    }

    /** Задачи, ещё ждущие в очереди. */
    public List<ScanTask> snapshot() {
        return List.copyOf(queue);
    }

    public ScanTask enqueue(Path image) {
        Objects.requireNonNull(image, "image");
        ScanTask t = new ScanTask(image);
        queue.add(t);
        notifyListeners(t);
        return t;
    }

    public List<ScanTask> enqueueAll(Collection<Path> images) {
        List<ScanTask> out = new ArrayList<>(images.size());
        for (Path p : images) out.add(enqueue(p));
        return out;
    }

    /** Запустить обработчик очереди. Повторный вызов, если уже запущен, игнорируется. */
    public synchronized void start(Processor processor) {
        Objects.requireNonNull(processor, "processor");
        if (running.get()) return;
        running.set(true);
        workerFuture = exec.submit(() -> workerLoop(processor));
        log.debug("scan queue started");
    }

    /** Остановить после текущей задачи. */
    public synchronized void stop() {
        running.set(false);
        if (workerFuture != null) workerFuture.cancel(false);
    }

    /** Отменить задачу, если она ещё не началась. */
    public boolean cancel(ScanTask t) {
        boolean removed = queue.remove(t);
        if (removed) {
            t.status = ScanTask.Status.CANCELED;
            t.message = "canceled";
            t.finishedAt = Instant.now();
            notifyListeners(t);
        }
        return removed;
    }

    private void workerLoop(Processor processor) {
        while (running.get()) {
            try {
                ScanTask t = queue.poll(250, TimeUnit.MILLISECONDS);
                if (t == null) continue;
                runTask(t, processor);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            } catch (Throwable th) {
                // очередь продолжает работу
                log.error("scan queue: unexpected worker error", th);
            }
        }
    }

    private void runTask(ScanTask t, Processor processor) {
        t.status = ScanTask.Status.RUNNING;
        t.startedAt = Instant.now();
        t.message = "running";
        notifyListeners(t);
        try {
            ScanResult r = processor.process(t.image);
            t.result = r;
            if (r != null && r.success()) {
                t.status = ScanTask.Status.DONE;
                t.message = "done";
            } else {
                t.status = ScanTask.Status.FAILED;
                t.message = r == null ? "no result" : r.errorMessage();
            }
        } catch (Throwable ex) {
            // в том числе Error из нативного кода: задача не должна зависнуть в RUNNING
            t.status = ScanTask.Status.FAILED;
            t.message = String.valueOf(ex.getMessage());
            log.warn("scan task {} failed: {}", t.id, ex.toString());
        } finally {
            t.finishedAt = Instant.now();
            notifyListeners(t);
        }
    }

    private void notifyListeners(ScanTask t) {
        for (Listener l : listeners) {
            try {
                l.onUpdate(t);
            } catch (RuntimeException e) {
                log.warn("scan queue listener failed on {}: {}", t, e.toString());
            }
        }
    }

    @Override
    public void close() {
        stop();
        exec.shutdownNow();
    }
}
