package com.receiptscan.core.queue;

import com.receiptscan.core.scan.Receipts;
import com.receiptscan.core.scan.ScanFailure;
import com.receiptscan.core.scan.ScanResult;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ScanQueueServiceTest {

    private static ScanResult fake(Path p) {
        String name = p.getFileName().toString();
        if (name.startsWith("boom")) throw new IllegalStateException("processor crashed");
        if (name.startsWith("bad")) {
            return ScanResult.failure(ScanFailure.IMAGE_LOAD_ERROR, "Image file not found: " + p, Duration.ZERO, 0);
        }
        return ScanResult.success(Receipts.walgreens(), Duration.ofMillis(1), 0.8);
    }

    @Test
    void processes_all_tasks_in_order_with_final_statuses() throws Exception {
        try (ScanQueueService q = new ScanQueueService()) {
            CountDownLatch done = new CountDownLatch(3);
            ConcurrentLinkedQueue<Integer> order = new ConcurrentLinkedQueue<>();
            q.addListener(t -> {
                if (t.finished()) {
                    order.add(t.id);
                    done.countDown();
                }
            });
            List<ScanTask> tasks = q.enqueueAll(List.of(Path.of("a.png"), Path.of("bad.png"), Path.of("boom.png")));
            q.start(ScanQueueServiceTest::fake);
            assertTrue(done.await(5, TimeUnit.SECONDS));

            assertEquals(ScanTask.Status.DONE, tasks.get(0).status);
            assertTrue(tasks.get(0).result.success());
            assertEquals(ScanTask.Status.FAILED, tasks.get(1).status);
            assertTrue(tasks.get(1).message.startsWith("Image file not found"));
            assertEquals(ScanTask.Status.FAILED, tasks.get(2).status);
            assertEquals("processor crashed", tasks.get(2).message);
            assertNull(tasks.get(2).result);
            assertEquals(List.of(tasks.get(0).id, tasks.get(1).id, tasks.get(2).id), List.copyOf(order));
            for (ScanTask t : tasks) {
                assertNotNull(t.startedAt);
                assertNotNull(t.finishedAt);
            }
        }
    }

    @Test
    void native_error_fails_task_and_queue_keeps_going() throws Exception {
        try (ScanQueueService q = new ScanQueueService()) {
            CountDownLatch done = new CountDownLatch(2);
            q.addListener(t -> {
                if (t.finished()) done.countDown();
            });
            List<ScanTask> tasks = q.enqueueAll(List.of(Path.of("native.png"), Path.of("a.png")));
            q.start(p -> {
                if (p.getFileName().toString().startsWith("native")) {
                    throw new UnsatisfiedLinkError("Unable to load library 'tesseract'");
                }
                return fake(p);
            });
            assertTrue(done.await(5, TimeUnit.SECONDS));

            assertEquals(ScanTask.Status.FAILED, tasks.get(0).status);
            assertEquals("Unable to load library 'tesseract'", tasks.get(0).message);
            assertNotNull(tasks.get(0).finishedAt);
            assertEquals(ScanTask.Status.DONE, tasks.get(1).status);
        }
    }

    @Test
    void cancel_before_start_skips_task() throws Exception {
        try (ScanQueueService q = new ScanQueueService()) {
            ScanTask keep = q.enqueue(Path.of("a.png"));
            ScanTask drop = q.enqueue(Path.of("b.png"));
            assertEquals(2, q.snapshot().size());

            assertTrue(q.cancel(drop));
            assertFalse(q.cancel(drop));
            assertEquals(ScanTask.Status.CANCELED, drop.status);
            assertEquals(List.of(keep), q.snapshot());

            CountDownLatch done = new CountDownLatch(1);
            q.addListener(t -> {
                if (t == keep && t.finished()) done.countDown();
            });
            q.start(ScanQueueServiceTest::fake);
            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertNull(drop.result);
            assertNull(drop.startedAt);
        }
    }

    @Test
    void failing_listener_does_not_stop_queue() throws Exception {
        try (ScanQueueService q = new ScanQueueService()) {
            CountDownLatch done = new CountDownLatch(1);
            q.addListener(t -> {
                throw new RuntimeException("listener bug");
            });
            q.addListener(t -> {
                if (t.finished()) done.countDown();
            });
            q.start(ScanQueueServiceTest::fake);
            q.start(p -> fail("second start must be ignored"));
            q.enqueue(Path.of("a.png"));
            assertTrue(done.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void enqueue_rejects_null() {
        try (ScanQueueService q = new ScanQueueService()) {
            assertThrows(NullPointerException.class, () -> q.enqueue(null));
        }
    }
}
