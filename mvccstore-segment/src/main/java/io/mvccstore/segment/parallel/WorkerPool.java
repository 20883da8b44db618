package io.mvccstore.segment.parallel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

import io.mvccstore.segment.SystemConfig;

/**
 * A bounded number of background worker slots shared by all parallel scans. A launch gets as many workers as
 * there are free slots, possibly none.
 */
public class WorkerPool implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);
    private static volatile WorkerPool shared;

    private final AtomicInteger id = new AtomicInteger(0);
    private final int capacity;
    private final Semaphore slots;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r);
        t.setName("MVCCStore-Worker-" + id.getAndIncrement());
        t.setDaemon(true);
        return t;
    });

    public WorkerPool(int capacity) {
        this.capacity = capacity;
        this.slots = new Semaphore(capacity);
    }

    public static WorkerPool shared() {
        if (shared == null) {
            synchronized (WorkerPool.class) {
                if (shared == null) {
                    shared = new WorkerPool(SystemConfig.PARALLEL_WORKER_SLOTS.getInt());
                }
            }
        }
        return shared;
    }

    public int capacity() {
        return capacity;
    }

    public int availableSlots() {
        return slots.availablePermits();
    }

    /**
     * Start up to {@code requested} workers. Worker {@code i} runs {@code body.apply(i)}.
     *
     * @return the futures of the launched workers, fewer than requested if slots ran out.
     */
    public List<Future<?>> launch(int requested, IntFunction<Runnable> body) {
        int granted = 0;
        while (granted < requested && slots.tryAcquire()) {
            granted++;
        }
        List<Future<?>> futures = new ArrayList<>(granted);
        for (int i = 0; i < granted; i++) {
            Runnable worker = body.apply(i);
            try {
                futures.add(executor.submit(() -> {
                    try {
                        worker.run();
                    } finally {
                        slots.release();
                    }
                }));
            } catch (RejectedExecutionException e) {
                logger.warn("Failed to launch worker #{}", i, e);
                slots.release(granted - i);
                break;
            }
        }
        if (futures.size() < requested) {
            logger.debug("Launched {} of {} requested workers", futures.size(), requested);
        }
        return futures;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
