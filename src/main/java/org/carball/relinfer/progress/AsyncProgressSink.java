package org.carball.relinfer.progress;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands events to a delegate on a single daemon thread. Senders never block:
 * when the queue is full the event is dropped and counted.
 */
@Slf4j
public class AsyncProgressSink implements ProgressSink, AutoCloseable {

    private static final int DEFAULT_CAPACITY = 1024;

    private final ProgressSink delegate;
    private final BlockingQueue<ProgressEvent> queue;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicLong dropped = new AtomicLong();
    private final Thread worker;

    public AsyncProgressSink(ProgressSink delegate) {
        this(delegate, DEFAULT_CAPACITY);
    }

    public AsyncProgressSink(ProgressSink delegate, int capacity) {
        this.delegate = delegate;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.worker = new Thread(this::consumeLoop, "relinfer-progress");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    @Override
    public void report(ProgressEvent event) {
        if (!running.get() || !queue.offer(event)) {
            dropped.incrementAndGet();
        }
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    private void consumeLoop() {
        while (running.get() || !queue.isEmpty()) {
            try {
                ProgressEvent event = queue.poll(100, TimeUnit.MILLISECONDS);
                if (event != null) {
                    deliver(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void deliver(ProgressEvent event) {
        try {
            delegate.report(event);
        } catch (RuntimeException e) {
            log.warn("Progress sink failed on {} event: {}", event.stage().getDisplayName(), e.getMessage());
        }
    }

    /**
     * Stops accepting events and waits briefly for queued ones to be delivered.
     */
    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        try {
            worker.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (dropped.get() > 0) {
            log.warn("Dropped {} progress events", dropped.get());
        }
    }
}
