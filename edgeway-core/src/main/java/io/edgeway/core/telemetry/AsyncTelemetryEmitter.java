package io.edgeway.core.telemetry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class AsyncTelemetryEmitter implements TelemetryEmitter, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AsyncTelemetryEmitter.class);

    private final TelemetryEmitter delegate;
    private final ThreadPoolExecutor executor;
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public AsyncTelemetryEmitter(TelemetryEmitter delegate, int queueCapacity) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be > 0");
        }
        this.executor = new ThreadPoolExecutor(
            1,
            1,
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            runnable -> {
                Thread thread = new Thread(runnable, "edgeway-telemetry");
                thread.setDaemon(true);
                return thread;
            },
            (runnable, pool) -> {
                long total = dropped.incrementAndGet();
                if (total == 1 || total % 1000 == 0) {
                    LOG.warn("Telemetry queue full, {} events dropped so far", total);
                }
            }
        );
    }

    @Override
    public void recordEvent(String name, Map<String, Object> tags) {
        Map<String, Object> snapshot = tags == null ? Map.of() : new LinkedHashMap<>(tags);
        executor.execute(() -> deliver(name, snapshot));
    }

    public long droppedCount() {
        return dropped.get();
    }

    public long failedCount() {
        return failed.get();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void deliver(String name, Map<String, Object> tags) {
        try {
            delegate.recordEvent(name, tags);
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            LOG.warn("Telemetry delivery failed for {}: {}", name, e.getMessage());
        }
    }
}
