package io.edgeway.core.ws;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ScheduledHeartbeatScheduler implements HeartbeatScheduler {
    private static final Logger LOG = LoggerFactory.getLogger(ScheduledHeartbeatScheduler.class);

    private final ScheduledExecutorService scheduler;

    public ScheduledHeartbeatScheduler(ScheduledExecutorService scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    @Override
    public HeartbeatHandle start(String connectionId, Runnable tick, Duration interval) {
        Objects.requireNonNull(tick, "tick must not be null");
        long periodMs = Math.max(1L, interval.toMillis());
        ScheduledHeartbeat heartbeat = new ScheduledHeartbeat(connectionId, tick);
        heartbeat.future = scheduler.scheduleAtFixedRate(heartbeat::runTick, periodMs, periodMs, TimeUnit.MILLISECONDS);
        if (heartbeat.isCancelled()) {
            heartbeat.future.cancel(false);
        }
        return heartbeat;
    }

    private static final class ScheduledHeartbeat implements HeartbeatHandle {
        private final String connectionId;
        private final Runnable tick;
        private final ReentrantLock tickLock = new ReentrantLock();
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private volatile ScheduledFuture<?> future;

        private ScheduledHeartbeat(String connectionId, Runnable tick) {
            this.connectionId = connectionId;
            this.tick = tick;
        }

        private void runTick() {
            if (cancelled.get()) {
                return;
            }
            tickLock.lock();
            try {
                if (!cancelled.get()) {
                    tick.run();
                }
            } catch (RuntimeException e) {
                // An escaping exception would silently stop the fixed-rate schedule.
                LOG.warn("Heartbeat tick failed for connection {}", connectionId, e);
            } finally {
                tickLock.unlock();
            }
        }

        @Override
        public void cancel() {
            if (!cancelled.compareAndSet(false, true)) {
                return;
            }
            ScheduledFuture<?> scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
            tickLock.lock();
            tickLock.unlock();
            LOG.debug("Heartbeat cancelled for connection {}", connectionId);
        }

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }
    }
}
