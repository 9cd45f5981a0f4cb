package io.sendshield.queue;

import io.sendshield.util.DaemonThreads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-threaded scheduler that drives {@link DispatchQueue#tick()} at a fixed delay, plus any
 * extra periodic tasks the runtime registers (health recompute, settings reload).
 *
 * <p>{@link #start()} and {@link #close()} are idempotent. A failing tick is logged and the
 * schedule continues.
 */
public final class DispatchLoop implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

    private final DispatchQueue queue;
    private final long intervalMs;
    private final AtomicLong ticks = new AtomicLong();
    private ScheduledExecutorService scheduler;
    private volatile boolean closed;

    public DispatchLoop(DispatchQueue queue, long intervalMs) {
        if (intervalMs < 1L) {
            throw new IllegalArgumentException("intervalMs must be >= 1");
        }
        this.queue = queue;
        this.intervalMs = intervalMs;
    }

    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("DispatchLoop has been closed");
        }
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(DaemonThreads.factory("sendshield-dispatch-"));
        scheduler.scheduleWithFixedDelay(this::runTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Dispatch loop started, interval={}ms", intervalMs);
    }

    /**
     * Runs {@code task} every {@code periodMs} on the loop thread once started.
     */
    public synchronized ScheduledFuture<?> every(String name, long periodMs, Runnable task) {
        if (scheduler == null) {
            throw new IllegalStateException("DispatchLoop not started");
        }
        return scheduler.scheduleWithFixedDelay(() -> {
            try {
                task.run();
            } catch (Throwable t) {
                log.error("Periodic task {} failed", name, t);
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    public boolean running() {
        return scheduler != null && !closed;
    }

    public long ticks() {
        return ticks.get();
    }

    void runTick() {
        if (closed) {
            return;
        }
        try {
            TickOutcome outcome = queue.tick();
            ticks.incrementAndGet();
            if (outcome.dispatched() > 0 || outcome.deferred() > 0) {
                log.debug("Tick dispatched={} deferred={} inFlightSkipped={}",
                        outcome.dispatched(), outcome.deferred(), outcome.skippedInFlight());
            }
        } catch (Throwable t) {
            log.error("Dispatch tick failed", t);
        }
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Dispatch loop stopped after {} ticks", ticks.get());
    }
}
