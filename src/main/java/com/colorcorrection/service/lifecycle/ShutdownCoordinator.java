package com.colorcorrection.service.lifecycle;

import com.colorcorrection.service.batch.BatchState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Graceful shutdown, reached two ways:
 * <ul>
 *   <li>explicit: {@link #requestShutdown()} (the shutdown endpoint). Runs on
 *       its own thread, waits up to 30s for the active batch, releases
 *       resources, then ends the process.</li>
 *   <li>signal: SIGINT/SIGTERM close the Spring context, which lands in
 *       {@link #onSignal()}. Waits up to 10s, releases resources and lets the
 *       JVM finish exiting.</li>
 * </ul>
 * Resources are released at most once whichever path gets there first, and
 * the process is terminated at most once.
 */
@Component
@Slf4j
public class ShutdownCoordinator {

    private final BatchState batchState;
    private final List<ReleasableResource> resources;
    private final ProcessTerminator terminator;
    private final Duration apiDrain;
    private final Duration signalDrain;
    private final long pollMillis;

    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private final AtomicBoolean signalReceived = new AtomicBoolean(false);
    private final AtomicBoolean released = new AtomicBoolean(false);
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    @Autowired
    public ShutdownCoordinator(
            BatchState batchState,
            List<ReleasableResource> resources,
            ProcessTerminator terminator,
            @Value("${app.shutdown.api-drain-seconds:30}") long apiDrainSeconds,
            @Value("${app.shutdown.signal-drain-seconds:10}") long signalDrainSeconds,
            @Value("${app.shutdown.poll-millis:500}") long pollMillis) {
        this(batchState, resources, terminator,
                Duration.ofSeconds(apiDrainSeconds), Duration.ofSeconds(signalDrainSeconds), pollMillis);
    }

    ShutdownCoordinator(
            BatchState batchState,
            List<ReleasableResource> resources,
            ProcessTerminator terminator,
            Duration apiDrain,
            Duration signalDrain,
            long pollMillis) {
        this.batchState = batchState;
        this.resources = List.copyOf(resources);
        this.terminator = terminator;
        this.apiDrain = apiDrain;
        this.signalDrain = signalDrain;
        this.pollMillis = Math.max(1, pollMillis);
    }

    /**
     * Starts the explicit shutdown sequence in the background.
     *
     * @return false if a shutdown was already requested
     */
    public boolean requestShutdown() {
        if (!shutdownRequested.compareAndSet(false, true)) {
            log.info("Shutdown already in progress");
            return false;
        }
        log.info("Shutdown requested via API");
        Thread thread = new Thread(this::runExplicitShutdown, "cc-shutdown");
        thread.start();
        return true;
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        onSignal();
    }

    /**
     * Signal path. Does not exit; the JVM is already on its way down.
     */
    public void onSignal() {
        if (signalReceived.compareAndSet(false, true)) {
            log.info("Received termination signal, shutting down gracefully");
        }
        drain(signalDrain);
        releaseResources();
    }

    void runExplicitShutdown() {
        drain(apiDrain);
        releaseResources();
        if (signalReceived.get()) {
            log.info("Context already closing, skipping explicit exit");
            return;
        }
        if (terminated.compareAndSet(false, true)) {
            terminator.terminate(0);
        }
    }

    /**
     * Waits for the active batch to finish, up to {@code bound}.
     *
     * @return true if no batch is active any more
     */
    boolean drain(Duration bound) {
        if (!batchState.isActive()) {
            return true;
        }
        log.info("Waiting up to {}s for active batch to complete...", bound.toSeconds());
        long deadline = System.nanoTime() + bound.toNanos();
        while (batchState.isActive()) {
            long remainingMillis = (deadline - System.nanoTime()) / 1_000_000;
            if (remainingMillis <= 0) {
                log.warn("⚠ Batch still active after {}s, forcing shutdown", bound.toSeconds());
                return false;
            }
            try {
                Thread.sleep(Math.min(pollMillis, remainingMillis));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for batch, continuing shutdown");
                return false;
            }
        }
        log.info("Batch processing completed");
        return true;
    }

    /**
     * @return true if this call released the resources, false if they were released already
     */
    boolean releaseResources() {
        if (!released.compareAndSet(false, true)) {
            log.debug("Resources already released");
            return false;
        }
        log.info("Releasing {} resources", resources.size());
        for (ReleasableResource resource : resources) {
            try {
                resource.release();
                log.info("✓ Released {}", resource.resourceName());
            } catch (Exception e) {
                log.error("⚠ Failed to release {}: {}", resource.resourceName(), e.getMessage(), e);
            }
        }
        return true;
    }

    public boolean isShutdownRequested() {
        return shutdownRequested.get();
    }
}
