package concierge.orchestrator.scheduler;

import concierge.orchestrator.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - BarrierReaper: releases barriers whose commis missed the deadline
 *
 * Uses a single-threaded executor to avoid concurrency issues.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final BarrierReaper barrierReaper;
    private final OrchestratorConfig config;

    private volatile boolean running = false;

    public Scheduler(BarrierReaper barrierReaper, OrchestratorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "concierge-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.barrierReaper = barrierReaper;
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = config.barrierReaperInterval().toMillis();
        executor.scheduleAtFixedRate(
                barrierReaper,
                intervalMs, // initial delay
                intervalMs, // interval
                TimeUnit.MILLISECONDS);
        log.info("Barrier reaper scheduled every {}ms (timeout {})", intervalMs, config.barrierTimeout());

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Get the barrier reaper for direct access (e.g., manual trigger).
     */
    public BarrierReaper barrierReaper() {
        return barrierReaper;
    }
}
