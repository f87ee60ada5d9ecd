package org.civicroute.engine.scheduler;

import org.civicroute.engine.cache.HandlingUnitRegistry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Refreshes the handling unit registry at a fixed interval.
 * Owned by the process lifecycle: started after the first load, stopped from the shutdown hook.
 */
public final class RegistryRefreshScheduler {

    private static final Logger LOG = Logger.getLogger(RegistryRefreshScheduler.class.getName());

    private final ScheduledExecutorService executor;
    private final HandlingUnitRegistry registry;
    private final Duration interval;
    private volatile boolean running = false;

    public RegistryRefreshScheduler(HandlingUnitRegistry registry, Duration interval) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(interval, "interval must not be null");

        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.interval = interval;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "registry-refresh");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the scheduler. The first run happens one interval from now.
     */
    public void start() {
        if (running) {
            LOG.warning("Registry refresh scheduler already running");
            return;
        }

        LOG.info(() -> "Starting registry refresh scheduler with interval: " + interval.getSeconds() + "s");

        executor.scheduleAtFixedRate(
                this::runRefreshCycle,
                interval.toMillis(), // Initial delay
                interval.toMillis(), // Period
                TimeUnit.MILLISECONDS
        );

        running = true;
    }

    /**
     * Stop the scheduler and cancel pending runs.
     */
    public void stop() {
        if (!running) {
            return;
        }

        LOG.info("Stopping registry refresh scheduler");
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    private void runRefreshCycle() {
        try {
            LOG.fine("Running registry refresh cycle");
            if (!registry.refresh()) {
                LOG.warning("Registry refresh cycle failed, serving previous snapshot");
            }
        } catch (RuntimeException e) {
            // an escaping exception would cancel all future runs
            LOG.log(Level.SEVERE, "Error in registry refresh cycle", e);
        }
    }
}
