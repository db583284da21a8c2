package io.surfworks.entitlement.lifecycle;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic license revalidation.
 *
 * <p>Each run takes the {@link JobLock} with a short timeout and skips
 * quietly when another run holds it. Runs never throw: every failure is
 * logged and reported as {@link Outcome#FAILED}.
 */
public class RevalidationJob implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(RevalidationJob.class.getName());

    public static final Duration DEFAULT_INTERVAL = Duration.ofHours(6);
    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(2);

    public enum Outcome {
        VALIDATED,
        SKIPPED_LOCKED,
        SKIPPED_NO_KEY,
        FAILED
    }

    private final LicenseController controller;
    private final JobLock lock;
    private final Duration interval;
    private final Duration lockTimeout;

    private ScheduledExecutorService ownedExecutor;
    private ScheduledFuture<?> scheduled;

    public RevalidationJob(LicenseController controller, JobLock lock) {
        this(controller, lock, DEFAULT_INTERVAL, DEFAULT_LOCK_TIMEOUT);
    }

    public RevalidationJob(LicenseController controller, JobLock lock, Duration interval, Duration lockTimeout) {
        this.controller = controller;
        this.lock = lock;
        this.interval = interval;
        this.lockTimeout = lockTimeout;
    }

    /**
     * Perform a single guarded revalidation.
     */
    public Outcome runOnce() {
        LOG.info("auto-validate: start");
        Optional<JobLock.Lease> lease;
        try {
            lease = lock.tryLock(lockTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warning("auto-validate: interrupted while waiting for lock");
            return Outcome.FAILED;
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.SEVERE, "auto-validate: lock unavailable", e);
            return Outcome.FAILED;
        }

        if (lease.isEmpty()) {
            LOG.info("auto-validate: skipped (another run is in progress)");
            return Outcome.SKIPPED_LOCKED;
        }

        try (JobLock.Lease held = lease.get()) {
            String key = controller.currentState().getLicenseKey();
            if (key.isBlank()) {
                LOG.warning("auto-validate: no license key set; skipping");
                return Outcome.SKIPPED_NO_KEY;
            }
            controller.validate(key);
            LOG.info("auto-validate: OK status=" + controller.currentState().getStatus());
            return Outcome.VALIDATED;
        } catch (LicenseOperationException e) {
            LOG.log(Level.WARNING, "auto-validate: failed: " + e.getMessage(), e);
            return Outcome.FAILED;
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "auto-validate: failed unexpectedly", e);
            return Outcome.FAILED;
        }
    }

    /**
     * Schedule runs with a fixed delay on the given executor.
     */
    public synchronized void start(ScheduledExecutorService executor) {
        if (scheduled != null) {
            throw new IllegalStateException("Revalidation job already started");
        }
        long millis = interval.toMillis();
        scheduled = executor.scheduleWithFixedDelay(this::runOnce, millis, millis, TimeUnit.MILLISECONDS);
        LOG.info("auto-validate scheduled every " + interval);
    }

    /**
     * Schedule runs on a private daemon thread.
     */
    public synchronized void start() {
        if (scheduled != null) {
            throw new IllegalStateException("Revalidation job already started");
        }
        ownedExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "entitlement-revalidation");
            t.setDaemon(true);
            return t;
        });
        start(ownedExecutor);
    }

    @Override
    public synchronized void close() {
        if (scheduled != null) {
            scheduled.cancel(false);
            scheduled = null;
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
            ownedExecutor = null;
        }
    }
}
