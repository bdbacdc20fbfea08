package io.pingjob.internal;

import io.pingjob.JobScheduler;
import io.pingjob.JobStore;
import io.pingjob.core.JobConfig;
import io.pingjob.core.JobNotFoundException;
import io.pingjob.utils.DriftDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically re-registers jobs that are in the durable job set but not in the scheduler.
 *
 * <p>Scheduler state is in-memory and empty after a restart; the store is authoritative.
 * Each pass computes {@code indexed - active} and registers the difference exactly as
 * creation does. A job is never removed for being out of sync.
 */
public class Reconciler {
    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final DefaultAutomator automator;
    private final JobStore store;
    private final JobScheduler scheduler;
    private final String jobSetName;
    private final Duration interval;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private ScheduledExecutorService ticker;

    Reconciler(DefaultAutomator automator, JobStore store, JobScheduler scheduler, String jobSetName, Duration interval) {
        this.automator = Objects.requireNonNull(automator, "automator must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.jobSetName = Objects.requireNonNull(jobSetName, "jobSetName must not be null");
        this.interval = Objects.requireNonNull(interval, "reconcile interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("reconcile interval must be a positive duration");
        }
    }

    /**
     * First pass runs immediately, then every interval after the previous pass finished.
     */
    synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("pingjob.reconciler");
            t.setDaemon(true);
            return t;
        });
        ticker.scheduleWithFixedDelay(this::tick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Reconciler started every={}", interval);
    }

    synchronized void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        ticker.shutdownNow();
        ticker = null;
        log.info("reconciling of jobs stopped");
    }

    boolean isRunning() {
        return started.get();
    }

    private void tick() {
        try {
            reconcileOnce();
        } catch (RuntimeException e) {
            // A thrown exception would cancel the periodic task.
            log.error("reconcile pass failed msg={}", e.getMessage(), e);
        }
    }

    /**
     * One reconciliation pass.
     *
     * @return number of jobs re-registered
     */
    public int reconcileOnce() {
        Set<String> indexed;
        try {
            indexed = store.getSet(jobSetName);
        } catch (RuntimeException e) {
            log.error("error getting job set set={} msg={}", jobSetName, e.getMessage());
            return 0;
        }

        Set<String> active = scheduler.listActiveTags();
        Set<String> missing = DriftDetector.computeMissing(indexed, active);
        if (missing.isEmpty()) {
            return 0;
        }
        log.info("missing jobs ids={}", missing);

        int restored = 0;
        for (String id : missing) {
            if (DefaultAutomator.parseId(id).isEmpty()) {
                log.warn("skipping malformed id in job set id={}", id);
                continue;
            }
            try {
                JobConfig config = automator.load(id);
                automator.register(config);
                restored++;
            } catch (JobNotFoundException e) {
                log.warn("job set entry has no record id={}", id);
            } catch (RuntimeException e) {
                log.error("error restoring job id={} msg={}", id, e.getMessage());
            }
        }
        log.info("reconciled jobs restored={} missing={}", restored, missing.size());
        return restored;
    }
}
