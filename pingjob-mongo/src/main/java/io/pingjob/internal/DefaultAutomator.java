package io.pingjob.internal;

import io.pingjob.Automator;
import io.pingjob.JobExecutor;
import io.pingjob.JobScheduler;
import io.pingjob.JobStore;
import io.pingjob.codec.JobConfigCodec;
import io.pingjob.core.BackingStoreException;
import io.pingjob.core.DecryptionException;
import io.pingjob.core.JobConfig;
import io.pingjob.core.JobNotFoundException;
import io.pingjob.core.OrphanedScheduleException;
import io.pingjob.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default {@link Automator}: keeps the scheduler and the store in step for each job.
 *
 * <p>Create order: encrypt, validate, schedule, persist, index. A failed persist removes the
 * schedule entry again. Delete order: unschedule, delete record, de-index, so a job cannot
 * fire once its record is gone.
 */
public class DefaultAutomator implements Automator {
    private static final Logger log = LoggerFactory.getLogger(DefaultAutomator.class);

    private final JobStore store;
    private final JobScheduler scheduler;
    private final JobConfigCodec codec;
    private final JobExecutor executor;
    private final String jobSetName;
    private final Reconciler reconciler;

    private final AtomicBoolean started = new AtomicBoolean(false);

    public DefaultAutomator(JobStore store,
                            JobScheduler scheduler,
                            JobConfigCodec codec,
                            JobExecutor executor,
                            String jobSetName,
                            Duration reconcileEvery) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.jobSetName = Objects.requireNonNull(jobSetName, "jobSetName must not be null");
        if (jobSetName.isBlank()) {
            throw new IllegalArgumentException("jobSetName must not be blank");
        }
        this.reconciler = new Reconciler(this, store, scheduler, jobSetName, reconcileEvery);
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            scheduler.start();
            reconciler.start();
        } catch (RuntimeException e) {
            log.error("error starting automator msg={}", e.getMessage());
            reconciler.stop();
            try {
                scheduler.stop();
            } catch (RuntimeException stopFailure) {
                e.addSuppressed(stopFailure);
            }
            started.set(false);
            throw e;
        }
        log.info("Automator started jobSetName={}", jobSetName);
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        reconciler.stop();
        scheduler.stop();
        log.info("ticker and scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public UUID createNewJob(String cronExpression, Task task) {
        Objects.requireNonNull(task, "task must not be null");

        JobConfig config = new JobConfig(cronExpression, UUID.randomUUID(), task);
        String id = config.tag();

        String encrypted = codec.encrypt(config);

        register(config);

        try {
            store.insert(id, encrypted);
        } catch (RuntimeException insertFailure) {
            log.error("error inserting new job into store id={} msg={}", id, insertFailure.getMessage());
            try {
                scheduler.removeByTag(id);
            } catch (RuntimeException removeFailure) {
                log.error("error removing job after failed insert; schedule entry is orphaned id={} msg={}",
                        id, removeFailure.getMessage());
                throw new OrphanedScheduleException(id, removeFailure, insertFailure);
            }
            throw new BackingStoreException("error inserting new job into store", id, insertFailure);
        }

        try {
            store.addToSet(jobSetName, id);
        } catch (RuntimeException e) {
            // Job runs regardless; only reconciliation after a restart misses it.
            log.error("error updating job set id={} set={} msg={}", id, jobSetName, e.getMessage());
        }

        log.debug("created new job id={}", id);
        return config.id();
    }

    @Override
    public void deleteJob(UUID id) {
        Objects.requireNonNull(id, "id must not be null");
        String jobId = id.toString();

        scheduler.removeByTag(jobId);

        try {
            store.delete(jobId);
        } catch (RuntimeException e) {
            log.error("error removing job record id={} msg={}", jobId, e.getMessage());
            throw new BackingStoreException("error removing job record", jobId, e);
        }

        try {
            store.removeFromSet(jobSetName, jobId);
        } catch (RuntimeException e) {
            log.error("error removing job from job set id={} msg={}", jobId, e.getMessage());
            throw new BackingStoreException("error removing job from job set", jobId, e);
        }
        log.debug("deleted job id={}", jobId);
    }

    @Override
    public JobConfig getJob(UUID id) {
        Objects.requireNonNull(id, "id must not be null");
        return load(id.toString());
    }

    @Override
    public List<JobConfig> getRunningJobs() {
        List<JobConfig> configs = new ArrayList<>();
        for (String tag : scheduler.listActiveTags()) {
            if (parseId(tag).isEmpty()) {
                continue;
            }
            try {
                configs.add(load(tag));
            } catch (JobNotFoundException e) {
                log.debug("scheduled job has no record, skipping id={}", tag);
            }
        }
        return configs;
    }

    /**
     * Register the job with the scheduler. Shared by create and reconciliation so both
     * produce identical entries.
     */
    void register(JobConfig config) {
        config.task().authHeaderOrNone().validate();
        scheduler.register(config.cronExpression(), config.tag(), () -> executor.execute(config));
    }

    /**
     * Fetch and decrypt the record stored under {@code id}.
     */
    JobConfig load(String id) {
        String encrypted;
        try {
            encrypted = store.get(id);
        } catch (JobNotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("error retrieving job data id={} msg={}", id, e.getMessage());
            throw new BackingStoreException("error retrieving job data", id, e);
        }

        try {
            return codec.decrypt(encrypted);
        } catch (DecryptionException e) {
            log.error("error decrypting job data id={} msg={}", id, e.getMessage());
            throw new DecryptionException("error decrypting job data", id, e);
        }
    }

    /**
     * Strict parse: the tag must be the canonical string form of a UUID.
     */
    static Optional<UUID> parseId(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        try {
            UUID uuid = UUID.fromString(tag);
            return uuid.toString().equalsIgnoreCase(tag) ? Optional.of(uuid) : Optional.empty();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    Reconciler reconciler() {
        return reconciler;
    }
}
