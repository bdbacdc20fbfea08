package io.pingjob;

import io.pingjob.core.JobConfig;
import io.pingjob.core.Task;

import java.util.List;
import java.util.UUID;

/**
 * Main API for recurring HTTP ping jobs.
 *
 * <p>Keeps two places consistent: the live, in-memory {@link JobScheduler} and the durable
 * {@link JobStore} holding each job's encrypted definition. The store is authoritative; a
 * periodic reconciliation pass re-registers any stored job the scheduler has lost, e.g. after
 * a restart.
 *
 * <p>Typical usage:
 * <pre>{@code
 * automator.start();
 *
 * UUID id = automator.createNewJob("0 * * * * *", Task.of("http://svc/ping", Duration.ofSeconds(5)));
 * JobConfig config = automator.getJob(id);
 * automator.deleteJob(id);
 *
 * automator.stop();
 * }</pre>
 *
 * <p>Operations are not isolated from each other. Each call orders its own steps and
 * compensates its own partial failures, nothing more.
 */
public interface Automator {

    /**
     * Start the scheduler and the reconciliation loop. Idempotent, and allowed again after
     * {@link #stop()}. A failed start leaves the Automator stopped.
     */
    void start();

    /**
     * Stop reconciling and stop the scheduler. In-flight probes are not awaited. Idempotent.
     */
    void stop();

    /**
     * Whether {@link #start()} has completed and {@link #stop()} has not been called since.
     */
    boolean isRunning();

    /**
     * Schedule and persist a new job.
     *
     * @return the generated job id
     * @throws io.pingjob.core.EncryptionException     the definition could not be encrypted
     * @throws io.pingjob.core.InvalidSchemeException  the auth scheme is not supported
     * @throws io.pingjob.core.SchedulingException     the scheduler rejected the job, e.g. a malformed cron expression
     * @throws io.pingjob.core.BackingStoreException   persisting failed; the schedule entry was removed again
     * @throws io.pingjob.core.OrphanedScheduleException persisting failed and the schedule entry could not be removed
     */
    UUID createNewJob(String cronExpression, Task task);

    /**
     * Unschedule a job, then delete its record and its index entry.
     *
     * @throws io.pingjob.core.SchedulingException   no schedule entry with this id, or removal failed
     * @throws io.pingjob.core.BackingStoreException deleting the record or index entry failed
     */
    void deleteJob(UUID id);

    /**
     * Read and decrypt a stored job.
     *
     * @throws io.pingjob.core.JobNotFoundException  no record for this id
     * @throws io.pingjob.core.BackingStoreException the store failed
     * @throws io.pingjob.core.DecryptionException   the record could not be decrypted
     */
    JobConfig getJob(UUID id);

    /**
     * Jobs currently registered with the scheduler that have a stored record.
     *
     * <p>Best-effort listing: tags and records are read at slightly different moments.
     */
    List<JobConfig> getRunningJobs();
}
