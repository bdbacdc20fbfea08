package io.pingjob.core;

/**
 * A schedule entry is live but has no durable record, because persisting the record failed
 * and removing the entry afterwards failed too. Needs manual cleanup of the named tag.
 *
 * <p>The removal failure is the cause; the original store failure is attached as suppressed.
 */
public class OrphanedScheduleException extends PingJobException {

    public OrphanedScheduleException(String jobId, Throwable removalFailure, Throwable storeFailure) {
        super("job scheduled without a durable record, remove the schedule entry manually", jobId, removalFailure);
        if (storeFailure != null) {
            addSuppressed(storeFailure);
        }
    }
}
