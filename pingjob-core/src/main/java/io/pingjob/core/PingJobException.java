package io.pingjob.core;

/**
 * Root of every failure raised by the Automator and its collaborators.
 *
 * <p>Carries the id of the job being operated on when one is known, so callers can
 * tell which job a failed step belonged to.
 */
public class PingJobException extends RuntimeException {

    private final String jobId;

    public PingJobException(String message) {
        this(message, null, null);
    }

    public PingJobException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public PingJobException(String message, String jobId, Throwable cause) {
        super(jobId == null ? message : message + " id=" + jobId, cause);
        this.jobId = jobId;
    }

    /**
     * Id of the affected job, or {@code null} when the failure is not tied to one.
     */
    public String jobId() {
        return jobId;
    }
}
