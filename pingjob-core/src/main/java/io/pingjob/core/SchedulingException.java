package io.pingjob.core;

/**
 * Registering or removing a schedule entry failed, including cron expressions the scheduler refuses.
 */
public class SchedulingException extends PingJobException {

    public SchedulingException(String message) {
        super(message);
    }

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }

    public SchedulingException(String message, String jobId, Throwable cause) {
        super(message, jobId, cause);
    }
}
