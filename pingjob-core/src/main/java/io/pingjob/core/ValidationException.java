package io.pingjob.core;

/**
 * Raised when a job definition is rejected before anything is scheduled or stored.
 */
public class ValidationException extends PingJobException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ValidationException(String message, String jobId, Throwable cause) {
        super(message, jobId, cause);
    }
}
