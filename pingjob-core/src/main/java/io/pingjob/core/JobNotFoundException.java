package io.pingjob.core;

/**
 * No record exists for the requested key. This is an expected outcome, not an infrastructure fault.
 */
public class JobNotFoundException extends PingJobException {

    public JobNotFoundException(String key) {
        super("job not found", key, null);
    }
}
