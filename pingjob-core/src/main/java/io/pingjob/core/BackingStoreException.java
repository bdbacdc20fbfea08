package io.pingjob.core;

/**
 * The durable store was unreachable or an operation on it failed.
 */
public class BackingStoreException extends PingJobException {

    public BackingStoreException(String message) {
        super(message);
    }

    public BackingStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public BackingStoreException(String message, String jobId, Throwable cause) {
        super(message, jobId, cause);
    }
}
