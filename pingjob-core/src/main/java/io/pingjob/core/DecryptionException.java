package io.pingjob.core;

/**
 * Raised when a stored job record cannot be turned back into a {@link JobConfig}.
 */
public class DecryptionException extends PingJobException {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }

    public DecryptionException(String message, String jobId, Throwable cause) {
        super(message, jobId, cause);
    }
}
