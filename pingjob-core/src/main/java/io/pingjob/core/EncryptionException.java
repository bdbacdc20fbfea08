package io.pingjob.core;

public class EncryptionException extends PingJobException {

    public EncryptionException(String message) {
        super(message);
    }

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }

    public EncryptionException(String message, String jobId, Throwable cause) {
        super(message, jobId, cause);
    }
}
