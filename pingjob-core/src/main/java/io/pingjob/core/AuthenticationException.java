package io.pingjob.core;

/**
 * GCM tag verification failed: wrong key, or the record was altered.
 */
public class AuthenticationException extends DecryptionException {

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
