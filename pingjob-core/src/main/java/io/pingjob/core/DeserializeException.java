package io.pingjob.core;

public class DeserializeException extends DecryptionException {

    public DeserializeException(String message, Throwable cause) {
        super(message, cause);
    }
}
