package io.pingjob.core;

/**
 * The stored record is not well-formed hex, or is too short to hold a nonce and tag.
 */
public class DecodeException extends DecryptionException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
