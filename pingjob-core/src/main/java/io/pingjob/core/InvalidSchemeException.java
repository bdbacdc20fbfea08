package io.pingjob.core;

public class InvalidSchemeException extends ValidationException {

    private final String scheme;

    public InvalidSchemeException(String scheme) {
        super("invalid authorization scheme: " + scheme);
        this.scheme = scheme;
    }

    public String scheme() {
        return scheme;
    }
}
