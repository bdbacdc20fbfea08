package io.pingjob.core;

/**
 * Authorization schemes a probe may send. Matching is exact and case-sensitive.
 */
public enum AuthScheme {
    BEARER("Bearer"),
    BASIC("Basic"),
    DIGEST("Digest");

    private final String value;

    AuthScheme(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static AuthScheme of(String value) {
        for (AuthScheme scheme : values()) {
            if (scheme.value.equals(value)) {
                return scheme;
            }
        }
        throw new InvalidSchemeException(value);
    }
}
