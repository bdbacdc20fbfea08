package io.pingjob.core;

/**
 * Authorization header sent with each probe.
 *
 * @param scheme     one of {@code Bearer}, {@code Basic}, {@code Digest}; empty or null sends no header
 * @param parameters credentials appended after the scheme
 */
public record AuthHeader(
        String scheme,
        String parameters
) {

    public static AuthHeader none() {
        return new AuthHeader("", "");
    }

    public boolean hasScheme() {
        return scheme != null && !scheme.isEmpty();
    }

    /**
     * Fails with {@link InvalidSchemeException} for any scheme other than the supported ones.
     */
    public void validate() {
        if (hasScheme()) {
            AuthScheme.of(scheme);
        }
    }

    /**
     * Value of the {@code Authorization} header, e.g. {@code "Bearer abc"}.
     */
    public String headerValue() {
        AuthScheme s = AuthScheme.of(scheme);
        return s.value() + " " + (parameters == null ? "" : parameters);
    }
}
