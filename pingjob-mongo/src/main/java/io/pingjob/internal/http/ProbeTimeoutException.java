package io.pingjob.internal.http;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * The probe did not complete within its task timeout and was cancelled.
 */
public class ProbeTimeoutException extends TimeoutException {

    public ProbeTimeoutException(Duration timeout, Throwable cause) {
        super("probe exceeded timeout of " + timeout.toMillis() + "ms");
        initCause(cause);
    }
}
