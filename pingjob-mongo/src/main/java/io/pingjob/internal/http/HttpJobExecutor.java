package io.pingjob.internal.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pingjob.JobExecutor;
import io.pingjob.core.AuthHeader;
import io.pingjob.core.JobConfig;
import io.pingjob.core.ProbeResult;
import io.pingjob.core.Task;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Probes a job's URL with a GET request.
 *
 * <p>One call per cron firing, bounded as a whole (connect, headers and body) by the task's
 * timeout. Network failures are logged and returned, never thrown, so a failed firing leaves
 * the job scheduled. JSON response bodies are decoded for logging only.
 */
public class HttpJobExecutor implements JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(HttpJobExecutor.class);

    // Bodies are only decoded for logging; anything longer is cut off.
    static final int MAX_BODY_CHARS = 64 * 1024;

    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration defaultTimeout;

    public HttpJobExecutor(CloseableHttpClient httpClient, ObjectMapper objectMapper, Duration defaultTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout must not be null");
        if (defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultTimeout must be a positive duration");
        }
    }

    /**
     * Pooled client whose connect timeout is {@code connectTimeout}; per-request timeouts come from each task.
     */
    public static CloseableHttpClient defaultClient(Duration connectTimeout) {
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(connectTimeout.toMillis()))
                .build();
        return HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(connectionConfig)
                        .build())
                .disableAutomaticRetries()
                .build();
    }

    @Override
    public ProbeResult execute(JobConfig job) {
        Objects.requireNonNull(job, "job must not be null");
        Task task = job.task();
        long start = System.nanoTime();

        HttpGet request;
        try {
            request = new HttpGet(task.url());
        } catch (IllegalArgumentException e) {
            log.error("job request invalid id={} url={} msg={}", job.id(), task.url(), e.getMessage());
            return ProbeResult.failed(e, elapsedSince(start));
        }

        Duration bound = timeoutFor(task);
        request.setConfig(requestConfig(Timeout.ofMilliseconds(bound.toMillis())));

        AuthHeader auth = task.authHeaderOrNone();
        if (auth.hasScheme()) {
            try {
                request.addHeader(HttpHeaders.AUTHORIZATION, auth.headerValue());
            } catch (RuntimeException e) {
                log.error("job auth header invalid id={} msg={}", job.id(), e.getMessage());
                return ProbeResult.failed(e, elapsedSince(start));
            }
        }

        // Socket timeouts only bound each read; the deadline bounds the whole exchange.
        CompletableFuture<Void> deadline = CompletableFuture.runAsync(
                request::cancel,
                CompletableFuture.delayedExecutor(bound.toMillis(), TimeUnit.MILLISECONDS));
        try {
            ProbeResult result = httpClient.execute(request, response -> toResult(job, response, start));
            log.info("job completed id={} status_code={} duration_ms={} body={}",
                    job.id(), result.statusCode(), result.duration().toMillis(), result.body());
            return result;
        } catch (Exception e) {
            Duration duration = elapsedSince(start);
            if (request.isCancelled()) {
                log.error("request timed out id={} url={} timeout_ms={} duration_ms={}",
                        job.id(), task.url(), bound.toMillis(), duration.toMillis());
                return ProbeResult.failed(new ProbeTimeoutException(bound, e), duration);
            }
            log.error("error making request id={} url={} duration_ms={} msg={}",
                    job.id(), task.url(), duration.toMillis(), e.getMessage());
            return ProbeResult.failed(e, duration);
        } finally {
            deadline.cancel(false);
        }
    }

    @SuppressWarnings("deprecation")
    private static RequestConfig requestConfig(Timeout timeout) {
        // Per-request connect timeout is deprecated in favour of ConnectionConfig, which is per pool.
        return RequestConfig.custom()
                .setConnectTimeout(timeout)
                .setConnectionRequestTimeout(timeout)
                .setResponseTimeout(timeout)
                .build();
    }

    private ProbeResult toResult(JobConfig job, ClassicHttpResponse response, long start) throws IOException, ParseException {
        int code = response.getCode();
        String body = response.getEntity() == null
                ? null
                : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8, MAX_BODY_CHARS);

        JsonNode decoded = null;
        if (body != null && !body.isEmpty() && isJson(response)) {
            try {
                decoded = objectMapper.readTree(body);
            } catch (JsonProcessingException e) {
                log.error("error decoding response id={} msg={}", job.id(), e.getOriginalMessage());
            }
        }
        return new ProbeResult(code, decoded, elapsedSince(start), null);
    }

    private Duration timeoutFor(Task task) {
        Duration t = task.timeout();
        return (t == null || t.isZero()) ? defaultTimeout : t;
    }

    private static boolean isJson(ClassicHttpResponse response) {
        Header header = response.getFirstHeader(HttpHeaders.CONTENT_TYPE);
        return header != null
                && header.getValue() != null
                && header.getValue().toLowerCase(Locale.ROOT).contains("application/json");
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
