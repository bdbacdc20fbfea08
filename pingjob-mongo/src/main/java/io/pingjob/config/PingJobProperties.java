package io.pingjob.config;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneId;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the ping job Automator.
 */
@ConfigurationProperties(prefix = "pingjob")
public class PingJobProperties {
    private boolean enabled = true;
    private String secretKey; // 32 bytes, UTF-8
    private Duration reconcileEvery = Duration.ofSeconds(10);
    private String jobSetName = "jobs_set";
    private String timezone = "UTC";
    private int workerThreads = 10; // quartz thread pool
    private Duration defaultProbeTimeout = Duration.ofSeconds(30);
    private String schedulerName = "pingjob";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getSecretKey() {
        return secretKey;
    }

    public void setSecretKey(String secretKey) {
        this.secretKey = secretKey;
    }

    /**
     * Secret key bytes, validated to be exactly 32 bytes long.
     */
    public byte[] secretKeyBytes() {
        if (secretKey == null || secretKey.isEmpty()) {
            throw new IllegalArgumentException("pingjob.secret-key must be set");
        }
        byte[] key = secretKey.getBytes(StandardCharsets.UTF_8);
        if (key.length != 32) {
            throw new IllegalArgumentException("pingjob.secret-key must be 32 bytes, got " + key.length);
        }
        return key;
    }

    public Duration getReconcileEvery() {
        return reconcileEvery;
    }

    public void setReconcileEvery(Duration reconcileEvery) {
        this.reconcileEvery = reconcileEvery;
    }

    public String getJobSetName() {
        return jobSetName;
    }

    public void setJobSetName(String jobSetName) {
        this.jobSetName = jobSetName;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public ZoneId zoneId() {
        return ZoneId.of(timezone == null || timezone.isBlank() ? "UTC" : timezone);
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public Duration getDefaultProbeTimeout() {
        return defaultProbeTimeout;
    }

    public void setDefaultProbeTimeout(Duration defaultProbeTimeout) {
        this.defaultProbeTimeout = defaultProbeTimeout;
    }

    public String getSchedulerName() {
        return schedulerName;
    }

    public void setSchedulerName(String schedulerName) {
        this.schedulerName = schedulerName;
    }
}
