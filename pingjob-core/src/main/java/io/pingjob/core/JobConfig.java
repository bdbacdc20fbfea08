package io.pingjob.core;

import java.util.Objects;
import java.util.UUID;

/**
 * Durable unit of work: a probe and the cron expression it fires on.
 *
 * <p>The id is assigned once at creation and doubles as the scheduler tag and the store key.
 */
public record JobConfig(
        String cronExpression,
        UUID id,
        Task task
) {
    public JobConfig {
        Objects.requireNonNull(cronExpression, "cronExpression must not be null");
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(task, "task must not be null");
    }

    public String tag() {
        return id.toString();
    }
}
