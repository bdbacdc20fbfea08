package io.pingjob;

import java.util.Set;

/**
 * Volatile cron scheduler. Entries are identified by tag and lost when the process exits.
 *
 * <p>Implementations throw {@link io.pingjob.core.SchedulingException} on failure.
 */
public interface JobScheduler {

    /**
     * Run {@code job} on every occurrence of {@code cronExpression}. Registering a tag that
     * is already active replaces the existing entry.
     */
    void register(String cronExpression, String tag, Runnable job);

    /**
     * @throws io.pingjob.core.SchedulingException when no entry carries {@code tag}
     */
    void removeByTag(String tag);

    Set<String> listActiveTags();

    void start();

    void stop();
}
