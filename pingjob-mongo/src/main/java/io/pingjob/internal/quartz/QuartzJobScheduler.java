package io.pingjob.internal.quartz;

import io.pingjob.JobScheduler;
import io.pingjob.core.SchedulingException;
import io.pingjob.utils.CronExpressions;
import org.quartz.CronExpression;
import org.quartz.CronScheduleBuilder;
import org.quartz.Job;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.quartz.impl.StdSchedulerFactory;
import org.quartz.impl.matchers.GroupMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;

/**
 * {@link JobScheduler} backed by an in-memory Quartz scheduler ({@code RAMJobStore}).
 *
 * <p>Each tag maps to one Quartz job in group {@value #GROUP}. Schedule state lives only in
 * this process and is gone after a restart; the reconciler rebuilds it from the store.
 */
public class QuartzJobScheduler implements JobScheduler, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QuartzJobScheduler.class);

    static final String GROUP = "pingjob";
    static final String RUNNABLE_KEY = "runnable";

    private final Scheduler scheduler;
    private final ZoneId zone;

    public QuartzJobScheduler(Scheduler scheduler, ZoneId zone) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    /**
     * Build a standalone RAM-backed Quartz scheduler. The instance name gets a random suffix
     * so several instances can live in one JVM.
     */
    public static QuartzJobScheduler create(String name, int threadCount, ZoneId zone) {
        if (threadCount <= 0) {
            throw new IllegalArgumentException("threadCount must be positive");
        }
        Properties props = new Properties();
        props.setProperty(StdSchedulerFactory.PROP_SCHED_INSTANCE_NAME, name + "-" + UUID.randomUUID());
        props.setProperty(StdSchedulerFactory.PROP_JOB_STORE_CLASS, "org.quartz.simpl.RAMJobStore");
        props.setProperty(StdSchedulerFactory.PROP_THREAD_POOL_CLASS, "org.quartz.simpl.SimpleThreadPool");
        props.setProperty("org.quartz.threadPool.threadCount", String.valueOf(threadCount));
        props.setProperty("org.quartz.threadPool.threadNamePrefix", name + ".worker");
        props.setProperty("org.quartz.threadPool.makeThreadsDaemons", "true");
        try {
            return new QuartzJobScheduler(new StdSchedulerFactory(props).getScheduler(), zone);
        } catch (SchedulerException e) {
            throw new SchedulingException("error creating quartz scheduler", e);
        }
    }

    @Override
    public void register(String cronExpression, String tag, Runnable job) {
        Objects.requireNonNull(tag, "tag must not be null");
        Objects.requireNonNull(job, "job must not be null");

        CronExpression cron;
        try {
            cron = CronExpressions.parse(cronExpression, zone);
        } catch (IllegalArgumentException e) {
            throw new SchedulingException("error scheduling job: " + e.getMessage(), tag, e);
        }

        JobDataMap data = new JobDataMap();
        data.put(RUNNABLE_KEY, job);

        JobKey key = JobKey.jobKey(tag, GROUP);
        JobDetail detail = JobBuilder.newJob(RunnableJob.class)
                .withIdentity(key)
                .usingJobData(data)
                .build();

        Trigger trigger = TriggerBuilder.newTrigger()
                .withIdentity(tag, GROUP)
                .forJob(key)
                .withSchedule(CronScheduleBuilder.cronSchedule(cron).withMisfireHandlingInstructionDoNothing())
                .build();

        try {
            scheduler.scheduleJob(detail, Set.of(trigger), true);
        } catch (SchedulerException e) {
            throw new SchedulingException("error scheduling job", tag, e);
        }
        log.debug("registered job tag={} cron={}", tag, cron.getCronExpression());
    }

    @Override
    public void removeByTag(String tag) {
        Objects.requireNonNull(tag, "tag must not be null");
        boolean removed;
        try {
            removed = scheduler.deleteJob(JobKey.jobKey(tag, GROUP));
        } catch (SchedulerException e) {
            throw new SchedulingException("error removing job from scheduler", tag, e);
        }
        if (!removed) {
            throw new SchedulingException("no scheduled job with tag", tag, null);
        }
        log.debug("removed job tag={}", tag);
    }

    @Override
    public Set<String> listActiveTags() {
        try {
            Set<String> tags = new LinkedHashSet<>();
            for (JobKey key : scheduler.getJobKeys(GroupMatcher.jobGroupEquals(GROUP))) {
                tags.add(key.getName());
            }
            return Collections.unmodifiableSet(tags);
        } catch (SchedulerException e) {
            throw new SchedulingException("error listing scheduled jobs", e);
        }
    }

    @Override
    public void start() {
        try {
            scheduler.start();
            log.info("Quartz scheduler started name={} zone={}", scheduler.getSchedulerName(), zone);
        } catch (SchedulerException e) {
            throw new SchedulingException("error starting scheduler", e);
        }
    }

    /**
     * Pause firing without waiting for running probes. Registered jobs are kept and
     * {@link #start()} resumes them.
     */
    @Override
    public void stop() {
        try {
            if (!scheduler.isShutdown() && !scheduler.isInStandbyMode()) {
                scheduler.standby();
                log.info("Quartz scheduler in standby name={}", scheduler.getSchedulerName());
            }
        } catch (SchedulerException e) {
            throw new SchedulingException("error stopping scheduler", e);
        }
    }

    /**
     * Release the Quartz threads. The scheduler cannot be started again afterwards.
     */
    @Override
    public void close() {
        try {
            if (!scheduler.isShutdown()) {
                scheduler.shutdown(false);
                log.info("Quartz scheduler shut down.");
            }
        } catch (SchedulerException e) {
            throw new SchedulingException("error shutting down scheduler", e);
        }
    }

    /**
     * Quartz entry point; runs the {@link Runnable} registered for the tag.
     */
    public static class RunnableJob implements Job {

        @Override
        public void execute(JobExecutionContext context) throws JobExecutionException {
            Object runnable = context.getMergedJobDataMap().get(RUNNABLE_KEY);
            if (!(runnable instanceof Runnable r)) {
                throw new JobExecutionException("no runnable bound to job " + context.getJobDetail().getKey());
            }
            try {
                r.run();
            } catch (RuntimeException e) {
                throw new JobExecutionException(e, false);
            }
        }
    }
}
