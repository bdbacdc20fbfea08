package io.pingjob;

import io.pingjob.core.JobConfig;
import io.pingjob.core.ProbeResult;

/**
 * Executes one firing of a job. Stateless: everything it needs is in the {@link JobConfig}.
 *
 * <p>Failures are reported in the returned {@link ProbeResult}, never thrown. The next cron
 * firing is the only retry.
 */
public interface JobExecutor {

    ProbeResult execute(JobConfig job);
}
