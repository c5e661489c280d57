package com.adlanda.perema.health;

import com.adlanda.perema.job.JobRunSummary;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Health indicator for the daily notification jobs.
 *
 * Reports the last run of each job, including:
 * - When it ran
 * - Mails sent and failed
 * - Error details if the job itself crashed
 *
 * UNKNOWN until the first run, DOWN while the latest run of any job crashed.
 * Individual failed mails are reported but keep the status UP.
 */
@Component
public class JobHealthIndicator implements HealthIndicator {

    private final Map<String, JobState> states = new ConcurrentHashMap<>();
    private final Clock clock;

    public JobHealthIndicator(Clock clock) {
        this.clock = clock;
    }

    public void markCompleted(JobRunSummary summary) {
        states.put(summary.job(), new JobState(true, summary, null, Instant.now(clock)));
    }

    public void markFailed(String job, String error) {
        states.put(job, new JobState(false, null, error, Instant.now(clock)));
    }

    @Override
    public Health health() {
        if (states.isEmpty()) {
            return Health.unknown()
                    .withDetail("lastRun", "never")
                    .build();
        }

        boolean allHealthy = true;
        Map<String, Object> details = new LinkedHashMap<>();
        for (Map.Entry<String, JobState> entry : new TreeMap<>(states).entrySet()) {
            JobState state = entry.getValue();
            Map<String, Object> jobDetails = new LinkedHashMap<>();
            jobDetails.put("lastRun", state.timestamp().toString());
            if (state.healthy()) {
                jobDetails.put("sent", state.summary().sent());
                jobDetails.put("failed", state.summary().failed());
            } else {
                allHealthy = false;
                jobDetails.put("error", state.error() != null ? state.error() : "unknown error");
            }
            details.put(entry.getKey(), jobDetails);
        }

        Health.Builder builder = allHealthy ? Health.up() : Health.down();
        return builder.withDetails(details).build();
    }

    /**
     * Internal state holder for thread-safe health updates.
     */
    private record JobState(
            boolean healthy,
            JobRunSummary summary,
            String error,
            Instant timestamp
    ) {}
}
