package com.adlanda.perema.job;

import com.adlanda.perema.config.JobProperties;
import com.adlanda.perema.health.JobHealthIndicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Fires the birthday and due-reminder jobs once a day.
 *
 * Defaults to 08:00 UTC; override with {@code perema.jobs.cron} and
 * {@code perema.jobs.zone}. Each job runs independently so one failing does
 * not keep the other from running.
 */
@Component
public class DailyJobScheduler {

    private static final Logger log = LoggerFactory.getLogger(DailyJobScheduler.class);

    private final JobProperties jobProperties;
    private final BirthdayReminderJob birthdayReminderJob;
    private final DueReminderJob dueReminderJob;
    private final JobHealthIndicator healthIndicator;

    public DailyJobScheduler(JobProperties jobProperties,
                             BirthdayReminderJob birthdayReminderJob,
                             DueReminderJob dueReminderJob,
                             JobHealthIndicator healthIndicator) {
        this.jobProperties = jobProperties;
        this.birthdayReminderJob = birthdayReminderJob;
        this.dueReminderJob = dueReminderJob;
        this.healthIndicator = healthIndicator;
    }

    @Scheduled(cron = "${perema.jobs.cron:0 0 8 * * *}", zone = "${perema.jobs.zone:UTC}")
    public void runDailyJobs() {
        if (!jobProperties.isEnabled()) {
            log.debug("Daily jobs are disabled");
            return;
        }
        runJob(BirthdayReminderJob.NAME, birthdayReminderJob::run);
        runJob(DueReminderJob.NAME, dueReminderJob::run);
    }

    private void runJob(String name, Supplier<JobRunSummary> job) {
        try {
            healthIndicator.markCompleted(job.get());
        } catch (Exception e) {
            log.error("Job '{}' failed: {}", name, e.getMessage(), e);
            healthIndicator.markFailed(name, e.getMessage());
        }
    }
}
