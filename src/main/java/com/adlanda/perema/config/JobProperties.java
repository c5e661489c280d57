package com.adlanda.perema.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the daily notification jobs.
 *
 * Maps to properties prefixed with 'perema.jobs' in application.properties.
 * The cron expression itself is read by the scheduler annotation directly.
 */
@Component
@ConfigurationProperties(prefix = "perema.jobs")
public class JobProperties {

    /**
     * Whether the daily birthday and reminder jobs run.
     * When false, the scheduler still fires but does nothing (useful for testing).
     */
    private boolean enabled = true;

    /**
     * Spring cron expression for the daily run.
     */
    private String cron = "0 0 8 * * *";

    /**
     * Time zone that defines "today" for birthdays and due reminders.
     */
    private String zone = "UTC";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }
}
