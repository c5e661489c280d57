package com.adlanda.perema.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Application-wide beans.
 *
 * Scheduling is enabled here; the daily jobs live in {@code DailyJobScheduler}.
 * Every "today" in the application comes from the {@link Clock} bean so tests
 * can pin the date.
 */
@Configuration
@EnableScheduling
public class PeremaConfig {

    @Bean
    public Clock clock(JobProperties jobProperties) {
        return Clock.system(ZoneId.of(jobProperties.getZone()));
    }
}
