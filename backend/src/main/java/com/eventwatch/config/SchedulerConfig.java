package com.eventwatch.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler pool shared by every watch poll loop. One loop per fingerprint, fixed delay between ticks.
 */
@Configuration
@EnableConfigurationProperties(WatchProperties.class)
public class SchedulerConfig {

    public static final String WATCH_SCHEDULER = "watch-scheduler";

    @Bean(name = WATCH_SCHEDULER)
    public ThreadPoolTaskScheduler watchScheduler(WatchProperties watchProperties) {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(Math.max(1, watchProperties.getSchedulerPoolSize()));
        s.setThreadNamePrefix("watch-");
        s.setRemoveOnCancelPolicy(true);
        s.initialize();
        return s;
    }
}
