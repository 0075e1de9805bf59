package com.eventwatch.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Watch engine defaults. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "eventwatch.watch")
@NoArgsConstructor
@Getter
@Setter
public class WatchProperties {

    /** Polling interval used when a subscription does not set one. Default 4000. */
    private long pollingIntervalMs = 4_000L;

    /** Threads shared by all watch poll loops. Default 4. */
    private int schedulerPoolSize = 4;
}
