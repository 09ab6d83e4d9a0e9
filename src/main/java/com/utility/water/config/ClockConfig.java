package com.utility.water.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wall clock used for hour truncation and calendar-day windows.
 * Zone defaults to the JVM zone unless {@code water.zone} is set.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${water.zone:}") String zone) {
        if (zone == null || zone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(zone));
    }
}
