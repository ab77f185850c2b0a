package com.schoolhub.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the shared clock. Announcement windows are evaluated against the calendar date of this
 * clock, so the zone decides when "today" rolls over.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock schoolClock(@Value("${app.time-zone:UTC}") String zoneId) {
        return Clock.system(ZoneId.of(zoneId));
    }
}
