package com.rabs.backend.global.common.time;

import java.time.Clock;

import com.rabs.backend.global.config.LoomProperties;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single clock source for every module. The zone decides what "today" means
 * for window calculation and where program times of day are anchored.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock loomClock(LoomProperties loomProperties) {
        return Clock.system(loomProperties.getTimeZone());
    }
}
