package com.nola.analytics.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AppConfig {

    /**
     * Clock used for report dates.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
