package com.nola.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Nola Analytics API
 *
 * Read-only analytics over the restaurant sales dataset.
 *
 * Architecture:
 * - REST APIs for dashboard filters and grouped aggregations
 * - Whitelisted metric/dimension tokens mapped to SQL fragments
 * - Redis cache-aside for filter lists and query results
 * - Unlimited CSV export with a metadata header
 */
@SpringBootApplication
public class NolaAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(NolaAnalyticsApplication.class, args);
    }
}
