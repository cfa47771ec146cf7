package com.forenx.sentinel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for ForenX Sentinel.
 *
 * Sentinel normalizes web server access logs, enriches them with geo and user-agent
 * attributes, runs signature and behavioral threat detection, coalesces the resulting
 * alerts and keeps time-bucketed traffic metrics for querying.
 *
 * Key Features:
 * - Apache/nginx common, combined, extended and JSON log formats
 * - SQL injection, XSS and path traversal signatures
 * - Brute force, DoS and data exfiltration detection over sliding windows
 * - Hour/day/week/month metrics with top-N by client, endpoint, user agent and status
 * - Live Server-Sent Events stream of records and alerts
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class SentinelApplication {

    /**
     * Main entry point for the Sentinel service.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(SentinelApplication.class, args);
    }
}
