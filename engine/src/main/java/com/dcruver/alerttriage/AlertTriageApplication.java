package com.dcruver.alerttriage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the alert triage engine.
 *
 * Decides whether an incoming security alert duplicates an open alert and should
 * join its thread, and groups unbound alerts into density-based clusters for bulk
 * triage. Operated through the Spring Shell commands in {@code app}.
 */
@SpringBootApplication
@EnableScheduling
@Slf4j
public class AlertTriageApplication {

    public static void main(String[] args) {
        log.info("Starting Alert Triage...");
        SpringApplication.run(AlertTriageApplication.class, args);
    }
}
