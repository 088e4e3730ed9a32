package com.dcruver.alerttriage.config;

import com.dcruver.alerttriage.domain.clustering.ClusteringResultCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;

/**
 * Clock and clustering cache wiring.
 * The cache schedules its cleanup on Boot's TaskScheduler (available through
 * {@code @EnableScheduling}) when created and cancels it when the context closes.
 */
@Configuration
public class ClusteringConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ClusteringResultCache clusteringResultCache(
            ObjectMapper objectMapper,
            Clock clock,
            TaskScheduler taskScheduler,
            @Value("${triage.clustering.cache-ttl:1h}") Duration ttl,
            @Value("${triage.clustering.cleanup-interval:10m}") Duration cleanupInterval) {
        return new ClusteringResultCache(objectMapper, clock, taskScheduler, ttl, cleanupInterval);
    }
}
