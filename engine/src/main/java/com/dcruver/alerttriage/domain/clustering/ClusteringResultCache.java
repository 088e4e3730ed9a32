package com.dcruver.alerttriage.domain.clustering;

import com.dcruver.alerttriage.domain.AlertCluster;
import com.dcruver.alerttriage.domain.ClusteringSummary;
import com.dcruver.alerttriage.domain.DbscanParams;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local cache of clustering summaries keyed by the serialized DBSCAN parameters.
 *
 * The key ignores the alert data on purpose: within one TTL, a repeated request with the
 * same parameters returns the summary computed first, even if alerts changed since.
 * Expired entries are invisible to readers and swept periodically on the application's
 * TaskScheduler.
 *
 * A cluster-id index is kept alongside the entries so a cluster can be resolved
 * without scanning every cached summary.
 */
@Slf4j
public class ClusteringResultCache implements AutoCloseable {

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TaskScheduler taskScheduler;
    private final Duration ttl;
    private final Duration cleanupInterval;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, CacheEntry> entries = new HashMap<>();
    // Cluster id -> cache keys; the same membership can appear under several parameter sets
    private final Map<String, Set<String>> clusterIndex = new HashMap<>();

    private ScheduledFuture<?> cleanupTask;

    public ClusteringResultCache(ObjectMapper objectMapper, Clock clock, TaskScheduler taskScheduler,
                                 Duration ttl, Duration cleanupInterval) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.taskScheduler = taskScheduler;
        this.ttl = ttl;
        this.cleanupInterval = cleanupInterval;
    }

    /**
     * Start the periodic sweep of expired entries.
     */
    @PostConstruct
    public synchronized void start() {
        if (cleanupTask != null) {
            return;
        }

        // First sweep one interval after start, then one interval after each sweep ends
        Instant firstRun = taskScheduler.getClock().instant().plus(cleanupInterval);
        cleanupTask = taskScheduler.scheduleWithFixedDelay(this::runCleanup, firstRun, cleanupInterval);

        log.info("Clustering cache started (ttl: {}, cleanup every {})", ttl, cleanupInterval);
    }

    /**
     * Cancel the sweep. The scheduler itself belongs to the application context.
     */
    @PreDestroy
    @Override
    public synchronized void close() {
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
            cleanupTask = null;
            log.info("Clustering cache cleanup stopped");
        }
    }

    /**
     * Look up a live summary. An expired entry is removed and reported as absent.
     */
    public Optional<ClusteringSummary> get(DbscanParams params) {
        String key = keyOf(params);
        Instant now = clock.instant();

        lock.readLock().lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                log.debug("Cache miss for {}: no entry", key);
                return Optional.empty();
            }
            if (now.isBefore(entry.getExpiresAt())) {
                log.debug("Cache hit for {}", key);
                return Optional.of(entry.getSummary());
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            // Re-check: a writer may have replaced the entry between the two locks
            CacheEntry entry = entries.get(key);
            if (entry != null && !now.isBefore(entry.getExpiresAt())) {
                removeEntry(key);
                log.debug("Cache miss for {}: entry expired at {}", key, entry.getExpiresAt());
                return Optional.empty();
            }
            return Optional.ofNullable(entry).map(CacheEntry::getSummary);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Store a summary for one TTL, replacing any previous entry for the same parameters.
     */
    public void put(DbscanParams params, ClusteringSummary summary) {
        String key = keyOf(params);
        CacheEntry entry = new CacheEntry(summary, clock.instant().plus(ttl));

        lock.writeLock().lock();
        try {
            removeEntry(key);
            entries.put(key, entry);
            for (AlertCluster cluster : summary.getClusters()) {
                clusterIndex.computeIfAbsent(cluster.getId(), id -> new HashSet<>()).add(key);
            }
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("Cached clustering summary for {} ({} clusters) until {}",
            key, summary.getClusters().size(), entry.getExpiresAt());
    }

    /**
     * Resolve a cluster id against the live entries.
     */
    public Optional<AlertCluster> findCluster(String clusterId) {
        Instant now = clock.instant();

        lock.readLock().lock();
        try {
            for (String key : clusterIndex.getOrDefault(clusterId, Set.of())) {
                CacheEntry entry = entries.get(key);
                if (entry == null || !now.isBefore(entry.getExpiresAt())) {
                    continue;
                }
                Optional<AlertCluster> cluster = entry.getSummary().getClusters().stream()
                    .filter(c -> c.getId().equals(clusterId))
                    .findFirst();
                if (cluster.isPresent()) {
                    return cluster;
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Remove every expired entry.
     *
     * @return number of entries removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;

        lock.writeLock().lock();
        try {
            List<String> expired = entries.entrySet().stream()
                .filter(e -> !now.isBefore(e.getValue().getExpiresAt()))
                .map(Map.Entry::getKey)
                .toList();
            for (String key : expired) {
                removeEntry(key);
                removed++;
            }
        } finally {
            lock.writeLock().unlock();
        }

        return removed;
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
            clusterIndex.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Cleared clustering cache");
    }

    public CacheStats getStats() {
        Instant now = clock.instant();
        CacheStats stats = new CacheStats();

        lock.readLock().lock();
        try {
            stats.setEntries(entries.size());
            stats.setExpiredEntries((int) entries.values().stream()
                .filter(entry -> !now.isBefore(entry.getExpiresAt()))
                .count());
            stats.setIndexedClusters(clusterIndex.size());
        } finally {
            lock.readLock().unlock();
        }

        stats.setTtl(ttl);
        stats.setCleanupInterval(cleanupInterval);
        synchronized (this) {
            stats.setCleanupRunning(cleanupTask != null);
        }
        return stats;
    }

    /**
     * Cache key: the JSON form of the parameters.
     */
    String keyOf(DbscanParams params) {
        try {
            return objectMapper.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize clustering parameters " + params, e);
        }
    }

    private void runCleanup() {
        try {
            int removed = evictExpired();
            if (removed > 0) {
                log.info("Evicted {} expired clustering results", removed);
            }
        } catch (RuntimeException e) {
            log.error("Clustering cache cleanup failed", e);
        }
    }

    // Caller holds the write lock
    private void removeEntry(String key) {
        CacheEntry removed = entries.remove(key);
        if (removed == null) {
            return;
        }
        for (AlertCluster cluster : removed.getSummary().getClusters()) {
            Set<String> keys = clusterIndex.get(cluster.getId());
            if (keys != null) {
                keys.remove(key);
                if (keys.isEmpty()) {
                    clusterIndex.remove(cluster.getId());
                }
            }
        }
    }

    /**
     * Cached summary with its expiry.
     */
    @Data
    static class CacheEntry {
        private final ClusteringSummary summary;
        private final Instant expiresAt;
    }

    /**
     * Cache statistics.
     */
    @Data
    public static class CacheStats {
        private int entries;
        private int expiredEntries;
        private int indexedClusters;
        private Duration ttl;
        private Duration cleanupInterval;
        private boolean cleanupRunning;
    }
}
