package com.dcruver.alerttriage.domain.query;

import com.dcruver.alerttriage.domain.Alert;
import com.dcruver.alerttriage.domain.AlertCluster;
import com.dcruver.alerttriage.domain.AlertTriageException;
import com.dcruver.alerttriage.domain.ClusterNotFoundException;
import com.dcruver.alerttriage.domain.ClusteringResult;
import com.dcruver.alerttriage.domain.ClusteringSummary;
import com.dcruver.alerttriage.domain.DbscanParams;
import com.dcruver.alerttriage.domain.clustering.ClusteringResultCache;
import com.dcruver.alerttriage.domain.clustering.DbscanClusteringEngine;
import com.dcruver.alerttriage.io.AlertRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Serves clustering results to browsing and triage callers.
 *
 * Summaries come from the cache; a miss clusters the current unbound alerts and
 * caches the result. Filtering and pagination never re-run clustering.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ClusterQueryService {

    private final AlertRepository alertRepository;
    private final DbscanClusteringEngine clusteringEngine;
    private final ClusteringResultCache cache;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ClusteringSummary getAlertClusters(ClusterQuery query) {
        if (query.getOffset() < 0) {
            throw new IllegalArgumentException("offset must not be negative, got " + query.getOffset());
        }

        DbscanParams params = query.getDbscanParams() == null
            ? DbscanParams.DEFAULT
            : query.getDbscanParams().orDefault();
        params.validate();

        ClusteringSummary summary = cache.get(params).orElseGet(() -> computeAndCache(params));

        String keyword = normalize(query.getKeyword());
        List<AlertCluster> filtered = new ArrayList<>();
        for (AlertCluster cluster : summary.getClusters()) {
            if (cluster.getSize() < query.getMinClusterSize()) {
                continue;
            }
            if (keyword != null && !clusterMatches(cluster, keyword)) {
                continue;
            }
            filtered.add(cluster);
        }

        return summary
            .withClusters(paginate(filtered, query.getOffset(), query.getLimit()))
            .withTotalCount(filtered.size());
    }

    public ClusterAlertsPage getClusterAlerts(String clusterId, String keyword, int limit, int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative, got " + offset);
        }

        AlertCluster cluster = cache.findCluster(clusterId)
            .orElseThrow(() -> new ClusterNotFoundException(clusterId));

        List<Alert> alerts;
        try {
            alerts = new ArrayList<>(alertRepository.batchGetAlerts(cluster.getAlertIds()));
        } catch (RuntimeException e) {
            throw new AlertTriageException("Failed to get alerts of cluster " + clusterId, e);
        }

        // Id order keeps pages stable between calls
        alerts.sort(Comparator.comparing(Alert::getId));

        String normalized = normalize(keyword);
        List<Alert> filtered = normalized == null
            ? alerts
            : alerts.stream().filter(a -> serializedData(a).contains(normalized)).toList();

        return new ClusterAlertsPage(paginate(filtered, offset, limit), filtered.size());
    }

    /**
     * Drop all cached summaries; the next query recomputes.
     */
    public void invalidate() {
        cache.clear();
    }

    private ClusteringSummary computeAndCache(DbscanParams params) {
        List<Alert> unbound;
        try {
            unbound = alertRepository.getAlertWithoutTicket(0, 0);
        } catch (RuntimeException e) {
            throw new AlertTriageException("Failed to get unbound alerts for clustering with " + params, e);
        }

        List<Alert> embedded = unbound.stream()
            .filter(a -> !a.isBound())
            .filter(Alert::hasEmbedding)
            .toList();

        ClusteringResult result = clusteringEngine.clusterAlerts(embedded, params);
        ClusteringSummary summary = ClusteringSummary.of(result, clock.instant());
        cache.put(params, summary);

        log.info("Computed {} clusters from {} unbound alerts for {}",
            result.clusters().size(), embedded.size(), params);
        return summary;
    }

    private boolean clusterMatches(AlertCluster cluster, String keyword) {
        Alert center;
        try {
            center = alertRepository.getAlert(cluster.getCenterAlertId())
                .orElseThrow(() -> new AlertTriageException(
                    "Center alert " + cluster.getCenterAlertId() + " of cluster " + cluster.getId() + " not found"));
        } catch (AlertTriageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AlertTriageException("Failed to get center alert for keyword search in cluster " + cluster.getId(), e);
        }

        if (serializedData(center).contains(keyword)) {
            return true;
        }
        return cluster.hasKeywords() && cluster.getKeywords().stream()
            .anyMatch(kw -> kw.toLowerCase(Locale.ROOT).contains(keyword));
    }

    /**
     * Lower-cased JSON of the alert data, empty when there is none.
     */
    private String serializedData(Alert alert) {
        if (alert.getData() == null) {
            return "";
        }
        try {
            return objectMapper.writeValueAsString(alert.getData()).toLowerCase(Locale.ROOT);
        } catch (JsonProcessingException e) {
            throw new AlertTriageException("Failed to serialize data of alert " + alert.getId(), e);
        }
    }

    private static String normalize(String keyword) {
        return keyword == null || keyword.isBlank() ? null : keyword.toLowerCase(Locale.ROOT);
    }

    private static <T> List<T> paginate(List<T> items, int offset, int limit) {
        if (offset >= items.size()) {
            return List.of();
        }
        // offset + limit can exceed Integer.MAX_VALUE
        int end = limit > 0 ? (int) Math.min(items.size(), (long) offset + limit) : items.size();
        return List.copyOf(items.subList(offset, end));
    }
}
