package com.dcruver.alerttriage.app;

import com.dcruver.alerttriage.domain.Alert;
import com.dcruver.alerttriage.domain.AlertCluster;
import com.dcruver.alerttriage.domain.ClusterNotFoundException;
import com.dcruver.alerttriage.domain.ClusteringSummary;
import com.dcruver.alerttriage.domain.DbscanParams;
import com.dcruver.alerttriage.domain.clustering.ClusteringResultCache;
import com.dcruver.alerttriage.domain.matching.AlertIngestionService;
import com.dcruver.alerttriage.domain.matching.IngestionResult;
import com.dcruver.alerttriage.domain.query.ClusterAlertsPage;
import com.dcruver.alerttriage.domain.query.ClusterQuery;
import com.dcruver.alerttriage.domain.query.ClusterQueryService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.time.Clock;
import java.util.UUID;

/**
 * Spring Shell commands for ingesting alerts and browsing clusters.
 * Clustering errors are reported as "temporarily unavailable" rather than failing the session.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class TriageShellCommands {

    private final AlertIngestionService ingestionService;
    private final ClusterQueryService clusterQueryService;
    private final ClusteringResultCache clusteringResultCache;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @ShellMethod(key = "ingest", value = "Ingest an alert and merge it into a duplicate's thread if one exists")
    public String ingest(
            @ShellOption(help = "Alert title") String title,
            @ShellOption(help = "Alert payload as JSON") String data,
            @ShellOption(defaultValue = ShellOption.NULL, help = "Alert id (generated if absent)") String id) {
        try {
            Alert alert = Alert.builder()
                .id(id != null ? id : UUID.randomUUID().toString())
                .title(title)
                .createdAt(clock.instant())
                .data(objectMapper.readTree(data))
                .build();

            IngestionResult result = ingestionService.ingest(alert);
            if (result.isMerged()) {
                return String.format("Alert %s merged into thread %s of alert %s",
                    result.alert().getId(), result.alert().getThread().threadId(),
                    result.duplicateOfAlertId().orElseThrow());
            }
            return String.format("Alert %s posted to new thread %s",
                result.alert().getId(), result.alert().getThread().threadId());

        } catch (Exception e) {
            log.error("Ingestion failed", e);
            return "Ingestion failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "clusters", value = "List clusters of unbound alerts")
    public String clusters(
            @ShellOption(defaultValue = "0.3", help = "Maximum cosine distance between neighbors") double eps,
            @ShellOption(defaultValue = "2", help = "Minimum neighborhood size of a core point") int minSamples,
            @ShellOption(defaultValue = "0", help = "Hide clusters smaller than this") int minSize,
            @ShellOption(defaultValue = "20") int limit,
            @ShellOption(defaultValue = "0") int offset,
            @ShellOption(defaultValue = ShellOption.NULL) String keyword) {
        try {
            ClusteringSummary summary = clusterQueryService.getAlertClusters(ClusterQuery.builder()
                .dbscanParams(new DbscanParams(eps, minSamples))
                .minClusterSize(minSize)
                .limit(limit)
                .offset(offset)
                .keyword(keyword)
                .build());

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Clusters (eps=%.2f, minSamples=%d, computed %s)%n",
                summary.getParameters().eps(), summary.getParameters().minSamples(), summary.getComputedAt()));
            sb.append(String.format("Showing %d of %d, %d noise alerts%n%n",
                summary.getClusters().size(), summary.getTotalCount(), summary.getNoiseAlertIds().size()));

            for (AlertCluster cluster : summary.getClusters()) {
                sb.append(String.format("- %s: %d alerts, center %s, cohesion %.3f%n",
                    cluster.getId(), cluster.getSize(), cluster.getCenterAlertId(), cluster.getAvgSimilarity()));
                if (cluster.hasKeywords()) {
                    sb.append("  keywords: ").append(String.join(", ", cluster.getKeywords())).append("\n");
                }
            }

            return sb.toString();

        } catch (IllegalArgumentException e) {
            return "Invalid query: " + e.getMessage();
        } catch (Exception e) {
            log.error("Clustering failed", e);
            return "Clustering is temporarily unavailable: " + e.getMessage();
        }
    }

    @ShellMethod(key = "cluster-alerts", value = "List the alerts of one cluster")
    public String clusterAlerts(
            @ShellOption String clusterId,
            @ShellOption(defaultValue = ShellOption.NULL) String keyword,
            @ShellOption(defaultValue = "20") int limit,
            @ShellOption(defaultValue = "0") int offset) {
        try {
            ClusterAlertsPage page = clusterQueryService.getClusterAlerts(clusterId, keyword, limit, offset);

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Cluster %s: showing %d of %d alerts%n%n",
                clusterId, page.alerts().size(), page.totalCount()));
            for (Alert alert : page.alerts()) {
                sb.append(String.format("- %s [%s] %s%n", alert.getId(), alert.getCreatedAt(), alert.getTitle()));
            }
            return sb.toString();

        } catch (ClusterNotFoundException e) {
            return e.getMessage() + " (cached results may have expired, run 'clusters' again)";
        } catch (Exception e) {
            log.error("Failed to list cluster alerts", e);
            return "Clustering is temporarily unavailable: " + e.getMessage();
        }
    }

    @ShellMethod(key = "cache stats", value = "Show clustering cache statistics")
    public String cacheStats() {
        ClusteringResultCache.CacheStats stats = clusteringResultCache.getStats();
        return String.format("""
            Clustering Cache:
            - Entries: %d (%d expired, awaiting cleanup)
            - Indexed clusters: %d
            - TTL: %s
            - Cleanup interval: %s (%s)
            """,
            stats.getEntries(), stats.getExpiredEntries(), stats.getIndexedClusters(),
            stats.getTtl(), stats.getCleanupInterval(), stats.isCleanupRunning() ? "running" : "stopped");
    }

    @ShellMethod(key = "cache clear", value = "Clear cached clustering results")
    public String cacheClear() {
        clusterQueryService.invalidate();
        return "Clustering cache cleared. Next query will recluster.";
    }
}
