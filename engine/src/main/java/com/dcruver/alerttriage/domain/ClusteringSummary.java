package com.dcruver.alerttriage.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.List;

/**
 * Clustering result as served to callers.
 * totalCount is only meaningful after filtering: the number of clusters that
 * survived the filters, before pagination.
 */
@Value
@Builder
@With
public class ClusteringSummary {
    List<AlertCluster> clusters;
    List<String> noiseAlertIds;
    DbscanParams parameters;
    Instant computedAt;
    int totalCount;

    public static ClusteringSummary of(ClusteringResult result, Instant computedAt) {
        return ClusteringSummary.builder()
            .clusters(result.clusters())
            .noiseAlertIds(result.noiseAlertIds())
            .parameters(result.parameters())
            .computedAt(computedAt)
            .totalCount(result.clusters().size())
            .build();
    }
}
