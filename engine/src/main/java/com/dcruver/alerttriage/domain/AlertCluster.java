package com.dcruver.alerttriage.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A density-based group of mutually similar unbound alerts.
 */
@Value
@Builder
public class AlertCluster {
    String id;
    String centerAlertId;  // Medoid of the cluster
    List<String> alertIds;
    List<String> keywords;
    double avgSimilarity;  // Mean cosine similarity of members to the centroid

    public int getSize() {
        return alertIds.size();
    }

    public boolean hasKeywords() {
        return keywords != null && !keywords.isEmpty();
    }
}
