package com.dcruver.alerttriage.domain;

import java.util.List;

/**
 * Raw output of a clustering run.
 */
public record ClusteringResult(List<AlertCluster> clusters, List<String> noiseAlertIds, DbscanParams parameters) {
}
