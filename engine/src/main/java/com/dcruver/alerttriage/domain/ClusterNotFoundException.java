package com.dcruver.alerttriage.domain;

/**
 * Raised for an unknown cluster id, usually because the cached summary holding it expired.
 */
public class ClusterNotFoundException extends AlertTriageException {

    private final String clusterId;

    public ClusterNotFoundException(String clusterId) {
        super("Cluster not found: " + clusterId);
        this.clusterId = clusterId;
    }

    public String getClusterId() {
        return clusterId;
    }
}
