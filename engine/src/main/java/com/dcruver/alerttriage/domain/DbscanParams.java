package com.dcruver.alerttriage.domain;

/**
 * DBSCAN parameters.
 *
 * @param eps        maximum cosine distance between two neighbors
 * @param minSamples minimum neighborhood size (the point itself included) for a core point
 */
public record DbscanParams(double eps, int minSamples) {

    public static final DbscanParams DEFAULT = new DbscanParams(0.3, 2);

    /**
     * Treat an all-zero parameter set as "not specified".
     */
    public DbscanParams orDefault() {
        return eps == 0 && minSamples == 0 ? DEFAULT : this;
    }

    public void validate() {
        if (Double.isNaN(eps) || eps < 0) {
            throw new IllegalArgumentException("eps must be a non-negative number, got " + eps);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be at least 1, got " + minSamples);
        }
    }
}
