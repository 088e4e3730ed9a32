package com.dcruver.alerttriage.nlp;

import java.util.Collections;
import java.util.List;

/**
 * Similarity and averaging over embedding vectors.
 *
 * Mismatched or all-zero vectors are an expected state (an alert whose embedding
 * has not been computed yet), so cosine similarity returns 0 for them instead of throwing.
 */
public final class VectorSimilarity {

    private VectorSimilarity() {
    }

    /**
     * Cosine similarity in [-1, 1], or 0 for null, mismatched or zero-norm vectors.
     */
    public static float cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length || a.length == 0) {
            return 0f;
        }

        double dotProduct = 0.0;
        double norm1 = 0.0;
        double norm2 = 0.0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += (double) a[i] * b[i];
            norm1 += (double) a[i] * a[i];
            norm2 += (double) b[i] * b[i];
        }

        if (norm1 == 0 || norm2 == 0) {
            return 0f;
        }

        double similarity = dotProduct / (Math.sqrt(norm1) * Math.sqrt(norm2));
        // Rounding can push parallel vectors slightly past 1
        return (float) Math.max(-1.0, Math.min(1.0, similarity));
    }

    /**
     * Cosine distance, 1 - similarity.
     */
    public static float cosineDistance(float[] a, float[] b) {
        return 1f - cosineSimilarity(a, b);
    }

    /**
     * Per-dimension weighted average. All vectors are expected to have the
     * dimension of the first one (they come from a single embedding model).
     *
     * @throws IllegalArgumentException if the lists are empty, differ in size, or the weights sum to zero
     */
    public static float[] weightedAverage(List<float[]> vectors, List<Float> weights) {
        if (vectors == null || weights == null || vectors.isEmpty()) {
            throw new IllegalArgumentException("No vectors to average");
        }
        if (vectors.size() != weights.size()) {
            throw new IllegalArgumentException(String.format(
                "Vector count %d does not match weight count %d", vectors.size(), weights.size()));
        }

        int dim = vectors.get(0).length;
        double[] sum = new double[dim];
        double totalWeight = 0.0;

        for (int v = 0; v < vectors.size(); v++) {
            float[] vector = vectors.get(v);
            float weight = weights.get(v);
            for (int i = 0; i < dim; i++) {
                sum[i] += (double) vector[i] * weight;
            }
            totalWeight += weight;
        }

        if (totalWeight == 0) {
            throw new IllegalArgumentException("Weights sum to zero");
        }

        float[] result = new float[dim];
        for (int i = 0; i < dim; i++) {
            result[i] = (float) (sum[i] / totalWeight);
        }
        return result;
    }

    /**
     * Unweighted mean of the vectors.
     */
    public static float[] average(List<float[]> vectors) {
        if (vectors == null || vectors.isEmpty()) {
            throw new IllegalArgumentException("No vectors to average");
        }
        return weightedAverage(vectors, Collections.nCopies(vectors.size(), 1f));
    }
}
