package com.dcruver.alerttriage.domain.clustering;

import com.dcruver.alerttriage.domain.Alert;
import com.dcruver.alerttriage.domain.AlertCluster;
import com.dcruver.alerttriage.domain.ClusteringResult;
import com.dcruver.alerttriage.domain.DbscanParams;
import com.dcruver.alerttriage.nlp.KeywordExtractor;
import com.dcruver.alerttriage.nlp.VectorSimilarity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * DBSCAN over cosine distance between alert embeddings.
 *
 * Conventions:
 * - Two alerts are neighbors when their cosine distance is at most eps.
 * - A neighborhood includes the point itself; a core point has at least minSamples members.
 * - A border point belongs to the first cluster that reaches it.
 * - Input is ordered by (createdAt, id) first, so membership does not depend on fetch order.
 *
 * Stateless and safe to call concurrently. Neighbor search is O(n^2) time; similarities
 * are computed per region query rather than held in an n x n matrix, so memory stays linear.
 */
@Service
@Slf4j
public class DbscanClusteringEngine {

    private static final int UNVISITED = -2;
    private static final int NOISE = -1;

    static final Comparator<Alert> STABLE_ORDER = Comparator
        .comparing(Alert::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(Alert::getId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final KeywordExtractor keywordExtractor;
    private final ClusterIdGenerator clusterIdGenerator;
    private final int keywordLimit;

    public DbscanClusteringEngine(
        KeywordExtractor keywordExtractor,
        ClusterIdGenerator clusterIdGenerator,
        @Value("${triage.clustering.keyword-limit:5}") int keywordLimit
    ) {
        this.keywordExtractor = keywordExtractor;
        this.clusterIdGenerator = clusterIdGenerator;
        this.keywordLimit = keywordLimit;
    }

    /**
     * Cluster the embedded alerts among the input. Alerts without embeddings are ignored.
     */
    public ClusteringResult clusterAlerts(List<Alert> alerts, DbscanParams params) {
        params.validate();

        List<Alert> points = alerts == null ? List.of() : alerts.stream()
            .filter(Alert::hasEmbedding)
            .sorted(STABLE_ORDER)
            .toList();

        if (points.isEmpty()) {
            return new ClusteringResult(List.of(), List.of(), params);
        }

        long start = System.nanoTime();
        int n = points.size();
        float[][] embeddings = points.stream().map(Alert::getEmbedding).toArray(float[][]::new);

        int[] labels = new int[n];
        Arrays.fill(labels, UNVISITED);
        int clusterCount = 0;

        for (int i = 0; i < n; i++) {
            if (labels[i] != UNVISITED) {
                continue;
            }

            List<Integer> neighbors = regionQuery(embeddings, i, params.eps());
            if (neighbors.size() < params.minSamples()) {
                // May still be claimed later as a border point
                labels[i] = NOISE;
                continue;
            }

            int clusterId = clusterCount++;
            labels[i] = clusterId;
            expandCluster(embeddings, labels, neighbors, clusterId, params);
        }

        ClusteringResult result = buildResult(points, embeddings, labels, clusterCount, params);

        log.info("Clustered {} alerts into {} clusters ({} noise) with eps={}, minSamples={} in {} ms",
            n, result.clusters().size(), result.noiseAlertIds().size(),
            params.eps(), params.minSamples(), (System.nanoTime() - start) / 1_000_000);

        return result;
    }

    private void expandCluster(float[][] embeddings, int[] labels, List<Integer> seeds,
                               int clusterId, DbscanParams params) {
        Deque<Integer> queue = new ArrayDeque<>(seeds);

        while (!queue.isEmpty()) {
            int point = queue.poll();

            if (labels[point] == NOISE) {
                // Border point: joins, does not propagate
                labels[point] = clusterId;
                continue;
            }
            if (labels[point] != UNVISITED) {
                continue;
            }

            labels[point] = clusterId;
            List<Integer> neighbors = regionQuery(embeddings, point, params.eps());
            if (neighbors.size() >= params.minSamples()) {
                for (int neighbor : neighbors) {
                    if (labels[neighbor] == UNVISITED || labels[neighbor] == NOISE) {
                        queue.add(neighbor);
                    }
                }
            }
        }
    }

    /**
     * Indices within eps of the point, the point itself included.
     */
    private List<Integer> regionQuery(float[][] embeddings, int point, double eps) {
        List<Integer> neighbors = new ArrayList<>();
        for (int j = 0; j < embeddings.length; j++) {
            if (1.0 - similarity(embeddings, point, j) <= eps) {
                neighbors.add(j);
            }
        }
        return neighbors;
    }

    private static double similarity(float[][] embeddings, int i, int j) {
        // Self-similarity is 1 by definition, even for degenerate vectors
        return i == j ? 1.0 : VectorSimilarity.cosineSimilarity(embeddings[i], embeddings[j]);
    }

    private ClusteringResult buildResult(List<Alert> points, float[][] embeddings, int[] labels,
                                         int clusterCount, DbscanParams params) {
        List<List<Integer>> members = new ArrayList<>();
        for (int c = 0; c < clusterCount; c++) {
            members.add(new ArrayList<>());
        }

        for (int i = 0; i < labels.length; i++) {
            if (labels[i] >= 0) {
                members.get(labels[i]).add(i);
            }
        }

        // A core point whose neighbors were already claimed as border points of an
        // earlier cluster can end up below minSamples; such a group is noise.
        List<AlertCluster> clusters = new ArrayList<>(clusterCount);
        for (List<Integer> indices : members) {
            if (indices.size() < params.minSamples()) {
                indices.forEach(i -> labels[i] = NOISE);
                continue;
            }
            clusters.add(buildCluster(points, embeddings, indices));
        }

        List<String> noise = new ArrayList<>();
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] < 0) {
                noise.add(points.get(i).getId());
            }
        }

        clusters.sort(Comparator.comparingInt(AlertCluster::getSize).reversed()
            .thenComparing(AlertCluster::getId));

        return new ClusteringResult(List.copyOf(clusters), List.copyOf(noise), params);
    }

    private AlertCluster buildCluster(List<Alert> points, float[][] embeddings, List<Integer> indices) {
        List<Alert> clusterAlerts = indices.stream().map(points::get).toList();
        List<String> alertIds = clusterAlerts.stream().map(Alert::getId).toList();

        Alert center = clusterAlerts.get(findMedoid(embeddings, indices));
        List<String> keywords = keywordExtractor.extract(clusterAlerts, keywordLimit);

        return AlertCluster.builder()
            .id(clusterIdGenerator.generate(alertIds))
            .centerAlertId(center.getId())
            .alertIds(alertIds)
            .keywords(keywords == null ? List.of() : List.copyOf(keywords))
            .avgSimilarity(averageSimilarityToCentroid(clusterAlerts))
            .build();
    }

    /**
     * Position (within indices) of the member with the highest mean similarity to the others.
     * Ties go to the earlier member.
     */
    private int findMedoid(float[][] embeddings, List<Integer> indices) {
        int best = 0;
        double bestScore = Double.NEGATIVE_INFINITY;

        for (int a = 0; a < indices.size(); a++) {
            double total = 0.0;
            for (int b = 0; b < indices.size(); b++) {
                if (a != b) {
                    total += similarity(embeddings, indices.get(a), indices.get(b));
                }
            }
            double score = indices.size() > 1 ? total / (indices.size() - 1) : 1.0;
            if (score > bestScore) {
                bestScore = score;
                best = a;
            }
        }
        return best;
    }

    private double averageSimilarityToCentroid(List<Alert> clusterAlerts) {
        List<float[]> embeddings = clusterAlerts.stream().map(Alert::getEmbedding).toList();
        int dim = embeddings.get(0).length;
        boolean sameDimension = embeddings.stream().allMatch(e -> e.length == dim);
        if (!sameDimension) {
            log.warn("Cluster mixes embedding dimensions, skipping centroid similarity");
            return 0.0;
        }

        float[] centroid = VectorSimilarity.average(embeddings);
        double total = 0.0;
        for (float[] embedding : embeddings) {
            total += VectorSimilarity.cosineSimilarity(embedding, centroid);
        }
        return total / embeddings.size();
    }
}
