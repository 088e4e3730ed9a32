package com.dcruver.alerttriage.domain.clustering;

import com.dcruver.alerttriage.domain.Alert;
import com.dcruver.alerttriage.domain.AlertCluster;
import com.dcruver.alerttriage.domain.ClusteringResult;
import com.dcruver.alerttriage.domain.DbscanParams;
import com.dcruver.alerttriage.nlp.FrequentTokenKeywordExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static com.dcruver.alerttriage.TestAlerts.NOW;
import static com.dcruver.alerttriage.TestAlerts.alert;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DBSCAN over cosine distance.
 */
class DbscanClusteringEngineTest {

    private DbscanClusteringEngine engine;

    @BeforeEach
    void setUp() {
        engine = new DbscanClusteringEngine(new FrequentTokenKeywordExtractor(), new ClusterIdGenerator(), 5);
    }

    @Test
    void testTwoSimilarAlertsClusterAndThirdIsNoise() {
        List<Alert> alerts = List.of(
            alert("alert-1", 1f, 0f, 0f),
            alert("alert-2", 0.99f, 0.01f, 0f),
            alert("alert-3", 0f, 1f, 0f)
        );

        ClusteringResult result = engine.clusterAlerts(alerts, new DbscanParams(0.15, 2));

        assertEquals(1, result.clusters().size());
        AlertCluster cluster = result.clusters().get(0);
        assertEquals(2, cluster.getSize());
        assertEquals(Set.of("alert-1", "alert-2"), Set.copyOf(cluster.getAlertIds()));
        assertTrue(Set.of("alert-1", "alert-2").contains(cluster.getCenterAlertId()));
        assertEquals(List.of("alert-3"), result.noiseAlertIds());
        assertTrue(cluster.getAvgSimilarity() > 0.99);
    }

    @Test
    void testEmptyAndUnembeddedInputGiveEmptyResult() {
        DbscanParams params = new DbscanParams(0.3, 2);

        ClusteringResult empty = engine.clusterAlerts(List.of(), params);
        assertTrue(empty.clusters().isEmpty());
        assertTrue(empty.noiseAlertIds().isEmpty());

        ClusteringResult unembedded = engine.clusterAlerts(List.of(alert("a"), alert("b")), params);
        assertTrue(unembedded.clusters().isEmpty());
        assertTrue(unembedded.noiseAlertIds().isEmpty(), "alerts without embeddings are not noise");
        assertEquals(params, unembedded.parameters());
    }

    @Test
    void testNeighborhoodCountsThePointItself() {
        List<Alert> alerts = List.of(alert("a", 1f, 0f), alert("b", 1f, 0.001f));

        assertEquals(1, engine.clusterAlerts(alerts, new DbscanParams(0.1, 2)).clusters().size());
        assertEquals(0, engine.clusterAlerts(alerts, new DbscanParams(0.1, 3)).clusters().size());
    }

    @Test
    void testBorderPointJoinsWithoutPropagating() {
        // eps covers about 17 degrees. b is the only point with four neighbors;
        // c is a border point of b, and d, which is only near c, stays noise.
        List<Alert> alerts = List.of(
            alert("a1", rotate(-15)),
            alert("a2", rotate(-8)),
            alert("b", rotate(0)),
            alert("c", rotate(15)),
            alert("d", rotate(30))
        );

        ClusteringResult result = engine.clusterAlerts(alerts, new DbscanParams(0.045, 4));

        assertEquals(1, result.clusters().size());
        assertEquals(Set.of("a1", "a2", "b", "c"), Set.copyOf(result.clusters().get(0).getAlertIds()));
        assertEquals("b", result.clusters().get(0).getCenterAlertId());
        assertEquals(List.of("d"), result.noiseAlertIds());
    }

    @Test
    void testDensityReachabilityChainsCorePoints() {
        // Same chain with minSamples 2: every point is core and the chain becomes one cluster
        List<Alert> alerts = List.of(
            alert("a", rotate(0)),
            alert("b", rotate(20)),
            alert("c", rotate(40)),
            alert("d", rotate(60))
        );

        ClusteringResult result = engine.clusterAlerts(alerts, new DbscanParams(0.07, 2));

        assertEquals(1, result.clusters().size());
        assertEquals(4, result.clusters().get(0).getSize());
        assertTrue(result.noiseAlertIds().isEmpty());
    }

    @Test
    void testEveryClusterMeetsMinSamples() {
        Random random = new Random(7);
        List<Alert> alerts = new ArrayList<>();
        for (int i = 0; i < 120; i++) {
            float[] v = new float[8];
            int axis = random.nextInt(4);
            v[axis] = 1f;
            for (int d = 0; d < v.length; d++) {
                v[d] += (float) random.nextGaussian() * 0.15f;
            }
            alerts.add(alert(String.format("alert-%03d", i), NOW.minusSeconds(i), v));
        }

        for (int minSamples = 1; minSamples <= 6; minSamples++) {
            DbscanParams params = new DbscanParams(0.05, minSamples);
            ClusteringResult result = engine.clusterAlerts(alerts, params);

            for (AlertCluster cluster : result.clusters()) {
                assertTrue(cluster.getSize() >= minSamples,
                    "cluster " + cluster.getId() + " smaller than " + minSamples);
                assertEquals(cluster.getAlertIds().size(), cluster.getSize());
            }

            int assigned = result.clusters().stream().mapToInt(AlertCluster::getSize).sum();
            assertEquals(alerts.size(), assigned + result.noiseAlertIds().size(), "every alert is placed exactly once");
        }
    }

    @Test
    void testMembershipDoesNotDependOnInputOrder() {
        Random random = new Random(11);
        List<Alert> alerts = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            float[] v = new float[6];
            v[random.nextInt(3)] = 1f;
            for (int d = 0; d < v.length; d++) {
                v[d] += (float) random.nextGaussian() * 0.2f;
            }
            alerts.add(alert("alert-" + i, NOW.minusSeconds(i), v));
        }
        DbscanParams params = new DbscanParams(0.1, 3);

        ClusteringResult first = engine.clusterAlerts(alerts, params);
        List<Alert> shuffled = new ArrayList<>(alerts);
        Collections.shuffle(shuffled, new Random(3));
        ClusteringResult second = engine.clusterAlerts(shuffled, params);

        assertEquals(partition(first), partition(second));
        assertEquals(Set.copyOf(first.noiseAlertIds()), Set.copyOf(second.noiseAlertIds()));
        assertEquals(
            first.clusters().stream().map(AlertCluster::getId).collect(Collectors.toSet()),
            second.clusters().stream().map(AlertCluster::getId).collect(Collectors.toSet()));
    }

    @Test
    void testClustersSortedBySizeDescending() {
        List<Alert> alerts = List.of(
            alert("x1", 1f, 0f), alert("x2", 1f, 0.01f),
            alert("y1", 0f, 1f), alert("y2", 0.01f, 1f), alert("y3", 0.02f, 1f)
        );

        ClusteringResult result = engine.clusterAlerts(alerts, new DbscanParams(0.05, 2));

        assertEquals(2, result.clusters().size());
        assertEquals(3, result.clusters().get(0).getSize());
        assertEquals(2, result.clusters().get(1).getSize());
    }

    @Test
    void testClustersThreeThousandAlerts() {
        // Two dense groups of 1470 around axes 0 and 1, plus 60 alerts on axes of their own
        int dims = 64;
        List<Alert> alerts = new ArrayList<>();
        for (int i = 0; i < 1470; i++) {
            for (int axis = 0; axis < 2; axis++) {
                float[] embedding = new float[dims];
                embedding[axis] = 1f;
                embedding[62] = 0.01f * (i % 7);
                embedding[63] = 0.01f * (i % 11);
                alerts.add(alert(String.format("g%d-%04d", axis, i), NOW.plusSeconds(i), embedding));
            }
        }
        for (int axis = 2; axis < 62; axis++) {
            float[] embedding = new float[dims];
            embedding[axis] = 1f;
            alerts.add(alert(String.format("n-%02d", axis), NOW, embedding));
        }

        ClusteringResult result = assertTimeoutPreemptively(Duration.ofSeconds(60),
            () -> engine.clusterAlerts(alerts, new DbscanParams(0.05, 5)));

        assertEquals(2, result.clusters().size());
        assertEquals(1470, result.clusters().get(0).getSize());
        assertEquals(1470, result.clusters().get(1).getSize());
        assertEquals(60, result.noiseAlertIds().size());
        assertTrue(result.clusters().stream().allMatch(c -> c.getAvgSimilarity() > 0.99));
    }

    @Test
    void testInvalidParametersRejected() {
        List<Alert> alerts = List.of(alert("a", 1f));
        assertThrows(IllegalArgumentException.class, () -> engine.clusterAlerts(alerts, new DbscanParams(-0.1, 2)));
        assertThrows(IllegalArgumentException.class, () -> engine.clusterAlerts(alerts, new DbscanParams(0.1, 0)));
    }

    private static Set<Set<String>> partition(ClusteringResult result) {
        return result.clusters().stream()
            .map(c -> Set.copyOf(c.getAlertIds()))
            .collect(Collectors.toSet());
    }

    private static float[] rotate(double degrees) {
        double rad = Math.toRadians(degrees);
        return new float[]{(float) Math.cos(rad), (float) Math.sin(rad)};
    }
}
