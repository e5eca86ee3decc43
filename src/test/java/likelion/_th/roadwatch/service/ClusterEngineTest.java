package likelion._th.roadwatch.service;

import likelion._th.roadwatch.domain.Cluster;
import likelion._th.roadwatch.domain.Report;
import likelion._th.roadwatch.domain.Severity;
import likelion._th.roadwatch.util.GeoDistance;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static likelion._th.roadwatch.support.TestReports.metersNorth;
import static likelion._th.roadwatch.support.TestReports.pothole;
import static org.junit.jupiter.api.Assertions.*;

class ClusterEngineTest {

    private static final double LAT = 12.9716;
    private static final double LON = 77.5946;

    private final ClusterEngine clusterEngine = new ClusterEngine();

    @Test
    void shouldReturnEmptyForNoReports() {
        assertTrue(clusterEngine.computeClusters(List.of()).isEmpty());
        assertTrue(clusterEngine.computeClusters(null).isEmpty());
    }

    @Test
    void shouldJoinReportAtExactlyRadiusAndRejectJustBeyond() {
        // Given
        Report anchor = pothole("a", LAT, LON, "Main St", Severity.LOW);
        Report edge = pothole("b", metersNorth(LAT, 100), LON, "Main St", Severity.LOW);
        double measured = GeoDistance.haversineMeters(LAT, LON, edge.getLatitude(), LON);

        // When
        List<Cluster> inside = clusterEngine.computeClusters(List.of(anchor, edge), measured);
        List<Cluster> outside = clusterEngine.computeClusters(List.of(anchor, edge), measured - 0.01);

        // Then
        assertEquals(1, inside.size());
        assertEquals(2, inside.get(0).getReports().size());
        assertEquals(2, outside.size());
    }

    @Test
    void shouldGroupRelativeToAnchorOnly() {
        // Given: B 는 A 에서 80m, C 는 B 에서 80m (A 에서 160m)
        Report a = pothole("a", LAT, LON, "Main St", Severity.LOW);
        Report b = pothole("b", metersNorth(LAT, 80), LON, "Main St", Severity.LOW);
        Report c = pothole("c", metersNorth(LAT, 160), LON, "Main St", Severity.LOW);

        // When
        List<Cluster> clusters = clusterEngine.computeClusters(List.of(a, b, c));

        // Then: 사슬로 이어지지 않는다
        assertEquals(2, clusters.size());
        assertEquals(List.of("a", "b"), ids(clusters.get(0)));
        assertEquals(List.of("c"), ids(clusters.get(1)));
    }

    @Test
    void shouldDependOnInputOrder() {
        Report a = pothole("a", LAT, LON, "Main St", Severity.LOW);
        Report b = pothole("b", metersNorth(LAT, 80), LON, "Main St", Severity.LOW);
        Report c = pothole("c", metersNorth(LAT, 160), LON, "Main St", Severity.LOW);

        List<Cluster> clusters = clusterEngine.computeClusters(List.of(b, a, c));

        assertEquals(1, clusters.size());
        assertEquals(List.of("b", "a", "c"), ids(clusters.get(0)));
    }

    @Test
    void shouldExcludeNonePotholesAndMissingCoordinates() {
        // Given
        Report none = pothole("none", LAT, LON, "Main St", Severity.NONE);
        Report noGps = Report.builder().id("nogps").severity(Severity.HIGH).build();
        Report invalid = pothole("invalid", 95.0, LON, "Main St", Severity.HIGH);
        Report valid = pothole("valid", metersNorth(LAT, 10), LON, "Main St", Severity.MEDIUM);

        // When
        List<Cluster> clusters = clusterEngine.computeClusters(List.of(none, noGps, invalid, valid));

        // Then
        assertEquals(1, clusters.size());
        assertEquals(List.of("valid"), ids(clusters.get(0)));
    }

    @Test
    void shouldUseAnchorCoordinatesForIdAndMaxSeverity() {
        // Given
        Report low = pothole("low", LAT, LON, "Main St", Severity.LOW);
        Report high = pothole("high", metersNorth(LAT, 30), LON, "Main St", Severity.HIGH);

        // When
        Cluster cluster = clusterEngine.computeClusters(List.of(low, high)).get(0);

        // Then
        assertEquals("12.9716_77.5946", cluster.getId());
        assertEquals(LAT, cluster.getCenterLat());
        assertEquals(Severity.HIGH, cluster.getMaxSeverity());
    }

    @Test
    void shouldKeepLowWhenAllMembersAreLow() {
        Report a = pothole("a", LAT, LON, "Main St", Severity.LOW);
        Report b = pothole("b", metersNorth(LAT, 30), LON, "Main St", Severity.LOW);

        assertEquals(Severity.LOW, clusterEngine.computeClusters(List.of(a, b)).get(0).getMaxSeverity());
    }

    @Test
    void shouldNameClusterByMostFrequentAreaAndRoad() {
        // Given
        Report first = pothole("1", LAT, LON, "Main St", Severity.LOW).toBuilder().area("Indiranagar").build();
        Report second = pothole("2", metersNorth(LAT, 10), LON, "Park Rd", Severity.LOW).toBuilder().area("Koramangala").build();
        Report third = pothole("3", metersNorth(LAT, 20), LON, "Park Rd", Severity.LOW).toBuilder().area("Unknown Area").build();
        Cluster cluster = clusterEngine.computeClusters(List.of(first, second, third)).get(0);

        // When
        String name = clusterEngine.friendlyName(cluster);

        // Then: 지역은 동률 → 먼저 나온 값
        assertEquals("Indiranagar – Park Rd", name);
    }

    @Test
    void shouldFallBackToLatitudeNameWhenLocationUnknown() {
        Report report = pothole("1", LAT, LON, "Unknown Road", Severity.LOW).toBuilder().area(null).build();
        Cluster cluster = clusterEngine.computeClusters(List.of(report)).get(0);

        assertEquals("Cluster #12.9716", clusterEngine.friendlyName(cluster));
    }

    @Test
    void shouldComputeBoundsOverMembers() {
        Report a = pothole("a", LAT, LON, "Main St", Severity.LOW);
        Report b = pothole("b", metersNorth(LAT, 50), LON, "Main St", Severity.LOW);
        Cluster cluster = clusterEngine.computeClusters(List.of(a, b)).get(0);

        double[][] bounds = clusterEngine.bounds(cluster);

        assertEquals(LAT, bounds[0][0]);
        assertEquals(LON, bounds[0][1]);
        assertEquals(b.getLatitude(), bounds[1][0]);
        assertEquals(LON, bounds[1][1]);
    }

    private List<String> ids(Cluster cluster) {
        return cluster.getReports().stream().map(Report::getId).collect(Collectors.toList());
    }
}
