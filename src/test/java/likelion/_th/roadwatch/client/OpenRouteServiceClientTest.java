package likelion._th.roadwatch.client;

import likelion._th.roadwatch.config.RoadwatchProperties;
import likelion._th.roadwatch.domain.LatLng;
import likelion._th.roadwatch.domain.Route;
import likelion._th.roadwatch.support.StubExchange;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OpenRouteServiceClientTest {

    private static final LatLng START = new LatLng(12.9716, 77.5946);
    private static final LatLng END = new LatLng(12.98, 77.6);

    private static final String GEOJSON = """
            {"type": "FeatureCollection",
             "features": [{"type": "Feature",
                           "properties": {"summary": {"distance": 4200.0, "duration": 540.0}},
                           "geometry": {"type": "LineString",
                                        "coordinates": [[77.5946, 12.9716], [77.59, 12.975], [77.6, 12.98]]}}]}
            """;

    @Test
    void shouldBeDisabledWithoutApiKey() {
        // Given
        StubExchange exchange = StubExchange.json(GEOJSON);
        OpenRouteServiceClient client = new OpenRouteServiceClient(
                exchange.webClient("http://ors.test"), " ", new RoadwatchProperties());

        // When
        Optional<Route> route = client.fetchRoute(START, END, List.of(new LatLng(12.975, 77.597)));

        // Then
        assertFalse(client.isEnabled());
        assertTrue(route.isEmpty());
        assertTrue(exchange.getRequests().isEmpty());
    }

    @Test
    void shouldPostToGeoJsonEndpointAndParseFeature() {
        // Given
        StubExchange exchange = StubExchange.json(GEOJSON);
        OpenRouteServiceClient client = new OpenRouteServiceClient(
                exchange.webClient("http://ors.test"), "secret", new RoadwatchProperties());

        // When
        Optional<Route> route = client.fetchRoute(START, END, List.of(new LatLng(12.975, 77.597)));

        // Then
        assertTrue(route.isPresent());
        assertEquals(4200.0, route.get().getDistanceMeters());
        assertEquals(540.0, route.get().getDurationSeconds());
        assertEquals(3, route.get().getGeometry().size());
        assertEquals(new LatLng(12.975, 77.59), route.get().getGeometry().get(1));
        assertEquals(HttpMethod.POST, exchange.lastRequest().method());
        assertEquals("/v2/directions/driving-car/geojson", exchange.lastRequest().url().getPath());
    }

    @Test
    void shouldReturnEmptyWhenNoFeatures() {
        StubExchange exchange = StubExchange.json("{\"error\": {\"code\": 2009, \"message\": \"Route could not be found\"}}");
        OpenRouteServiceClient client = new OpenRouteServiceClient(
                exchange.webClient("http://ors.test"), "secret", new RoadwatchProperties());

        assertTrue(client.fetchRoute(START, END, List.of()).isEmpty());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldBuildClosedSquarePerAvoidPoint() {
        // Given
        OpenRouteServiceClient client = new OpenRouteServiceClient(
                StubExchange.json(GEOJSON).webClient("http://ors.test"), "secret", new RoadwatchProperties());
        LatLng first = new LatLng(12.975, 77.597);
        LatLng second = new LatLng(12.977, 77.598);

        // When
        Map<String, Object> body = client.buildRequestBody(START, END, List.of(first, second));

        // Then
        assertEquals(List.of(START.toLonLat(), END.toLonLat()), body.get("coordinates"));

        Map<String, Object> options = (Map<String, Object>) body.get("options");
        Map<String, Object> polygon = (Map<String, Object>) options.get("avoid_polygons");
        assertEquals("MultiPolygon", polygon.get("type"));

        List<List<List<List<Double>>>> polygons = (List<List<List<List<Double>>>>) polygon.get("coordinates");
        assertEquals(2, polygons.size());

        List<List<Double>> ring = polygons.get(0).get(0);
        assertEquals(5, ring.size());
        assertEquals(ring.get(0), ring.get(4));
        // 반폭 150m ≒ 위도 0.00135도
        double halfHeight = ring.get(2).get(1) - first.getLat();
        assertEquals(150 / 111_320.0, halfHeight, 1e-9);
        assertTrue(ring.get(0).get(0) < first.getLng());
        assertTrue(ring.get(1).get(0) > first.getLng());
    }

    @Test
    void shouldOmitOptionsWithoutAvoidPoints() {
        OpenRouteServiceClient client = new OpenRouteServiceClient(
                StubExchange.json(GEOJSON).webClient("http://ors.test"), "secret", new RoadwatchProperties());

        Map<String, Object> body = client.buildRequestBody(START, END, List.of());

        assertFalse(body.containsKey("options"));
    }
}
