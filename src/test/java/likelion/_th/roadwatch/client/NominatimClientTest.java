package likelion._th.roadwatch.client;

import likelion._th.roadwatch.config.RoadwatchProperties;
import likelion._th.roadwatch.domain.Address;
import likelion._th.roadwatch.domain.LatLng;
import likelion._th.roadwatch.support.StubExchange;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class NominatimClientTest {

    @Test
    void shouldGeocodeFirstResult() {
        // Given
        StubExchange exchange = StubExchange.json("""
                [{"lat": "12.9716", "lon": "77.5946", "display_name": "MG Road, Bengaluru"}]
                """);
        NominatimClient client = new NominatimClient(exchange.webClient("http://nominatim.test"), new RoadwatchProperties());

        // When
        Optional<LatLng> result = client.geocode("MG Road, Bengaluru");

        // Then
        assertEquals(Optional.of(new LatLng(12.9716, 77.5946)), result);
        assertEquals("/search", exchange.lastRequest().url().getPath());
        assertTrue(exchange.lastRequest().url().getQuery().contains("limit=1"));
    }

    @Test
    void shouldReturnEmptyWhenNothingFound() {
        StubExchange exchange = StubExchange.json("[]");
        NominatimClient client = new NominatimClient(exchange.webClient("http://nominatim.test"), new RoadwatchProperties());

        assertTrue(client.geocode("Atlantis").isEmpty());
    }

    @Test
    void shouldNotCallServiceForBlankAddress() {
        StubExchange exchange = StubExchange.json("[]");
        NominatimClient client = new NominatimClient(exchange.webClient("http://nominatim.test"), new RoadwatchProperties());

        assertTrue(client.geocode("  ").isEmpty());
        assertTrue(exchange.getRequests().isEmpty());
    }

    @Test
    void shouldFallBackToNeighbourhoodWhenSuburbMissing() {
        // Given
        StubExchange exchange = StubExchange.json("""
                {"display_name": "80 Feet Road, HAL 2nd Stage, Bengaluru",
                 "address": {"road": "80 Feet Road", "neighbourhood": "HAL 2nd Stage", "city": "Bengaluru"}}
                """);
        NominatimClient client = new NominatimClient(exchange.webClient("http://nominatim.test"), new RoadwatchProperties());

        // When
        Address address = client.reverseGeocode(12.97, 77.64);

        // Then
        assertEquals("80 Feet Road", address.getRoad());
        assertEquals("HAL 2nd Stage", address.getArea());
        assertEquals("80 Feet Road, HAL 2nd Stage, Bengaluru", address.getFullAddress());
    }

    @Test
    void shouldFillUnknownValuesForMissingParts() {
        StubExchange exchange = StubExchange.json("{\"address\": {\"city\": \"Bengaluru\"}}");
        NominatimClient client = new NominatimClient(exchange.webClient("http://nominatim.test"), new RoadwatchProperties());

        Address address = client.reverseGeocode(12.97, 77.64);

        assertEquals("Unknown Road", address.getRoad());
        assertEquals("Bengaluru", address.getArea());
        assertEquals("Address not found", address.getFullAddress());
    }

    @Test
    void shouldNeverThrowOnReverseFailure() {
        StubExchange exchange = StubExchange.status(HttpStatus.TOO_MANY_REQUESTS);
        NominatimClient client = new NominatimClient(exchange.webClient("http://nominatim.test"), new RoadwatchProperties());

        Address address = client.reverseGeocode(12.97, 77.64);

        assertEquals("Unknown Road", address.getRoad());
        assertEquals("Unknown Area", address.getArea());
    }
}
