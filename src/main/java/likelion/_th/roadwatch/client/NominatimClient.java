package likelion._th.roadwatch.client;

import com.fasterxml.jackson.databind.JsonNode;
import likelion._th.roadwatch.config.RoadwatchProperties;
import likelion._th.roadwatch.domain.Address;
import likelion._th.roadwatch.domain.LatLng;
import likelion._th.roadwatch.domain.Report;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Optional;

@Component
@Slf4j
// OpenStreetMap Nominatim (정/역 지오코딩)
public class NominatimClient implements Geocoder, ReverseGeocoder {

    private final WebClient webClient;
    private final Duration timeout;

    public NominatimClient(
            @Qualifier("nominatimWebClient") WebClient webClient,
            RoadwatchProperties properties
    ) {
        this.webClient = webClient;
        this.timeout = properties.getTimeouts().getGeocoding();
    }

    @Override
    public Optional<LatLng> geocode(String address) {
        if (address == null || address.isBlank()) {
            return Optional.empty();
        }

        try {
            JsonNode response = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/search")
                            .queryParam("q", address)
                            .queryParam("format", "json")
                            .queryParam("limit", 1)
                            .build())
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(timeout);

            if (response == null || !response.isArray() || response.isEmpty()) {
                log.info("[Nominatim] 검색 결과 없음: {}", address);
                return Optional.empty();
            }

            JsonNode first = response.get(0);
            double lat = Double.parseDouble(first.path("lat").asText());
            double lon = Double.parseDouble(first.path("lon").asText());
            return Optional.of(new LatLng(lat, lon));

        } catch (Exception e) {
            log.warn("[Nominatim] 지오코딩 실패: {} - {}", address, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Address reverseGeocode(double latitude, double longitude) {
        try {
            JsonNode response = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/reverse")
                            .queryParam("lat", latitude)
                            .queryParam("lon", longitude)
                            .queryParam("format", "json")
                            .build())
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(timeout);

            if (response == null) {
                return Address.unknown();
            }

            JsonNode address = response.path("address");
            String road = textOrNull(address, "road");
            // 지역: suburb → neighbourhood → city 순서
            String area = textOrNull(address, "suburb");
            if (area == null) area = textOrNull(address, "neighbourhood");
            if (area == null) area = textOrNull(address, "city");
            String fullAddress = textOrNull(response, "display_name");

            return new Address(
                    road != null ? road : Report.UNKNOWN_ROAD,
                    area != null ? area : Report.UNKNOWN_AREA,
                    fullAddress != null ? fullAddress : Report.UNKNOWN_ADDRESS
            );

        } catch (Exception e) {
            log.warn("[Nominatim] 역지오코딩 실패: ({},{}) - {}", latitude, longitude, e.getMessage());
            return Address.unknown();
        }
    }

    private String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }
}
