package likelion._th.roadwatch.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
// nominatim, osrm, openrouteservice 호출
public class WebClientConfig {

    @Value("${external-api.nominatim.base-url}")
    private String nominatimBaseUrl;

    @Value("${external-api.osrm.base-url}")
    private String osrmBaseUrl;

    @Value("${external-api.ors.base-url}")
    private String orsBaseUrl;

    @Bean(name = "nominatimWebClient")
    public WebClient nominatimWebClient(@Value("${external-api.nominatim.user-agent}") String userAgent) {
        // nominatim 은 User-Agent 없으면 거절
        return WebClient.builder()
                .baseUrl(nominatimBaseUrl)
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .build();
    }

    @Bean(name = "osrmWebClient")
    public WebClient osrmWebClient() {
        return WebClient.builder()
                .baseUrl(osrmBaseUrl)
                .build();
    }

    @Bean(name = "orsWebClient")
    public WebClient orsWebClient(@Value("${external-api.ors.api-key:}") String apiKey) {
        return WebClient.builder()
                .baseUrl(orsBaseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, apiKey)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, "application/json")
                .build();
    }

}
