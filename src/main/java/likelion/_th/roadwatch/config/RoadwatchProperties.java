package likelion._th.roadwatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "roadwatch")
@Data
public class RoadwatchProperties {

    private Clustering clustering = new Clustering();
    private Series series = new Series();
    private Routing routing = new Routing();
    private Timeouts timeouts = new Timeouts();

    @Data
    public static class Clustering {
        private double radiusMeters = 100;
    }

    @Data
    public static class Series {
        private double distanceThresholdMeters = 200;
        private int minPotholes = 3;
    }

    @Data
    public static class Routing {
        private double intersectionThresholdMeters = 50;
        // 회피 지점 주변 사각형 반폭
        private double avoidRadiusMeters = 150;
    }

    @Data
    public static class Timeouts {
        private Duration geocoding = Duration.ofSeconds(10);
        private Duration routing = Duration.ofSeconds(15);
        private Duration store = Duration.ofSeconds(15);
    }
}
