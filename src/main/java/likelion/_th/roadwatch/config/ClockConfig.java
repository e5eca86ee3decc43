package likelion._th.roadwatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // 구간 created_at, 신고 timestamp 기준 시각
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
