package likelion._th.roadwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RoadwatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoadwatchApplication.class, args);
    }
}
