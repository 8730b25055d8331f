package dev.catananti.stats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StatsDataServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(StatsDataServiceApplication.class, args);
    }
}
