package dev.trafomatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the transformer design matcher.
 *
 * <p>Runs without a web server: the catalog is reloaded on a schedule and searches go through
 * {@link dev.trafomatch.search.DesignSearchService}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class TrafoMatchApplication {
    public static void main(String[] args) {
        SpringApplication.run(TrafoMatchApplication.class, args);
    }
}
