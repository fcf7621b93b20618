package dev.compass;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Compass query router.
 *
 * <p>Exposes routing over REST ({@code /api/route}) and as MCP tools over SSE.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CompassApplication {
    public static void main(String[] args) {
        SpringApplication.run(CompassApplication.class, args);
    }
}
