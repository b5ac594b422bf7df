package app.lexora.cards.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Browser origins allowed to call the cards API. The export endpoint's {@code Content-Disposition}
 * header is always exposed so the frontend can read the package file name.
 */
@ConfigurationProperties(prefix = "app.cors")
public record CorsProps(
        List<String> origins,
        List<String> methods,
        Duration maxAge
) {

    public CorsProps {
        origins = origins == null || origins.isEmpty() ? List.of("http://localhost:3000") : List.copyOf(origins);
        methods = methods == null || methods.isEmpty()
                ? List.of("GET", "POST", "PATCH", "DELETE", "OPTIONS")
                : List.copyOf(methods);
        maxAge = maxAge == null ? Duration.ofHours(1) : maxAge;
    }
}
