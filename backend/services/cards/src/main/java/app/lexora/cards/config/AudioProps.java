package app.lexora.cards.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.audio")
public record AudioProps(
        String provider,
        String keyPrefix,
        String format
) {

    public AudioProps {
        provider = provider == null || provider.isBlank() ? "none" : provider;
        keyPrefix = keyPrefix == null ? "audio/" : keyPrefix;
        format = format == null || format.isBlank() ? "mp3" : format;
    }
}
