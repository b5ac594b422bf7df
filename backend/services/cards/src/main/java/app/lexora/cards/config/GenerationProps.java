package app.lexora.cards.config;

import app.lexora.cards.generation.pipeline.QualityConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.generation")
public record GenerationProps(
        String provider,
        Integer maxCards,
        Double similarityThreshold,
        Quality quality,
        Duration generationTimeout,
        Duration audioTimeout,
        Integer audioConcurrency,
        boolean audioRequired,
        Integer sessionRetentionDays,
        Integer lockStripes,
        String targetLanguage,
        String nativeLanguage,
        Integer generationConcurrency,
        Duration staleAfter
) {

    public GenerationProps {
        provider = provider == null || provider.isBlank() ? "stub" : provider;
        maxCards = maxCards == null || maxCards < 1 ? 20 : maxCards;
        similarityThreshold = similarityThreshold == null ? 0.8d : similarityThreshold;
        quality = quality == null ? new Quality(null, null, null, null, null, null, null, null, null) : quality;
        generationTimeout = generationTimeout == null ? Duration.ofSeconds(60) : generationTimeout;
        audioTimeout = audioTimeout == null ? Duration.ofSeconds(20) : audioTimeout;
        audioConcurrency = audioConcurrency == null || audioConcurrency < 1 ? 4 : audioConcurrency;
        sessionRetentionDays = sessionRetentionDays == null || sessionRetentionDays < 1 ? 30 : sessionRetentionDays;
        lockStripes = lockStripes == null || lockStripes < 1 ? 64 : lockStripes;
        targetLanguage = targetLanguage == null || targetLanguage.isBlank() ? "English" : targetLanguage;
        nativeLanguage = nativeLanguage == null || nativeLanguage.isBlank() ? "Portuguese" : nativeLanguage;
        generationConcurrency = generationConcurrency == null || generationConcurrency < 1 ? 8 : generationConcurrency;
        staleAfter = staleAfter == null ? Duration.ofMinutes(30) : staleAfter;
    }

    public QualityConfig toQualityConfig() {
        QualityConfig defaults = QualityConfig.defaults();
        return new QualityConfig(
                orDefault(quality.minWordLength(), defaults.minWordLength()),
                orDefault(quality.maxWordLength(), defaults.maxWordLength()),
                orDefault(quality.exampleMinLength(), defaults.exampleMinLength()),
                orDefault(quality.exampleMaxLength(), defaults.exampleMaxLength()),
                orDefault(quality.maxTranslationLength(), defaults.maxTranslationLength()),
                orDefault(quality.completenessWeight(), defaults.completenessWeight()),
                orDefault(quality.lengthWeight(), defaults.lengthWeight()),
                orDefault(quality.contentWeight(), defaults.contentWeight()),
                orDefault(quality.threshold(), defaults.threshold())
        );
    }

    private static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }

    private static double orDefault(Double value, double fallback) {
        return value == null ? fallback : value;
    }

    public record Quality(
            Integer minWordLength,
            Integer maxWordLength,
            Integer exampleMinLength,
            Integer exampleMaxLength,
            Integer maxTranslationLength,
            Double completenessWeight,
            Double lengthWeight,
            Double contentWeight,
            Double threshold
    ) {
    }
}
