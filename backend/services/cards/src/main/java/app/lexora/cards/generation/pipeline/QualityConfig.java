package app.lexora.cards.generation.pipeline;

/**
 * Tunable bounds and weights of the quality gate.
 */
public record QualityConfig(
        int minWordLength,
        int maxWordLength,
        int exampleMinLength,
        int exampleMaxLength,
        int maxTranslationLength,
        double completenessWeight,
        double lengthWeight,
        double contentWeight,
        double threshold
) {

    public QualityConfig {
        if (minWordLength < 1 || maxWordLength < minWordLength) {
            throw new IllegalArgumentException("Invalid word length bounds: " + minWordLength + ".." + maxWordLength);
        }
        if (exampleMinLength < 0 || exampleMaxLength < exampleMinLength) {
            throw new IllegalArgumentException("Invalid example length bounds: " + exampleMinLength + ".." + exampleMaxLength);
        }
        if (completenessWeight < 0 || lengthWeight < 0 || contentWeight < 0
                || completenessWeight + lengthWeight + contentWeight <= 0) {
            throw new IllegalArgumentException("Quality weights must be non-negative and not all zero");
        }
    }

    public static QualityConfig defaults() {
        return new QualityConfig(2, 40, 10, 200, 100, 0.2d, 0.45d, 0.35d, 0.7d);
    }
}
