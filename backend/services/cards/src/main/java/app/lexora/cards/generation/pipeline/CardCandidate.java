package app.lexora.cards.generation.pipeline;

public record CardCandidate(
        String word,
        String translation,
        String example,
        String exampleTranslation
) {
}
