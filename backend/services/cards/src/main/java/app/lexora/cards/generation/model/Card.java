package app.lexora.cards.generation.model;

import java.time.Instant;
import java.util.UUID;

public record Card(
        UUID cardId,
        UUID deckId,
        String word,
        String normalizedWord,
        String translation,
        String example,
        String exampleTranslation,
        AudioRef audio,
        String context,
        Instant createdAt,
        Instant updatedAt
) {

    public boolean hasAudio() {
        return audio != null;
    }
}
