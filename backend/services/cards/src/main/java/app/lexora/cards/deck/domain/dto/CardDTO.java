package app.lexora.cards.deck.domain.dto;

import java.time.Instant;
import java.util.UUID;

public record CardDTO(
        UUID cardId,
        UUID deckId,
        String word,
        String translation,
        String example,
        String exampleTranslation,
        String audioFile,
        String context,
        Instant createdAt,
        Instant updatedAt
) {
}
