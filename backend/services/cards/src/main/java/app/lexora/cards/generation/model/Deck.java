package app.lexora.cards.generation.model;

import java.time.Instant;
import java.util.UUID;

public record Deck(
        UUID deckId,
        UUID ownerId,
        String title,
        String description,
        int cardCount,
        Instant createdAt,
        Instant updatedAt
) {
}
