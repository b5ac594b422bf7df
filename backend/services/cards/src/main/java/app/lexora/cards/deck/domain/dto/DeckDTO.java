package app.lexora.cards.deck.domain.dto;

import java.time.Instant;
import java.util.UUID;

public record DeckDTO(
        UUID deckId,
        UUID ownerId,
        String title,
        String description,
        int cardCount,
        Instant createdAt,
        Instant updatedAt
) {
}
