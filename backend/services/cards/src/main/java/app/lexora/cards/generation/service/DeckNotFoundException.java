package app.lexora.cards.generation.service;

import java.util.UUID;

public class DeckNotFoundException extends RuntimeException {

    private final UUID deckId;

    public DeckNotFoundException(UUID deckId) {
        super("Deck not found: " + deckId);
        this.deckId = deckId;
    }

    public UUID getDeckId() {
        return deckId;
    }
}
