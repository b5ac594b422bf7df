package app.lexora.cards.generation.port;

import app.lexora.cards.generation.model.Deck;
import app.lexora.cards.generation.pipeline.NormalizedKey;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public interface DeckStore {

    Optional<Deck> get(UUID deckId);

    Set<NormalizedKey> listWordKeys(UUID deckId);

    /**
     * Adds {@code n} to the deck's running card counter. Must join the caller's transaction.
     */
    void incrementCardCount(UUID deckId, int n);
}
