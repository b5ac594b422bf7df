package app.lexora.cards.generation.store;

import app.lexora.cards.deck.domain.entity.DeckEntity;
import app.lexora.cards.deck.repository.CardRepository;
import app.lexora.cards.deck.repository.DeckRepository;
import app.lexora.cards.generation.model.Deck;
import app.lexora.cards.generation.pipeline.NormalizedKey;
import app.lexora.cards.generation.port.CardStoreException;
import app.lexora.cards.generation.port.DeckStore;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Component
public class JpaDeckStore implements DeckStore {

    private final DeckRepository deckRepository;
    private final CardRepository cardRepository;

    public JpaDeckStore(DeckRepository deckRepository, CardRepository cardRepository) {
        this.deckRepository = deckRepository;
        this.cardRepository = cardRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Deck> get(UUID deckId) {
        return deckRepository.findById(deckId).map(JpaDeckStore::toDeck);
    }

    @Override
    @Transactional(readOnly = true)
    public Set<NormalizedKey> listWordKeys(UUID deckId) {
        Set<NormalizedKey> keys = new HashSet<>();
        for (String word : cardRepository.findNormalizedWordsByDeckId(deckId)) {
            keys.add(new NormalizedKey(word));
        }
        return keys;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void incrementCardCount(UUID deckId, int n) {
        int updated = deckRepository.incrementCardCount(deckId, n);
        if (updated != 1) {
            throw new CardStoreException("Deck counter not updated for deck " + deckId);
        }
    }

    static Deck toDeck(DeckEntity entity) {
        return new Deck(
                entity.getDeckId(),
                entity.getOwnerId(),
                entity.getTitle(),
                entity.getDescription(),
                entity.getCardCount() == null ? 0 : entity.getCardCount(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }
}
