package app.lexora.cards.generation.store;

import app.lexora.cards.deck.domain.entity.CardEntity;
import app.lexora.cards.deck.repository.CardRepository;
import app.lexora.cards.generation.model.Card;
import app.lexora.cards.generation.port.CardStore;
import app.lexora.cards.generation.port.CardStoreException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

@Component
public class JpaCardStore implements CardStore {

    private final CardRepository cardRepository;

    public JpaCardStore(CardRepository cardRepository) {
        this.cardRepository = cardRepository;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void insertBatch(List<Card> cards) {
        List<CardEntity> entities = new ArrayList<>(cards.size());
        for (Card card : cards) {
            entities.add(toEntity(card));
        }
        try {
            cardRepository.saveAll(entities);
            cardRepository.flush();
        } catch (DataAccessException ex) {
            throw new CardStoreException("Card batch of " + cards.size() + " could not be inserted", ex);
        }
    }

    static CardEntity toEntity(Card card) {
        return new CardEntity(
                card.cardId(),
                card.deckId(),
                card.word(),
                card.normalizedWord(),
                card.translation(),
                card.example(),
                card.exampleTranslation(),
                card.audio() == null ? null : card.audio().fileName(),
                card.context(),
                card.createdAt(),
                card.updatedAt()
        );
    }
}
