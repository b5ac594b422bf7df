package app.lexora.cards.generation.port;

import app.lexora.cards.generation.model.Card;

import java.util.List;

public interface CardStore {

    /**
     * Inserts all cards or none of them.
     *
     * @throws CardStoreException if the batch cannot be written
     */
    void insertBatch(List<Card> cards);
}
