package app.lexora.cards.generation.service;

import app.lexora.cards.config.GenerationProps;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Striped per-deck locks. Two decks may share a stripe, which only costs throughput.
 * Runs in other processes are kept apart by the unique (deck_id, normalized_word) constraint.
 */
@Component
public class DeckLockRegistry {

    private final ReentrantLock[] stripes;

    public DeckLockRegistry(GenerationProps props) {
        this(props.lockStripes());
    }

    DeckLockRegistry(int stripeCount) {
        this.stripes = new ReentrantLock[Math.max(stripeCount, 1)];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public Lock lockFor(UUID deckId) {
        return stripes[Math.floorMod(deckId.hashCode(), stripes.length)];
    }
}
