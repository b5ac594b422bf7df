package app.lexora.cards.generation.service;

import app.lexora.cards.deck.service.DeckService;
import app.lexora.cards.generation.session.GenerationSession;
import app.lexora.cards.generation.store.JpaSessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * Entry point for user-facing generation requests: ownership checks in front of the orchestrator,
 * session lookups and cancellation.
 */
@Service
public class GenerationService {

    private static final Logger log = LoggerFactory.getLogger(GenerationService.class);

    static final int MAX_SESSION_LIMIT = 100;

    private final DeckService deckService;
    private final CardGenerationOrchestrator orchestrator;
    private final JpaSessionStore sessionStore;
    private final ActiveGenerationRegistry activeRuns;

    public GenerationService(DeckService deckService,
                             CardGenerationOrchestrator orchestrator,
                             JpaSessionStore sessionStore,
                             ActiveGenerationRegistry activeRuns) {
        this.deckService = deckService;
        this.orchestrator = orchestrator;
        this.sessionStore = sessionStore;
        this.activeRuns = activeRuns;
    }

    public GenerationResult generate(UUID ownerId, UUID deckId, String context, int maxCards) {
        deckService.requireOwnedDeck(ownerId, deckId);
        return orchestrator.generate(deckId, context.trim(), maxCards);
    }

    public GenerationSession getSession(UUID ownerId, UUID sessionId) {
        return sessionStore.find(sessionId)
                .filter(session -> deckService.isOwnedBy(ownerId, session.getDeckId()))
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Generation session not found: " + sessionId));
    }

    public List<GenerationSession> getSessions(UUID ownerId, UUID deckId, int limit) {
        if (limit < 1 || limit > MAX_SESSION_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_SESSION_LIMIT);
        }
        deckService.requireOwnedDeck(ownerId, deckId);
        return sessionStore.listByDeck(deckId, limit);
    }

    /**
     * Signals a run in flight in this process. Returns {@code false} when the session already
     * finalized or runs elsewhere. A run that has started writing its cards refuses the signal.
     */
    public boolean cancel(UUID ownerId, UUID sessionId) {
        GenerationSession session = getSession(ownerId, sessionId);
        if (session.isFinalized()) {
            return false;
        }
        boolean signalled = activeRuns.cancel(sessionId);
        log.info("Generation cancel requested sessionId={} deckId={} signalled={}",
                sessionId, session.getDeckId(), signalled);
        return signalled;
    }
}
