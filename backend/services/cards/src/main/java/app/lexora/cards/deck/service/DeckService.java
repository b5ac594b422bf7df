package app.lexora.cards.deck.service;

import app.lexora.cards.deck.domain.dto.DeckDTO;
import app.lexora.cards.deck.domain.entity.DeckEntity;
import app.lexora.cards.deck.domain.request.CreateDeckRequest;
import app.lexora.cards.deck.domain.request.UpdateDeckRequest;
import app.lexora.cards.deck.repository.DeckRepository;
import app.lexora.cards.generation.service.DeckNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Service
public class DeckService {

    private static final Logger log = LoggerFactory.getLogger(DeckService.class);

    private final DeckRepository deckRepository;
    private final Clock clock;

    public DeckService(DeckRepository deckRepository, Clock clock) {
        this.deckRepository = deckRepository;
        this.clock = clock;
    }

    @Transactional
    public DeckDTO createDeck(UUID ownerId, CreateDeckRequest request) {
        String title = request.title() == null ? "" : request.title().trim();
        if (title.isEmpty()) {
            throw new IllegalArgumentException("Deck title must not be blank");
        }
        Instant now = clock.instant();
        DeckEntity deck = new DeckEntity(
                UUID.randomUUID(),
                ownerId,
                title,
                trimToNull(request.description()),
                0,
                now,
                now
        );
        DeckEntity saved = deckRepository.save(deck);
        log.info("Deck created deckId={} ownerId={}", saved.getDeckId(), ownerId);
        return toDeckDTO(saved);
    }

    @Transactional(readOnly = true)
    public Page<DeckDTO> getDecks(UUID ownerId, int page, int limit) {
        Pageable pageable = PageRequest.of(page - 1, limit);
        return deckRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId, pageable)
                .map(this::toDeckDTO);
    }

    @Transactional(readOnly = true)
    public DeckDTO getDeck(UUID ownerId, UUID deckId) {
        return toDeckDTO(requireOwnedDeck(ownerId, deckId));
    }

    @Transactional
    public DeckDTO updateDeck(UUID ownerId, UUID deckId, UpdateDeckRequest request) {
        DeckEntity deck = requireOwnedDeck(ownerId, deckId);
        if (request.title() != null) {
            String title = request.title().trim();
            if (title.isEmpty()) {
                throw new IllegalArgumentException("Deck title must not be blank");
            }
            deck.setTitle(title);
        }
        if (request.description() != null) {
            deck.setDescription(trimToNull(request.description()));
        }
        deck.setUpdatedAt(clock.instant());
        return toDeckDTO(deckRepository.save(deck));
    }

    /**
     * Decks of other users are reported exactly like missing ones.
     */
    @Transactional(readOnly = true)
    public DeckEntity requireOwnedDeck(UUID ownerId, UUID deckId) {
        return deckRepository.findByDeckIdAndOwnerId(deckId, ownerId)
                .orElseThrow(() -> new DeckNotFoundException(deckId));
    }

    @Transactional(readOnly = true)
    public boolean isOwnedBy(UUID ownerId, UUID deckId) {
        return deckRepository.findByDeckIdAndOwnerId(deckId, ownerId).isPresent();
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private DeckDTO toDeckDTO(DeckEntity entity) {
        return new DeckDTO(
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
