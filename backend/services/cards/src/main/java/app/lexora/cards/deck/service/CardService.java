package app.lexora.cards.deck.service;

import app.lexora.cards.deck.domain.dto.CardDTO;
import app.lexora.cards.deck.domain.entity.CardEntity;
import app.lexora.cards.deck.repository.CardRepository;
import app.lexora.cards.generation.model.AudioRef;
import app.lexora.cards.generation.port.AudioSynthesisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.UUID;

@Service
public class CardService {

    private static final Logger log = LoggerFactory.getLogger(CardService.class);

    private final CardRepository cardRepository;
    private final DeckService deckService;
    private final AudioSynthesisService audioSynthesisService;
    private final Clock clock;

    public CardService(CardRepository cardRepository,
                       DeckService deckService,
                       AudioSynthesisService audioSynthesisService,
                       Clock clock) {
        this.cardRepository = cardRepository;
        this.deckService = deckService;
        this.audioSynthesisService = audioSynthesisService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Page<CardDTO> getCards(UUID ownerId, UUID deckId, int page, int limit) {
        deckService.requireOwnedDeck(ownerId, deckId);
        Pageable pageable = PageRequest.of(page - 1, limit);
        return cardRepository.findByDeckIdOrderByCreatedAtAsc(deckId, pageable)
                .map(CardService::toCardDTO);
    }

    @Transactional(readOnly = true)
    public CardDTO getCard(UUID ownerId, UUID deckId, UUID cardId) {
        deckService.requireOwnedDeck(ownerId, deckId);
        return toCardDTO(requireCard(deckId, cardId));
    }

    /**
     * Synthesizes the card's pronunciation again and attaches it. The external call runs outside
     * any transaction. The replaced clip is released once the card points at the new one.
     */
    public CardDTO regenerateAudio(UUID ownerId, UUID deckId, UUID cardId) {
        deckService.requireOwnedDeck(ownerId, deckId);
        CardEntity card = requireCard(deckId, cardId);
        String previous = card.getAudioFile();
        AudioRef audio = audioSynthesisService.synthesize(card.getWord());
        card.setAudioFile(audio.fileName());
        card.setUpdatedAt(clock.instant());
        CardEntity saved;
        try {
            saved = cardRepository.save(card);
        } catch (RuntimeException ex) {
            audioSynthesisService.discard(audio);
            throw ex;
        }
        if (previous != null && !previous.equals(audio.fileName())) {
            audioSynthesisService.discard(new AudioRef(previous));
        }
        log.info("Card audio regenerated cardId={} deckId={} file={}", cardId, deckId, audio.fileName());
        return toCardDTO(saved);
    }

    private CardEntity requireCard(UUID deckId, UUID cardId) {
        return cardRepository.findByCardIdAndDeckId(cardId, deckId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Card not found: " + cardId));
    }

    static CardDTO toCardDTO(CardEntity entity) {
        return new CardDTO(
                entity.getCardId(),
                entity.getDeckId(),
                entity.getWord(),
                entity.getTranslation(),
                entity.getExample(),
                entity.getExampleTranslation(),
                entity.getAudioFile(),
                entity.getContext(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }
}
