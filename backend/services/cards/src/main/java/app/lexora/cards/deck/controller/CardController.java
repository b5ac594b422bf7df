package app.lexora.cards.deck.controller;

import app.lexora.cards.deck.domain.dto.CardDTO;
import app.lexora.cards.deck.service.CardService;
import app.lexora.cards.security.CurrentUserProvider;
import org.springframework.data.domain.Page;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/decks/{deckId}/cards")
public class CardController {

    private final CardService cardService;
    private final CurrentUserProvider currentUserProvider;

    public CardController(CardService cardService, CurrentUserProvider currentUserProvider) {
        this.cardService = cardService;
        this.currentUserProvider = currentUserProvider;
    }

    // GET /decks/{deckId}/cards?page=1&limit=50
    @GetMapping
    public Page<CardDTO> getCards(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID deckId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int limit
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        return cardService.getCards(userId, deckId, page, limit);
    }

    // GET /decks/{deckId}/cards/{cardId}
    @GetMapping("/{cardId}")
    public CardDTO getCard(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID deckId,
            @PathVariable UUID cardId
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        return cardService.getCard(userId, deckId, cardId);
    }

    // POST /decks/{deckId}/cards/{cardId}/audio
    @PostMapping("/{cardId}/audio")
    public CardDTO regenerateAudio(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID deckId,
            @PathVariable UUID cardId
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        return cardService.regenerateAudio(userId, deckId, cardId);
    }
}
