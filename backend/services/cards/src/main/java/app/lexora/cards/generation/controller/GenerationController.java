package app.lexora.cards.generation.controller;

import app.lexora.cards.deck.domain.dto.CardDTO;
import app.lexora.cards.generation.controller.dto.CancelGenerationResponse;
import app.lexora.cards.generation.controller.dto.GenerateCardsRequest;
import app.lexora.cards.generation.controller.dto.GenerationResultResponse;
import app.lexora.cards.generation.controller.dto.GenerationSessionResponse;
import app.lexora.cards.generation.model.Card;
import app.lexora.cards.generation.service.GenerationResult;
import app.lexora.cards.generation.service.GenerationService;
import app.lexora.cards.security.CurrentUserProvider;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
public class GenerationController {

    private final GenerationService generationService;
    private final CurrentUserProvider currentUserProvider;

    public GenerationController(GenerationService generationService, CurrentUserProvider currentUserProvider) {
        this.generationService = generationService;
        this.currentUserProvider = currentUserProvider;
    }

    // POST /decks/{deckId}/generations
    @PostMapping("/decks/{deckId}/generations")
    @ResponseStatus(HttpStatus.CREATED)
    public GenerationResultResponse generate(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID deckId,
            @Valid @RequestBody GenerateCardsRequest request
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        GenerationResult result = generationService.generate(userId, deckId, request.context(), request.maxCards());
        List<CardDTO> cards = result.cards().stream()
                .map(GenerationController::toCardDTO)
                .toList();
        return new GenerationResultResponse(GenerationSessionResponse.from(result.session()), cards);
    }

    // GET /decks/{deckId}/generations?limit=20
    @GetMapping("/decks/{deckId}/generations")
    public List<GenerationSessionResponse> getSessions(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID deckId,
            @RequestParam(defaultValue = "20") int limit
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        return generationService.getSessions(userId, deckId, limit).stream()
                .map(GenerationSessionResponse::from)
                .toList();
    }

    // GET /generations/{sessionId}
    @GetMapping("/generations/{sessionId}")
    public GenerationSessionResponse getSession(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID sessionId
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        return GenerationSessionResponse.from(generationService.getSession(userId, sessionId));
    }

    // POST /generations/{sessionId}/cancel
    @PostMapping("/generations/{sessionId}/cancel")
    public CancelGenerationResponse cancel(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID sessionId
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        return new CancelGenerationResponse(sessionId, generationService.cancel(userId, sessionId));
    }

    private static CardDTO toCardDTO(Card card) {
        return new CardDTO(
                card.cardId(),
                card.deckId(),
                card.word(),
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
