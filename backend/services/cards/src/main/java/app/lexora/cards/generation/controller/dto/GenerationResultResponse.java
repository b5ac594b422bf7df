package app.lexora.cards.generation.controller.dto;

import app.lexora.cards.deck.domain.dto.CardDTO;

import java.util.List;

public record GenerationResultResponse(
        GenerationSessionResponse session,
        List<CardDTO> cards
) {
}
