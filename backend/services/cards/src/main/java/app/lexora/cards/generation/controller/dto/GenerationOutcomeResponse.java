package app.lexora.cards.generation.controller.dto;

import app.lexora.cards.generation.domain.type.OutcomeVerdict;

public record GenerationOutcomeResponse(
        String word,
        OutcomeVerdict verdict,
        String reason
) {
}
