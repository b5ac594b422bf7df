package app.lexora.cards.generation.controller.dto;

import java.util.UUID;

public record CancelGenerationResponse(
        UUID sessionId,
        boolean cancelled
) {
}
