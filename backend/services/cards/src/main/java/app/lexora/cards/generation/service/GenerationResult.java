package app.lexora.cards.generation.service;

import app.lexora.cards.generation.model.Card;
import app.lexora.cards.generation.session.GenerationSession;

import java.util.List;

public record GenerationResult(
        GenerationSession session,
        List<Card> cards
) {
}
