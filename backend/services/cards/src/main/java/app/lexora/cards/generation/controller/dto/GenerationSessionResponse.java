package app.lexora.cards.generation.controller.dto;

import app.lexora.cards.generation.domain.type.GenerationStatus;
import app.lexora.cards.generation.session.GenerationOutcome;
import app.lexora.cards.generation.session.GenerationSession;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record GenerationSessionResponse(
        UUID sessionId,
        UUID deckId,
        String context,
        int requestedCount,
        GenerationStatus status,
        int acceptedCount,
        int rejectedCount,
        String failureReason,
        List<GenerationOutcomeResponse> outcomes,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt
) {

    public static GenerationSessionResponse from(GenerationSession session) {
        List<GenerationOutcomeResponse> outcomes = session.getOutcomes().stream()
                .map(GenerationSessionResponse::toOutcome)
                .toList();
        return new GenerationSessionResponse(
                session.getSessionId(),
                session.getDeckId(),
                session.getContext(),
                session.getRequestedCount(),
                session.getStatus(),
                session.getAcceptedCount(),
                session.getRejectedCount(),
                session.getFailureReason(),
                outcomes,
                session.getCreatedAt(),
                session.getStartedAt(),
                session.getCompletedAt()
        );
    }

    private static GenerationOutcomeResponse toOutcome(GenerationOutcome outcome) {
        return new GenerationOutcomeResponse(outcome.word(), outcome.verdict(), outcome.reason());
    }
}
