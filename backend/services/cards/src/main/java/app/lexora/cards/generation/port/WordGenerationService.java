package app.lexora.cards.generation.port;

import app.lexora.cards.generation.pipeline.CardCandidate;

import java.util.List;

/**
 * External generator turning a context into candidate vocabulary cards.
 * Implementations may return fewer than {@code maxCount} candidates.
 */
public interface WordGenerationService {

    List<CardCandidate> generate(String context, int maxCount);
}
