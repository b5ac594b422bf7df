package app.lexora.cards.generation.session;

import app.lexora.cards.generation.domain.type.OutcomeVerdict;

/**
 * What happened to one candidate word during a run.
 *
 * @param degraded the candidate was accepted but an infrastructure step (audio) did not succeed
 */
public record GenerationOutcome(
        String word,
        OutcomeVerdict verdict,
        String reason,
        boolean degraded
) {

    public GenerationOutcome {
        if (verdict == null) {
            throw new IllegalArgumentException("verdict is required");
        }
    }

    public static GenerationOutcome of(String word, OutcomeVerdict verdict, String reason) {
        return new GenerationOutcome(word, verdict, reason, false);
    }

    public static GenerationOutcome acceptedWithoutAudio(String word, String reason) {
        return new GenerationOutcome(word, OutcomeVerdict.ACCEPTED, reason, true);
    }
}
