package app.lexora.cards.generation.domain.type;

public enum OutcomeVerdict {
    ACCEPTED,
    REJECTED_DUPLICATE,
    REJECTED_QUALITY,
    REJECTED_GENERATION_FAILURE,
    REJECTED_AUDIO_FAILURE;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
