package app.lexora.cards.generation.service;

import app.lexora.cards.generation.session.GenerationSession;

public class GenerationServiceFailureException extends GenerationFailureException {

    public GenerationServiceFailureException(GenerationSession session, Throwable cause) {
        super("Word generation failed for session " + session.getSessionId(), session, cause);
    }
}
