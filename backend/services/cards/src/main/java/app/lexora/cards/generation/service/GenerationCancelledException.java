package app.lexora.cards.generation.service;

import app.lexora.cards.generation.session.GenerationSession;

public class GenerationCancelledException extends GenerationFailureException {

    public GenerationCancelledException(GenerationSession session) {
        super("Generation cancelled for session " + session.getSessionId(), session, null);
    }
}
