package app.lexora.cards.generation.service;

import app.lexora.cards.generation.session.GenerationSession;

public class PersistenceFailureException extends GenerationFailureException {

    public PersistenceFailureException(GenerationSession session, Throwable cause) {
        super("Accepted cards could not be stored for session " + session.getSessionId(), session, cause);
    }
}
