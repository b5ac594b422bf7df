package app.lexora.cards.generation.service;

import app.lexora.cards.generation.session.GenerationSession;

/**
 * A run that ended FAILED for a reason other than its candidates. The finalized session travels
 * with the exception so callers can still report it.
 */
public abstract class GenerationFailureException extends RuntimeException {

    private final transient GenerationSession session;

    protected GenerationFailureException(String message, GenerationSession session, Throwable cause) {
        super(message, cause);
        this.session = session;
    }

    public GenerationSession getSession() {
        return session;
    }
}
