package app.lexora.cards.generation.port;

import app.lexora.cards.generation.session.GenerationSession;

public interface SessionStore {

    void create(GenerationSession session);

    void update(GenerationSession session);
}
