package app.lexora.cards.generation.port;

import app.lexora.cards.generation.model.AudioRef;

public interface AudioSynthesisService {

    AudioRef synthesize(String word);

    /**
     * Releases a clip produced by {@link #synthesize} that no card will reference.
     */
    default void discard(AudioRef ref) {
    }
}
