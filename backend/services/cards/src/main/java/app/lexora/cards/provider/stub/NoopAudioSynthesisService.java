package app.lexora.cards.provider.stub;

import app.lexora.cards.generation.model.AudioRef;
import app.lexora.cards.generation.port.AudioSynthesisException;
import app.lexora.cards.generation.port.AudioSynthesisService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Used when no speech backend is configured. Every call fails, so cards are stored without audio.
 */
@Component
@ConditionalOnProperty(prefix = "app.audio", name = "provider", havingValue = "none", matchIfMissing = true)
public class NoopAudioSynthesisService implements AudioSynthesisService {

    @Override
    public AudioRef synthesize(String word) {
        throw new AudioSynthesisException("audio synthesis is disabled");
    }
}
