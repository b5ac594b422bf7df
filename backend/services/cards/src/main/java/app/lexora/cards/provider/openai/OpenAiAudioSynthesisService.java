package app.lexora.cards.provider.openai;

import app.lexora.cards.audio.AudioStorage;
import app.lexora.cards.generation.model.AudioRef;
import app.lexora.cards.generation.port.AudioSynthesisException;
import app.lexora.cards.generation.port.AudioSynthesisService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import software.amazon.awssdk.core.exception.SdkException;

@Component
@ConditionalOnProperty(prefix = "app.audio", name = "provider", havingValue = "openai")
public class OpenAiAudioSynthesisService implements AudioSynthesisService {

    private final OpenAiClient openAiClient;
    private final OpenAiProps props;
    private final AudioStorage storage;

    public OpenAiAudioSynthesisService(OpenAiClient openAiClient, OpenAiProps props, AudioStorage storage) {
        this.openAiClient = openAiClient;
        this.props = props;
        this.storage = storage;
    }

    @Override
    public AudioRef synthesize(String word) {
        if (word == null || word.isBlank()) {
            throw new AudioSynthesisException("word is empty");
        }
        byte[] audio;
        try {
            audio = openAiClient.createSpeech(OpenAiSpeechRequest.forWord(word, props));
        } catch (RestClientException | IllegalStateException ex) {
            throw new AudioSynthesisException("OpenAI speech request failed: " + ex.getMessage(), ex);
        }
        try {
            return storage.store(word, audio);
        } catch (SdkException ex) {
            throw new AudioSynthesisException("Audio could not be stored for '" + word + "'", ex);
        }
    }

    @Override
    public void discard(AudioRef ref) {
        storage.delete(ref);
    }
}
