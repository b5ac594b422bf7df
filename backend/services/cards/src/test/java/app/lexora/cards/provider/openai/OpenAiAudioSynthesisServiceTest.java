package app.lexora.cards.provider.openai;

import app.lexora.cards.audio.AudioStorage;
import app.lexora.cards.generation.model.AudioRef;
import app.lexora.cards.generation.port.AudioSynthesisException;
import app.lexora.cards.support.InMemoryObjectStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpServerErrorException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OpenAiAudioSynthesisServiceTest {

    @Mock
    OpenAiClient openAiClient;

    private final InMemoryObjectStorage objectStorage = new InMemoryObjectStorage();
    private AudioStorage storage;
    private OpenAiAudioSynthesisService service;

    @BeforeEach
    void setUp() {
        OpenAiProps props = new OpenAiProps(null, "test-key", null, null, "nova", null, null, null, null, null);
        storage = new AudioStorage(objectStorage, "audio/", "mp3");
        service = new OpenAiAudioSynthesisService(openAiClient, props, storage);
    }

    @Test
    void synthesize_storesReturnedAudio() {
        when(openAiClient.createSpeech(any())).thenReturn(new byte[]{9, 8, 7});

        AudioRef ref = service.synthesize(" airport ");

        assertThat(storage.load(ref)).hasValue(new byte[]{9, 8, 7});
        ArgumentCaptor<OpenAiSpeechRequest> request = ArgumentCaptor.forClass(OpenAiSpeechRequest.class);
        verify(openAiClient).createSpeech(request.capture());
        assertThat(request.getValue().word()).isEqualTo("airport");
        assertThat(request.getValue().voice()).isEqualTo("nova");
        assertThat(request.getValue().format()).isEqualTo("mp3");
        assertThat(request.getValue().instructions()).isEqualTo(OpenAiProps.DEFAULT_TTS_INSTRUCTIONS);
    }

    @Test
    void synthesize_upstreamErrorBecomesAudioFailure() {
        when(openAiClient.createSpeech(any())).thenThrow(new HttpServerErrorException(HttpStatus.BAD_GATEWAY));

        assertThatThrownBy(() -> service.synthesize("airport"))
                .isInstanceOf(AudioSynthesisException.class)
                .hasMessageStartingWith("OpenAI speech request failed");
    }

    @Test
    void synthesize_blankWordIsRejectedWithoutCall() {
        assertThatThrownBy(() -> service.synthesize("  ")).isInstanceOf(AudioSynthesisException.class);
        verifyNoInteractions(openAiClient);
    }

    @Test
    void discard_deletesStoredClip() {
        when(openAiClient.createSpeech(any())).thenReturn(new byte[]{1});
        AudioRef ref = service.synthesize("airport");

        service.discard(ref);

        assertThat(objectStorage.objects()).isEmpty();
    }
}
