package app.lexora.cards.provider.openai;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.ai.openai")
public record OpenAiProps(
        String baseUrl,
        String apiKey,
        String defaultModel,
        String defaultTtsModel,
        String defaultVoice,
        String defaultTtsFormat,
        String ttsInstructions,
        Integer maxOutputTokens,
        Duration connectTimeout,
        Duration readTimeout
) {

    static final String DEFAULT_TTS_INSTRUCTIONS =
            "Pronounce the word once, clearly and at a slow even pace, like a dictionary recording.";

    public OpenAiProps {
        baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.openai.com" : baseUrl;
        defaultModel = defaultModel == null || defaultModel.isBlank() ? "gpt-4.1-mini" : defaultModel;
        defaultTtsModel = defaultTtsModel == null || defaultTtsModel.isBlank() ? "gpt-4o-mini-tts" : defaultTtsModel;
        defaultVoice = defaultVoice == null || defaultVoice.isBlank() ? "alloy" : defaultVoice;
        defaultTtsFormat = defaultTtsFormat == null || defaultTtsFormat.isBlank() ? "mp3" : defaultTtsFormat;
        ttsInstructions = ttsInstructions == null ? DEFAULT_TTS_INSTRUCTIONS : ttsInstructions;
        maxOutputTokens = maxOutputTokens == null || maxOutputTokens < 1 ? 4000 : maxOutputTokens;
        connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
        readTimeout = readTimeout == null ? Duration.ofSeconds(90) : readTimeout;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
