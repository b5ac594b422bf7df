package app.lexora.cards.provider.openai;

/**
 * Body of {@code POST /v1/audio/speech} for one word. {@code instructions} is only honoured by the
 * gpt-4o TTS models and is left out of the payload when blank.
 */
public record OpenAiSpeechRequest(
        String model,
        String word,
        String voice,
        String format,
        String instructions
) {

    public OpenAiSpeechRequest {
        if (word == null || word.isBlank()) {
            throw new IllegalArgumentException("word is required");
        }
        word = word.trim();
    }

    public static OpenAiSpeechRequest forWord(String word, OpenAiProps props) {
        return new OpenAiSpeechRequest(
                props.defaultTtsModel(),
                word,
                props.defaultVoice(),
                props.defaultTtsFormat(),
                props.ttsInstructions()
        );
    }

    public boolean hasInstructions() {
        return instructions != null && !instructions.isBlank();
    }
}
