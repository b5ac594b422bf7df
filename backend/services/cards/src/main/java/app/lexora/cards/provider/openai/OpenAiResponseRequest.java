package app.lexora.cards.provider.openai;

import com.fasterxml.jackson.databind.JsonNode;

public record OpenAiResponseRequest(
        String model,
        String instructions,
        String input,
        Integer maxOutputTokens,
        JsonNode responseFormat
) {
}
