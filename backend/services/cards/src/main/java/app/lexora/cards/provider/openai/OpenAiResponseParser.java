package app.lexora.cards.provider.openai;

import com.fasterxml.jackson.databind.JsonNode;

public final class OpenAiResponseParser {

    private OpenAiResponseParser() {
    }

    /**
     * Concatenates the {@code output_text} parts of a Responses API payload.
     */
    public static String extractText(JsonNode response) {
        if (response == null) {
            return "";
        }
        JsonNode outputText = response.get("output_text");
        if (outputText != null && outputText.isTextual()) {
            return outputText.asText();
        }
        JsonNode output = response.get("output");
        if (output == null || !output.isArray()) {
            return "";
        }
        StringBuilder builder = new StringBuilder();
        for (JsonNode item : output) {
            JsonNode content = item.get("content");
            if (content == null || !content.isArray()) {
                continue;
            }
            for (JsonNode part : content) {
                if (!"output_text".equals(part.path("type").asText())) {
                    continue;
                }
                String text = part.path("text").asText();
                if (text.isBlank()) {
                    continue;
                }
                if (!builder.isEmpty()) {
                    builder.append('\n');
                }
                builder.append(text);
            }
        }
        return builder.toString();
    }
}
