package app.lexora.cards.provider.openai;

public record OpenAiResponseResult(
        String outputText,
        String model,
        Integer inputTokens,
        Integer outputTokens
) {
}
