package app.lexora.cards.provider.openai;

import app.lexora.cards.config.GenerationProps;
import app.lexora.cards.generation.pipeline.CardCandidate;
import app.lexora.cards.generation.port.WordGenerationException;
import app.lexora.cards.generation.port.WordGenerationService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;

@Component
@ConditionalOnProperty(prefix = "app.generation", name = "provider", havingValue = "openai")
public class OpenAiWordGenerationService implements WordGenerationService {

    private static final Logger log = LoggerFactory.getLogger(OpenAiWordGenerationService.class);

    static final List<String> FIELDS = List.of("word", "translation", "example", "exampleTranslation");

    private final OpenAiClient openAiClient;
    private final OpenAiProps props;
    private final ObjectMapper objectMapper;
    private final String targetLanguage;
    private final String nativeLanguage;

    public OpenAiWordGenerationService(OpenAiClient openAiClient,
                                       OpenAiProps props,
                                       GenerationProps generationProps,
                                       ObjectMapper objectMapper) {
        this.openAiClient = openAiClient;
        this.props = props;
        this.objectMapper = objectMapper;
        this.targetLanguage = generationProps.targetLanguage();
        this.nativeLanguage = generationProps.nativeLanguage();
    }

    @Override
    public List<CardCandidate> generate(String context, int maxCount) {
        OpenAiResponseRequest request = new OpenAiResponseRequest(
                props.defaultModel(),
                buildInstructions(maxCount),
                context,
                props.maxOutputTokens(),
                buildCardsSchema(maxCount)
        );
        OpenAiResponseResult result;
        try {
            result = openAiClient.createResponse(request);
        } catch (RestClientException | IllegalStateException ex) {
            throw new WordGenerationException("OpenAI request failed: " + ex.getMessage(), ex);
        }
        List<CardCandidate> candidates = parseCandidates(result.outputText());
        log.info("OpenAI generated candidates count={} model={} tokensIn={} tokensOut={}",
                candidates.size(), result.model(), result.inputTokens(), result.outputTokens());
        return candidates;
    }

    String buildInstructions(int maxCount) {
        return """
                You create vocabulary flashcards for a learner of %s whose native language is %s.
                From the context given as input, pick up to %d useful words or short expressions in %s.
                For each one return: the word in its dictionary form, its %s translation, one natural %s
                example sentence that contains the word, and the %s translation of that sentence.
                Do not repeat words. Do not add commentary.
                """.formatted(targetLanguage, nativeLanguage, maxCount, targetLanguage,
                nativeLanguage, targetLanguage, nativeLanguage);
    }

    JsonNode buildCardsSchema(int maxCount) {
        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        ObjectNode cards = properties.putObject("cards");
        cards.put("type", "array");
        cards.put("maxItems", maxCount);
        ObjectNode items = cards.putObject("items");
        items.put("type", "object");
        ObjectNode itemProps = items.putObject("properties");
        ArrayNode required = items.putArray("required");
        for (String field : FIELDS) {
            itemProps.putObject(field).put("type", "string");
            required.add(field);
        }
        items.put("additionalProperties", false);
        schema.put("additionalProperties", false);
        schema.putArray("required").add("cards");

        ObjectNode responseFormat = objectMapper.createObjectNode();
        responseFormat.put("type", "json_schema");
        responseFormat.put("name", "lexora_cards");
        responseFormat.set("schema", schema);
        responseFormat.put("strict", true);
        return responseFormat;
    }

    List<CardCandidate> parseCandidates(String outputText) {
        if (outputText == null || outputText.isBlank()) {
            throw new WordGenerationException("OpenAI response is empty");
        }
        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(outputText);
        } catch (JsonProcessingException ex) {
            throw new WordGenerationException("Failed to parse OpenAI response", ex);
        }
        JsonNode cardsNode = parsed.path("cards");
        if (!cardsNode.isArray()) {
            throw new WordGenerationException("OpenAI response missing cards array");
        }
        List<CardCandidate> candidates = new ArrayList<>();
        for (JsonNode cardNode : cardsNode) {
            if (!cardNode.isObject()) {
                continue;
            }
            candidates.add(new CardCandidate(
                    text(cardNode, "word"),
                    text(cardNode, "translation"),
                    text(cardNode, "example"),
                    text(cardNode, "exampleTranslation")
            ));
        }
        return candidates;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        return value.asText();
    }
}
