package app.lexora.cards.provider.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Thin wrapper over the OpenAI Responses and Speech endpoints. Created only by the providers that
 * need it, so a missing API key never affects the stub setup.
 */
public class OpenAiClient {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public OpenAiClient(RestClient.Builder restClientBuilder,
                        OpenAiProps props,
                        ObjectMapper objectMapper) {
        if (!props.hasApiKey()) {
            throw new IllegalStateException("app.ai.openai.api-key is required for the openai provider");
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(props.connectTimeout());
        requestFactory.setReadTimeout(props.readTimeout());
        this.restClient = restClientBuilder
                .baseUrl(props.baseUrl())
                .requestFactory(requestFactory)
                .build();
        this.objectMapper = objectMapper;
        this.apiKey = props.apiKey();
    }

    public OpenAiResponseResult createResponse(OpenAiResponseRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", request.model());
        if (request.instructions() != null && !request.instructions().isBlank()) {
            payload.put("instructions", request.instructions());
        }
        payload.put("input", request.input());
        if (request.maxOutputTokens() != null && request.maxOutputTokens() > 0) {
            payload.put("max_output_tokens", request.maxOutputTokens());
        }
        if (request.responseFormat() != null && !request.responseFormat().isNull()) {
            ObjectNode textNode = payload.putObject("text");
            textNode.set("format", request.responseFormat());
        }

        JsonNode response = restClient.post()
                .uri("/v1/responses")
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class);

        if (response == null) {
            throw new IllegalStateException("OpenAI response is empty");
        }

        JsonNode usage = response.path("usage");
        return new OpenAiResponseResult(
                OpenAiResponseParser.extractText(response),
                response.path("model").asText(null),
                usage.hasNonNull("input_tokens") ? usage.get("input_tokens").asInt() : null,
                usage.hasNonNull("output_tokens") ? usage.get("output_tokens").asInt() : null
        );
    }

    public byte[] createSpeech(OpenAiSpeechRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", request.model());
        payload.put("input", request.word());
        payload.put("voice", request.voice());
        payload.put("response_format", request.format());
        if (request.hasInstructions()) {
            payload.put("instructions", request.instructions());
        }

        byte[] response = restClient.post()
                .uri("/v1/audio/speech")
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(byte[].class);

        if (response == null || response.length == 0) {
            throw new IllegalStateException("OpenAI speech response is empty");
        }
        return response;
    }

    private String bearer() {
        return "Bearer " + apiKey;
    }
}
