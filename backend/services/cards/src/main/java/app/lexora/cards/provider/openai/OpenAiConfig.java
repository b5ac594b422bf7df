package app.lexora.cards.provider.openai;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class OpenAiConfig {

    @Bean
    @ConditionalOnExpression("'${app.generation.provider:stub}' == 'openai' or '${app.audio.provider:none}' == 'openai'")
    public OpenAiClient openAiClient(RestClient.Builder restClientBuilder,
                                     OpenAiProps props,
                                     ObjectMapper objectMapper) {
        return new OpenAiClient(restClientBuilder, props, objectMapper);
    }
}
