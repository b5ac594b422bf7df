package app.lexora.cards.config;

import app.lexora.cards.generation.pipeline.DuplicateDetector;
import app.lexora.cards.generation.pipeline.QualityGate;
import app.lexora.cards.generation.pipeline.WordNormalizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class GenerationPipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DuplicateDetector duplicateDetector(GenerationProps props) {
        return new DuplicateDetector(props.similarityThreshold());
    }

    @Bean
    public QualityGate qualityGate(WordNormalizer normalizer) {
        return new QualityGate(normalizer);
    }
}
