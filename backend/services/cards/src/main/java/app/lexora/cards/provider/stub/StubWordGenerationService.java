package app.lexora.cards.provider.stub;

import app.lexora.cards.generation.pipeline.CardCandidate;
import app.lexora.cards.generation.port.WordGenerationService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Offline generator for local runs: turns the distinct longer words of the context into cards.
 */
@Service
@ConditionalOnProperty(name = "app.generation.provider", havingValue = "stub", matchIfMissing = true)
public class StubWordGenerationService implements WordGenerationService {

    private static final int MIN_WORD_LENGTH = 4;

    @Override
    public List<CardCandidate> generate(String context, int maxCount) {
        Set<String> words = new LinkedHashSet<>();
        for (String token : context.split("[^\\p{L}'-]+")) {
            if (token.length() >= MIN_WORD_LENGTH) {
                words.add(token.toLowerCase(Locale.ROOT));
            }
            if (words.size() == maxCount) {
                break;
            }
        }
        List<CardCandidate> candidates = new ArrayList<>(words.size());
        for (String word : words) {
            candidates.add(new CardCandidate(
                    word,
                    "(" + word + ")",
                    "Here is an example sentence with " + word + " in it.",
                    "Aqui está uma frase de exemplo com " + word + "."
            ));
        }
        return candidates;
    }
}
