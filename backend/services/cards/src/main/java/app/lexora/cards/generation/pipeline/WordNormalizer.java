package app.lexora.cards.generation.pipeline;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

@Component
public class WordNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern DISALLOWED = Pattern.compile("[^\\p{L}\\p{N}\\s'-]+");
    // hyphens and apostrophes survive only between letters or digits
    private static final Pattern DANGLING_JOINERS = Pattern.compile("(?<![\\p{L}\\p{N}])['-]+|['-]+(?![\\p{L}\\p{N}])");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public NormalizedKey normalize(String rawWord) {
        String normalized = normalizeText(rawWord);
        return normalized.isEmpty() ? NormalizedKey.EMPTY : new NormalizedKey(normalized);
    }

    public String normalizeText(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String folded = Normalizer.normalize(raw, Normalizer.Form.NFD);
        folded = COMBINING_MARKS.matcher(folded).replaceAll("");
        folded = folded.toLowerCase(Locale.ROOT)
                .replace('’', '\'')
                .replace('‘', '\'')
                .replace('‐', '-')
                .replace('‑', '-');
        folded = DISALLOWED.matcher(folded).replaceAll(" ");
        folded = DANGLING_JOINERS.matcher(folded).replaceAll(" ");
        return WHITESPACE.matcher(folded).replaceAll(" ").trim();
    }
}
