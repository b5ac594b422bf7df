package app.lexora.cards.generation.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scores a generated candidate and decides whether it is good enough to become a card.
 */
public class QualityGate {

    private static final int TRACKED_FIELDS = 4;
    private static final int MIN_STEM_TOKEN = 3;
    private static final String[] SUFFIXES = {"ing", "est", "ed", "es", "er", "ly", "s"};
    private static final int MAX_WORD_TOKENS = 5;
    private static final Pattern NON_LETTERS = Pattern.compile("[^\\p{L}\\s'-]");
    private static final Set<String> FUNCTION_WORDS = Set.of(
            "the", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by");
    private static final List<String> GENERIC_OPENERS = List.of(
            "this is a", "that is a", "it is a", "here is a", "there is a");

    private final WordNormalizer normalizer;

    public QualityGate(WordNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public QualityVerdict passesQuality(CardCandidate candidate, QualityConfig config) {
        if (candidate == null) {
            return QualityVerdict.reject("candidate is empty", 0d);
        }
        NormalizedKey word = normalizer.normalize(candidate.word());
        String translation = normalizer.normalizeText(candidate.translation());
        String example = normalizer.normalizeText(candidate.example());
        String exampleTranslation = normalizer.normalizeText(candidate.exampleTranslation());

        List<String> missing = new ArrayList<>();
        if (word.isEmpty()) {
            missing.add("word");
        }
        if (translation.isEmpty()) {
            missing.add("translation");
        }
        if (example.isEmpty()) {
            missing.add("example");
        }
        if (exampleTranslation.isEmpty()) {
            missing.add("exampleTranslation");
        }

        List<ContentIssue> issues = contentIssues(word, example, exampleTranslation, config);
        double score = compositeScore(word, translation, example, exampleTranslation, missing.size(), issues, config);
        if (!missing.isEmpty()) {
            return QualityVerdict.reject("missing field(s): " + String.join(", ", missing), score);
        }
        if (word.length() < config.minWordLength()) {
            return QualityVerdict.reject(
                    "word length " + word.length() + " is below minimum " + config.minWordLength(), score);
        }
        if (word.length() > config.maxWordLength()) {
            return QualityVerdict.reject(
                    "word length " + word.length() + " is above maximum " + config.maxWordLength(), score);
        }
        if (!exampleMentions(example, word)) {
            return QualityVerdict.reject("example does not contain the word", score);
        }
        if (score < config.threshold()) {
            String reason = String.format(Locale.ROOT, "quality score %.2f below threshold %.2f",
                    score, config.threshold());
            if (!issues.isEmpty()) {
                reason += issues.stream()
                        .map(ContentIssue::description)
                        .collect(Collectors.joining("; ", " (", ")"));
            }
            return QualityVerdict.reject(reason, score);
        }
        return QualityVerdict.accept(score);
    }

    private double compositeScore(NormalizedKey word,
                                  String translation,
                                  String example,
                                  String exampleTranslation,
                                  int missingFields,
                                  List<ContentIssue> issues,
                                  QualityConfig config) {
        double completeness = (TRACKED_FIELDS - missingFields) / (double) TRACKED_FIELDS;
        double lengthScore = (
                fitness(word.length(), config.minWordLength(), config.maxWordLength())
                        + fitness(example.length(), config.exampleMinLength(), config.exampleMaxLength())
                        + fitness(translation.length(), 1, config.maxTranslationLength())
                        + fitness(exampleTranslation.length(), config.exampleMinLength(), config.exampleMaxLength())
        ) / TRACKED_FIELDS;
        double penalty = issues.stream().mapToDouble(ContentIssue::penalty).sum();
        double contentScore = Math.max(0d, 1d - penalty);
        double weights = config.completenessWeight() + config.lengthWeight() + config.contentWeight();
        return (config.completenessWeight() * completeness
                + config.lengthWeight() * lengthScore
                + config.contentWeight() * contentScore) / weights;
    }

    /**
     * 1 inside {@code [min, max]}. Below the range it rises linearly from 0 at an empty field,
     * above it falls linearly to 0 once the overshoot reaches {@code max}.
     */
    static double fitness(int length, int min, int max) {
        if (length == 0) {
            return 0d;
        }
        if (length < min) {
            return length / (double) min;
        }
        if (length > max) {
            return Math.max(0d, 1d - (length - max) / (double) max);
        }
        return 1d;
    }

    private List<ContentIssue> contentIssues(NormalizedKey word,
                                             String example,
                                             String exampleTranslation,
                                             QualityConfig config) {
        List<ContentIssue> issues = new ArrayList<>();
        if (hasNonLetters(word)) {
            issues.add(new ContentIssue("word contains non-letter characters", 0.4d));
        }
        if (FUNCTION_WORDS.contains(word.value())) {
            issues.add(new ContentIssue("word is a function word", 0.2d));
        }
        if (word.tokens().size() > MAX_WORD_TOKENS) {
            issues.add(new ContentIssue("word has more than " + MAX_WORD_TOKENS + " tokens", 0.3d));
        }
        if (isGeneric(example)) {
            issues.add(new ContentIssue("example is generic", 0.3d));
        }
        if (!exampleTranslation.isEmpty() && exampleTranslation.length() < config.exampleMinLength()) {
            issues.add(new ContentIssue("example translation is shorter than " + config.exampleMinLength(), 0.3d));
        }
        return issues;
    }

    private boolean hasNonLetters(NormalizedKey word) {
        return !word.isEmpty() && NON_LETTERS.matcher(word.value()).find();
    }

    private boolean isGeneric(String example) {
        String padded = " " + example + " ";
        for (String opener : GENERIC_OPENERS) {
            if (padded.contains(" " + opener + " ")) {
                return true;
            }
        }
        return false;
    }

    boolean exampleMentions(String example, NormalizedKey word) {
        if (example.isEmpty() || word.isEmpty()) {
            return false;
        }
        if (example.contains(word.value())) {
            return true;
        }
        String[] exampleTokens = example.split(" ");
        boolean checkedAny = false;
        for (String token : word.tokens()) {
            if (token.length() < MIN_STEM_TOKEN) {
                continue;
            }
            checkedAny = true;
            if (!matchesAnyToken(stem(token), exampleTokens)) {
                return false;
            }
        }
        return checkedAny;
    }

    private boolean matchesAnyToken(String stem, String[] exampleTokens) {
        for (String exampleToken : exampleTokens) {
            if (exampleToken.startsWith(stem) || stem(exampleToken).equals(stem)) {
                return true;
            }
        }
        return false;
    }

    static String stem(String token) {
        String stem = token;
        for (String suffix : SUFFIXES) {
            if (stem.endsWith(suffix) && stem.length() - suffix.length() >= MIN_STEM_TOKEN) {
                stem = stem.substring(0, stem.length() - suffix.length());
                break;
            }
        }
        if (stem.endsWith("e") && stem.length() > MIN_STEM_TOKEN) {
            stem = stem.substring(0, stem.length() - 1);
        }
        return stem;
    }

    private record ContentIssue(String description, double penalty) {
    }
}
