package app.lexora.cards.generation.pipeline;

import java.util.Arrays;
import java.util.List;

/**
 * Canonical comparison form of a word. Instances are produced by {@link WordNormalizer}.
 */
public record NormalizedKey(String value) {

    public static final NormalizedKey EMPTY = new NormalizedKey("");

    public NormalizedKey {
        value = value == null ? "" : value;
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    public int length() {
        return value.length();
    }

    public List<String> tokens() {
        if (value.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(value.split(" "));
    }

    @Override
    public String toString() {
        return value;
    }
}
