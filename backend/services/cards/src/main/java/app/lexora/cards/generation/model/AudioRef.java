package app.lexora.cards.generation.model;

/**
 * Reference to a synthesized pronunciation clip, relative to the audio key prefix in object storage.
 */
public record AudioRef(String fileName) {

    public AudioRef {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("fileName is required");
        }
    }
}
