package app.lexora.cards.audio;

import app.lexora.cards.config.AudioProps;
import app.lexora.cards.generation.model.AudioRef;
import app.lexora.cards.storage.ObjectStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.text.Normalizer;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Pronunciation clips in object storage, one object per synthesis. An {@link AudioRef} holds the
 * file name; the object key is the configured prefix plus that name.
 */
@Component
public class AudioStorage {

    private static final Logger log = LoggerFactory.getLogger(AudioStorage.class);
    private static final int MAX_SLUG = 40;

    private final ObjectStorage objectStorage;
    private final String keyPrefix;
    private final String extension;

    public AudioStorage(ObjectStorage objectStorage, AudioProps props) {
        this(objectStorage, props.keyPrefix(), props.format());
    }

    public AudioStorage(ObjectStorage objectStorage, String keyPrefix, String extension) {
        this.objectStorage = objectStorage;
        this.keyPrefix = keyPrefix;
        this.extension = extension.toLowerCase(Locale.ROOT);
    }

    public AudioRef store(String word, byte[] audio) {
        String fileName = slug(word) + "-" + UUID.randomUUID().toString().substring(0, 8) + "." + extension;
        objectStorage.putObject(keyOf(fileName), contentType(), audio.length, new ByteArrayInputStream(audio));
        return new AudioRef(fileName);
    }

    public Optional<byte[]> load(AudioRef ref) {
        if (ref == null) {
            return Optional.empty();
        }
        return objectStorage.getObject(keyOf(ref.fileName()));
    }

    /**
     * Best-effort removal of a clip that will not be referenced by any card.
     */
    public void delete(AudioRef ref) {
        if (ref == null) {
            return;
        }
        try {
            objectStorage.deleteObject(keyOf(ref.fileName()));
        } catch (RuntimeException ex) {
            log.warn("Audio object could not be deleted fileName={} errorType={}",
                    ref.fileName(), ex.getClass().getSimpleName());
        }
    }

    String keyOf(String fileName) {
        return keyPrefix + fileName;
    }

    String contentType() {
        return switch (extension) {
            case "mp3" -> "audio/mpeg";
            case "wav" -> "audio/wav";
            case "opus" -> "audio/ogg";
            case "aac" -> "audio/aac";
            case "flac" -> "audio/flac";
            default -> "application/octet-stream";
        };
    }

    private String slug(String word) {
        String folded = Normalizer.normalize(word == null ? "" : word, Normalizer.Form.NFD)
                .replaceAll("\\p{M}+", "")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+|-+$)", "");
        if (folded.isEmpty()) {
            return "word";
        }
        return folded.length() <= MAX_SLUG ? folded : folded.substring(0, MAX_SLUG);
    }
}
