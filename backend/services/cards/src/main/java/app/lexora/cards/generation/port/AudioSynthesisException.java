package app.lexora.cards.generation.port;

public class AudioSynthesisException extends RuntimeException {

    public AudioSynthesisException(String message) {
        super(message);
    }

    public AudioSynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
