package app.lexora.cards.generation.port;

public class WordGenerationException extends RuntimeException {

    public WordGenerationException(String message) {
        super(message);
    }

    public WordGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
