package app.lexora.cards.generation.port;

public class CardStoreException extends RuntimeException {

    public CardStoreException(String message) {
        super(message);
    }

    public CardStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
