package app.lexora.cards.deck.domain.type;

public enum ExportFormat {
    apkg,
    csv
}
