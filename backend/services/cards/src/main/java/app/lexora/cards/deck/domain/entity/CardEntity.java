package app.lexora.cards.deck.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "cards", schema = "app_cards")
public class CardEntity {

    @Id
    @Column(name = "card_id", nullable = false)
    private UUID cardId;

    @Column(name = "deck_id", nullable = false)
    private UUID deckId;

    @Column(name = "word", nullable = false)
    private String word;

    @Column(name = "normalized_word", nullable = false)
    private String normalizedWord;

    @Column(name = "translation", nullable = false)
    private String translation;

    @Column(name = "example", nullable = false)
    private String example;

    @Column(name = "example_translation", nullable = false)
    private String exampleTranslation;

    @Column(name = "audio_file")
    private String audioFile;

    @Column(name = "context")
    private String context;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public CardEntity() {
    }

    public CardEntity(UUID cardId,
                      UUID deckId,
                      String word,
                      String normalizedWord,
                      String translation,
                      String example,
                      String exampleTranslation,
                      String audioFile,
                      String context,
                      Instant createdAt,
                      Instant updatedAt) {
        this.cardId = cardId;
        this.deckId = deckId;
        this.word = word;
        this.normalizedWord = normalizedWord;
        this.translation = translation;
        this.example = example;
        this.exampleTranslation = exampleTranslation;
        this.audioFile = audioFile;
        this.context = context;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public UUID getCardId() {
        return cardId;
    }

    public void setCardId(UUID cardId) {
        this.cardId = cardId;
    }

    public UUID getDeckId() {
        return deckId;
    }

    public void setDeckId(UUID deckId) {
        this.deckId = deckId;
    }

    public String getWord() {
        return word;
    }

    public void setWord(String word) {
        this.word = word;
    }

    public String getNormalizedWord() {
        return normalizedWord;
    }

    public void setNormalizedWord(String normalizedWord) {
        this.normalizedWord = normalizedWord;
    }

    public String getTranslation() {
        return translation;
    }

    public void setTranslation(String translation) {
        this.translation = translation;
    }

    public String getExample() {
        return example;
    }

    public void setExample(String example) {
        this.example = example;
    }

    public String getExampleTranslation() {
        return exampleTranslation;
    }

    public void setExampleTranslation(String exampleTranslation) {
        this.exampleTranslation = exampleTranslation;
    }

    public String getAudioFile() {
        return audioFile;
    }

    public void setAudioFile(String audioFile) {
        this.audioFile = audioFile;
    }

    public String getContext() {
        return context;
    }

    public void setContext(String context) {
        this.context = context;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
