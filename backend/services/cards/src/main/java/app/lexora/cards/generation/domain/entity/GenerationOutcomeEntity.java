package app.lexora.cards.generation.domain.entity;

import app.lexora.cards.generation.domain.composite.GenerationOutcomeId;
import app.lexora.cards.generation.domain.type.OutcomeVerdict;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.UUID;

@Entity
@Table(name = "generation_outcomes", schema = "app_cards")
@IdClass(GenerationOutcomeId.class)
public class GenerationOutcomeEntity {

    @Id
    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Id
    @Column(name = "position", nullable = false)
    private Integer position;

    @Column(name = "word")
    private String word;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.NAMED_ENUM)
    @Column(name = "verdict", columnDefinition = "outcome_verdict", nullable = false)
    private OutcomeVerdict verdict;

    @Column(name = "reason")
    private String reason;

    @Column(name = "degraded", nullable = false)
    private boolean degraded;

    public GenerationOutcomeEntity() {
    }

    public GenerationOutcomeEntity(UUID sessionId,
                                   Integer position,
                                   String word,
                                   OutcomeVerdict verdict,
                                   String reason,
                                   boolean degraded) {
        this.sessionId = sessionId;
        this.position = position;
        this.word = word;
        this.verdict = verdict;
        this.reason = reason;
        this.degraded = degraded;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public void setSessionId(UUID sessionId) {
        this.sessionId = sessionId;
    }

    public Integer getPosition() {
        return position;
    }

    public void setPosition(Integer position) {
        this.position = position;
    }

    public String getWord() {
        return word;
    }

    public void setWord(String word) {
        this.word = word;
    }

    public OutcomeVerdict getVerdict() {
        return verdict;
    }

    public void setVerdict(OutcomeVerdict verdict) {
        this.verdict = verdict;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public void setDegraded(boolean degraded) {
        this.degraded = degraded;
    }
}
