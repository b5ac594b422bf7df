package app.lexora.cards.generation.domain.composite;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

public class GenerationOutcomeId implements Serializable {
    private UUID sessionId;
    private Integer position;

    public GenerationOutcomeId() {
    }

    public GenerationOutcomeId(UUID sessionId, Integer position) {
        this.sessionId = sessionId;
        this.position = position;
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

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        GenerationOutcomeId that = (GenerationOutcomeId) o;
        return Objects.equals(sessionId, that.sessionId) && Objects.equals(position, that.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, position);
    }
}
