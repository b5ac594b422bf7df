package app.lexora.cards.generation.store;

import app.lexora.cards.generation.domain.entity.GenerationOutcomeEntity;
import app.lexora.cards.generation.domain.entity.GenerationSessionEntity;
import app.lexora.cards.generation.domain.type.GenerationStatus;
import app.lexora.cards.generation.port.SessionStore;
import app.lexora.cards.generation.repository.GenerationOutcomeRepository;
import app.lexora.cards.generation.repository.GenerationSessionRepository;
import app.lexora.cards.generation.session.GenerationOutcome;
import app.lexora.cards.generation.session.GenerationSession;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Sessions are saved by value: the session row plus one outcome row per position.
 * Outcomes only grow or get rewritten in place, so an update is a merge of every position.
 */
@Component
public class JpaSessionStore implements SessionStore {

    private final GenerationSessionRepository sessionRepository;
    private final GenerationOutcomeRepository outcomeRepository;

    public JpaSessionStore(GenerationSessionRepository sessionRepository,
                           GenerationOutcomeRepository outcomeRepository) {
        this.sessionRepository = sessionRepository;
        this.outcomeRepository = outcomeRepository;
    }

    @Override
    @Transactional
    public void create(GenerationSession session) {
        save(session);
    }

    @Override
    @Transactional
    public void update(GenerationSession session) {
        save(session);
    }

    @Transactional(readOnly = true)
    public Optional<GenerationSession> find(UUID sessionId) {
        return sessionRepository.findById(sessionId)
                .map(entity -> toSession(entity, outcomeRepository.findBySessionIdOrderByPositionAsc(sessionId),
                        Clock.systemUTC()));
    }

    @Transactional(readOnly = true)
    public List<GenerationSession> listByDeck(UUID deckId, int limit) {
        return withOutcomes(
                sessionRepository.findByDeckIdOrderByCreatedAtDesc(deckId, PageRequest.of(0, limit)),
                Clock.systemUTC()
        );
    }

    /**
     * Sessions still PENDING or RUNNING that were created before {@code cutoff}. The returned
     * sessions finalize against {@code clock}.
     */
    @Transactional(readOnly = true)
    public List<GenerationSession> listUnfinishedCreatedBefore(Instant cutoff, Clock clock) {
        return withOutcomes(
                sessionRepository.findByStatusInAndCreatedAtBefore(
                        EnumSet.of(GenerationStatus.PENDING, GenerationStatus.RUNNING), cutoff),
                clock
        );
    }

    private List<GenerationSession> withOutcomes(List<GenerationSessionEntity> entities, Clock clock) {
        if (entities.isEmpty()) {
            return List.of();
        }
        Map<UUID, List<GenerationOutcomeEntity>> outcomesBySession = new LinkedHashMap<>();
        for (GenerationSessionEntity entity : entities) {
            outcomesBySession.put(entity.getSessionId(), new ArrayList<>());
        }
        for (GenerationOutcomeEntity outcome :
                outcomeRepository.findBySessionIdInOrderByPositionAsc(outcomesBySession.keySet())) {
            outcomesBySession.get(outcome.getSessionId()).add(outcome);
        }
        List<GenerationSession> sessions = new ArrayList<>(entities.size());
        for (GenerationSessionEntity entity : entities) {
            sessions.add(toSession(entity, outcomesBySession.get(entity.getSessionId()), clock));
        }
        return sessions;
    }

    private void save(GenerationSession session) {
        sessionRepository.save(new GenerationSessionEntity(
                session.getSessionId(),
                session.getDeckId(),
                session.getContext(),
                session.getRequestedCount(),
                session.getStatus(),
                session.getAcceptedCount(),
                session.getRejectedCount(),
                session.getFailureReason(),
                session.getCreatedAt(),
                session.getStartedAt(),
                session.getCompletedAt()
        ));
        List<GenerationOutcome> outcomes = session.getOutcomes();
        if (outcomes.isEmpty()) {
            return;
        }
        List<GenerationOutcomeEntity> rows = new ArrayList<>(outcomes.size());
        for (int i = 0; i < outcomes.size(); i++) {
            GenerationOutcome outcome = outcomes.get(i);
            rows.add(new GenerationOutcomeEntity(
                    session.getSessionId(),
                    i,
                    outcome.word(),
                    outcome.verdict(),
                    outcome.reason(),
                    outcome.degraded()
            ));
        }
        outcomeRepository.saveAll(rows);
    }

    private GenerationSession toSession(GenerationSessionEntity entity,
                                        List<GenerationOutcomeEntity> rows,
                                        Clock clock) {
        List<GenerationOutcome> outcomes = new ArrayList<>(rows.size());
        for (GenerationOutcomeEntity row : rows) {
            outcomes.add(new GenerationOutcome(row.getWord(), row.getVerdict(), row.getReason(), row.isDegraded()));
        }
        return GenerationSession.restore(
                entity.getSessionId(),
                entity.getDeckId(),
                entity.getContext(),
                entity.getRequestedCount(),
                entity.getStatus(),
                outcomes,
                entity.getCreatedAt(),
                entity.getStartedAt(),
                entity.getCompletedAt(),
                entity.getFailureReason(),
                clock
        );
    }
}
