package app.lexora.cards.generation.service;

import app.lexora.cards.config.GenerationProps;
import app.lexora.cards.generation.domain.type.GenerationStatus;
import app.lexora.cards.generation.repository.GenerationOutcomeRepository;
import app.lexora.cards.generation.repository.GenerationSessionRepository;
import app.lexora.cards.generation.session.GenerationSession;
import app.lexora.cards.generation.store.JpaSessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * Housekeeping for stored sessions: purges finalized ones past the retention window and fails
 * sessions left PENDING or RUNNING by a run that no longer exists.
 */
@Component
public class GenerationSessionCleanup {

    private static final Logger log = LoggerFactory.getLogger(GenerationSessionCleanup.class);

    static final String EXPIRED_REASON = "expired: run did not finish";

    private final GenerationSessionRepository sessionRepository;
    private final GenerationOutcomeRepository outcomeRepository;
    private final JpaSessionStore sessionStore;
    private final ActiveGenerationRegistry activeRuns;
    private final Duration retention;
    private final Duration staleAfter;
    private final Clock clock;

    public GenerationSessionCleanup(GenerationSessionRepository sessionRepository,
                                    GenerationOutcomeRepository outcomeRepository,
                                    JpaSessionStore sessionStore,
                                    ActiveGenerationRegistry activeRuns,
                                    GenerationProps props,
                                    Clock clock) {
        this.sessionRepository = sessionRepository;
        this.outcomeRepository = outcomeRepository;
        this.sessionStore = sessionStore;
        this.activeRuns = activeRuns;
        this.retention = Duration.ofDays(props.sessionRetentionDays());
        this.staleAfter = props.staleAfter();
        this.clock = clock;
    }

    @Scheduled(cron = "${app.generation.cleanup-cron:0 30 3 * * *}")
    @Transactional
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(retention);
        List<UUID> expired = sessionRepository.findFinalizedBefore(
                EnumSet.of(GenerationStatus.COMPLETED, GenerationStatus.PARTIALLY_COMPLETED, GenerationStatus.FAILED),
                cutoff
        );
        if (expired.isEmpty()) {
            return 0;
        }
        outcomeRepository.deleteBySessionIds(expired);
        sessionRepository.deleteAllByIdInBatch(expired);
        log.info("Purged generation sessions count={} cutoff={}", expired.size(), cutoff);
        return expired.size();
    }

    /**
     * Fails sessions that have not finalized within {@code staleAfter} of their creation and have no
     * run in this process, e.g. after a crash or restart mid-run.
     */
    @Scheduled(
            initialDelayString = "${app.generation.stale-check-delay-ms:300000}",
            fixedDelayString = "${app.generation.stale-check-delay-ms:300000}"
    )
    public int expireStale() {
        Instant cutoff = clock.instant().minus(staleAfter);
        int expired = 0;
        for (GenerationSession session : sessionStore.listUnfinishedCreatedBefore(cutoff, clock)) {
            if (activeRuns.isActive(session.getSessionId())) {
                continue;
            }
            try {
                session.finishFailed(EXPIRED_REASON);
                sessionStore.update(session);
                expired++;
                log.warn("Expired stale generation session sessionId={} deckId={} createdAt={}",
                        session.getSessionId(), session.getDeckId(), session.getCreatedAt());
            } catch (RuntimeException ex) {
                log.error("Stale session could not be expired sessionId={}", session.getSessionId(), ex);
            }
        }
        return expired;
    }
}
