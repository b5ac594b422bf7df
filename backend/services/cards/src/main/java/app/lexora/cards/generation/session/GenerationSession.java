package app.lexora.cards.generation.session;

import app.lexora.cards.generation.domain.type.GenerationStatus;
import app.lexora.cards.generation.domain.type.OutcomeVerdict;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Lifecycle of one generation run.
 * <p>
 * {@code PENDING -> RUNNING -> COMPLETED | PARTIALLY_COMPLETED | FAILED}. A session is finalized
 * exactly once, either by {@link #finish()} or by {@link #finishFailed(String)}, and is never re-opened.
 * Instances are not thread-safe; a run owns its session.
 */
public class GenerationSession {

    private final UUID sessionId;
    private final UUID deckId;
    private final String context;
    private final int requestedCount;
    private final Instant createdAt;
    private final Clock clock;
    private final List<GenerationOutcome> outcomes;

    private GenerationStatus status;
    private int acceptedCount;
    private int rejectedCount;
    private Instant startedAt;
    private Instant completedAt;
    private String failureReason;

    private GenerationSession(UUID sessionId,
                              UUID deckId,
                              String context,
                              int requestedCount,
                              GenerationStatus status,
                              List<GenerationOutcome> outcomes,
                              Instant createdAt,
                              Instant startedAt,
                              Instant completedAt,
                              String failureReason,
                              Clock clock) {
        this.sessionId = sessionId;
        this.deckId = deckId;
        this.context = context;
        this.requestedCount = requestedCount;
        this.status = status;
        this.outcomes = new ArrayList<>(outcomes);
        this.createdAt = createdAt;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.failureReason = failureReason;
        this.clock = clock;
        recount();
    }

    public static GenerationSession create(UUID deckId, String context, int requestedCount, Clock clock) {
        if (deckId == null) {
            throw new IllegalArgumentException("deckId is required");
        }
        if (requestedCount < 1) {
            throw new IllegalArgumentException("requestedCount must be positive: " + requestedCount);
        }
        return new GenerationSession(
                UUID.randomUUID(),
                deckId,
                context,
                requestedCount,
                GenerationStatus.PENDING,
                List.of(),
                clock.instant(),
                null,
                null,
                null,
                clock
        );
    }

    /**
     * Rebuilds a session read back from storage.
     */
    public static GenerationSession restore(UUID sessionId,
                                            UUID deckId,
                                            String context,
                                            int requestedCount,
                                            GenerationStatus status,
                                            List<GenerationOutcome> outcomes,
                                            Instant createdAt,
                                            Instant startedAt,
                                            Instant completedAt,
                                            String failureReason) {
        return restore(sessionId, deckId, context, requestedCount, status, outcomes,
                createdAt, startedAt, completedAt, failureReason, Clock.systemUTC());
    }

    /**
     * Same as above, with the clock used for any later transition of the restored session.
     */
    public static GenerationSession restore(UUID sessionId,
                                            UUID deckId,
                                            String context,
                                            int requestedCount,
                                            GenerationStatus status,
                                            List<GenerationOutcome> outcomes,
                                            Instant createdAt,
                                            Instant startedAt,
                                            Instant completedAt,
                                            String failureReason,
                                            Clock clock) {
        return new GenerationSession(
                sessionId,
                deckId,
                context,
                requestedCount,
                status,
                outcomes == null ? List.of() : outcomes,
                createdAt,
                startedAt,
                completedAt,
                failureReason,
                clock
        );
    }

    public void start() {
        if (status != GenerationStatus.PENDING) {
            throw new IllegalStateException("Session " + sessionId + " cannot start from " + status);
        }
        status = GenerationStatus.RUNNING;
        startedAt = clock.instant();
    }

    public void recordOutcome(String word, OutcomeVerdict verdict, String reason) {
        recordOutcome(GenerationOutcome.of(word, verdict, reason));
    }

    public void recordOutcome(GenerationOutcome outcome) {
        if (status != GenerationStatus.RUNNING) {
            throw new IllegalStateException("Session " + sessionId + " is not running: " + status);
        }
        outcomes.add(outcome);
        if (outcome.verdict().isAccepted()) {
            acceptedCount++;
        } else {
            rejectedCount++;
        }
    }

    public GenerationStatus finish() {
        if (status != GenerationStatus.RUNNING) {
            throw new IllegalStateException("Session " + sessionId + " cannot finish from " + status);
        }
        boolean degraded = outcomes.stream().anyMatch(GenerationOutcome::degraded);
        if (acceptedCount == 0) {
            status = GenerationStatus.FAILED;
        } else if (rejectedCount > 0 || degraded) {
            status = GenerationStatus.PARTIALLY_COMPLETED;
        } else {
            status = GenerationStatus.COMPLETED;
        }
        completedAt = clock.instant();
        return status;
    }

    /**
     * Finalizes the run as FAILED after an infrastructure failure or cancellation. Outcomes already
     * recorded are re-marked as generation failures since none of their cards were persisted.
     */
    public void finishFailed(String reason) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Session " + sessionId + " is already finalized: " + status);
        }
        if (outcomes.isEmpty()) {
            outcomes.add(GenerationOutcome.of(null, OutcomeVerdict.REJECTED_GENERATION_FAILURE, reason));
        } else {
            outcomes.replaceAll(outcome ->
                    GenerationOutcome.of(outcome.word(), OutcomeVerdict.REJECTED_GENERATION_FAILURE, reason));
        }
        recount();
        failureReason = reason;
        status = GenerationStatus.FAILED;
        completedAt = clock.instant();
    }

    private void recount() {
        int accepted = 0;
        for (GenerationOutcome outcome : outcomes) {
            if (outcome.verdict().isAccepted()) {
                accepted++;
            }
        }
        acceptedCount = accepted;
        rejectedCount = outcomes.size() - accepted;
    }

    public boolean isFinalized() {
        return status.isTerminal();
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public UUID getDeckId() {
        return deckId;
    }

    public String getContext() {
        return context;
    }

    public int getRequestedCount() {
        return requestedCount;
    }

    public GenerationStatus getStatus() {
        return status;
    }

    public List<GenerationOutcome> getOutcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public int getAcceptedCount() {
        return acceptedCount;
    }

    public int getRejectedCount() {
        return rejectedCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public String getFailureReason() {
        return failureReason;
    }
}
