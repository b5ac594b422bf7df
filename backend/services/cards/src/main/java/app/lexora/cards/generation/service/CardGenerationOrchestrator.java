package app.lexora.cards.generation.service;

import app.lexora.cards.config.GenerationProps;
import app.lexora.cards.generation.domain.type.OutcomeVerdict;
import app.lexora.cards.generation.model.AudioRef;
import app.lexora.cards.generation.model.Card;
import app.lexora.cards.generation.model.Deck;
import app.lexora.cards.generation.pipeline.CardCandidate;
import app.lexora.cards.generation.pipeline.DuplicateDetector;
import app.lexora.cards.generation.pipeline.NormalizedKey;
import app.lexora.cards.generation.pipeline.QualityConfig;
import app.lexora.cards.generation.pipeline.QualityGate;
import app.lexora.cards.generation.pipeline.QualityVerdict;
import app.lexora.cards.generation.pipeline.WordNormalizer;
import app.lexora.cards.generation.port.AudioSynthesisService;
import app.lexora.cards.generation.port.CardStore;
import app.lexora.cards.generation.port.DeckStore;
import app.lexora.cards.generation.port.SessionStore;
import app.lexora.cards.generation.port.WordGenerationException;
import app.lexora.cards.generation.port.WordGenerationService;
import app.lexora.cards.generation.session.GenerationOutcome;
import app.lexora.cards.generation.session.GenerationSession;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;

/**
 * Runs one generation: external call, filter chain, audio, a single transactional write, and the
 * session bookkeeping around all of it. Runs for the same deck are serialized from the read of the
 * existing keys until the write.
 */
@Service
public class CardGenerationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CardGenerationOrchestrator.class);

    static final String CANCELLED_REASON = "cancelled";
    static final String PERSISTENCE_REASON = "cards could not be stored";

    private final DeckStore deckStore;
    private final CardStore cardStore;
    private final SessionStore sessionStore;
    private final WordGenerationService wordGenerationService;
    private final AudioSynthesisService audioSynthesisService;
    private final WordNormalizer normalizer;
    private final DuplicateDetector duplicateDetector;
    private final QualityGate qualityGate;
    private final QualityConfig qualityConfig;
    private final TransactionOperations transactionOperations;
    private final DeckLockRegistry lockRegistry;
    private final ActiveGenerationRegistry activeRuns;
    private final Clock clock;
    private final int maxCards;
    private final Duration generationTimeout;
    private final Duration audioTimeout;
    private final boolean audioRequired;
    private final ExecutorService generationExecutor;
    private final ExecutorService audioExecutor;

    public CardGenerationOrchestrator(DeckStore deckStore,
                                      CardStore cardStore,
                                      SessionStore sessionStore,
                                      WordGenerationService wordGenerationService,
                                      AudioSynthesisService audioSynthesisService,
                                      WordNormalizer normalizer,
                                      DuplicateDetector duplicateDetector,
                                      QualityGate qualityGate,
                                      TransactionOperations transactionOperations,
                                      DeckLockRegistry lockRegistry,
                                      ActiveGenerationRegistry activeRuns,
                                      GenerationProps props,
                                      Clock clock) {
        this.deckStore = deckStore;
        this.cardStore = cardStore;
        this.sessionStore = sessionStore;
        this.wordGenerationService = wordGenerationService;
        this.audioSynthesisService = audioSynthesisService;
        this.normalizer = normalizer;
        this.duplicateDetector = duplicateDetector;
        this.qualityGate = qualityGate;
        this.qualityConfig = props.toQualityConfig();
        this.transactionOperations = transactionOperations;
        this.lockRegistry = lockRegistry;
        this.activeRuns = activeRuns;
        this.clock = clock;
        this.maxCards = props.maxCards();
        this.generationTimeout = props.generationTimeout();
        this.audioTimeout = props.audioTimeout();
        this.audioRequired = props.audioRequired();
        this.generationExecutor = Executors.newFixedThreadPool(
                props.generationConcurrency(),
                new CustomizableThreadFactory("card-generation-")
        );
        this.audioExecutor = Executors.newFixedThreadPool(
                props.audioConcurrency(),
                new CustomizableThreadFactory("card-audio-")
        );
    }

    public GenerationResult generate(UUID deckId, String context, int requestedCards) {
        if (requestedCards < 1 || requestedCards > maxCards) {
            throw new IllegalArgumentException("maxCards must be between 1 and " + maxCards);
        }
        Deck deck = deckStore.get(deckId).orElseThrow(() -> new DeckNotFoundException(deckId));
        Lock lock = lockRegistry.lockFor(deck.deckId());
        lock.lock();
        try {
            return runLocked(deck, context, requestedCards);
        } finally {
            lock.unlock();
        }
    }

    private GenerationResult runLocked(Deck deck, String context, int requestedCards) {
        Set<NormalizedKey> deckKeys = new HashSet<>(deckStore.listWordKeys(deck.deckId()));

        GenerationSession session = GenerationSession.create(deck.deckId(), context, requestedCards, clock);
        sessionStore.create(session);
        CancellationHandle handle = activeRuns.register(session.getSessionId());
        List<Card> cards = List.of();
        try {
            session.start();
            sessionStore.update(session);
            log.info("Generation started sessionId={} deckId={} requested={} knownWords={}",
                    session.getSessionId(), deck.deckId(), requestedCards, deckKeys.size());

            List<CardCandidate> candidates = requestCandidates(session, handle, context, requestedCards);
            List<Slot> slots = filter(candidates, deckKeys);
            List<AudioAttempt> audio = synthesizeAudio(slots, handle);

            cards = recordOutcomes(session, deck, context, slots, audio);
            if (!handle.seal()) {
                throw new RunCancelledException();
            }
            persist(session, deck, cards);

            session.finish();
            sessionStore.update(session);
            log.info("Generation finished sessionId={} deckId={} status={} accepted={} rejected={}",
                    session.getSessionId(), deck.deckId(), session.getStatus(),
                    session.getAcceptedCount(), session.getRejectedCount());
            return new GenerationResult(session, List.copyOf(cards));
        } catch (RunCancelledException ex) {
            log.info("Generation cancelled sessionId={} deckId={}", session.getSessionId(), deck.deckId());
            discardAudio(cards);
            GenerationCancelledException failure = new GenerationCancelledException(session);
            finishFailed(session, CANCELLED_REASON, failure);
            throw failure;
        } catch (RuntimeException ex) {
            if (!session.isFinalized()) {
                log.error("Generation aborted sessionId={} deckId={}", session.getSessionId(), deck.deckId(), ex);
                finishFailed(session, "internal error: " + ex.getClass().getSimpleName(), ex);
            }
            discardAudio(cards);
            throw ex;
        } finally {
            activeRuns.remove(session.getSessionId());
        }
    }

    private List<CardCandidate> requestCandidates(GenerationSession session,
                                                  CancellationHandle handle,
                                                  String context,
                                                  int requestedCards) {
        Future<List<CardCandidate>> future = generationExecutor.submit(
                () -> wordGenerationService.generate(context, requestedCards)
        );
        handle.register(future);
        try {
            List<CardCandidate> candidates = future.get(generationTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (candidates == null) {
                return List.of();
            }
            return candidates.size() > requestedCards ? candidates.subList(0, requestedCards) : candidates;
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw generationFailed(session, new WordGenerationException(
                    "word generation timed out after " + generationTimeout.toMillis() + " ms"));
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            WordGenerationException failure = cause instanceof WordGenerationException generationException
                    ? generationException
                    : new WordGenerationException("word generation failed: " + safeMessage(cause), cause);
            throw generationFailed(session, failure);
        } catch (CancellationException ex) {
            throw cancelledOrFailed(session, handle, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw cancelledOrFailed(session, handle, ex);
        } finally {
            handle.unregister(future);
        }
    }

    private RuntimeException cancelledOrFailed(GenerationSession session, CancellationHandle handle, Exception ex) {
        if (handle.isCancelled()) {
            return new RunCancelledException();
        }
        return generationFailed(session, new WordGenerationException("word generation interrupted", ex));
    }

    private GenerationServiceFailureException generationFailed(GenerationSession session,
                                                               WordGenerationException cause) {
        log.warn("Word generation failed sessionId={} deckId={} message={}",
                session.getSessionId(), session.getDeckId(), safeMessage(cause));
        GenerationServiceFailureException failure = new GenerationServiceFailureException(session, cause);
        finishFailed(session, cause.getMessage(), failure);
        return failure;
    }

    /**
     * Duplicate and quality checks in input order. When audio is optional every survivor will be
     * accepted, so its key is reserved right away. When audio is required a candidate that only
     * collides with an earlier candidate of this run is deferred until that one's audio verdict.
     */
    private List<Slot> filter(List<CardCandidate> candidates, Set<NormalizedKey> deckKeys) {
        Set<NormalizedKey> runKeys = new HashSet<>();
        List<Slot> slots = new ArrayList<>(candidates.size());
        for (CardCandidate candidate : candidates) {
            String word = candidate == null ? null : candidate.word();
            NormalizedKey key = normalizer.normalize(word);

            Optional<DuplicateDetector.Match> match = duplicateDetector.findMatch(key, deckKeys);
            if (match.isEmpty() && !audioRequired) {
                match = duplicateDetector.findMatch(key, runKeys);
            }
            if (match.isPresent()) {
                slots.add(Slot.rejected(candidate, key, GenerationOutcome.of(
                        word, OutcomeVerdict.REJECTED_DUPLICATE, duplicateReason(key, match.get()))));
                continue;
            }
            QualityVerdict verdict = qualityGate.passesQuality(candidate, qualityConfig);
            if (audioRequired && duplicateDetector.findMatch(key, runKeys).isPresent()) {
                slots.add(Slot.deferred(candidate, key, verdict));
                continue;
            }
            if (!verdict.pass()) {
                slots.add(Slot.rejected(candidate, key, GenerationOutcome.of(
                        word, OutcomeVerdict.REJECTED_QUALITY, verdict.reason())));
                continue;
            }
            runKeys.add(key);
            slots.add(Slot.survivor(candidate, key, verdict));
        }
        return slots;
    }

    private String duplicateReason(NormalizedKey key, DuplicateDetector.Match match) {
        if (match.existing().equals(key)) {
            return "already in deck";
        }
        return String.format(Locale.ROOT, "similar to '%s' (%.2f)", match.existing(), match.score());
    }

    private List<AudioAttempt> synthesizeAudio(List<Slot> slots, CancellationHandle handle) {
        List<Future<AudioRef>> futures = new ArrayList<>(slots.size());
        for (Slot slot : slots) {
            if (!slot.needsAudio()) {
                futures.add(null);
                continue;
            }
            Future<AudioRef> future = audioExecutor.submit(
                    () -> audioSynthesisService.synthesize(slot.candidate().word().trim())
            );
            handle.register(future);
            futures.add(future);
        }

        List<AudioAttempt> attempts = new ArrayList<>(slots.size());
        try {
            for (int i = 0; i < slots.size(); i++) {
                Future<AudioRef> future = futures.get(i);
                if (future == null) {
                    attempts.add(null);
                    continue;
                }
                try {
                    attempts.add(awaitAudio(slots.get(i), future, handle));
                } finally {
                    handle.unregister(future);
                }
            }
        } catch (RunCancelledException ex) {
            for (AudioAttempt attempt : attempts) {
                if (attempt != null) {
                    discard(attempt.ref());
                }
            }
            for (int i = attempts.size(); i < futures.size(); i++) {
                discardCompleted(futures.get(i));
            }
            throw ex;
        }
        return attempts;
    }

    private AudioAttempt awaitAudio(Slot slot, Future<AudioRef> future, CancellationHandle handle) {
        String word = slot.candidate().word();
        try {
            AudioRef ref = future.get(audioTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (ref == null) {
                return AudioAttempt.failed("audio synthesis returned nothing");
            }
            return AudioAttempt.succeeded(ref);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Audio synthesis timed out word={} timeoutMs={}", word, audioTimeout.toMillis());
            return AudioAttempt.failed("audio synthesis timed out after " + audioTimeout.toMillis() + " ms");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn("Audio synthesis failed word={} errorType={} message={}",
                    word, cause.getClass().getSimpleName(), safeMessage(cause));
            return AudioAttempt.failed("audio synthesis failed: " + safeMessage(cause));
        } catch (CancellationException ex) {
            if (handle.isCancelled()) {
                throw new RunCancelledException();
            }
            return AudioAttempt.failed("audio synthesis cancelled");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new RunCancelledException();
        }
    }

    private List<Card> recordOutcomes(GenerationSession session,
                                      Deck deck,
                                      String context,
                                      List<Slot> slots,
                                      List<AudioAttempt> audio) {
        Instant now = clock.instant();
        Set<NormalizedKey> acceptedKeys = new HashSet<>();
        List<Card> cards = new ArrayList<>();
        for (int i = 0; i < slots.size(); i++) {
            Slot slot = slots.get(i);
            if (slot.rejection() != null) {
                session.recordOutcome(slot.rejection());
                continue;
            }
            CardCandidate candidate = slot.candidate();
            AudioAttempt attempt = audio.get(i);
            if (audioRequired) {
                Optional<DuplicateDetector.Match> twin = duplicateDetector.findMatch(slot.key(), acceptedKeys);
                if (twin.isPresent()) {
                    session.recordOutcome(candidate.word(), OutcomeVerdict.REJECTED_DUPLICATE,
                            duplicateReason(slot.key(), twin.get()));
                    discard(attempt == null ? null : attempt.ref());
                    continue;
                }
                if (!slot.quality().pass()) {
                    session.recordOutcome(candidate.word(), OutcomeVerdict.REJECTED_QUALITY, slot.quality().reason());
                    continue;
                }
                if (attempt.failure() != null) {
                    session.recordOutcome(candidate.word(), OutcomeVerdict.REJECTED_AUDIO_FAILURE, attempt.failure());
                    continue;
                }
            }
            acceptedKeys.add(slot.key());
            if (attempt.failure() != null) {
                session.recordOutcome(GenerationOutcome.acceptedWithoutAudio(candidate.word(), attempt.failure()));
            } else {
                session.recordOutcome(candidate.word(), OutcomeVerdict.ACCEPTED, null);
            }
            cards.add(new Card(
                    UUID.randomUUID(),
                    deck.deckId(),
                    candidate.word().trim(),
                    slot.key().value(),
                    candidate.translation().trim(),
                    candidate.example().trim(),
                    candidate.exampleTranslation().trim(),
                    attempt.ref(),
                    context,
                    now,
                    now
            ));
        }
        return cards;
    }

    private void persist(GenerationSession session, Deck deck, List<Card> cards) {
        if (cards.isEmpty()) {
            return;
        }
        try {
            transactionOperations.executeWithoutResult(status -> {
                cardStore.insertBatch(cards);
                deckStore.incrementCardCount(deck.deckId(), cards.size());
            });
        } catch (RuntimeException ex) {
            log.warn("Card batch write failed sessionId={} deckId={} cards={} errorType={} message={}",
                    session.getSessionId(), deck.deckId(), cards.size(),
                    ex.getClass().getSimpleName(), safeMessage(ex));
            PersistenceFailureException failure = new PersistenceFailureException(session, ex);
            finishFailed(session, PERSISTENCE_REASON, failure);
            throw failure;
        }
    }

    private void finishFailed(GenerationSession session, String reason, RuntimeException failure) {
        session.finishFailed(reason);
        try {
            sessionStore.update(session);
        } catch (RuntimeException ex) {
            log.error("Failed session could not be saved sessionId={}", session.getSessionId(), ex);
            failure.addSuppressed(ex);
        }
    }

    private void discardAudio(List<Card> cards) {
        for (Card card : cards) {
            discard(card.audio());
        }
    }

    private void discardCompleted(Future<AudioRef> future) {
        if (future == null || !future.isDone() || future.isCancelled()) {
            return;
        }
        try {
            discard(future.get());
        } catch (ExecutionException ex) {
            log.debug("Abandoned audio call had failed errorType={}", ex.getCause() == null
                    ? ex.getClass().getSimpleName() : ex.getCause().getClass().getSimpleName());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private void discard(AudioRef ref) {
        if (ref == null) {
            return;
        }
        try {
            audioSynthesisService.discard(ref);
        } catch (RuntimeException ex) {
            log.warn("Unused audio could not be discarded fileName={} errorType={} message={}",
                    ref.fileName(), ex.getClass().getSimpleName(), safeMessage(ex));
        }
    }

    private String safeMessage(Throwable ex) {
        if (ex == null) {
            return "";
        }
        String message = ex.getMessage();
        if (message == null) {
            return ex.getClass().getSimpleName();
        }
        String trimmed = message.replaceAll("[\\r\\n]+", " ").trim();
        int max = 200;
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max) + "...";
    }

    @PreDestroy
    public void shutdown() {
        generationExecutor.shutdownNow();
        audioExecutor.shutdownNow();
    }

    private record Slot(CardCandidate candidate,
                        NormalizedKey key,
                        GenerationOutcome rejection,
                        QualityVerdict quality) {

        static Slot rejected(CardCandidate candidate, NormalizedKey key, GenerationOutcome rejection) {
            return new Slot(candidate, key, rejection, null);
        }

        static Slot survivor(CardCandidate candidate, NormalizedKey key, QualityVerdict quality) {
            return new Slot(candidate, key, null, quality);
        }

        static Slot deferred(CardCandidate candidate, NormalizedKey key, QualityVerdict quality) {
            return new Slot(candidate, key, null, quality);
        }

        boolean needsAudio() {
            return rejection == null && quality.pass();
        }
    }

    private record AudioAttempt(AudioRef ref, String failure) {

        static AudioAttempt succeeded(AudioRef ref) {
            return new AudioAttempt(ref, null);
        }

        static AudioAttempt failed(String failure) {
            return new AudioAttempt(null, failure);
        }
    }

    private static final class RunCancelledException extends RuntimeException {

        RunCancelledException() {
            super(CANCELLED_REASON, null, false, false);
        }
    }
}
