package app.lexora.cards.generation.service;

import app.lexora.cards.config.GenerationProps;
import app.lexora.cards.generation.domain.type.GenerationStatus;
import app.lexora.cards.generation.domain.type.OutcomeVerdict;
import app.lexora.cards.generation.model.AudioRef;
import app.lexora.cards.generation.model.Card;
import app.lexora.cards.generation.model.Deck;
import app.lexora.cards.generation.pipeline.CardCandidate;
import app.lexora.cards.generation.pipeline.DuplicateDetector;
import app.lexora.cards.generation.pipeline.NormalizedKey;
import app.lexora.cards.generation.pipeline.QualityGate;
import app.lexora.cards.generation.pipeline.WordNormalizer;
import app.lexora.cards.generation.port.AudioSynthesisException;
import app.lexora.cards.generation.port.AudioSynthesisService;
import app.lexora.cards.generation.port.CardStore;
import app.lexora.cards.generation.port.CardStoreException;
import app.lexora.cards.generation.port.DeckStore;
import app.lexora.cards.generation.port.SessionStore;
import app.lexora.cards.generation.port.WordGenerationException;
import app.lexora.cards.generation.port.WordGenerationService;
import app.lexora.cards.generation.session.GenerationOutcome;
import app.lexora.cards.generation.session.GenerationSession;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;

class CardGenerationOrchestratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);

    private final WordNormalizer normalizer = new WordNormalizer();
    private final List<CardGenerationOrchestrator> created = new ArrayList<>();

    private InMemoryDecks decks;
    private RecordingSessionStore sessions;
    private ActiveGenerationRegistry activeRuns;
    private UUID deckId;

    @BeforeEach
    void setUp() {
        decks = new InMemoryDecks(normalizer);
        sessions = new RecordingSessionStore();
        activeRuns = new ActiveGenerationRegistry();
        deckId = decks.addDeck("Travel");
        decks.seed(deckId, "hotel", "beach");
    }

    @AfterEach
    void tearDown() {
        created.forEach(CardGenerationOrchestrator::shutdown);
    }

    @Test
    void generate_filtersDuplicatesAndLowQualityCandidates() {
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> List.of(candidate("hotel"), candidate("airport"), candidate("a")),
                word -> new AudioRef(word + ".mp3"),
                props(Duration.ofSeconds(2), Duration.ofSeconds(1), false)
        );

        GenerationResult result = orchestrator.generate(deckId, "Travel", 3);

        GenerationSession session = result.session();
        assertThat(session.getStatus()).isEqualTo(GenerationStatus.PARTIALLY_COMPLETED);
        assertThat(session.getOutcomes())
                .extracting(GenerationOutcome::word, GenerationOutcome::verdict, GenerationOutcome::reason)
                .containsExactly(
                        tuple("hotel", OutcomeVerdict.REJECTED_DUPLICATE, "already in deck"),
                        tuple("airport", OutcomeVerdict.ACCEPTED, null),
                        tuple("a", OutcomeVerdict.REJECTED_QUALITY,
                                "word length 1 is below minimum 2")
                );
        assertThat(result.cards()).singleElement().satisfies(card -> {
            assertThat(card.word()).isEqualTo("airport");
            assertThat(card.normalizedWord()).isEqualTo("airport");
            assertThat(card.audio()).isEqualTo(new AudioRef("airport.mp3"));
            assertThat(card.context()).isEqualTo("Travel");
        });
        assertThat(decks.cardCount(deckId)).isEqualTo(3);
        assertThat(decks.wordsOf(deckId)).containsExactlyInAnyOrder("hotel", "beach", "airport");
        assertThat(sessions.statusHistory(session.getSessionId()))
                .containsExactly(GenerationStatus.PENDING, GenerationStatus.RUNNING,
                        GenerationStatus.PARTIALLY_COMPLETED);
        assertThat(activeRuns.isActive(session.getSessionId())).isFalse();
    }

    @Test
    void generate_allAcceptedIsCompletedAndCountsMatch() {
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> List.of(candidate("airport"), candidate("luggage"), candidate("ticket")),
                word -> new AudioRef(word + ".mp3"),
                props(Duration.ofSeconds(2), Duration.ofSeconds(1), false)
        );

        GenerationResult result = orchestrator.generate(deckId, "Travel", 3);

        assertThat(result.session().getStatus()).isEqualTo(GenerationStatus.COMPLETED);
        assertThat(result.session().getAcceptedCount()).isEqualTo(3).isEqualTo(result.cards().size());
        assertThat(decks.cardCount(deckId)).isEqualTo(2 + 3);
        assertThat(decks.cardCount(deckId)).isEqualTo(decks.wordsOf(deckId).size());
    }

    @Test
    void generate_truncatesToRequestedCount() {
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> List.of(candidate("airport"), candidate("luggage"), candidate("ticket"),
                        candidate("museum"), candidate("passport")),
                word -> new AudioRef(word + ".mp3"),
                props(Duration.ofSeconds(2), Duration.ofSeconds(1), false)
        );

        GenerationResult result = orchestrator.generate(deckId, "Travel", 2);

        assertThat(result.session().getOutcomes())
                .extracting(GenerationOutcome::word)
                .containsExactly("airport", "luggage");
        assertThat(result.cards()).hasSize(2);
    }

    @Test
    void generate_rejectsDuplicatesWithinTheSameRun() {
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> List.of(candidate("travel"), candidate("Travel"), candidate("travels")),
                word -> new AudioRef(word + ".mp3"),
                props(Duration.ofSeconds(2), Duration.ofSeconds(1), false)
        );

        GenerationResult result = orchestrator.generate(deckId, "Travel", 3);

        assertThat(result.session().getOutcomes())
                .extracting(GenerationOutcome::verdict, GenerationOutcome::reason)
                .containsExactly(
                        tuple(OutcomeVerdict.ACCEPTED, null),
                        tuple(OutcomeVerdict.REJECTED_DUPLICATE, "already in deck"),
                        tuple(OutcomeVerdict.REJECTED_DUPLICATE,
                                "similar to 'travel' (0.86)")
                );
        assertThat(result.cards()).extracting(Card::word).containsExactly("travel");
    }

    @Test
    void generate_wordWithoutLettersIsRejectedAsMissing() {
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> List.of(candidate("!!!"), candidate("airport")),
                word -> new AudioRef(word + ".mp3"),
                props(Duration.ofSeconds(2), Duration.ofSeconds(1), false)
        );

        GenerationResult result = orchestrator.generate(deckId, "Travel", 2);

        assertThat(result.session().getOutcomes().get(0).verdict()).isEqualTo(OutcomeVerdict.REJECTED_QUALITY);
        assertThat(result.session().getOutcomes().get(0).reason()).isEqualTo("missing field(s): word");
        assertThat(result.session().getStatus()).isEqualTo(GenerationStatus.PARTIALLY_COMPLETED);
    }

    @Test
    void generate_rerunWithSameWordsAddsNothing() {
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> List.of(candidate("airport"), candidate("luggage")),
                word -> new AudioRef(word + ".mp3"),
                props(Duration.ofSeconds(2), Duration.ofSeconds(1), false)
        );

        orchestrator.generate(deckId, "Travel", 2);
        GenerationResult second = orchestrator.generate(deckId, "Travel", 2);

        assertThat(second.session().getStatus()).isEqualTo(GenerationStatus.FAILED);
        assertThat(second.session().getOutcomes())
                .allMatch(outcome -> outcome.verdict() == OutcomeVerdict.REJECTED_DUPLICATE);
        assertThat(second.cards()).isEmpty();
        assertThat(decks.cardCount(deckId)).isEqualTo(4);
    }

    @Test
    void generate_generatorTimeoutFailsSessionWithoutWrites() {
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    }
                    return List.of(candidate("airport"));
                },
                word -> new AudioRef(word + ".mp3"),
                props(Duration.ofMillis(200), Duration.ofSeconds(1), false)
        );

        GenerationServiceFailureException failure = failureOf(
                () -> orchestrator.generate(deckId, "Travel", 1), GenerationServiceFailureException.class);

        GenerationSession session = failure.getSession();
        assertThat(session.getStatus()).isEqualTo(GenerationStatus.FAILED);
        assertThat(session.getFailureReason()).isEqualTo("word generation timed out after 200 ms");
        assertThat(session.getOutcomes()).singleElement()
                .extracting(GenerationOutcome::verdict)
                .isEqualTo(OutcomeVerdict.REJECTED_GENERATION_FAILURE);
        assertThat(decks.cardCount(deckId)).isEqualTo(2);
        assertThat(decks.insertCalls()).isZero();
        assertThat(sessions.latest(session.getSessionId()).getStatus()).isEqualTo(GenerationStatus.FAILED);
    }

    @Test
    void generate_generatorErrorFailsSession() {
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> {
                    throw new WordGenerationException("provider unavailable");
                },
                word -> new AudioRef(word + ".mp3"),
                props(Duration.ofSeconds(2), Duration.ofSeconds(1), false)
        );

        GenerationServiceFailureException failure = failureOf(
                () -> orchestrator.generate(deckId, "Travel", 1), GenerationServiceFailureException.class);

        assertThat(failure.getSession().getFailureReason()).isEqualTo("provider unavailable");
        assertThat(failure.getCause()).isInstanceOf(WordGenerationException.class);
        assertThat(decks.insertCalls()).isZero();
    }

    @Test
    void generate_audioFailureKeepsCardWithoutAudio() {
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> List.of(candidate("airport"), candidate("luggage")),
                word -> {
                    if (word.equals("luggage")) {
                        throw new AudioSynthesisException("voice not available");
                    }
                    return new AudioRef(word + ".mp3");
                },
                props(Duration.ofSeconds(2), Duration.ofSeconds(1), false)
        );

        GenerationResult result = orchestrator.generate(deckId, "Travel", 2);

        assertThat(result.session().getStatus()).isEqualTo(GenerationStatus.PARTIALLY_COMPLETED);
        GenerationOutcome luggage = result.session().getOutcomes().get(1);
        assertThat(luggage.verdict()).isEqualTo(OutcomeVerdict.ACCEPTED);
        assertThat(luggage.degraded()).isTrue();
        assertThat(luggage.reason()).isEqualTo("audio synthesis failed: voice not available");
        assertThat(result.cards()).hasSize(2);
        assertThat(result.cards().get(1).hasAudio()).isFalse();
        assertThat(result.cards().get(0).hasAudio()).isTrue();
    }

    @Test
    void generate_audioTimeoutKeepsCardWithoutAudio() {
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> List.of(candidate("airport")),
                word -> {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    }
                    return new AudioRef(word + ".mp3");
                },
                props(Duration.ofSeconds(2), Duration.ofMillis(100), false)
        );

        GenerationResult result = orchestrator.generate(deckId, "Travel", 1);

        assertThat(result.session().getOutcomes()).singleElement().satisfies(outcome -> {
            assertThat(outcome.verdict()).isEqualTo(OutcomeVerdict.ACCEPTED);
            assertThat(outcome.reason()).isEqualTo("audio synthesis timed out after 100 ms");
        });
        assertThat(result.cards()).singleElement().extracting(Card::audio).isNull();
    }

    @Test
    void generate_audioRequiredRejectsCandidateWithoutAudio() {
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> List.of(candidate("airport"), candidate("luggage")),
                word -> {
                    if (word.equals("luggage")) {
                        throw new AudioSynthesisException("voice not available");
                    }
                    return new AudioRef(word + ".mp3");
                },
                props(Duration.ofSeconds(2), Duration.ofSeconds(1), true)
        );

        GenerationResult result = orchestrator.generate(deckId, "Travel", 2);

        assertThat(result.session().getOutcomes())
                .extracting(GenerationOutcome::verdict)
                .containsExactly(OutcomeVerdict.ACCEPTED, OutcomeVerdict.REJECTED_AUDIO_FAILURE);
        assertThat(result.cards()).extracting(Card::word).containsExactly("airport");
        assertThat(decks.cardCount(deckId)).isEqualTo(3);
    }

    @Test
    void generate_storeFailureRollsBackWholeBatch() {
        decks.failInserts();
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> List.of(candidate("airport"), candidate("luggage"), candidate("ticket"),
                        candidate("museum"), candidate("passport")),
                word -> new AudioRef(word + ".mp3"),
                props(Duration.ofSeconds(2), Duration.ofSeconds(1), false)
        );

        PersistenceFailureException failure = failureOf(
                () -> orchestrator.generate(deckId, "Travel", 5), PersistenceFailureException.class);

        GenerationSession session = failure.getSession();
        assertThat(session.getStatus()).isEqualTo(GenerationStatus.FAILED);
        assertThat(session.getFailureReason()).isEqualTo(CardGenerationOrchestrator.PERSISTENCE_REASON);
        assertThat(session.getOutcomes()).hasSize(5)
                .allMatch(outcome -> outcome.verdict() == OutcomeVerdict.REJECTED_GENERATION_FAILURE);
        assertThat(session.getAcceptedCount()).isZero();
        assertThat(decks.cardCount(deckId)).isEqualTo(2);
        assertThat(decks.wordsOf(deckId)).containsExactlyInAnyOrder("hotel", "beach");
    }

    @Test
    void generate_unknownDeckThrows() {
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> List.of(candidate("airport")),
                word -> new AudioRef(word + ".mp3"),
                props(Duration.ofSeconds(2), Duration.ofSeconds(1), false)
        );

        assertThatThrownBy(() -> orchestrator.generate(UUID.randomUUID(), "Travel", 1))
                .isInstanceOf(DeckNotFoundException.class);
        assertThat(sessions.createdCount()).isZero();
    }

    @Test
    void generate_requestedCountOutOfRangeThrows() {
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> List.of(candidate("airport")),
                word -> new AudioRef(word + ".mp3"),
                props(Duration.ofSeconds(2), Duration.ofSeconds(1), false)
        );

        assertThatThrownBy(() -> orchestrator.generate(deckId, "Travel", 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> orchestrator.generate(deckId, "Travel", 21))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(sessions.createdCount()).isZero();
    }

    @Test
    void generate_cancelledRunIsFailedWithoutWrites() throws Exception {
        CountDownLatch generatorStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> {
                    generatorStarted.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    }
                    return List.of(candidate("airport"));
                },
                word -> new AudioRef(word + ".mp3"),
                props(Duration.ofSeconds(5), Duration.ofSeconds(1), false)
        );

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<GenerationResult> run = caller.submit(() -> orchestrator.generate(deckId, "Travel", 1));
            assertThat(generatorStarted.await(5, TimeUnit.SECONDS)).isTrue();
            UUID sessionId = sessions.onlySessionId();

            assertThat(activeRuns.cancel(sessionId)).isTrue();

            ExecutionException thrown = failureOf(() -> run.get(5, TimeUnit.SECONDS), ExecutionException.class);
            GenerationSession session = failureOf(() -> {
                throw thrown.getCause();
            }, GenerationCancelledException.class).getSession();
            assertThat(session.getStatus()).isEqualTo(GenerationStatus.FAILED);
            assertThat(session.getFailureReason()).isEqualTo(CardGenerationOrchestrator.CANCELLED_REASON);
            assertThat(decks.insertCalls()).isZero();
            assertThat(activeRuns.isActive(sessionId)).isFalse();
        } finally {
            release.countDown();
            caller.shutdownNow();
        }
    }

    @Test
    void generate_audioRequiredKeepsSimilarCandidateWhenEarlierOneLosesItsAudio() {
        RecordingAudio audio = new RecordingAudio(word -> {
            if (word.equals("travel")) {
                throw new AudioSynthesisException("voice not available");
            }
            return new AudioRef(word + ".mp3");
        });
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> List.of(candidate("travel"), candidate("travels")),
                audio,
                props(Duration.ofSeconds(2), Duration.ofSeconds(1), true)
        );

        GenerationResult result = orchestrator.generate(deckId, "Travel", 2);

        assertThat(result.session().getOutcomes())
                .extracting(GenerationOutcome::word, GenerationOutcome::verdict)
                .containsExactly(
                        tuple("travel", OutcomeVerdict.REJECTED_AUDIO_FAILURE),
                        tuple("travels", OutcomeVerdict.ACCEPTED)
                );
        assertThat(result.cards()).extracting(Card::word).containsExactly("travels");
        assertThat(audio.discarded()).isEmpty();
    }

    @Test
    void generate_audioRequiredRejectsSimilarCandidateOnceEarlierOneIsAccepted() {
        RecordingAudio audio = new RecordingAudio(word -> new AudioRef(word + ".mp3"));
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> List.of(candidate("travel"), candidate("travels"), candidate("a")),
                audio,
                props(Duration.ofSeconds(2), Duration.ofSeconds(1), true)
        );

        GenerationResult result = orchestrator.generate(deckId, "Travel", 3);

        assertThat(result.session().getOutcomes())
                .extracting(GenerationOutcome::verdict, GenerationOutcome::reason)
                .containsExactly(
                        tuple(OutcomeVerdict.ACCEPTED, null),
                        tuple(OutcomeVerdict.REJECTED_DUPLICATE, "similar to 'travel' (0.86)"),
                        tuple(OutcomeVerdict.REJECTED_QUALITY, "word length 1 is below minimum 2")
                );
        assertThat(result.cards()).extracting(Card::word).containsExactly("travel");
        assertThat(audio.synthesized()).containsExactly("travel", "travels");
        assertThat(audio.discarded()).containsExactly(new AudioRef("travels.mp3"));
    }

    @Test
    void generate_storeFailureDiscardsSynthesizedAudio() {
        decks.failInserts();
        RecordingAudio audio = new RecordingAudio(word -> new AudioRef(word + ".mp3"));
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> List.of(candidate("airport"), candidate("luggage")),
                audio,
                props(Duration.ofSeconds(2), Duration.ofSeconds(1), false)
        );

        failureOf(() -> orchestrator.generate(deckId, "Travel", 2), PersistenceFailureException.class);

        assertThat(audio.discarded())
                .containsExactlyInAnyOrder(new AudioRef("airport.mp3"), new AudioRef("luggage.mp3"));
    }

    @Test
    void generate_cancelDuringAudioDiscardsFinishedClips() throws Exception {
        CountDownLatch secondClipStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        RecordingAudio audio = new RecordingAudio(word -> {
            if (word.equals("luggage")) {
                secondClipStarted.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            }
            return new AudioRef(word + ".mp3");
        });
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> List.of(candidate("airport"), candidate("luggage")),
                audio,
                props(Duration.ofSeconds(2), Duration.ofSeconds(5), false, 1)
        );

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<GenerationResult> run = caller.submit(() -> orchestrator.generate(deckId, "Travel", 2));
            assertThat(secondClipStarted.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(activeRuns.cancel(sessions.onlySessionId())).isTrue();

            ExecutionException thrown = failureOf(() -> run.get(5, TimeUnit.SECONDS), ExecutionException.class);
            assertThat(thrown.getCause()).isInstanceOf(GenerationCancelledException.class);
            assertThat(audio.discarded()).containsExactly(new AudioRef("airport.mp3"));
            assertThat(decks.insertCalls()).isZero();
        } finally {
            release.countDown();
            caller.shutdownNow();
        }
    }

    @Test
    void generate_cancelArrivingWhileCardsAreWrittenIsRefused() throws Exception {
        CountDownLatch insertStarted = new CountDownLatch(1);
        CountDownLatch releaseInsert = new CountDownLatch(1);
        decks.blockInserts(insertStarted, releaseInsert);
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> List.of(candidate("airport")),
                word -> new AudioRef(word + ".mp3"),
                props(Duration.ofSeconds(2), Duration.ofSeconds(1), false)
        );

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<GenerationResult> run = caller.submit(() -> orchestrator.generate(deckId, "Travel", 1));
            assertThat(insertStarted.await(5, TimeUnit.SECONDS)).isTrue();
            UUID sessionId = sessions.onlySessionId();

            assertThat(activeRuns.cancel(sessionId)).isFalse();
            releaseInsert.countDown();

            GenerationResult result = run.get(5, TimeUnit.SECONDS);
            assertThat(result.session().getStatus()).isEqualTo(GenerationStatus.COMPLETED);
            assertThat(result.cards()).extracting(Card::word).containsExactly("airport");
            assertThat(sessions.latest(sessionId).getStatus()).isEqualTo(GenerationStatus.COMPLETED);
            assertThat(decks.cardCount(deckId)).isEqualTo(3);
        } finally {
            releaseInsert.countDown();
            caller.shutdownNow();
        }
    }

    @Test
    void generate_concurrentRunsOnSameDeckAreSerialized() throws Exception {
        CountDownLatch firstCallStarted = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        CardGenerationOrchestrator orchestrator = orchestrator(
                (context, max) -> {
                    maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                    try {
                        if (calls.incrementAndGet() == 1) {
                            firstCallStarted.countDown();
                            releaseFirst.await(5, TimeUnit.SECONDS);
                        }
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    } finally {
                        running.decrementAndGet();
                    }
                    return List.of(candidate("airport"), candidate("luggage"));
                },
                word -> new AudioRef(word + ".mp3"),
                props(Duration.ofSeconds(5), Duration.ofSeconds(1), false)
        );

        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Future<GenerationResult> first = callers.submit(() -> orchestrator.generate(deckId, "Travel", 2));
            assertThat(firstCallStarted.await(5, TimeUnit.SECONDS)).isTrue();
            Future<GenerationResult> second = callers.submit(() -> orchestrator.generate(deckId, "Travel", 2));

            Thread.sleep(200);
            assertThat(calls.get()).isEqualTo(1);
            assertThat(sessions.createdCount()).isEqualTo(1);
            releaseFirst.countDown();

            GenerationResult firstResult = first.get(5, TimeUnit.SECONDS);
            GenerationResult secondResult = second.get(5, TimeUnit.SECONDS);

            assertThat(maxRunning.get()).isEqualTo(1);
            assertThat(firstResult.cards()).extracting(Card::word).containsExactly("airport", "luggage");
            assertThat(secondResult.cards()).isEmpty();
            assertThat(secondResult.session().getOutcomes())
                    .allMatch(outcome -> outcome.verdict() == OutcomeVerdict.REJECTED_DUPLICATE);
            assertThat(decks.cardCount(deckId)).isEqualTo(4);
            assertThat(decks.wordsOf(deckId)).containsExactlyInAnyOrder("hotel", "beach", "airport", "luggage");
        } finally {
            releaseFirst.countDown();
            callers.shutdownNow();
        }
    }

    private CardGenerationOrchestrator orchestrator(WordGenerationService generator,
                                                    AudioSynthesisService audio,
                                                    GenerationProps props) {
        CardGenerationOrchestrator orchestrator = new CardGenerationOrchestrator(
                decks,
                decks,
                sessions,
                generator,
                audio,
                normalizer,
                new DuplicateDetector(props.similarityThreshold()),
                new QualityGate(normalizer),
                TransactionOperations.withoutTransaction(),
                new DeckLockRegistry(8),
                activeRuns,
                props,
                CLOCK
        );
        created.add(orchestrator);
        return orchestrator;
    }

    private static <T extends Throwable> T failureOf(ThrowingCallable call, Class<T> type) {
        Throwable thrown = catchThrowable(call);
        assertThat(thrown).isInstanceOf(type);
        return type.cast(thrown);
    }

    private static GenerationProps props(Duration generationTimeout, Duration audioTimeout, boolean audioRequired) {
        return props(generationTimeout, audioTimeout, audioRequired, 2);
    }

    private static GenerationProps props(Duration generationTimeout,
                                         Duration audioTimeout,
                                         boolean audioRequired,
                                         int audioConcurrency) {
        return new GenerationProps("stub", 20, 0.8, null, generationTimeout, audioTimeout, audioConcurrency,
                audioRequired, 30, 8, null, null, null, null);
    }

    private static CardCandidate candidate(String word) {
        return new CardCandidate(
                word,
                "tr " + word,
                "We talked about the " + word + " today.",
                "Falamos sobre " + word + " hoje."
        );
    }

    /**
     * Deck and card storage in one map. Inserts are all-or-nothing like the real transaction.
     */
    private static final class InMemoryDecks implements DeckStore, CardStore {

        private final WordNormalizer normalizer;
        private final Map<UUID, Deck> decks = new ConcurrentHashMap<>();
        private final Map<UUID, List<String>> words = new ConcurrentHashMap<>();
        private volatile boolean failInserts;
        private volatile int insertCalls;
        private volatile CountDownLatch insertStarted;
        private volatile CountDownLatch releaseInsert;

        InMemoryDecks(WordNormalizer normalizer) {
            this.normalizer = normalizer;
        }

        UUID addDeck(String title) {
            UUID id = UUID.randomUUID();
            decks.put(id, new Deck(id, UUID.randomUUID(), title, null, 0, CLOCK.instant(), CLOCK.instant()));
            words.put(id, new CopyOnWriteArrayList<>());
            return id;
        }

        void seed(UUID deckId, String... seeded) {
            for (String word : seeded) {
                words.get(deckId).add(normalizer.normalize(word).value());
            }
            incrementCardCount(deckId, seeded.length);
        }

        void failInserts() {
            this.failInserts = true;
        }

        void blockInserts(CountDownLatch started, CountDownLatch release) {
            this.insertStarted = started;
            this.releaseInsert = release;
        }

        int insertCalls() {
            return insertCalls;
        }

        int cardCount(UUID deckId) {
            return decks.get(deckId).cardCount();
        }

        List<String> wordsOf(UUID deckId) {
            return List.copyOf(words.get(deckId));
        }

        @Override
        public Optional<Deck> get(UUID deckId) {
            return Optional.ofNullable(decks.get(deckId));
        }

        @Override
        public Set<NormalizedKey> listWordKeys(UUID deckId) {
            return words.getOrDefault(deckId, List.of()).stream()
                    .map(NormalizedKey::new)
                    .collect(Collectors.toSet());
        }

        @Override
        public void incrementCardCount(UUID deckId, int n) {
            decks.computeIfPresent(deckId, (id, deck) -> new Deck(id, deck.ownerId(), deck.title(),
                    deck.description(), deck.cardCount() + n, deck.createdAt(), deck.updatedAt()));
        }

        @Override
        public void insertBatch(List<Card> cards) {
            insertCalls++;
            if (insertStarted != null) {
                insertStarted.countDown();
                try {
                    releaseInsert.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            }
            if (failInserts) {
                throw new CardStoreException("duplicate key value violates unique constraint");
            }
            for (Card card : cards) {
                words.get(card.deckId()).add(card.normalizedWord());
            }
        }
    }

    private static final class RecordingAudio implements AudioSynthesisService {

        private final Function<String, AudioRef> synthesizer;
        private final List<String> synthesized = new CopyOnWriteArrayList<>();
        private final List<AudioRef> discarded = new CopyOnWriteArrayList<>();

        RecordingAudio(Function<String, AudioRef> synthesizer) {
            this.synthesizer = synthesizer;
        }

        @Override
        public AudioRef synthesize(String word) {
            synthesized.add(word);
            return synthesizer.apply(word);
        }

        @Override
        public void discard(AudioRef ref) {
            discarded.add(ref);
        }

        List<String> synthesized() {
            return synthesized;
        }

        List<AudioRef> discarded() {
            return discarded;
        }
    }

    private static final class RecordingSessionStore implements SessionStore {

        private final Map<UUID, List<GenerationStatus>> history = new ConcurrentHashMap<>();
        private final Map<UUID, GenerationSession> latest = new ConcurrentHashMap<>();

        @Override
        public void create(GenerationSession session) {
            history.put(session.getSessionId(), new CopyOnWriteArrayList<>(List.of(session.getStatus())));
            latest.put(session.getSessionId(), session);
        }

        @Override
        public void update(GenerationSession session) {
            history.get(session.getSessionId()).add(session.getStatus());
            latest.put(session.getSessionId(), session);
        }

        List<GenerationStatus> statusHistory(UUID sessionId) {
            return history.get(sessionId);
        }

        GenerationSession latest(UUID sessionId) {
            return latest.get(sessionId);
        }

        int createdCount() {
            return history.size();
        }

        UUID onlySessionId() {
            assertThat(history).hasSize(1);
            return history.keySet().iterator().next();
        }
    }
}
