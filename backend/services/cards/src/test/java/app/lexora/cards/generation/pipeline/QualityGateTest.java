package app.lexora.cards.generation.pipeline;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class QualityGateTest {

    private final QualityGate gate = new QualityGate(new WordNormalizer());
    private final QualityConfig config = QualityConfig.defaults();

    @Test
    void passesQuality_acceptsCompleteCandidate() {
        CardCandidate candidate = new CardCandidate(
                "airport", "aeroporto", "We arrived at the airport early.", "Chegamos cedo ao aeroporto.");

        QualityVerdict verdict = gate.passesQuality(candidate, config);

        assertThat(verdict.pass()).isTrue();
        assertThat(verdict.reason()).isNull();
        assertThat(verdict.score()).isEqualTo(1.0);
    }

    @Test
    void passesQuality_rejectsEmptyNormalizedWord() {
        CardCandidate candidate = new CardCandidate(
                "?!", "ponto", "What does ?! mean here?", "O que significa ?! aqui?");

        QualityVerdict verdict = gate.passesQuality(candidate, config);

        assertThat(verdict.pass()).isFalse();
        assertThat(verdict.reason()).isEqualTo("missing field(s): word");
    }

    @Test
    void passesQuality_listsEveryMissingField() {
        CardCandidate candidate = new CardCandidate("hotel", " ", null, "");

        QualityVerdict verdict = gate.passesQuality(candidate, config);

        assertThat(verdict.pass()).isFalse();
        assertThat(verdict.reason()).isEqualTo("missing field(s): translation, example, exampleTranslation");
    }

    @Test
    void passesQuality_rejectsTooShortWord() {
        CardCandidate candidate = new CardCandidate("a", "um", "I would like a room.", "Eu gostaria de um quarto.");

        QualityVerdict verdict = gate.passesQuality(candidate, config);

        assertThat(verdict.pass()).isFalse();
        assertThat(verdict.reason()).isEqualTo("word length 1 is below minimum 2");
    }

    @Test
    void passesQuality_rejectsExampleWithoutTheWord() {
        CardCandidate candidate = new CardCandidate(
                "luggage", "bagagem", "We arrived at the airport early.", "Chegamos cedo ao aeroporto.");

        QualityVerdict verdict = gate.passesQuality(candidate, config);

        assertThat(verdict.pass()).isFalse();
        assertThat(verdict.reason()).isEqualTo("example does not contain the word");
    }

    @Test
    void passesQuality_acceptsInflectedFormInExample() {
        CardCandidate candidate = new CardCandidate(
                "book a room", "reservar um quarto", "She booked two rooms for the trip.", "Ela reservou dois quartos.");

        assertThat(gate.passesQuality(candidate, config).pass()).isTrue();
    }

    @Test
    void passesQuality_rejectsOversizedFieldsWithDefaultConfig() {
        CardCandidate candidate = new CardCandidate(
                "hotel",
                "hotel de praia ".repeat(50),
                "We stayed at a lovely hotel by the sea. ".repeat(25),
                "Ficamos num hotel perto do mar. ".repeat(25));

        QualityVerdict verdict = gate.passesQuality(candidate, config);

        assertThat(verdict.pass()).isFalse();
        assertThat(verdict.score()).isCloseTo(0.6625, within(0.0001));
        assertThat(verdict.reason()).isEqualTo("quality score 0.66 below threshold 0.70");
    }

    @Test
    void passesQuality_rejectsCandidateWithContentIssuesWithDefaultConfig() {
        CardCandidate candidate = new CardCandidate("hotel2", "hotel", "This is a hotel2.", "Hotel.");

        QualityVerdict verdict = gate.passesQuality(candidate, config);

        assertThat(verdict.pass()).isFalse();
        assertThat(verdict.score()).isCloseTo(0.59375, within(0.0001));
        assertThat(verdict.reason()).isEqualTo("quality score 0.59 below threshold 0.70 "
                + "(word contains non-letter characters; example is generic; example translation is shorter than 10)");
    }

    @Test
    void passesQuality_genericExampleAloneLowersScoreButPasses() {
        CardCandidate candidate = new CardCandidate(
                "hotel", "hotel", "This is a hotel near the beach.", "Este é um hotel perto da praia.");

        QualityVerdict verdict = gate.passesQuality(candidate, config);

        assertThat(verdict.pass()).isTrue();
        assertThat(verdict.score()).isCloseTo(0.895, within(0.0001));
    }

    @Test
    void passesQuality_honoursConfiguredThreshold() {
        QualityConfig strict = new QualityConfig(2, 40, 10, 200, 100, 0.2, 0.45, 0.35, 0.95);
        CardCandidate candidate = new CardCandidate("hotel", "hotel", "We booked a hotel near the beach.", "Um hotel.");

        assertThat(gate.passesQuality(candidate, config).pass()).isTrue();

        QualityVerdict verdict = gate.passesQuality(candidate, strict);

        assertThat(verdict.pass()).isFalse();
        assertThat(verdict.score()).isCloseTo(0.8725, within(0.0001));
        assertThat(verdict.reason())
                .isEqualTo("quality score 0.87 below threshold 0.95 (example translation is shorter than 10)");
    }

    @Test
    void fitness_fallsLinearlyOutsideTheRange() {
        assertThat(QualityGate.fitness(0, 10, 200)).isZero();
        assertThat(QualityGate.fitness(5, 10, 200)).isEqualTo(0.5);
        assertThat(QualityGate.fitness(150, 10, 200)).isEqualTo(1.0);
        assertThat(QualityGate.fitness(300, 10, 200)).isEqualTo(0.5);
        assertThat(QualityGate.fitness(900, 10, 200)).isZero();
    }

    @Test
    void stem_stripsCommonEnglishSuffixes() {
        assertThat(QualityGate.stem("booking")).isEqualTo("book");
        assertThat(QualityGate.stem("booked")).isEqualTo("book");
        assertThat(QualityGate.stem("rooms")).isEqualTo("room");
        assertThat(QualityGate.stem("reserve")).isEqualTo("reserv");
        assertThat(QualityGate.stem("bus")).isEqualTo("bus");
    }
}
