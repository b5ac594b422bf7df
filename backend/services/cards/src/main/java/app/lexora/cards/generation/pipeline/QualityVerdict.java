package app.lexora.cards.generation.pipeline;

public record QualityVerdict(
        boolean pass,
        String reason,
        double score
) {

    public static QualityVerdict accept(double score) {
        return new QualityVerdict(true, null, score);
    }

    public static QualityVerdict reject(String reason, double score) {
        return new QualityVerdict(false, reason, score);
    }
}
