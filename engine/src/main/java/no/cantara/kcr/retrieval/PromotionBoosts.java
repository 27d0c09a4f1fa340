package no.cantara.kcr.retrieval;

import no.cantara.kcr.model.PromotionLevel;

/**
 * Flat additive score boost per promotion level.
 */
public record PromotionBoosts(double critical, double important, double standard) {

    public static PromotionBoosts defaults() {
        return new PromotionBoosts(0.15, 0.10, 0.0);
    }

    public double boostFor(PromotionLevel level) {
        return switch (level) {
            case CRITICAL  -> critical;
            case IMPORTANT -> important;
            case STANDARD  -> standard;
        };
    }

    /** {@code min(1.0, raw + boost(level))}. */
    public double apply(double rawScore, PromotionLevel level) {
        return Math.min(1.0, rawScore + boostFor(level));
    }
}
