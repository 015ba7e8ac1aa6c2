package com.outbound.routing.domain.valueobject;

/**
 * Output of the scoring function with its per-family breakdown.
 *
 * @param score    clamped total in [0, 100]
 * @param level    level the score maps to
 * @param intent   positive-intent component
 * @param repeated repeated light engagement component
 * @param single   single light engagement component
 * @param penalty  subtracted penalty (non-negative)
 */
public record ScoreResult(double score, EngagementLevel level,
        double intent, double repeated, double single, double penalty) {
}
