package com.outbound.routing.domain.valueobject;

import java.time.Duration;

/**
 * Immutable scoring configuration: weights, level thresholds and recency bands.
 *
 * <pre>
 * age &lt;= fullWeightWindow      → 1.0
 * age &lt;= reducedWeightWindow   → reducedFactor
 * age &lt;= decayWindow           → agingFactor
 * older, or never observed     → staleFactor
 * </pre>
 */
public final class ScoringPolicy {

    private final ScoringWeights weights;
    private final LevelThresholds thresholds;
    private final Duration fullWeightWindow;
    private final Duration reducedWeightWindow;
    private final Duration decayWindow;
    private final double reducedFactor;
    private final double agingFactor;
    private final double staleFactor;

    public ScoringPolicy(ScoringWeights weights, LevelThresholds thresholds,
            Duration fullWeightWindow, Duration reducedWeightWindow, Duration decayWindow,
            double reducedFactor, double agingFactor, double staleFactor) {
        if (weights == null || thresholds == null) {
            throw new IllegalArgumentException("weights and thresholds cannot be null");
        }
        if (fullWeightWindow.compareTo(reducedWeightWindow) > 0
                || reducedWeightWindow.compareTo(decayWindow) > 0) {
            throw new IllegalArgumentException(
                    "Recency windows must be ordered: full <= reduced <= decay");
        }
        if (staleFactor < 0 || staleFactor > agingFactor || agingFactor > reducedFactor || reducedFactor > 1) {
            throw new IllegalArgumentException(
                    "Recency factors must satisfy 0 <= stale <= aging <= reduced <= 1");
        }
        this.weights = weights;
        this.thresholds = thresholds;
        this.fullWeightWindow = fullWeightWindow;
        this.reducedWeightWindow = reducedWeightWindow;
        this.decayWindow = decayWindow;
        this.reducedFactor = reducedFactor;
        this.agingFactor = agingFactor;
        this.staleFactor = staleFactor;
    }

    public static ScoringPolicy defaults() {
        return new ScoringPolicy(ScoringWeights.defaults(), LevelThresholds.defaults(),
                Duration.ofDays(7), Duration.ofDays(14), Duration.ofDays(30),
                0.8, 0.6, 0.3);
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public LevelThresholds getThresholds() {
        return thresholds;
    }

    public Duration getFullWeightWindow() {
        return fullWeightWindow;
    }

    public Duration getReducedWeightWindow() {
        return reducedWeightWindow;
    }

    public Duration getDecayWindow() {
        return decayWindow;
    }

    public double getReducedFactor() {
        return reducedFactor;
    }

    public double getAgingFactor() {
        return agingFactor;
    }

    public double getStaleFactor() {
        return staleFactor;
    }
}
