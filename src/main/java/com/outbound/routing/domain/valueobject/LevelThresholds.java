package com.outbound.routing.domain.valueobject;

/**
 * Score boundaries between engagement levels.
 * <p>
 * Total and non-overlapping over [0, 100]: {@code [0, lukewarm)} is COLD,
 * {@code [lukewarm, warm)} LUKEWARM, {@code [warm, hot)} WARM and
 * {@code [hot, 100]} HOT.
 * </p>
 */
public final class LevelThresholds {

    private final double lukewarm;
    private final double warm;
    private final double hot;

    public LevelThresholds(double lukewarm, double warm, double hot) {
        if (!(lukewarm > 0 && lukewarm < warm && warm < hot && hot <= 100)) {
            throw new IllegalArgumentException(String.format(
                    "Level thresholds must satisfy 0 < lukewarm < warm < hot <= 100 (got %s/%s/%s)",
                    lukewarm, warm, hot));
        }
        this.lukewarm = lukewarm;
        this.warm = warm;
        this.hot = hot;
    }

    public static LevelThresholds defaults() {
        return new LevelThresholds(15, 40, 70);
    }

    /**
     * Maps a clamped score to exactly one level.
     *
     * @param score score in [0, 100]
     * @return engagement level
     */
    public EngagementLevel classify(double score) {
        if (score >= hot) {
            return EngagementLevel.HOT;
        }
        if (score >= warm) {
            return EngagementLevel.WARM;
        }
        if (score >= lukewarm) {
            return EngagementLevel.LUKEWARM;
        }
        return EngagementLevel.COLD;
    }

    public double getLukewarm() {
        return lukewarm;
    }

    public double getWarm() {
        return warm;
    }

    public double getHot() {
        return hot;
    }

    @Override
    public String toString() {
        return "LevelThresholds{lukewarm=" + lukewarm + ", warm=" + warm + ", hot=" + hot + "}";
    }
}
