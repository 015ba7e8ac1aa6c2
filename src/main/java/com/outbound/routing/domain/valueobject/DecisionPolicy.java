package com.outbound.routing.domain.valueobject;

import java.time.Duration;

/**
 * Thresholds for the score- and burst-based transition rules.
 */
public final class DecisionPolicy {

    private final double highWaterMark;
    private final int openBurstCount;
    private final Duration openBurstWindow;

    public DecisionPolicy(double highWaterMark, int openBurstCount, Duration openBurstWindow) {
        if (highWaterMark <= 0 || highWaterMark > 100) {
            throw new IllegalArgumentException("highWaterMark must be in (0, 100]");
        }
        if (openBurstCount < 1) {
            throw new IllegalArgumentException("openBurstCount must be positive");
        }
        if (openBurstWindow == null || openBurstWindow.isNegative() || openBurstWindow.isZero()) {
            throw new IllegalArgumentException("openBurstWindow must be positive");
        }
        this.highWaterMark = highWaterMark;
        this.openBurstCount = openBurstCount;
        this.openBurstWindow = openBurstWindow;
    }

    public static DecisionPolicy defaults() {
        return new DecisionPolicy(65, 3, Duration.ofDays(7));
    }

    public double getHighWaterMark() {
        return highWaterMark;
    }

    public int getOpenBurstCount() {
        return openBurstCount;
    }

    public Duration getOpenBurstWindow() {
        return openBurstWindow;
    }
}
