package com.outbound.routing.domain.valueobject;

/**
 * Outbound-communication platform a lead is currently routed through.
 * <p>
 * Platforms are totally ordered; automated routing only ever moves a lead
 * forward along this order.
 * </p>
 *
 * <pre>
 * Legal graph (automated):
 *   NONE → OUTREACH → HYBRID → CRM
 *   (forward skips such as NONE → CRM or OUTREACH → CRM are allowed)
 * </pre>
 */
public enum Platform {

    /** Not yet routed anywhere */
    NONE("none", 0),

    /** Cold-outreach sequencing platform */
    OUTREACH("outreach", 1),

    /** Still in outreach, flagged for relationship follow-up */
    HYBRID("hybrid", 2),

    /** Relationship/CRM platform - terminal for automated routing */
    CRM("crm", 3);

    private final String wireName;
    private final int rank;

    Platform(String wireName, int rank) {
        this.wireName = wireName;
        this.rank = rank;
    }

    public String wireName() {
        return wireName;
    }

    public int rank() {
        return rank;
    }

    /**
     * @param other platform to compare against
     * @return true if this platform is strictly ahead of {@code other}
     */
    public boolean isAheadOf(Platform other) {
        return this.rank > other.rank;
    }

    /**
     * Terminal platforms accept no further automated transitions.
     *
     * @return true if CRM
     */
    public boolean isTerminal() {
        return this == CRM;
    }

    public static Platform fromWireName(String wireName) {
        for (Platform platform : values()) {
            if (platform.wireName.equalsIgnoreCase(wireName)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unknown platform: " + wireName);
    }
}
