package com.outbound.routing.domain.valueobject;

/**
 * Discrete engagement bucket derived from the engagement score.
 */
public enum EngagementLevel {

    /** No signal, or only sends with no response */
    COLD("cold"),

    /** Single light engagement (one open, one click, a connection) */
    LUKEWARM("lukewarm"),

    /** Repeated light engagement */
    WARM("warm"),

    /** Positive intent: reply, meeting, form, contact request */
    HOT("hot");

    private final String wireName;

    EngagementLevel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static EngagementLevel fromWireName(String wireName) {
        for (EngagementLevel level : values()) {
            if (level.wireName.equalsIgnoreCase(wireName)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown engagement level: " + wireName);
    }
}
