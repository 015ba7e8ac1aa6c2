package com.outbound.routing.domain.valueobject;

/**
 * Reason a transition was proposed, in evaluation priority order.
 * <p>
 * Lower {@code priority} values are evaluated first; the first trigger whose
 * condition holds and whose target is ahead of the current platform wins.
 * </p>
 */
public enum TransitionTrigger {

    EMAIL_REPLY(1, Platform.CRM),
    NETWORK_REPLY(1, Platform.CRM),
    MEETING_BOOKED(1, Platform.CRM),
    FORM_SUBMITTED(1, Platform.CRM),
    REQUESTED_CONTACT(1, Platform.CRM),

    /** Repeated opens inside the trailing burst window while in outreach */
    HIGH_OPEN_ENGAGEMENT(2, Platform.HYBRID),

    /** Score at or above the configured high-water mark */
    SCORE_HIGH_WATER(3, Platform.CRM),

    /** Outreach platform reported sending to a lead not yet routed */
    OUTREACH_ACTIVITY_OBSERVED(4, Platform.OUTREACH),

    /** Operator-initiated move; target is chosen by the operator */
    MANUAL_OVERRIDE(0, null);

    private final int priority;
    private final Platform target;

    TransitionTrigger(int priority, Platform target) {
        this.priority = priority;
        this.target = target;
    }

    public int priority() {
        return priority;
    }

    /**
     * @return fixed target platform, or null for manual overrides
     */
    public Platform target() {
        return target;
    }

    public String wireName() {
        return name().toLowerCase();
    }

    public static TransitionTrigger fromWireName(String wireName) {
        for (TransitionTrigger trigger : values()) {
            if (trigger.wireName().equals(wireName)) {
                return trigger;
            }
        }
        throw new IllegalArgumentException("Unknown transition trigger: " + wireName);
    }

    public boolean isManual() {
        return this == MANUAL_OVERRIDE;
    }
}
