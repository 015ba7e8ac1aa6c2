package com.outbound.routing.domain.valueobject;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed classification of engagement events accepted by the routing engine.
 * <p>
 * Each constant carries its wire name (the snake_case form used by upstream
 * adapters and stored in the event log). Anything outside this set is
 * rejected at validation time.
 * </p>
 */
public enum EventType {

    EMAIL_SENT("email_sent"),
    EMAIL_OPENED("email_opened"),
    EMAIL_CLICKED("email_clicked"),
    EMAIL_REPLIED("email_replied"),
    EMAIL_BOUNCED("email_bounced"),

    NETWORK_CONNECTED("network_connected"),
    NETWORK_MESSAGE_SENT("network_message_sent"),
    NETWORK_MESSAGE_RECEIVED("network_message_received"),

    WEBSITE_VISIT("website_visit"),
    PAGE_VIEW("page_view"),
    VISITOR_IDENTIFIED("visitor_identified"),

    FORM_SUBMITTED("form_submitted"),
    CONTENT_DOWNLOADED("content_downloaded"),
    CONTACT_REQUESTED("contact_requested"),

    MEETING_BOOKED("meeting_booked"),
    MEETING_COMPLETED("meeting_completed"),
    MEETING_NO_SHOW("meeting_no_show"),

    PIPELINE_STAGE_CHANGED("pipeline_stage_changed"),

    /** Written by the executor only; never accepted from an adapter */
    PLATFORM_TRANSITION("platform_transition"),

    /** Administrative flag reset; accepted only from the manual source */
    SIGNALS_RESET("signals_reset");

    private static final Map<String, EventType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(EventType::wireName, Function.identity()));

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name (case-insensitive) to its event type.
     *
     * @param raw wire name as sent by an adapter
     * @return matching type, or null if the name is outside the enumeration
     */
    public static EventType fromWireName(String raw) {
        if (raw == null) {
            return null;
        }
        return BY_WIRE_NAME.get(raw.trim().toLowerCase());
    }

    /**
     * Positive-intent events: each one alone is enough to hand the lead to the CRM.
     *
     * @return true for replies, booked meetings, form submissions and contact requests
     */
    public boolean isPositiveIntent() {
        return this == EMAIL_REPLIED || this == NETWORK_MESSAGE_RECEIVED
                || this == MEETING_BOOKED || this == FORM_SUBMITTED
                || this == CONTACT_REQUESTED;
    }

    /**
     * Reserved types cannot be submitted by platform adapters.
     *
     * @return true if only the engine itself may write this type
     */
    public boolean isEngineOnly() {
        return this == PLATFORM_TRANSITION;
    }

    /** @return true if this event is an administrative reset */
    public boolean isAdministrative() {
        return this == SIGNALS_RESET;
    }
}
