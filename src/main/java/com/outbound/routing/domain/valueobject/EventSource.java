package com.outbound.routing.domain.valueobject;

import java.util.Map;

/**
 * Originating system of an engagement event.
 * <p>
 * Provenance is advisory: an unrecognized source is tagged {@link #UNVERIFIED}
 * instead of being rejected. {@link #ROUTING_ENGINE} is internal and is never
 * produced by normalization.
 * </p>
 */
public enum EventSource {

    OUTREACH_PLATFORM("outreach_platform"),
    CRM_PLATFORM("crm_platform"),
    NETWORK_PLATFORM("network_platform"),
    VISITOR_ID_PROVIDER("visitor_id_provider"),
    WEBSITE("website"),
    MANUAL("manual"),
    UNVERIFIED("unverified"),
    ROUTING_ENGINE("routing_engine");

    // Vendor names used by existing webhook adapters
    private static final Map<String, EventSource> ALIASES = Map.ofEntries(
            Map.entry("outreach_platform", OUTREACH_PLATFORM),
            Map.entry("instantly", OUTREACH_PLATFORM),
            Map.entry("crm_platform", CRM_PLATFORM),
            Map.entry("gohighlevel", CRM_PLATFORM),
            Map.entry("ghl", CRM_PLATFORM),
            Map.entry("network_platform", NETWORK_PLATFORM),
            Map.entry("linkedin", NETWORK_PLATFORM),
            Map.entry("heyreach", NETWORK_PLATFORM),
            Map.entry("visitor_id_provider", VISITOR_ID_PROVIDER),
            Map.entry("rb2b", VISITOR_ID_PROVIDER),
            Map.entry("website", WEBSITE),
            Map.entry("manual", MANUAL));

    private final String wireName;

    EventSource(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Normalizes a raw source string from an adapter.
     *
     * @param raw source as reported upstream, may be null
     * @return recognized source, or UNVERIFIED
     */
    public static EventSource normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNVERIFIED;
        }
        return ALIASES.getOrDefault(raw.trim().toLowerCase(), UNVERIFIED);
    }

    /**
     * Parses a stored wire name back into a source (used when reading the log).
     */
    public static EventSource fromWireName(String wireName) {
        for (EventSource source : values()) {
            if (source.wireName.equals(wireName)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown event source: " + wireName);
    }

    public boolean isVerified() {
        return this != UNVERIFIED;
    }
}
