package com.outbound.routing.application.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

import com.outbound.routing.domain.entity.EngagementEvent;
import com.outbound.routing.domain.entity.EngagementSignal;
import com.outbound.routing.domain.entity.RawEngagementEvent;
import com.outbound.routing.domain.exception.InvalidEventException;
import com.outbound.routing.domain.valueobject.EventSource;
import com.outbound.routing.domain.valueobject.EventType;

/**
 * Normalizes raw adapter events into validated {@link EngagementEvent}s.
 * <p>
 * <b>Pure:</b> no I/O, no side effects. The only external input is the clock
 * used for the future-timestamp check.
 * </p>
 *
 * <p>
 * Dedup key: {@code <source>:<external_id>} when the adapter supplies an
 * external id, otherwise {@code sha256:<hex>} over identity, type, occurrence
 * time and the payload with keys in sorted order.
 * </p>
 */
public class EventValidator {

    // Widths of the engagement_signals / engagement_events columns
    public static final int MAX_LEAD_ID_LENGTH = 128;
    public static final int MAX_EMAIL_LENGTH = 320;
    public static final int MAX_SOURCE_LENGTH = 128;
    public static final int MAX_DEDUP_KEY_LENGTH = 512;

    private final Clock clock;
    private final Duration clockSkewTolerance;

    public EventValidator(Clock clock, Duration clockSkewTolerance) {
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");
        if (clockSkewTolerance == null || clockSkewTolerance.isNegative())
            throw new IllegalArgumentException("clockSkewTolerance must be non-negative");

        this.clock = clock;
        this.clockSkewTolerance = clockSkewTolerance;
    }

    /**
     * Validates and normalizes an adapter event.
     *
     * @param raw event as received
     * @return normalized event (lead id may still be null if only email was given)
     * @throws InvalidEventException if the event must be rejected
     */
    public EngagementEvent validate(RawEngagementEvent raw) {
        if (raw == null) {
            throw new InvalidEventException("event", "event body is required");
        }

        EventType type = EventType.fromWireName(raw.eventType());
        if (type == null) {
            throw new InvalidEventException("event_type", "unknown event_type: " + raw.eventType());
        }
        if (type.isEngineOnly()) {
            throw new InvalidEventException("event_type",
                    type.wireName() + " is written by the routing engine and cannot be submitted");
        }

        String leadId = trimToNull(raw.leadId());
        String email = normalizeEmail(raw.email());
        if (leadId == null && email == null) {
            throw new InvalidEventException("lead_id", "lead_id or email is required");
        }
        requireMaxLength("lead_id", leadId, MAX_LEAD_ID_LENGTH);
        requireMaxLength("email", email, MAX_EMAIL_LENGTH);
        requireMaxLength("source", raw.source(), MAX_SOURCE_LENGTH);
        if (email != null && (email.indexOf('@') < 1 || email.endsWith("@"))) {
            throw new InvalidEventException("email", "malformed email: " + raw.email());
        }

        Instant occurredAt = raw.occurredAt();
        if (occurredAt == null) {
            throw new InvalidEventException("occurred_at", "occurred_at is required");
        }
        Instant latestAccepted = clock.instant().plus(clockSkewTolerance);
        if (occurredAt.isAfter(latestAccepted)) {
            throw new InvalidEventException("occurred_at",
                    "occurred_at " + occurredAt + " is in the future beyond the clock-skew tolerance");
        }

        EventSource source = EventSource.normalize(raw.source());
        Map<String, Object> payload = raw.payload() != null ? raw.payload() : Map.of();

        if (type.isAdministrative()) {
            if (source != EventSource.MANUAL) {
                throw new InvalidEventException("source", type.wireName() + " is accepted only from the manual source");
            }
            try {
                EngagementSignal.resetFlags(payload.get("flags"));
            } catch (IllegalArgumentException e) {
                throw new InvalidEventException("payload", "unknown flag in reset: " + payload.get("flags"));
            }
        }

        String dedupKey = dedupKey(leadId, email, type, source, trimToNull(raw.externalId()), occurredAt, payload);
        if (dedupKey.length() > MAX_DEDUP_KEY_LENGTH) {
            throw new InvalidEventException("external_id",
                    "external_id too long: dedup key exceeds " + MAX_DEDUP_KEY_LENGTH + " characters");
        }

        return new EngagementEvent(UUID.randomUUID().toString(), leadId, email, type, source,
                raw.source(), dedupKey, payload, occurredAt, null);
    }

    // ─────────────────── Private Helpers ───────────────────

    private static void requireMaxLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new InvalidEventException(field, field + " exceeds " + max + " characters");
        }
    }

    private static String dedupKey(String leadId, String email, EventType type, EventSource source,
            String externalId, Instant occurredAt, Map<String, Object> payload) {
        if (externalId != null) {
            return source.wireName() + ":" + externalId;
        }
        String identity = leadId != null ? leadId : email;
        String material = identity + "|" + type.wireName() + "|" + occurredAt + "|" + canonical(payload);
        return "sha256:" + sha256(material);
    }

    /**
     * Stable textual form of a payload: nested maps with sorted keys.
     */
    static String canonical(Object value) {
        if (value instanceof Map) {
            Map<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                sorted.put(String.valueOf(entry.getKey()), canonicalValue(entry.getValue()));
            }
            return sorted.toString();
        }
        return String.valueOf(canonicalValue(value));
    }

    private static Object canonicalValue(Object value) {
        if (value instanceof Map) {
            return canonical(value);
        }
        if (value instanceof List) {
            List<Object> items = new ArrayList<>();
            for (Object item : (List<?>) value) {
                items.add(canonicalValue(item));
            }
            return items;
        }
        return value;
    }

    private static String sha256(String material) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String normalizeEmail(String email) {
        String trimmed = trimToNull(email);
        return trimmed != null ? trimmed.toLowerCase() : null;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
