package com.outbound.routing.domain.entity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.outbound.routing.domain.valueobject.EngagementLevel;
import com.outbound.routing.domain.valueobject.Platform;

/**
 * Per-lead engagement aggregate: the single authoritative summary of a lead's
 * event history plus its routing state.
 * <p>
 * <b>IMMUTABLE:</b> applying an event, rescoring or recording a transition
 * returns a NEW instance. The store persists it with optimistic versioning.
 * </p>
 *
 * <p>
 * <b>Invariants:</b>
 * </p>
 * <ul>
 * <li>counters never decrease</li>
 * <li>one-time flags are only lowered by an administrative reset</li>
 * <li>last-occurrence timestamps only move forward (max of occurredAt)</li>
 * <li>transitionCount grows by exactly one per committed transition</li>
 * </ul>
 *
 * <p>
 * Counter and timestamp updates are commutative, so replaying the event log
 * in any order (barring resets) reproduces the same aggregate.
 * </p>
 */
public final class EngagementSignal {

    /** Open timestamps kept for the trailing-window burst check */
    public static final int RECENT_OPENS_CAPACITY = 20;

    /** Flags an administrative reset may clear */
    public enum Flag {
        NETWORK_CONNECTED,
        VISITOR_IDENTIFIED,
        REQUESTED_CONTACT,
        DOWNLOADED_CONTENT,
        VIEWED_PRICING,
        VIEWED_DEMO,
        IN_CRM;

        public static Flag fromWireName(String raw) {
            return Flag.valueOf(raw.trim().toUpperCase());
        }
    }

    private final String leadId;
    private final String email;

    // Email
    private final int emailsSent;
    private final int emailsOpened;
    private final int emailsClicked;
    private final int emailsReplied;
    private final int emailsBounced;
    private final Instant lastEmailSentAt;
    private final Instant lastEmailOpenAt;
    private final Instant lastEmailClickAt;
    private final Instant lastEmailReplyAt;
    private final Instant lastEmailBounceAt;
    private final List<Instant> recentOpens;

    // Professional network
    private final boolean networkConnected;
    private final Instant networkConnectedAt;
    private final int networkMessagesSent;
    private final int networkMessagesReceived;
    private final Instant lastNetworkReplyAt;
    private final Instant lastNetworkActivityAt;

    // Website / intent
    private final int websiteVisits;
    private final int pageViews;
    private final Instant lastWebsiteVisitAt;
    private final boolean visitorIdentified;
    private final Instant visitorIdentifiedAt;
    private final boolean viewedPricing;
    private final boolean viewedDemo;
    private final boolean downloadedContent;
    private final int contentDownloads;
    private final Instant lastContentDownloadAt;
    private final boolean requestedContact;
    private final Instant requestedContactAt;
    private final int formsSubmitted;
    private final Instant lastFormSubmittedAt;

    // Meetings / CRM
    private final int meetingsBooked;
    private final int meetingsCompleted;
    private final int meetingsNoShow;
    private final Instant lastMeetingAt;
    private final boolean inCrm;
    private final String crmStage;
    private final Instant lastCrmActivityAt;

    private final Instant lastEventAt;

    // Derived
    private final double engagementScore;
    private final EngagementLevel engagementLevel;

    // Routing
    private final Platform currentPlatform;
    private final Map<String, Object> lastRoutingDecision;
    private final Instant lastRoutedAt;
    private final int transitionCount;

    // Bookkeeping
    private final long version;
    private final Instant createdAt;
    private final Instant updatedAt;

    private EngagementSignal(Builder b) {
        if (b.leadId == null || b.leadId.isBlank()) {
            throw new IllegalArgumentException("leadId cannot be null or blank");
        }
        if (b.engagementLevel == null) {
            throw new IllegalArgumentException("engagementLevel cannot be null");
        }
        if (b.currentPlatform == null) {
            throw new IllegalArgumentException("currentPlatform cannot be null");
        }
        if (b.createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        this.leadId = b.leadId;
        this.email = b.email;
        this.emailsSent = b.emailsSent;
        this.emailsOpened = b.emailsOpened;
        this.emailsClicked = b.emailsClicked;
        this.emailsReplied = b.emailsReplied;
        this.emailsBounced = b.emailsBounced;
        this.lastEmailSentAt = b.lastEmailSentAt;
        this.lastEmailOpenAt = b.lastEmailOpenAt;
        this.lastEmailClickAt = b.lastEmailClickAt;
        this.lastEmailReplyAt = b.lastEmailReplyAt;
        this.lastEmailBounceAt = b.lastEmailBounceAt;
        this.recentOpens = Collections.unmodifiableList(new ArrayList<>(b.recentOpens));
        this.networkConnected = b.networkConnected;
        this.networkConnectedAt = b.networkConnectedAt;
        this.networkMessagesSent = b.networkMessagesSent;
        this.networkMessagesReceived = b.networkMessagesReceived;
        this.lastNetworkReplyAt = b.lastNetworkReplyAt;
        this.lastNetworkActivityAt = b.lastNetworkActivityAt;
        this.websiteVisits = b.websiteVisits;
        this.pageViews = b.pageViews;
        this.lastWebsiteVisitAt = b.lastWebsiteVisitAt;
        this.visitorIdentified = b.visitorIdentified;
        this.visitorIdentifiedAt = b.visitorIdentifiedAt;
        this.viewedPricing = b.viewedPricing;
        this.viewedDemo = b.viewedDemo;
        this.downloadedContent = b.downloadedContent;
        this.contentDownloads = b.contentDownloads;
        this.lastContentDownloadAt = b.lastContentDownloadAt;
        this.requestedContact = b.requestedContact;
        this.requestedContactAt = b.requestedContactAt;
        this.formsSubmitted = b.formsSubmitted;
        this.lastFormSubmittedAt = b.lastFormSubmittedAt;
        this.meetingsBooked = b.meetingsBooked;
        this.meetingsCompleted = b.meetingsCompleted;
        this.meetingsNoShow = b.meetingsNoShow;
        this.lastMeetingAt = b.lastMeetingAt;
        this.inCrm = b.inCrm;
        this.crmStage = b.crmStage;
        this.lastCrmActivityAt = b.lastCrmActivityAt;
        this.lastEventAt = b.lastEventAt;
        this.engagementScore = b.engagementScore;
        this.engagementLevel = b.engagementLevel;
        this.currentPlatform = b.currentPlatform;
        this.lastRoutingDecision = b.lastRoutingDecision != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.lastRoutingDecision))
                : null;
        this.lastRoutedAt = b.lastRoutedAt;
        this.transitionCount = b.transitionCount;
        this.version = b.version;
        this.createdAt = b.createdAt;
        this.updatedAt = b.updatedAt != null ? b.updatedAt : b.createdAt;
    }

    // ─────────────────── Factory Methods ───────────────────

    /**
     * Default aggregate created lazily on a lead's first event:
     * platform NONE, score 0, level COLD, version 0 (not yet persisted).
     */
    public static EngagementSignal initial(String leadId, String email, Instant now) {
        return builder(leadId)
                .email(email)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public static Builder builder(String leadId) {
        return new Builder(leadId);
    }

    // ─────────────────── Event Application (CRITICAL!) ───────────────────

    /**
     * Folds one event into the aggregate, returning a NEW instance.
     * <p>
     * Does not rescore; the caller runs the scoring function on the result.
     * Platform transition events leave the counters untouched: routing fields
     * are changed only through {@link #withTransition}.
     * </p>
     *
     * @param event validated event bound to this lead
     * @param now   wall-clock time of the update
     * @return updated aggregate
     */
    public EngagementSignal apply(EngagementEvent event, Instant now) {
        Instant at = event.getOccurredAt();
        Builder b = toBuilder().updatedAt(now);
        if (b.email == null && event.getEmail() != null) {
            b.email(event.getEmail());
        }

        switch (event.getEventType()) {
            case EMAIL_SENT -> {
                b.emailsSent = emailsSent + 1;
                b.lastEmailSentAt = latest(lastEmailSentAt, at);
            }
            case EMAIL_OPENED -> {
                b.emailsOpened = emailsOpened + 1;
                b.lastEmailOpenAt = latest(lastEmailOpenAt, at);
                b.recentOpens = appendOpen(recentOpens, at);
            }
            case EMAIL_CLICKED -> {
                b.emailsClicked = emailsClicked + 1;
                b.lastEmailClickAt = latest(lastEmailClickAt, at);
            }
            case EMAIL_REPLIED -> {
                b.emailsReplied = emailsReplied + 1;
                b.lastEmailReplyAt = latest(lastEmailReplyAt, at);
            }
            case EMAIL_BOUNCED -> {
                b.emailsBounced = emailsBounced + 1;
                b.lastEmailBounceAt = latest(lastEmailBounceAt, at);
            }
            case NETWORK_CONNECTED -> {
                b.networkConnected = true;
                b.networkConnectedAt = earliest(networkConnectedAt, at);
                b.lastNetworkActivityAt = latest(lastNetworkActivityAt, at);
            }
            case NETWORK_MESSAGE_SENT -> {
                b.networkMessagesSent = networkMessagesSent + 1;
                b.lastNetworkActivityAt = latest(lastNetworkActivityAt, at);
            }
            case NETWORK_MESSAGE_RECEIVED -> {
                b.networkMessagesReceived = networkMessagesReceived + 1;
                b.lastNetworkReplyAt = latest(lastNetworkReplyAt, at);
                b.lastNetworkActivityAt = latest(lastNetworkActivityAt, at);
            }
            case WEBSITE_VISIT -> {
                b.websiteVisits = websiteVisits + 1;
                b.lastWebsiteVisitAt = latest(lastWebsiteVisitAt, at);
                markPageFlags(b, event.payloadText("page"));
            }
            case PAGE_VIEW -> {
                b.pageViews = pageViews + 1;
                b.lastWebsiteVisitAt = latest(lastWebsiteVisitAt, at);
                markPageFlags(b, event.payloadText("page"));
            }
            case VISITOR_IDENTIFIED -> {
                b.visitorIdentified = true;
                b.visitorIdentifiedAt = latest(visitorIdentifiedAt, at);
            }
            case FORM_SUBMITTED -> {
                b.formsSubmitted = formsSubmitted + 1;
                b.lastFormSubmittedAt = latest(lastFormSubmittedAt, at);
            }
            case CONTENT_DOWNLOADED -> {
                b.downloadedContent = true;
                b.contentDownloads = contentDownloads + 1;
                b.lastContentDownloadAt = latest(lastContentDownloadAt, at);
            }
            case CONTACT_REQUESTED -> {
                b.requestedContact = true;
                b.requestedContactAt = latest(requestedContactAt, at);
            }
            case MEETING_BOOKED -> {
                b.meetingsBooked = meetingsBooked + 1;
                b.lastMeetingAt = latest(lastMeetingAt, at);
            }
            case MEETING_COMPLETED -> {
                b.meetingsCompleted = meetingsCompleted + 1;
                b.lastMeetingAt = latest(lastMeetingAt, at);
            }
            case MEETING_NO_SHOW -> {
                b.meetingsNoShow = meetingsNoShow + 1;
                b.lastMeetingAt = latest(lastMeetingAt, at);
            }
            case PIPELINE_STAGE_CHANGED -> {
                b.inCrm = true;
                String stage = event.payloadText("stage");
                // Latest stage by occurrence wins so out-of-order delivery converges
                if (stage != null && (lastCrmActivityAt == null || !at.isBefore(lastCrmActivityAt))) {
                    b.crmStage = stage;
                }
                b.lastCrmActivityAt = latest(lastCrmActivityAt, at);
            }
            case SIGNALS_RESET -> applyReset(b, event);
            case PLATFORM_TRANSITION -> {
                return b.build();
            }
        }

        b.lastEventAt = latest(lastEventAt, at);
        return b.build();
    }

    /**
     * Returns a copy carrying the recomputed score and level.
     */
    public EngagementSignal withScore(double score, EngagementLevel level) {
        Builder b = toBuilder();
        b.engagementScore = score;
        b.engagementLevel = level;
        return b.build();
    }

    /**
     * Returns a copy reflecting one committed transition.
     *
     * @param target   platform the lead moves to
     * @param decision structured routing decision that authorized the move
     * @param at       commit time
     */
    public EngagementSignal withTransition(Platform target, Map<String, Object> decision, Instant at) {
        Builder b = toBuilder().updatedAt(at);
        b.currentPlatform = target;
        b.lastRoutingDecision = decision;
        b.lastRoutedAt = at;
        b.transitionCount = transitionCount + 1;
        return b.build();
    }

    /**
     * Returns a copy with the version assigned by the store after a write.
     */
    public EngagementSignal withVersion(long newVersion) {
        Builder b = toBuilder();
        b.version = newVersion;
        return b.build();
    }

    // ─────────────────── Query Methods ───────────────────

    /** @return true if the aggregate has never been written */
    public boolean isNew() {
        return version == 0;
    }

    /** @return true if any explicit reply (email or network message) was received */
    public boolean hasExplicitReply() {
        return emailsReplied > 0 || networkMessagesReceived > 0;
    }

    /** @return number of opens at or after {@code since} */
    public int opensSince(Instant since) {
        int count = 0;
        for (Instant open : recentOpens) {
            if (!open.isBefore(since)) {
                count++;
            }
        }
        return count;
    }

    /** @return most recent activity timestamp across all families, or null */
    public Instant lastActivityAt() {
        return lastEventAt;
    }

    // ─────────────────── Private Helpers ───────────────────

    private void applyReset(Builder b, EngagementEvent event) {
        Set<Flag> flags = resetFlags(event.getPayload().get("flags"));
        for (Flag flag : flags) {
            switch (flag) {
                case NETWORK_CONNECTED -> b.networkConnected = false;
                case VISITOR_IDENTIFIED -> b.visitorIdentified = false;
                case REQUESTED_CONTACT -> b.requestedContact = false;
                case DOWNLOADED_CONTENT -> b.downloadedContent = false;
                case VIEWED_PRICING -> b.viewedPricing = false;
                case VIEWED_DEMO -> b.viewedDemo = false;
                case IN_CRM -> b.inCrm = false;
            }
        }
    }

    /**
     * Parses the reset payload: a list of flag names, or "all".
     */
    public static Set<Flag> resetFlags(Object raw) {
        if (raw == null || "all".equals(raw)) {
            return EnumSet.allOf(Flag.class);
        }
        Set<Flag> flags = EnumSet.noneOf(Flag.class);
        if (raw instanceof Collection) {
            for (Object name : (Collection<?>) raw) {
                flags.add(Flag.fromWireName(String.valueOf(name)));
            }
        } else {
            for (String name : raw.toString().split(",")) {
                if (!name.isBlank()) {
                    flags.add(Flag.fromWireName(name));
                }
            }
        }
        return flags;
    }

    private static void markPageFlags(Builder b, String page) {
        if (page == null) {
            return;
        }
        String normalized = page.toLowerCase();
        if (normalized.contains("pricing")) {
            b.viewedPricing = true;
        }
        if (normalized.contains("demo")) {
            b.viewedDemo = true;
        }
    }

    private static List<Instant> appendOpen(List<Instant> opens, Instant at) {
        List<Instant> merged = new ArrayList<>(opens);
        merged.add(at);
        Collections.sort(merged);
        if (merged.size() > RECENT_OPENS_CAPACITY) {
            return new ArrayList<>(merged.subList(merged.size() - RECENT_OPENS_CAPACITY, merged.size()));
        }
        return merged;
    }

    private static Instant latest(Instant current, Instant candidate) {
        if (current == null) {
            return candidate;
        }
        return candidate.isAfter(current) ? candidate : current;
    }

    private static Instant earliest(Instant current, Instant candidate) {
        if (current == null) {
            return candidate;
        }
        return candidate.isBefore(current) ? candidate : current;
    }

    // ─────────────────── Getters ───────────────────

    public String getLeadId() {
        return leadId;
    }

    public String getEmail() {
        return email;
    }

    public int getEmailsSent() {
        return emailsSent;
    }

    public int getEmailsOpened() {
        return emailsOpened;
    }

    public int getEmailsClicked() {
        return emailsClicked;
    }

    public int getEmailsReplied() {
        return emailsReplied;
    }

    public int getEmailsBounced() {
        return emailsBounced;
    }

    public Instant getLastEmailSentAt() {
        return lastEmailSentAt;
    }

    public Instant getLastEmailOpenAt() {
        return lastEmailOpenAt;
    }

    public Instant getLastEmailClickAt() {
        return lastEmailClickAt;
    }

    public Instant getLastEmailReplyAt() {
        return lastEmailReplyAt;
    }

    public Instant getLastEmailBounceAt() {
        return lastEmailBounceAt;
    }

    public List<Instant> getRecentOpens() {
        return recentOpens;
    }

    public boolean isNetworkConnected() {
        return networkConnected;
    }

    public Instant getNetworkConnectedAt() {
        return networkConnectedAt;
    }

    public int getNetworkMessagesSent() {
        return networkMessagesSent;
    }

    public int getNetworkMessagesReceived() {
        return networkMessagesReceived;
    }

    public Instant getLastNetworkReplyAt() {
        return lastNetworkReplyAt;
    }

    public Instant getLastNetworkActivityAt() {
        return lastNetworkActivityAt;
    }

    public int getWebsiteVisits() {
        return websiteVisits;
    }

    public int getPageViews() {
        return pageViews;
    }

    public Instant getLastWebsiteVisitAt() {
        return lastWebsiteVisitAt;
    }

    public boolean isVisitorIdentified() {
        return visitorIdentified;
    }

    public Instant getVisitorIdentifiedAt() {
        return visitorIdentifiedAt;
    }

    public boolean isViewedPricing() {
        return viewedPricing;
    }

    public boolean isViewedDemo() {
        return viewedDemo;
    }

    public boolean isDownloadedContent() {
        return downloadedContent;
    }

    public int getContentDownloads() {
        return contentDownloads;
    }

    public Instant getLastContentDownloadAt() {
        return lastContentDownloadAt;
    }

    public boolean isRequestedContact() {
        return requestedContact;
    }

    public Instant getRequestedContactAt() {
        return requestedContactAt;
    }

    public int getFormsSubmitted() {
        return formsSubmitted;
    }

    public Instant getLastFormSubmittedAt() {
        return lastFormSubmittedAt;
    }

    public int getMeetingsBooked() {
        return meetingsBooked;
    }

    public int getMeetingsCompleted() {
        return meetingsCompleted;
    }

    public int getMeetingsNoShow() {
        return meetingsNoShow;
    }

    public Instant getLastMeetingAt() {
        return lastMeetingAt;
    }

    public boolean isInCrm() {
        return inCrm;
    }

    public String getCrmStage() {
        return crmStage;
    }

    public Instant getLastCrmActivityAt() {
        return lastCrmActivityAt;
    }

    public Instant getLastEventAt() {
        return lastEventAt;
    }

    public double getEngagementScore() {
        return engagementScore;
    }

    public EngagementLevel getEngagementLevel() {
        return engagementLevel;
    }

    public Platform getCurrentPlatform() {
        return currentPlatform;
    }

    public Map<String, Object> getLastRoutingDecision() {
        return lastRoutingDecision;
    }

    public Instant getLastRoutedAt() {
        return lastRoutedAt;
    }

    public int getTransitionCount() {
        return transitionCount;
    }

    public long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    // ─────────────────── Identity ───────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        EngagementSignal that = (EngagementSignal) o;
        return Objects.equals(leadId, that.leadId) && version == that.version;
    }

    @Override
    public int hashCode() {
        return Objects.hash(leadId, version);
    }

    @Override
    public String toString() {
        return "EngagementSignal{leadId='" + leadId
                + "', platform=" + currentPlatform
                + ", score=" + engagementScore
                + ", level=" + engagementLevel
                + ", transitions=" + transitionCount
                + ", version=" + version + "}";
    }

    // ─────────────────── Builder ───────────────────

    public Builder toBuilder() {
        Builder b = new Builder(leadId);
        b.email = email;
        b.emailsSent = emailsSent;
        b.emailsOpened = emailsOpened;
        b.emailsClicked = emailsClicked;
        b.emailsReplied = emailsReplied;
        b.emailsBounced = emailsBounced;
        b.lastEmailSentAt = lastEmailSentAt;
        b.lastEmailOpenAt = lastEmailOpenAt;
        b.lastEmailClickAt = lastEmailClickAt;
        b.lastEmailReplyAt = lastEmailReplyAt;
        b.lastEmailBounceAt = lastEmailBounceAt;
        b.recentOpens = recentOpens;
        b.networkConnected = networkConnected;
        b.networkConnectedAt = networkConnectedAt;
        b.networkMessagesSent = networkMessagesSent;
        b.networkMessagesReceived = networkMessagesReceived;
        b.lastNetworkReplyAt = lastNetworkReplyAt;
        b.lastNetworkActivityAt = lastNetworkActivityAt;
        b.websiteVisits = websiteVisits;
        b.pageViews = pageViews;
        b.lastWebsiteVisitAt = lastWebsiteVisitAt;
        b.visitorIdentified = visitorIdentified;
        b.visitorIdentifiedAt = visitorIdentifiedAt;
        b.viewedPricing = viewedPricing;
        b.viewedDemo = viewedDemo;
        b.downloadedContent = downloadedContent;
        b.contentDownloads = contentDownloads;
        b.lastContentDownloadAt = lastContentDownloadAt;
        b.requestedContact = requestedContact;
        b.requestedContactAt = requestedContactAt;
        b.formsSubmitted = formsSubmitted;
        b.lastFormSubmittedAt = lastFormSubmittedAt;
        b.meetingsBooked = meetingsBooked;
        b.meetingsCompleted = meetingsCompleted;
        b.meetingsNoShow = meetingsNoShow;
        b.lastMeetingAt = lastMeetingAt;
        b.inCrm = inCrm;
        b.crmStage = crmStage;
        b.lastCrmActivityAt = lastCrmActivityAt;
        b.lastEventAt = lastEventAt;
        b.engagementScore = engagementScore;
        b.engagementLevel = engagementLevel;
        b.currentPlatform = currentPlatform;
        b.lastRoutingDecision = lastRoutingDecision;
        b.lastRoutedAt = lastRoutedAt;
        b.transitionCount = transitionCount;
        b.version = version;
        b.createdAt = createdAt;
        b.updatedAt = updatedAt;
        return b;
    }

    /**
     * Mutable builder used for reconstruction from storage and by {@link #apply}.
     */
    public static final class Builder {

        private final String leadId;
        private String email;
        private int emailsSent;
        private int emailsOpened;
        private int emailsClicked;
        private int emailsReplied;
        private int emailsBounced;
        private Instant lastEmailSentAt;
        private Instant lastEmailOpenAt;
        private Instant lastEmailClickAt;
        private Instant lastEmailReplyAt;
        private Instant lastEmailBounceAt;
        private List<Instant> recentOpens = List.of();
        private boolean networkConnected;
        private Instant networkConnectedAt;
        private int networkMessagesSent;
        private int networkMessagesReceived;
        private Instant lastNetworkReplyAt;
        private Instant lastNetworkActivityAt;
        private int websiteVisits;
        private int pageViews;
        private Instant lastWebsiteVisitAt;
        private boolean visitorIdentified;
        private Instant visitorIdentifiedAt;
        private boolean viewedPricing;
        private boolean viewedDemo;
        private boolean downloadedContent;
        private int contentDownloads;
        private Instant lastContentDownloadAt;
        private boolean requestedContact;
        private Instant requestedContactAt;
        private int formsSubmitted;
        private Instant lastFormSubmittedAt;
        private int meetingsBooked;
        private int meetingsCompleted;
        private int meetingsNoShow;
        private Instant lastMeetingAt;
        private boolean inCrm;
        private String crmStage;
        private Instant lastCrmActivityAt;
        private Instant lastEventAt;
        private double engagementScore;
        private EngagementLevel engagementLevel = EngagementLevel.COLD;
        private Platform currentPlatform = Platform.NONE;
        private Map<String, Object> lastRoutingDecision;
        private Instant lastRoutedAt;
        private int transitionCount;
        private long version;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder(String leadId) {
            this.leadId = leadId;
        }

        public Builder email(String v) { this.email = v; return this; }
        public Builder emailsSent(int v) { this.emailsSent = v; return this; }
        public Builder emailsOpened(int v) { this.emailsOpened = v; return this; }
        public Builder emailsClicked(int v) { this.emailsClicked = v; return this; }
        public Builder emailsReplied(int v) { this.emailsReplied = v; return this; }
        public Builder emailsBounced(int v) { this.emailsBounced = v; return this; }
        public Builder lastEmailSentAt(Instant v) { this.lastEmailSentAt = v; return this; }
        public Builder lastEmailOpenAt(Instant v) { this.lastEmailOpenAt = v; return this; }
        public Builder lastEmailClickAt(Instant v) { this.lastEmailClickAt = v; return this; }
        public Builder lastEmailReplyAt(Instant v) { this.lastEmailReplyAt = v; return this; }
        public Builder lastEmailBounceAt(Instant v) { this.lastEmailBounceAt = v; return this; }
        public Builder recentOpens(List<Instant> v) { this.recentOpens = v != null ? v : List.of(); return this; }
        public Builder networkConnected(boolean v) { this.networkConnected = v; return this; }
        public Builder networkConnectedAt(Instant v) { this.networkConnectedAt = v; return this; }
        public Builder networkMessagesSent(int v) { this.networkMessagesSent = v; return this; }
        public Builder networkMessagesReceived(int v) { this.networkMessagesReceived = v; return this; }
        public Builder lastNetworkReplyAt(Instant v) { this.lastNetworkReplyAt = v; return this; }
        public Builder lastNetworkActivityAt(Instant v) { this.lastNetworkActivityAt = v; return this; }
        public Builder websiteVisits(int v) { this.websiteVisits = v; return this; }
        public Builder pageViews(int v) { this.pageViews = v; return this; }
        public Builder lastWebsiteVisitAt(Instant v) { this.lastWebsiteVisitAt = v; return this; }
        public Builder visitorIdentified(boolean v) { this.visitorIdentified = v; return this; }
        public Builder visitorIdentifiedAt(Instant v) { this.visitorIdentifiedAt = v; return this; }
        public Builder viewedPricing(boolean v) { this.viewedPricing = v; return this; }
        public Builder viewedDemo(boolean v) { this.viewedDemo = v; return this; }
        public Builder downloadedContent(boolean v) { this.downloadedContent = v; return this; }
        public Builder contentDownloads(int v) { this.contentDownloads = v; return this; }
        public Builder lastContentDownloadAt(Instant v) { this.lastContentDownloadAt = v; return this; }
        public Builder requestedContact(boolean v) { this.requestedContact = v; return this; }
        public Builder requestedContactAt(Instant v) { this.requestedContactAt = v; return this; }
        public Builder formsSubmitted(int v) { this.formsSubmitted = v; return this; }
        public Builder lastFormSubmittedAt(Instant v) { this.lastFormSubmittedAt = v; return this; }
        public Builder meetingsBooked(int v) { this.meetingsBooked = v; return this; }
        public Builder meetingsCompleted(int v) { this.meetingsCompleted = v; return this; }
        public Builder meetingsNoShow(int v) { this.meetingsNoShow = v; return this; }
        public Builder lastMeetingAt(Instant v) { this.lastMeetingAt = v; return this; }
        public Builder inCrm(boolean v) { this.inCrm = v; return this; }
        public Builder crmStage(String v) { this.crmStage = v; return this; }
        public Builder lastCrmActivityAt(Instant v) { this.lastCrmActivityAt = v; return this; }
        public Builder lastEventAt(Instant v) { this.lastEventAt = v; return this; }
        public Builder engagementScore(double v) { this.engagementScore = v; return this; }
        public Builder engagementLevel(EngagementLevel v) { this.engagementLevel = v; return this; }
        public Builder currentPlatform(Platform v) { this.currentPlatform = v; return this; }
        public Builder lastRoutingDecision(Map<String, Object> v) { this.lastRoutingDecision = v; return this; }
        public Builder lastRoutedAt(Instant v) { this.lastRoutedAt = v; return this; }
        public Builder transitionCount(int v) { this.transitionCount = v; return this; }
        public Builder version(long v) { this.version = v; return this; }
        public Builder createdAt(Instant v) { this.createdAt = v; return this; }
        public Builder updatedAt(Instant v) { this.updatedAt = v; return this; }

        public EngagementSignal build() {
            return new EngagementSignal(this);
        }
    }
}
