package com.outbound.routing.adapters.out.postgres;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.outbound.routing.application.port.out.SignalStore;
import com.outbound.routing.domain.entity.EngagementSignal;
import com.outbound.routing.domain.valueobject.EngagementLevel;
import com.outbound.routing.domain.valueobject.Platform;
import com.outbound.routing.domain.valueobject.PlatformLevelCount;

/**
 * PostgreSQL implementation of the SignalStore outbound port.
 * <p>
 * One row per lead. Routing and scoring fields are mirrored into indexed
 * columns for the dashboard queries; the full aggregate lives in a JSONB
 * document. Writes are guarded by the {@code version} column.
 * </p>
 */
@Component
public class PostgresSignalStore implements SignalStore {

    private static final Logger log = LoggerFactory.getLogger(PostgresSignalStore.class);

    private static final String COLUMNS = "lead_id, email, version, document, created_at, updated_at";

    private static final String SELECT_BY_LEAD_SQL = "SELECT " + COLUMNS
            + " FROM engagement_signals WHERE lead_id = ?";

    private static final String SELECT_BY_EMAIL_SQL = "SELECT " + COLUMNS
            + " FROM engagement_signals WHERE email = ?";

    // Conflict on lead_id or email means another writer created the lead first
    private static final String INSERT_SQL = "INSERT INTO engagement_signals "
            + "(lead_id, email, current_platform, engagement_level, engagement_score, transition_count, "
            + "last_event_at, version, document, created_at, updated_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, 1, ?::jsonb, ?, ?) "
            + "ON CONFLICT DO NOTHING";

    private static final String UPDATE_SQL = "UPDATE engagement_signals SET "
            + "email = ?, current_platform = ?, engagement_level = ?, engagement_score = ?, "
            + "transition_count = ?, last_event_at = ?, version = version + 1, document = ?::jsonb, "
            + "updated_at = ? "
            + "WHERE lead_id = ? AND version = ?";

    private static final String FIRST_PAGE_SQL = "SELECT " + COLUMNS
            + " FROM engagement_signals ORDER BY lead_id LIMIT ?";

    private static final String PAGE_AFTER_SQL = "SELECT " + COLUMNS
            + " FROM engagement_signals WHERE lead_id > ? ORDER BY lead_id LIMIT ?";

    private static final String COUNT_BY_PLATFORM_LEVEL_SQL = "SELECT current_platform, engagement_level, "
            + "COUNT(*) AS cnt, AVG(engagement_score) AS avg_score "
            + "FROM engagement_signals GROUP BY current_platform, engagement_level "
            + "ORDER BY current_platform, engagement_level";

    private static final String COUNT_ALL_SQL = "SELECT COUNT(*) FROM engagement_signals";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public PostgresSignalStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<EngagementSignal> findByLeadId(String leadId) {
        return jdbcTemplate.query(SELECT_BY_LEAD_SQL, (rs, rowNum) -> mapRow(rs), leadId)
                .stream().findFirst();
    }

    @Override
    public Optional<EngagementSignal> findByEmail(String email) {
        return jdbcTemplate.query(SELECT_BY_EMAIL_SQL, (rs, rowNum) -> mapRow(rs), email)
                .stream().findFirst();
    }

    @Override
    public boolean compareAndSet(EngagementSignal signal, long expectedVersion) {
        String document = serialize(signal);
        Timestamp lastEventAt = signal.getLastEventAt() != null ? Timestamp.from(signal.getLastEventAt()) : null;
        try {
            int rows;
            if (expectedVersion == 0) {
                rows = jdbcTemplate.update(INSERT_SQL,
                        signal.getLeadId(),
                        signal.getEmail(),
                        signal.getCurrentPlatform().wireName(),
                        signal.getEngagementLevel().wireName(),
                        signal.getEngagementScore(),
                        signal.getTransitionCount(),
                        lastEventAt,
                        document,
                        Timestamp.from(signal.getCreatedAt()),
                        Timestamp.from(signal.getUpdatedAt()));
            } else {
                rows = jdbcTemplate.update(UPDATE_SQL,
                        signal.getEmail(),
                        signal.getCurrentPlatform().wireName(),
                        signal.getEngagementLevel().wireName(),
                        signal.getEngagementScore(),
                        signal.getTransitionCount(),
                        lastEventAt,
                        document,
                        Timestamp.from(signal.getUpdatedAt()),
                        signal.getLeadId(),
                        expectedVersion);
            }
            if (rows == 0) {
                log.debug("action=signal_version_conflict leadId={} expectedVersion={}",
                        signal.getLeadId(), expectedVersion);
                return false;
            }
            log.debug("action=signal_saved leadId={} version={}", signal.getLeadId(), expectedVersion + 1);
            return true;
        } catch (DuplicateKeyException e) {
            // Email already claimed by another lead
            log.debug("action=signal_email_conflict leadId={} email={}", signal.getLeadId(), signal.getEmail());
            return false;
        }
    }

    @Override
    public List<EngagementSignal> findPageAfter(String afterLeadId, int limit) {
        if (afterLeadId == null) {
            return jdbcTemplate.query(FIRST_PAGE_SQL, (rs, rowNum) -> mapRow(rs), limit);
        }
        return jdbcTemplate.query(PAGE_AFTER_SQL, (rs, rowNum) -> mapRow(rs), afterLeadId, limit);
    }

    @Override
    public List<PlatformLevelCount> countByPlatformAndLevel() {
        return jdbcTemplate.query(COUNT_BY_PLATFORM_LEVEL_SQL,
                (rs, rowNum) -> new PlatformLevelCount(
                        Platform.fromWireName(rs.getString("current_platform")),
                        EngagementLevel.fromWireName(rs.getString("engagement_level")),
                        rs.getLong("cnt"),
                        Math.round(rs.getDouble("avg_score") * 100.0) / 100.0));
    }

    @Override
    public long countAll() {
        Long count = jdbcTemplate.queryForObject(COUNT_ALL_SQL, Long.class);
        return count != null ? count : 0;
    }

    // ─────────────────── Private Helpers ───────────────────

    private EngagementSignal mapRow(ResultSet rs) throws SQLException {
        String leadId = rs.getString("lead_id");
        try {
            SignalDocument document = objectMapper.readValue(rs.getString("document"), SignalDocument.class);
            return document.toDomain(leadId, rs.getString("email"), rs.getLong("version"),
                    rs.getTimestamp("created_at").toInstant(), rs.getTimestamp("updated_at").toInstant());
        } catch (JsonProcessingException e) {
            log.error("action=signal_deserialize_error leadId={} error={}", leadId, e.getMessage());
            throw new IllegalStateException("Failed to deserialize engagement signal for lead: " + leadId, e);
        }
    }

    private String serialize(EngagementSignal signal) {
        try {
            return objectMapper.writeValueAsString(SignalDocument.fromDomain(signal));
        } catch (JsonProcessingException e) {
            log.error("action=signal_serialize_error leadId={} error={}", signal.getLeadId(), e.getMessage());
            throw new IllegalStateException("Failed to serialize engagement signal for lead: " + signal.getLeadId(), e);
        }
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    private static Instant parse(String value) {
        return value != null ? Instant.parse(value) : null;
    }

    // ─────────────────── Inner DTO ───────────────────

    /**
     * Serialization DTO for the JSONB {@code document} column.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SignalDocument {

        @JsonProperty("emails_sent")
        public int emailsSent;
        @JsonProperty("emails_opened")
        public int emailsOpened;
        @JsonProperty("emails_clicked")
        public int emailsClicked;
        @JsonProperty("emails_replied")
        public int emailsReplied;
        @JsonProperty("emails_bounced")
        public int emailsBounced;
        @JsonProperty("last_email_sent_at")
        public String lastEmailSentAt;
        @JsonProperty("last_email_open_at")
        public String lastEmailOpenAt;
        @JsonProperty("last_email_click_at")
        public String lastEmailClickAt;
        @JsonProperty("last_email_reply_at")
        public String lastEmailReplyAt;
        @JsonProperty("last_email_bounce_at")
        public String lastEmailBounceAt;
        @JsonProperty("recent_opens")
        public List<String> recentOpens;

        @JsonProperty("network_connected")
        public boolean networkConnected;
        @JsonProperty("network_connected_at")
        public String networkConnectedAt;
        @JsonProperty("network_messages_sent")
        public int networkMessagesSent;
        @JsonProperty("network_messages_received")
        public int networkMessagesReceived;
        @JsonProperty("last_network_reply_at")
        public String lastNetworkReplyAt;
        @JsonProperty("last_network_activity_at")
        public String lastNetworkActivityAt;

        @JsonProperty("website_visits")
        public int websiteVisits;
        @JsonProperty("page_views")
        public int pageViews;
        @JsonProperty("last_website_visit_at")
        public String lastWebsiteVisitAt;
        @JsonProperty("visitor_identified")
        public boolean visitorIdentified;
        @JsonProperty("visitor_identified_at")
        public String visitorIdentifiedAt;
        @JsonProperty("viewed_pricing")
        public boolean viewedPricing;
        @JsonProperty("viewed_demo")
        public boolean viewedDemo;
        @JsonProperty("downloaded_content")
        public boolean downloadedContent;
        @JsonProperty("content_downloads")
        public int contentDownloads;
        @JsonProperty("last_content_download_at")
        public String lastContentDownloadAt;
        @JsonProperty("requested_contact")
        public boolean requestedContact;
        @JsonProperty("requested_contact_at")
        public String requestedContactAt;
        @JsonProperty("forms_submitted")
        public int formsSubmitted;
        @JsonProperty("last_form_submitted_at")
        public String lastFormSubmittedAt;

        @JsonProperty("meetings_booked")
        public int meetingsBooked;
        @JsonProperty("meetings_completed")
        public int meetingsCompleted;
        @JsonProperty("meetings_no_show")
        public int meetingsNoShow;
        @JsonProperty("last_meeting_at")
        public String lastMeetingAt;
        @JsonProperty("in_crm")
        public boolean inCrm;
        @JsonProperty("crm_stage")
        public String crmStage;
        @JsonProperty("last_crm_activity_at")
        public String lastCrmActivityAt;

        @JsonProperty("last_event_at")
        public String lastEventAt;
        @JsonProperty("engagement_score")
        public double engagementScore;
        @JsonProperty("engagement_level")
        public String engagementLevel;
        @JsonProperty("current_platform")
        public String currentPlatform;
        @JsonProperty("last_routing_decision")
        public Map<String, Object> lastRoutingDecision;
        @JsonProperty("last_routed_at")
        public String lastRoutedAt;
        @JsonProperty("transition_count")
        public int transitionCount;

        public SignalDocument() {
        } // Jackson

        public static SignalDocument fromDomain(EngagementSignal s) {
            SignalDocument d = new SignalDocument();
            d.emailsSent = s.getEmailsSent();
            d.emailsOpened = s.getEmailsOpened();
            d.emailsClicked = s.getEmailsClicked();
            d.emailsReplied = s.getEmailsReplied();
            d.emailsBounced = s.getEmailsBounced();
            d.lastEmailSentAt = format(s.getLastEmailSentAt());
            d.lastEmailOpenAt = format(s.getLastEmailOpenAt());
            d.lastEmailClickAt = format(s.getLastEmailClickAt());
            d.lastEmailReplyAt = format(s.getLastEmailReplyAt());
            d.lastEmailBounceAt = format(s.getLastEmailBounceAt());
            d.recentOpens = new ArrayList<>();
            for (Instant open : s.getRecentOpens()) {
                d.recentOpens.add(open.toString());
            }
            d.networkConnected = s.isNetworkConnected();
            d.networkConnectedAt = format(s.getNetworkConnectedAt());
            d.networkMessagesSent = s.getNetworkMessagesSent();
            d.networkMessagesReceived = s.getNetworkMessagesReceived();
            d.lastNetworkReplyAt = format(s.getLastNetworkReplyAt());
            d.lastNetworkActivityAt = format(s.getLastNetworkActivityAt());
            d.websiteVisits = s.getWebsiteVisits();
            d.pageViews = s.getPageViews();
            d.lastWebsiteVisitAt = format(s.getLastWebsiteVisitAt());
            d.visitorIdentified = s.isVisitorIdentified();
            d.visitorIdentifiedAt = format(s.getVisitorIdentifiedAt());
            d.viewedPricing = s.isViewedPricing();
            d.viewedDemo = s.isViewedDemo();
            d.downloadedContent = s.isDownloadedContent();
            d.contentDownloads = s.getContentDownloads();
            d.lastContentDownloadAt = format(s.getLastContentDownloadAt());
            d.requestedContact = s.isRequestedContact();
            d.requestedContactAt = format(s.getRequestedContactAt());
            d.formsSubmitted = s.getFormsSubmitted();
            d.lastFormSubmittedAt = format(s.getLastFormSubmittedAt());
            d.meetingsBooked = s.getMeetingsBooked();
            d.meetingsCompleted = s.getMeetingsCompleted();
            d.meetingsNoShow = s.getMeetingsNoShow();
            d.lastMeetingAt = format(s.getLastMeetingAt());
            d.inCrm = s.isInCrm();
            d.crmStage = s.getCrmStage();
            d.lastCrmActivityAt = format(s.getLastCrmActivityAt());
            d.lastEventAt = format(s.getLastEventAt());
            d.engagementScore = s.getEngagementScore();
            d.engagementLevel = s.getEngagementLevel().wireName();
            d.currentPlatform = s.getCurrentPlatform().wireName();
            d.lastRoutingDecision = s.getLastRoutingDecision();
            d.lastRoutedAt = format(s.getLastRoutedAt());
            d.transitionCount = s.getTransitionCount();
            return d;
        }

        public EngagementSignal toDomain(String leadId, String email, long version, Instant createdAt,
                Instant updatedAt) {
            List<Instant> opens = new ArrayList<>();
            if (recentOpens != null) {
                for (String open : recentOpens) {
                    opens.add(Instant.parse(open));
                }
            }
            return EngagementSignal.builder(leadId)
                    .email(email)
                    .emailsSent(emailsSent)
                    .emailsOpened(emailsOpened)
                    .emailsClicked(emailsClicked)
                    .emailsReplied(emailsReplied)
                    .emailsBounced(emailsBounced)
                    .lastEmailSentAt(parse(lastEmailSentAt))
                    .lastEmailOpenAt(parse(lastEmailOpenAt))
                    .lastEmailClickAt(parse(lastEmailClickAt))
                    .lastEmailReplyAt(parse(lastEmailReplyAt))
                    .lastEmailBounceAt(parse(lastEmailBounceAt))
                    .recentOpens(opens)
                    .networkConnected(networkConnected)
                    .networkConnectedAt(parse(networkConnectedAt))
                    .networkMessagesSent(networkMessagesSent)
                    .networkMessagesReceived(networkMessagesReceived)
                    .lastNetworkReplyAt(parse(lastNetworkReplyAt))
                    .lastNetworkActivityAt(parse(lastNetworkActivityAt))
                    .websiteVisits(websiteVisits)
                    .pageViews(pageViews)
                    .lastWebsiteVisitAt(parse(lastWebsiteVisitAt))
                    .visitorIdentified(visitorIdentified)
                    .visitorIdentifiedAt(parse(visitorIdentifiedAt))
                    .viewedPricing(viewedPricing)
                    .viewedDemo(viewedDemo)
                    .downloadedContent(downloadedContent)
                    .contentDownloads(contentDownloads)
                    .lastContentDownloadAt(parse(lastContentDownloadAt))
                    .requestedContact(requestedContact)
                    .requestedContactAt(parse(requestedContactAt))
                    .formsSubmitted(formsSubmitted)
                    .lastFormSubmittedAt(parse(lastFormSubmittedAt))
                    .meetingsBooked(meetingsBooked)
                    .meetingsCompleted(meetingsCompleted)
                    .meetingsNoShow(meetingsNoShow)
                    .lastMeetingAt(parse(lastMeetingAt))
                    .inCrm(inCrm)
                    .crmStage(crmStage)
                    .lastCrmActivityAt(parse(lastCrmActivityAt))
                    .lastEventAt(parse(lastEventAt))
                    .engagementScore(engagementScore)
                    .engagementLevel(EngagementLevel.fromWireName(engagementLevel))
                    .currentPlatform(Platform.fromWireName(currentPlatform))
                    .lastRoutingDecision(lastRoutingDecision)
                    .lastRoutedAt(parse(lastRoutedAt))
                    .transitionCount(transitionCount)
                    .version(version)
                    .createdAt(createdAt)
                    .updatedAt(updatedAt)
                    .build();
        }
    }
}
